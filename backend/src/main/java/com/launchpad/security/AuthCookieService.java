package com.launchpad.security;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.WebUtils;

import java.time.Duration;
import java.util.Optional;

/**
 * Reads and writes auth cookies.
 *
 * Cookies are HttpOnly, SameSite=Lax, scoped to the API prefix and marked
 * Secure when the process sits behind HTTPS ({@code app.https}).
 */
@Component
@Slf4j
public class AuthCookieService {

    public static final String JOB_BOARD_COOKIE = "job_board_session";

    @Value("${app.https:false}")
    private boolean secure;

    @Value("${app.api.prefix:/api}")
    private String cookiePath;

    public Optional<String> read(HttpServletRequest request, String name) {
        Cookie cookie = WebUtils.getCookie(request, name);
        if (cookie == null || !StringUtils.hasText(cookie.getValue())) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    public void write(HttpServletResponse response, String name, String value, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite("Lax")
                .path(cookiePath)
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
        log.debug("Issued cookie {} (secure={}, maxAge={})", name, secure, maxAge);
    }
}
