package com.launchpad.config;

import com.launchpad.security.JobBoardAuthenticationEntryPoint;
import com.launchpad.security.JobBoardAuthenticationFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.CrossOriginOpenerPolicyHeaderWriter.CrossOriginOpenerPolicy;
import org.springframework.security.web.header.writers.CrossOriginResourcePolicyHeaderWriter.CrossOriginResourcePolicy;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.security.web.header.writers.StaticHeadersWriter;
import org.springframework.security.web.header.writers.XXssProtectionHeaderWriter;
import org.springframework.security.web.util.matcher.AnyRequestMatcher;

import static org.springframework.security.web.util.matcher.AntPathRequestMatcher.antMatcher;

/**
 * Spring Security configuration: security headers, CORS and dashboard protection.
 *
 * The API itself is public; only the job-queue dashboard requires credentials.
 *
 * - Dashboard paths require ROLE_JOB_BOARD, granted by {@link JobBoardAuthenticationFilter}
 * - Every other path is permitted
 * - Stateless session management (no JSESSIONID)
 * - CSRF disabled (no browser form posts; the auth cookie is SameSite=Lax)
 * - CORS delegated to the {@code corsConfigurationSource} bean from {@link CorsConfig}
 * - Unauthenticated dashboard requests get 401 with a Basic challenge
 *
 * Security headers on every response:
 * - Content-Security-Policy with same-origin defaults
 * - Cross-Origin-Opener-Policy and Cross-Origin-Resource-Policy: same-origin
 * - Strict-Transport-Security: one year, subdomains included
 * - X-Content-Type-Options: nosniff, X-Frame-Options: SAMEORIGIN
 * - Referrer-Policy: no-referrer, X-XSS-Protection: 0
 * - X-DNS-Prefetch-Control, X-Download-Options, X-Permitted-Cross-Domain-Policies, Origin-Agent-Cluster
 *
 * @see JobBoardAuthenticationFilter
 * @see JobBoardAuthenticationEntryPoint
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    static final String CONTENT_SECURITY_POLICY = String.join(";",
            "default-src 'self'",
            "base-uri 'self'",
            "font-src 'self' https: data:",
            "form-action 'self'",
            "frame-ancestors 'self'",
            "img-src 'self' data:",
            "object-src 'none'",
            "script-src 'self'",
            "script-src-attr 'none'",
            "style-src 'self' https: 'unsafe-inline'",
            "upgrade-insecure-requests");

    private static final long HSTS_MAX_AGE_SECONDS = 31_536_000L;

    private final JobBoardAuthenticationFilter jobBoardAuthenticationFilter;
    private final JobBoardAuthenticationEntryPoint jobBoardAuthenticationEntryPoint;

    @Value("${app.job-board.path:/api/queues}")
    private String jobBoardPath;

    /**
     * Configure the security filter chain.
     *
     * @param http the HttpSecurity builder to configure
     * @return the configured SecurityFilterChain
     * @throws Exception if configuration fails
     */
    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .cors(Customizer.withDefaults())
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)

                .headers(headers -> headers
                        .contentSecurityPolicy(csp -> csp.policyDirectives(CONTENT_SECURITY_POLICY))
                        .crossOriginOpenerPolicy(coop -> coop.policy(CrossOriginOpenerPolicy.SAME_ORIGIN))
                        .crossOriginResourcePolicy(corp -> corp.policy(CrossOriginResourcePolicy.SAME_ORIGIN))
                        .httpStrictTransportSecurity(hsts -> hsts
                                .requestMatcher(AnyRequestMatcher.INSTANCE)
                                .includeSubDomains(true)
                                .maxAgeInSeconds(HSTS_MAX_AGE_SECONDS))
                        .frameOptions(HeadersConfigurer.FrameOptionsConfig::sameOrigin)
                        .referrerPolicy(referrer -> referrer.policy(ReferrerPolicy.NO_REFERRER))
                        .xssProtection(xss -> xss.headerValue(XXssProtectionHeaderWriter.HeaderValue.DISABLED))
                        .addHeaderWriter(new StaticHeadersWriter("X-DNS-Prefetch-Control", "off"))
                        .addHeaderWriter(new StaticHeadersWriter("X-Download-Options", "noopen"))
                        .addHeaderWriter(new StaticHeadersWriter("X-Permitted-Cross-Domain-Policies", "none"))
                        .addHeaderWriter(new StaticHeadersWriter("Origin-Agent-Cluster", "?1"))
                )

                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(antMatcher(jobBoardPath), antMatcher(jobBoardPath + "/**"))
                        .hasRole("JOB_BOARD")
                        .anyRequest().permitAll()
                )

                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                )

                .exceptionHandling(exceptions -> exceptions
                        .authenticationEntryPoint(jobBoardAuthenticationEntryPoint)
                )

                .addFilterBefore(jobBoardAuthenticationFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
