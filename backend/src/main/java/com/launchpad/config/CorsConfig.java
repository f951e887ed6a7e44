package com.launchpad.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * CORS (Cross-Origin Resource Sharing) configuration for browser clients.
 *
 * The allowed origin comes from {@code app.cors-origin}, which accepts:
 * - {@code true}: reflect any requesting origin
 * - {@code false} or empty: no cross-origin access
 * - a comma-separated list of origins, each of which may contain {@code *} wildcards
 *
 * Methods, headers and credentials are fixed:
 * - Methods: GET, PATCH, POST, PUT, DELETE, OPTIONS, HEAD
 * - Headers: Content-Type, Authorization, X-Requested-With, Accept
 * - Credentials: always allowed so the auth cookie travels with requests
 *
 * The resulting {@link CorsConfigurationSource} is picked up by Spring Security
 * ({@code http.cors()}) and by the STOMP endpoint registration.
 *
 * @see org.springframework.web.cors.CorsConfiguration
 */
@Configuration
@Slf4j
public class CorsConfig {

    static final List<String> ALLOWED_METHODS = List.of("GET", "PATCH", "POST", "PUT", "DELETE", "OPTIONS", "HEAD");

    static final List<String> ALLOWED_HEADERS = List.of("Content-Type", "Authorization", "X-Requested-With", "Accept");

    @Value("${app.cors-origin:false}")
    private String corsOrigin;

    @Value("${app.cors.max-age:3600}")
    private long maxAge;

    /**
     * Register the CORS policy for every path.
     *
     * @return source consulted by the security filter chain
     */
    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", buildCorsConfiguration());
        log.info("CORS configured for origin setting '{}'", corsOrigin);
        return source;
    }

    /**
     * Translate {@code app.cors-origin} into a {@link CorsConfiguration}.
     *
     * Origin patterns are used instead of plain origins because credentials are
     * enabled, and a literal {@code *} origin is rejected in that case.
     *
     * @return configuration with fixed methods, headers and credentials
     */
    public CorsConfiguration buildCorsConfiguration() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOriginPatterns(getAllowedOriginPatterns());
        config.setAllowedMethods(ALLOWED_METHODS);
        config.setAllowedHeaders(ALLOWED_HEADERS);
        config.setAllowCredentials(true);
        config.setMaxAge(maxAge);

        log.debug("CORS allowed methods: {}", ALLOWED_METHODS);
        log.debug("CORS allowed headers: {}", ALLOWED_HEADERS);
        return config;
    }

    /**
     * @return origin patterns derived from {@code app.cors-origin}, empty when CORS is off
     */
    public List<String> getAllowedOriginPatterns() {
        String value = corsOrigin == null ? "" : corsOrigin.trim();

        if (value.isEmpty() || "false".equalsIgnoreCase(value)) {
            return List.of();
        }
        if ("true".equalsIgnoreCase(value)) {
            return List.of("*");
        }

        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toList();
    }
}
