package com.launchpad.config;

import com.launchpad.LaunchpadApplication;
import com.launchpad.web.ApiVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.filter.CommonsRequestLoggingFilter;
import org.springframework.web.filter.ForwardedHeaderFilter;
import org.springframework.web.method.HandlerTypePredicate;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;
import java.util.function.Predicate;

/**
 * MVC configuration for the HTTP surface.
 *
 * Features:
 * - Global {@code /api} prefix for every application controller
 * - URI versioning: controllers marked {@link ApiVersion} get {@code /api/v{n}}
 * - Proxy header trust ({@code X-Forwarded-*}) when {@code app.https=true}
 * - Request logging when {@code app.logging=true}
 *
 * Only controllers in the application's own packages are prefixed, so library
 * endpoints (API docs, error page) keep the paths they register themselves.
 */
@Configuration
@Slf4j
public class WebConfig implements WebMvcConfigurer {

    @Value("${app.api.prefix:/api}")
    private String apiPrefix;

    @Value("${app.api.versions:1}")
    private List<String> apiVersions;

    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
        Predicate<Class<?>> applicationControllers = HandlerTypePredicate
                .forBasePackageClass(LaunchpadApplication.class)
                .and(HandlerTypePredicate.forAnnotation(RestController.class));

        for (String version : apiVersions) {
            String versionedPrefix = apiPrefix + "/v" + version;
            configurer.addPathPrefix(versionedPrefix, applicationControllers.and(type -> isVersion(type, version)));
            log.info("Versioned API enabled at {}", versionedPrefix);
        }

        configurer.addPathPrefix(apiPrefix,
                applicationControllers.and(type -> !AnnotatedElementUtils.hasAnnotation(type, ApiVersion.class)));
    }

    /**
     * Trust {@code X-Forwarded-*} headers from the TLS-terminating proxy.
     *
     * @return filter registration running before security
     */
    @Bean
    @ConditionalOnProperty(name = "app.https", havingValue = "true")
    public FilterRegistrationBean<ForwardedHeaderFilter> forwardedHeaderFilter() {
        FilterRegistrationBean<ForwardedHeaderFilter> registration = new FilterRegistrationBean<>(new ForwardedHeaderFilter());
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        log.info("Trusting forwarded headers from proxy");
        return registration;
    }

    /**
     * Log one line per request (method, URI, query string, client).
     *
     * @return request logging filter; output goes to the DEBUG level of its logger
     */
    @Bean
    @ConditionalOnProperty(name = "app.logging", havingValue = "true")
    public CommonsRequestLoggingFilter requestLoggingFilter() {
        CommonsRequestLoggingFilter filter = new CommonsRequestLoggingFilter();
        filter.setIncludeQueryString(true);
        filter.setIncludeClientInfo(true);
        filter.setIncludeHeaders(false);
        filter.setIncludePayload(false);
        log.info("HTTP request logging enabled");
        return filter;
    }

    private static boolean isVersion(Class<?> type, String version) {
        ApiVersion apiVersion = AnnotatedElementUtils.findMergedAnnotation(type, ApiVersion.class);
        return apiVersion != null && apiVersion.value().equals(version);
    }
}
