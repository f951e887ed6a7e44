package com.launchpad.monitoring;

import com.launchpad.bootstrap.RuntimeEnvironment;
import io.sentry.Sentry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Initializes the Sentry SDK for error tracking.
 *
 * Sentry stays disabled for local and test environments and whenever
 * {@code sentry.dsn} is empty. Events are tagged with the runtime environment
 * and traces are sampled at 100%.
 *
 * @see ErrorMonitor
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class SentryConfig {

    private final RuntimeEnvironment runtimeEnvironment;

    @Value("${sentry.dsn:}")
    private String dsn;

    @Value("${sentry.traces-sample-rate:1.0}")
    private double tracesSampleRate;

    @PostConstruct
    public void init() {
        if (runtimeEnvironment.isLocal() || runtimeEnvironment.isTest()) {
            log.info("Sentry disabled in {} environment", runtimeEnvironment);
            return;
        }
        if (!StringUtils.hasText(dsn)) {
            log.warn("sentry.dsn is empty; error tracking disabled");
            return;
        }

        Sentry.init(options -> {
            options.setDsn(dsn);
            options.setEnvironment(runtimeEnvironment.getValue());
            options.setTracesSampleRate(tracesSampleRate);
        });
        log.info("Sentry initialized for environment {}", runtimeEnvironment);
    }

    @PreDestroy
    public void close() {
        if (Sentry.isEnabled()) {
            Sentry.close();
            log.info("Sentry client closed");
        }
    }
}
