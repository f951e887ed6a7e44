package com.launchpad.bootstrap;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Process-wide beans resolved once at startup: environment, process role and clock.
 */
@Configuration
@Slf4j
public class BootstrapConfig {

    @Bean
    public RuntimeEnvironment runtimeEnvironment(@Value("${app.node-env}") String nodeEnv) {
        RuntimeEnvironment environment = RuntimeEnvironment.from(nodeEnv);
        log.info("Runtime environment: {}", environment);
        return environment;
    }

    @Bean
    public ProcessRole processRole(@Value("${app.worker:false}") String worker) {
        ProcessRole role = ProcessRole.fromWorkerFlag(worker);
        log.info("Process role: {}", role);
        return role;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
