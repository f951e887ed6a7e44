package com.launchpad;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Launchpad backend.
 *
 * The same binary runs in one of two process roles, selected by {@code app.worker}:
 * - main: serves the versioned REST API under /api and the STOMP WebSocket endpoint
 * - worker: consumes background jobs from RabbitMQ and runs scheduled maintenance
 *
 * Both roles expose the job-queue dashboard under /api/queues and bind all interfaces,
 * on {@code app.port} (main) or {@code app.worker-port} (worker).
 *
 * @version 0.0.1-SNAPSHOT
 */
@SpringBootApplication
@EnableScheduling
public class LaunchpadApplication {

    public static void main(String[] args) {
        SpringApplication.run(LaunchpadApplication.class, args);
    }
}
