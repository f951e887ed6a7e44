package com.launchpad.bootstrap;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.server.Shutdown;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.boot.web.servlet.server.ConfigurableServletWebServerFactory;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Binds the embedded web server according to the process role.
 *
 * Features:
 * - Worker processes listen on {@code app.worker-port}, main processes on {@code app.port}
 * - Always binds 0.0.0.0 so containers can route traffic to the process
 * - Drains in-flight requests on shutdown outside local and test environments
 */
@Component
@Slf4j
public class ServerCustomizer implements WebServerFactoryCustomizer<ConfigurableServletWebServerFactory> {

    static final String BIND_ADDRESS = "0.0.0.0";

    private final ProcessRole processRole;
    private final RuntimeEnvironment runtimeEnvironment;
    private final int mainPort;
    private final int workerPort;

    public ServerCustomizer(
            ProcessRole processRole,
            RuntimeEnvironment runtimeEnvironment,
            @Value("${app.port:3000}") int mainPort,
            @Value("${app.worker-port:3001}") int workerPort
    ) {
        this.processRole = processRole;
        this.runtimeEnvironment = runtimeEnvironment;
        this.mainPort = mainPort;
        this.workerPort = workerPort;
    }

    @Override
    public void customize(ConfigurableServletWebServerFactory factory) {
        int port = resolvePort();
        factory.setPort(port);
        factory.setAddress(bindAddress());

        if (runtimeEnvironment.shutsDownGracefully()) {
            factory.setShutdown(Shutdown.GRACEFUL);
        }

        log.info("Configured {} server on {}:{} (graceful shutdown: {})",
                processRole, BIND_ADDRESS, port, runtimeEnvironment.shutsDownGracefully());
    }

    /**
     * @return the port this process must listen on
     */
    public int resolvePort() {
        return processRole.isWorker() ? workerPort : mainPort;
    }

    private static InetAddress bindAddress() {
        try {
            return InetAddress.getByName(BIND_ADDRESS);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Cannot resolve bind address " + BIND_ADDRESS, e);
        }
    }
}
