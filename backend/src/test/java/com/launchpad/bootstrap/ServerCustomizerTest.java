package com.launchpad.bootstrap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.web.server.Shutdown;
import org.springframework.boot.web.servlet.server.ConfigurableServletWebServerFactory;

import java.net.InetAddress;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ServerCustomizer Unit Tests")
class ServerCustomizerTest {

    private static final int MAIN_PORT = 3000;
    private static final int WORKER_PORT = 3001;

    @Mock
    private ConfigurableServletWebServerFactory factory;

    @Test
    @DisplayName("a worker process should listen on the worker port")
    void testCustomize_WorkerPort() {
        // Arrange
        ServerCustomizer customizer = new ServerCustomizer(ProcessRole.WORKER, RuntimeEnvironment.TEST, MAIN_PORT, WORKER_PORT);

        // Act
        customizer.customize(factory);

        // Assert
        assertEquals(WORKER_PORT, customizer.resolvePort());
        verify(factory).setPort(WORKER_PORT);
    }

    @Test
    @DisplayName("a main process should listen on the main port")
    void testCustomize_MainPort() {
        // Arrange
        ServerCustomizer customizer = new ServerCustomizer(ProcessRole.MAIN, RuntimeEnvironment.TEST, MAIN_PORT, WORKER_PORT);

        // Act
        customizer.customize(factory);

        // Assert
        assertEquals(MAIN_PORT, customizer.resolvePort());
        verify(factory).setPort(MAIN_PORT);
    }

    @Test
    @DisplayName("the server should bind every interface")
    void testCustomize_BindsAllInterfaces() {
        // Arrange
        ServerCustomizer customizer = new ServerCustomizer(ProcessRole.MAIN, RuntimeEnvironment.LOCAL, MAIN_PORT, WORKER_PORT);
        ArgumentCaptor<InetAddress> address = ArgumentCaptor.forClass(InetAddress.class);

        // Act
        customizer.customize(factory);

        // Assert
        verify(factory).setAddress(address.capture());
        assertTrue(address.getValue().isAnyLocalAddress());
        assertEquals("0.0.0.0", address.getValue().getHostAddress());
    }

    @Test
    @DisplayName("graceful shutdown should be enabled in production")
    void testCustomize_GracefulInProduction() {
        ServerCustomizer customizer = new ServerCustomizer(ProcessRole.MAIN, RuntimeEnvironment.PRODUCTION, MAIN_PORT, WORKER_PORT);

        customizer.customize(factory);

        verify(factory).setShutdown(Shutdown.GRACEFUL);
    }

    @Test
    @DisplayName("graceful shutdown should be skipped for local and test runs")
    void testCustomize_NoGracefulLocally() {
        new ServerCustomizer(ProcessRole.WORKER, RuntimeEnvironment.LOCAL, MAIN_PORT, WORKER_PORT).customize(factory);
        new ServerCustomizer(ProcessRole.MAIN, RuntimeEnvironment.TEST, MAIN_PORT, WORKER_PORT).customize(factory);

        verify(factory, never()).setShutdown(any());
    }
}
