package com.launchpad.bootstrap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the process role flag, both the parser and the way a context
 * starts (or refuses to start) for a given {@code app.worker} value.
 */
@DisplayName("ProcessRole Tests")
class ProcessRoleTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withPropertyValues("app.node-env=test")
            .withUserConfiguration(BootstrapConfig.class, RoleMarkers.class);

    @Test
    @DisplayName("fromWorkerFlag should accept true and false in any case")
    void testFromWorkerFlag_Valid() {
        assertEquals(ProcessRole.WORKER, ProcessRole.fromWorkerFlag("true"));
        assertEquals(ProcessRole.WORKER, ProcessRole.fromWorkerFlag("TRUE"));
        assertEquals(ProcessRole.MAIN, ProcessRole.fromWorkerFlag("false"));
        assertEquals(ProcessRole.MAIN, ProcessRole.fromWorkerFlag("False"));
        assertTrue(ProcessRole.WORKER.isWorker());
        assertFalse(ProcessRole.MAIN.isWorker());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "0", "yes", "on", "", " true"})
    @DisplayName("fromWorkerFlag should reject values the role conditions do not match")
    void testFromWorkerFlag_Invalid(String value) {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> ProcessRole.fromWorkerFlag(value));
        assertTrue(exception.getMessage().contains("app.worker"));
    }

    @Test
    @DisplayName("an unset flag should start a main process with main beans only")
    void testContext_Unset() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertEquals(ProcessRole.MAIN, context.getBean(ProcessRole.class));
            assertTrue(context.containsBean("mainMarker"));
            assertFalse(context.containsBean("workerMarker"));
        });
    }

    @Test
    @DisplayName("app.worker=true should start a worker process with worker beans only")
    void testContext_Worker() {
        contextRunner.withPropertyValues("app.worker=true").run(context -> {
            assertNull(context.getStartupFailure());
            assertEquals(ProcessRole.WORKER, context.getBean(ProcessRole.class));
            assertTrue(context.containsBean("workerMarker"));
            assertFalse(context.containsBean("mainMarker"));
        });
    }

    @Test
    @DisplayName("app.worker=1 should fail startup instead of booting a process with no role")
    void testContext_NumericFlagFails() {
        contextRunner.withPropertyValues("app.worker=1").run(context -> {
            Throwable failure = context.getStartupFailure();
            assertNotNull(failure);

            Throwable root = failure;
            while (root.getCause() != null) {
                root = root.getCause();
            }
            assertInstanceOf(IllegalArgumentException.class, root);
            assertTrue(root.getMessage().contains("'1'"));
        });
    }

    @Configuration
    static class RoleMarkers {

        @Bean
        @MainProcess
        String mainMarker() {
            return "main";
        }

        @Bean
        @WorkerProcess
        String workerMarker() {
            return "worker";
        }
    }
}
