package com.launchpad.bootstrap;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RuntimeEnvironment Unit Tests")
class RuntimeEnvironmentTest {

    @Test
    @DisplayName("from should ignore case and surrounding whitespace")
    void testFrom_Normalizes() {
        assertEquals(RuntimeEnvironment.PRODUCTION, RuntimeEnvironment.from(" Production "));
        assertEquals(RuntimeEnvironment.TEST, RuntimeEnvironment.from("TEST"));
    }

    @Test
    @DisplayName("from should reject unknown and blank names")
    void testFrom_Invalid() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> RuntimeEnvironment.from("qa"));
        assertTrue(exception.getMessage().contains("qa"));

        assertThrows(IllegalArgumentException.class, () -> RuntimeEnvironment.from(""));
        assertThrows(IllegalArgumentException.class, () -> RuntimeEnvironment.from(null));
    }

    @ParameterizedTest
    @EnumSource(value = RuntimeEnvironment.class, names = {"DEVELOPMENT", "STAGING", "PRODUCTION"})
    @DisplayName("deployed environments should shut down gracefully")
    void testShutsDownGracefully_Deployed(RuntimeEnvironment environment) {
        assertTrue(environment.shutsDownGracefully());
    }

    @ParameterizedTest
    @EnumSource(value = RuntimeEnvironment.class, names = {"LOCAL", "TEST"})
    @DisplayName("local and test runs should stop immediately")
    void testShutsDownGracefully_LocalAndTest(RuntimeEnvironment environment) {
        assertFalse(environment.shutsDownGracefully());
    }
}
