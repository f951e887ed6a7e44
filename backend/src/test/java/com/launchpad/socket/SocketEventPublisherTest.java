package com.launchpad.socket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SocketEventPublisher Unit Tests")
class SocketEventPublisherTest {

    private static final String CHANNEL = "launchpad:socket:events";

    @Mock
    private StringRedisTemplate redisStringTemplate;

    private SocketEventPublisher publisher;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        publisher = new SocketEventPublisher(redisStringTemplate, objectMapper);
        ReflectionTestUtils.setField(publisher, "channel", CHANNEL);
    }

    @Test
    @DisplayName("publish should send the event as JSON on the shared channel")
    void testPublish() {
        // Arrange
        UUID jobId = UUID.randomUUID();

        // Act
        publisher.publish(JobEvent.of("verification.dispatch.queue", jobId, JobEvent.Status.COMPLETED, null));

        // Assert
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(redisStringTemplate).convertAndSend(eq(CHANNEL), payload.capture());
        assertTrue(payload.getValue().contains(jobId.toString()));
        assertTrue(payload.getValue().contains("\"status\":\"COMPLETED\""));
    }

    @Test
    @DisplayName("publish should not fail the caller when Redis is down")
    void testPublish_RedisDown() {
        // Arrange
        when(redisStringTemplate.convertAndSend(anyString(), anyString()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        // Act & Assert
        assertDoesNotThrow(() -> publisher.publish(
                JobEvent.of("verification.dispatch.queue", UUID.randomUUID(), JobEvent.Status.FAILED, "boom")));
    }
}
