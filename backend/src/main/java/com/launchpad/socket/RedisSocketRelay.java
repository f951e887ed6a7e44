package com.launchpad.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.nio.charset.StandardCharsets;

/**
 * Forwards socket events from the shared Redis channel to this instance's
 * STOMP subscribers.
 *
 * Every main instance subscribes to the same channel, so an event published
 * anywhere reaches every connected client. Registered by {@link SocketRelayConfig}.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisSocketRelay implements MessageListener {

    public static final String JOBS_DESTINATION = "/topic/jobs";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String payload = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            JobEvent event = objectMapper.readValue(payload, JobEvent.class);
            messagingTemplate.convertAndSend(JOBS_DESTINATION, event);
            log.debug("Relayed {} event for job {} to {}", event.getStatus(), event.getJobId(), JOBS_DESTINATION);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable socket event: {}", e.getOriginalMessage());
        }
    }
}
