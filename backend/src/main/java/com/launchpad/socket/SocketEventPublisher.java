package com.launchpad.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes socket events to the shared Redis channel.
 *
 * Any process can publish; every main process relays the channel to its own
 * WebSocket subscribers, so an event reaches clients regardless of which
 * instance they are connected to.
 *
 * Publishing is fire-and-forget: a failure is logged and never fails the job
 * that produced the event.
 *
 * @see RedisSocketRelay
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SocketEventPublisher {

    private final StringRedisTemplate redisStringTemplate;
    private final ObjectMapper objectMapper;

    @Value("${app.socket.channel:launchpad:socket:events}")
    private String channel;

    public void publish(JobEvent event) {
        try {
            redisStringTemplate.convertAndSend(channel, objectMapper.writeValueAsString(event));
            log.debug("Published {} event for job {} on {}", event.getStatus(), event.getJobId(), channel);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize socket event for job {}: {}", event.getJobId(), e.getMessage());
        } catch (DataAccessException e) {
            log.warn("Socket event for job {} not published, Redis unavailable: {}", event.getJobId(), e.getMessage());
        }
    }
}
