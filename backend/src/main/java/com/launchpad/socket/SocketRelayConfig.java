package com.launchpad.socket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchpad.bootstrap.MainProcess;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * Subscribes the main process to the Redis socket channel.
 *
 * Disabled with {@code app.socket.redis-relay.enabled=false}, which leaves
 * WebSocket delivery local to each instance.
 */
@Configuration
@MainProcess
@ConditionalOnProperty(name = "app.socket.redis-relay.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SocketRelayConfig {

    @Value("${app.socket.channel:launchpad:socket:events}")
    private String channel;

    @Bean
    public RedisSocketRelay redisSocketRelay(SimpMessagingTemplate messagingTemplate, ObjectMapper objectMapper) {
        return new RedisSocketRelay(messagingTemplate, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer socketRelayListenerContainer(
            RedisConnectionFactory redisConnectionFactory,
            RedisSocketRelay redisSocketRelay
    ) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(redisConnectionFactory);
        container.addMessageListener(redisSocketRelay, new ChannelTopic(channel));
        log.info("Relaying Redis channel {} to WebSocket subscribers", channel);
        return container;
    }
}
