package com.launchpad.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Redis configuration shared by rate limiting and socket event fan-out.
 *
 * Features:
 * - Configurable Redis host, port and password
 * - Lettuce client with a command timeout so a slow Redis cannot hang request threads
 * - A string template used for counters and for pub/sub payloads (JSON strings)
 *
 * @see org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory
 */
@Configuration
@Slf4j
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Value("${spring.data.redis.timeout:2s}")
    private Duration redisTimeout;

    /**
     * Configure Redis connection factory.
     *
     * @return Lettuce-based standalone connection factory
     */
    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
        config.setHostName(redisHost);
        config.setPort(redisPort);
        if (StringUtils.hasText(redisPassword)) {
            config.setPassword(redisPassword);
        }

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .commandTimeout(redisTimeout)
                .build();

        log.info("Configuring Redis connection factory: host={}, port={}, timeout={}", redisHost, redisPort, redisTimeout);
        return new LettuceConnectionFactory(config, clientConfig);
    }

    /**
     * String template for counters and pub/sub.
     *
     * @param redisConnectionFactory the Redis connection factory
     * @return template with string serialization for keys and values
     */
    @Bean
    public StringRedisTemplate redisStringTemplate(RedisConnectionFactory redisConnectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate(redisConnectionFactory);
        log.debug("StringRedisTemplate configured");
        return template;
    }
}
