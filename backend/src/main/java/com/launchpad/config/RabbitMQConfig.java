package com.launchpad.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ configuration for background verification dispatch.
 *
 * Architecture:
 * - Exchange: direct exchange {@code verification.exchange}
 * - Main Queue: {@code verification.dispatch.queue}, consumed by the worker process
 * - DLQ: {@code verification.dispatch.dlq}, receives rejected or expired messages
 * - Routing Keys: {@code verification.dispatch} and {@code verification.dispatch.dlq}
 *
 * Features:
 * - JSON message converter sharing the application's ObjectMapper
 * - Dead letter routing for rejected messages
 * - TTL and max-length settings for queue management
 * - Publisher confirm and return callbacks logged for diagnosis
 *
 * Both process roles declare the topology: the main process publishes,
 * the worker consumes, and the job board in either role inspects it.
 *
 * @see org.springframework.amqp.core.DirectExchange
 * @see org.springframework.amqp.rabbit.core.RabbitTemplate
 */
@Configuration
@Slf4j
public class RabbitMQConfig {

    @Value("${app.rabbitmq.exchange.verification:verification.exchange}")
    private String verificationExchange;

    @Value("${app.rabbitmq.queue.dispatch:verification.dispatch.queue}")
    private String dispatchQueue;

    @Value("${app.rabbitmq.queue.dlq:verification.dispatch.dlq}")
    private String dispatchDLQ;

    @Value("${app.rabbitmq.routing-key.dispatch:verification.dispatch}")
    private String dispatchRoutingKey;

    @Value("${app.rabbitmq.routing-key.dlq:verification.dispatch.dlq}")
    private String dlqRoutingKey;

    @Value("${app.rabbitmq.queue.ttl:3600000}")
    private long queueTTL;

    @Value("${app.rabbitmq.queue.max-length:10000}")
    private int queueMaxLength;

    /**
     * JSON converter built on the Spring-managed ObjectMapper so dates
     * serialize the same way on the wire as in HTTP responses.
     *
     * @param objectMapper the application ObjectMapper
     * @return converter for message payloads
     */
    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        log.debug("Configuring Jackson2JsonMessageConverter for RabbitMQ");
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    /**
     * RabbitTemplate with JSON conversion and logged publisher callbacks.
     *
     * @param connectionFactory the RabbitMQ connection factory
     * @param jsonMessageConverter the JSON message converter
     * @return configured RabbitTemplate
     */
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter);

        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (ack) {
                log.debug("Message published successfully to RabbitMQ");
            } else {
                log.error("Failed to publish message to RabbitMQ: {}", cause);
            }
        });

        rabbitTemplate.setReturnsCallback(returned ->
                log.error("Message returned from RabbitMQ - Exchange: {}, RoutingKey: {}, ReplyText: {}",
                        returned.getExchange(),
                        returned.getRoutingKey(),
                        returned.getReplyText()));

        log.info("RabbitTemplate configured with JSON message converter");
        return rabbitTemplate;
    }

    /**
     * Dead letter queue. Messages stay here until retried or purged from the job board.
     *
     * @return durable DLQ
     */
    @Bean
    public Queue verificationDispatchDLQ() {
        log.info("Configuring DLQ: {} (durable=true)", dispatchDLQ);
        return QueueBuilder.durable(dispatchDLQ).build();
    }

    /**
     * Main dispatch queue.
     *
     * Queue Features:
     * - durable: survives broker restart
     * - TTL: undelivered messages expire after the configured time (default: 1 hour)
     * - Max Length: oldest messages are dropped when the limit is reached
     * - DLQ: rejected and expired messages are routed to the DLQ
     *
     * @return dispatch queue with dead letter routing
     */
    @Bean
    public Queue verificationDispatchQueue() {
        log.info("Configuring queue: {} (durable=true, ttl={}, maxLength={})",
                dispatchQueue, queueTTL, queueMaxLength);

        return QueueBuilder.durable(dispatchQueue)
                .withArgument("x-message-ttl", queueTTL)
                .withArgument("x-max-length", queueMaxLength)
                .withArgument("x-dead-letter-exchange", verificationExchange)
                .withArgument("x-dead-letter-routing-key", dlqRoutingKey)
                .build();
    }

    @Bean
    public DirectExchange verificationExchange() {
        log.info("Configuring direct exchange: {} (durable=true)", verificationExchange);
        return new DirectExchange(verificationExchange, true, false);
    }

    @Bean
    public Binding dlqBinding() {
        log.debug("Binding DLQ {} to exchange {} with routing key {}",
                dispatchDLQ, verificationExchange, dlqRoutingKey);

        return BindingBuilder
                .bind(verificationDispatchDLQ())
                .to(verificationExchange())
                .with(dlqRoutingKey);
    }

    @Bean
    public Binding dispatchBinding() {
        log.debug("Binding queue {} to exchange {} with routing key {}",
                dispatchQueue, verificationExchange, dispatchRoutingKey);

        return BindingBuilder
                .bind(verificationDispatchQueue())
                .to(verificationExchange())
                .with(dispatchRoutingKey);
    }

    /**
     * Admin that declares the topology on first connection and backs the job board queue inspection.
     *
     * @param connectionFactory the RabbitMQ connection factory
     * @return RabbitAdmin for declaration and queue info
     */
    @Bean
    public AmqpAdmin amqpAdmin(ConnectionFactory connectionFactory) {
        log.info("Configuring AmqpAdmin for automatic queue/exchange declaration");
        return new RabbitAdmin(connectionFactory);
    }
}
