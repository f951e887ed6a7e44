package com.launchpad.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Publishes verification dispatch jobs to RabbitMQ.
 *
 * Messages are routed through the verification exchange to the dispatch
 * queue, where the worker process picks them up.
 *
 * @see VerificationDispatchConsumer
 * @see com.launchpad.config.RabbitMQConfig
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VerificationDispatchProducer {

    private final RabbitTemplate rabbitTemplate;

    @Value("${app.rabbitmq.exchange.verification:verification.exchange}")
    private String verificationExchange;

    @Value("${app.rabbitmq.routing-key.dispatch:verification.dispatch}")
    private String dispatchRoutingKey;

    /**
     * Queue delivery of a verification code.
     *
     * @param verificationId id of the persisted record
     * @param identifier who the code goes to, carried for logging on the worker side
     * @throws IllegalArgumentException if verificationId is null
     * @throws AmqpException if the broker rejects the publish
     */
    public void sendDispatchTask(UUID verificationId, String identifier) {
        if (verificationId == null) {
            log.error("Attempted to send null verification ID to dispatch queue");
            throw new IllegalArgumentException("Verification ID cannot be null");
        }

        log.info("Sending verification dispatch task: verificationId={}", verificationId);
        log.debug("Queue configuration: exchange={}, routingKey={}", verificationExchange, dispatchRoutingKey);

        try {
            rabbitTemplate.convertAndSend(
                    verificationExchange,
                    dispatchRoutingKey,
                    new VerificationDispatchMessage(verificationId, identifier)
            );
            log.info("Verification dispatch task queued: verificationId={}", verificationId);
        } catch (AmqpException e) {
            log.error("Failed to queue verification dispatch task: verificationId={}, error={}",
                    verificationId, e.getMessage(), e);
            throw e;
        }
    }
}
