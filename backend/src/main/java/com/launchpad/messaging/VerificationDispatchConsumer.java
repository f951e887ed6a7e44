package com.launchpad.messaging;

import com.launchpad.bootstrap.WorkerProcess;
import com.launchpad.entity.VerificationEntity;
import com.launchpad.exception.NotificationException;
import com.launchpad.notification.VerificationNotifier;
import com.launchpad.repository.VerificationRepository;
import com.launchpad.socket.JobEvent;
import com.launchpad.socket.SocketEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Worker-side consumer delivering verification codes.
 *
 * Processing Flow:
 * 1. Receive a dispatch message from the dispatch queue
 * 2. Reload the record; skip it if it was consumed, replaced or has expired
 * 3. Deliver the code through the {@link VerificationNotifier}
 * 4. Publish the outcome as a {@link JobEvent} for WebSocket subscribers
 *
 * Error Handling:
 * - Malformed messages and delivery failures are rejected without requeue,
 *   so the broker routes them to the dead letter queue
 * - Other runtime failures are retried by the listener container, then dead-lettered
 *
 * @see VerificationDispatchProducer
 * @see com.launchpad.config.RabbitMQConfig
 */
@Component
@WorkerProcess
@Slf4j
@RequiredArgsConstructor
public class VerificationDispatchConsumer {

    private final VerificationRepository verificationRepository;
    private final VerificationNotifier verificationNotifier;
    private final SocketEventPublisher socketEventPublisher;
    private final Clock clock;

    @Value("${app.rabbitmq.queue.dispatch:verification.dispatch.queue}")
    private String dispatchQueue;

    @RabbitListener(queues = "${app.rabbitmq.queue.dispatch:verification.dispatch.queue}")
    public void dispatchVerification(VerificationDispatchMessage message) {
        if (message == null || message.getVerificationId() == null) {
            log.error("Received dispatch message without verification ID: {}", message);
            throw new AmqpRejectAndDontRequeueException("Dispatch message has no verification ID");
        }

        log.info("Received verification dispatch task: verificationId={}", message.getVerificationId());

        Optional<VerificationEntity> found = verificationRepository.findById(message.getVerificationId());
        if (found.isEmpty()) {
            log.info("Verification {} no longer exists, skipping delivery", message.getVerificationId());
            socketEventPublisher.publish(JobEvent.of(dispatchQueue, message.getVerificationId(),
                    JobEvent.Status.SKIPPED, "verification no longer exists"));
            return;
        }

        VerificationEntity verification = found.get();
        if (verification.isExpired(LocalDateTime.now(clock))) {
            log.info("Verification {} expired before delivery, skipping", verification.getId());
            socketEventPublisher.publish(JobEvent.of(dispatchQueue, verification.getId(),
                    JobEvent.Status.SKIPPED, "verification expired"));
            return;
        }

        try {
            verificationNotifier.deliver(verification.getIdentifier(), verification.getValue(), verification.getExpiresAt());
        } catch (NotificationException e) {
            log.error("Verification delivery failed: verificationId={}, channel={}, error={}",
                    verification.getId(), e.getChannel(), e.getMessage());
            socketEventPublisher.publish(JobEvent.of(dispatchQueue, verification.getId(),
                    JobEvent.Status.FAILED, e.getMessage()));
            throw new AmqpRejectAndDontRequeueException(e.getMessage(), e);
        }

        log.info("Verification dispatch completed: verificationId={}", verification.getId());
        socketEventPublisher.publish(JobEvent.of(dispatchQueue, verification.getId(),
                JobEvent.Status.COMPLETED, null));
    }
}
