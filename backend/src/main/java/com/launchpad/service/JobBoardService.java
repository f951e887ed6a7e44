package com.launchpad.service;

import com.launchpad.dto.response.QueueStatsResponse;
import com.launchpad.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.QueueInformation;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backs the job-queue dashboard: queue inspection, purging and dead letter replay.
 *
 * Only the queues this application declares are visible. Any other name is
 * reported as not found, even if the broker knows it.
 *
 * @see com.launchpad.controller.JobBoardController
 * @see com.launchpad.config.RabbitMQConfig
 */
@Service
@Slf4j
public class JobBoardService {

    static final String DISPATCH_KIND = "dispatch";
    static final String DEAD_LETTER_KIND = "dead-letter";

    private final AmqpAdmin amqpAdmin;
    private final RabbitTemplate rabbitTemplate;
    private final String verificationExchange;
    private final String dispatchRoutingKey;
    private final String dispatchDLQ;
    private final Map<String, String> managedQueues = new LinkedHashMap<>();

    @Value("${app.job-board.retry-batch-size:100}")
    private int retryBatchSize;

    public JobBoardService(
            AmqpAdmin amqpAdmin,
            RabbitTemplate rabbitTemplate,
            @Value("${app.rabbitmq.exchange.verification:verification.exchange}") String verificationExchange,
            @Value("${app.rabbitmq.routing-key.dispatch:verification.dispatch}") String dispatchRoutingKey,
            @Value("${app.rabbitmq.queue.dispatch:verification.dispatch.queue}") String dispatchQueue,
            @Value("${app.rabbitmq.queue.dlq:verification.dispatch.dlq}") String dispatchDLQ
    ) {
        this.amqpAdmin = amqpAdmin;
        this.rabbitTemplate = rabbitTemplate;
        this.verificationExchange = verificationExchange;
        this.dispatchRoutingKey = dispatchRoutingKey;
        this.dispatchDLQ = dispatchDLQ;
        this.managedQueues.put(dispatchQueue, DISPATCH_KIND);
        this.managedQueues.put(dispatchDLQ, DEAD_LETTER_KIND);
    }

    /**
     * @return stats for every managed queue, in declaration order
     */
    public List<QueueStatsResponse> listQueues() {
        return managedQueues.keySet().stream()
                .map(this::describe)
                .toList();
    }

    /**
     * @param name queue name
     * @return stats for the queue
     * @throws ResourceNotFoundException if the queue is not managed by this application
     */
    public QueueStatsResponse getQueue(String name) {
        requireManaged(name);
        return describe(name);
    }

    /**
     * Drop every waiting message in a queue.
     *
     * @param name queue name
     * @return number of messages removed
     * @throws ResourceNotFoundException if the queue is not managed by this application
     */
    public int purgeQueue(String name) {
        requireManaged(name);
        int purged = amqpAdmin.purgeQueue(name);
        log.warn("Job board purged {} message(s) from queue {}", purged, name);
        return purged;
    }

    /**
     * Move dead-lettered jobs back to the dispatch exchange.
     *
     * At most {@code app.job-board.retry-batch-size} messages are moved per call.
     *
     * @return number of messages moved
     */
    public int retryDeadLetters() {
        int moved = 0;
        while (moved < retryBatchSize) {
            Message message = rabbitTemplate.receive(dispatchDLQ);
            if (message == null) {
                break;
            }
            rabbitTemplate.send(verificationExchange, dispatchRoutingKey, message);
            moved++;
        }

        log.info("Job board moved {} dead-lettered job(s) back to {}", moved, verificationExchange);
        return moved;
    }

    public String getDeadLetterQueue() {
        return dispatchDLQ;
    }

    private QueueStatsResponse describe(String name) {
        QueueInformation info = amqpAdmin.getQueueInfo(name);
        if (info == null) {
            log.debug("Queue {} is not declared on the broker yet", name);
            return QueueStatsResponse.builder()
                    .name(name)
                    .kind(managedQueues.get(name))
                    .declared(false)
                    .build();
        }

        return QueueStatsResponse.builder()
                .name(name)
                .kind(managedQueues.get(name))
                .declared(true)
                .messageCount(info.getMessageCount())
                .consumerCount(info.getConsumerCount())
                .build();
    }

    private void requireManaged(String name) {
        if (!managedQueues.containsKey(name)) {
            throw ResourceNotFoundException.queue(name);
        }
    }
}
