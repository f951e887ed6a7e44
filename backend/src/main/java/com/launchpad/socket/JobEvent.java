package com.launchpad.socket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Outcome of a background job, pushed to WebSocket subscribers on {@code /topic/jobs}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobEvent {

    public enum Status {
        COMPLETED,
        SKIPPED,
        FAILED
    }

    private String queue;

    private UUID jobId;

    private Status status;

    private String detail;

    private LocalDateTime timestamp;

    public static JobEvent of(String queue, UUID jobId, Status status, String detail) {
        return JobEvent.builder()
                .queue(queue)
                .jobId(jobId)
                .status(status)
                .detail(detail)
                .timestamp(LocalDateTime.now())
                .build();
    }
}
