package com.launchpad.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of one managed queue as reported by the broker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatsResponse {

    private String name;

    /**
     * Role of the queue in the pipeline: {@code dispatch} or {@code dead-letter}.
     */
    private String kind;

    private boolean declared;

    private long messageCount;

    private long consumerCount;
}
