package com.launchpad.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a job board action (purge, dead letter retry).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobBoardActionResponse {

    private String queue;

    private String action;

    private int affected;
}
