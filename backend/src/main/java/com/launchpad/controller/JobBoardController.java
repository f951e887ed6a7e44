package com.launchpad.controller;

import com.launchpad.dto.response.JobBoardActionResponse;
import com.launchpad.dto.response.QueueStatsResponse;
import com.launchpad.service.JobBoardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Job-queue dashboard, served at /api/queues in both process roles.
 *
 * Every endpoint requires job board credentials (HTTP Basic or the session
 * cookie issued after a Basic login); see SecurityConfig.
 *
 * @see com.launchpad.service.JobBoardService
 * @see com.launchpad.security.JobBoardAuthenticationFilter
 */
@RestController
@RequestMapping("/queues")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Job board", description = "Inspect and operate background job queues")
@SecurityRequirement(name = "jobBoardBasic")
public class JobBoardController {

    private final JobBoardService jobBoardService;

    @GetMapping
    @Operation(summary = "List managed queues")
    public ResponseEntity<List<QueueStatsResponse>> listQueues() {
        return ResponseEntity.ok(jobBoardService.listQueues());
    }

    @GetMapping("/{name}")
    @Operation(summary = "Show one queue")
    public ResponseEntity<QueueStatsResponse> getQueue(@PathVariable String name) {
        return ResponseEntity.ok(jobBoardService.getQueue(name));
    }

    @DeleteMapping("/{name}/jobs")
    @Operation(summary = "Purge waiting jobs from a queue")
    public ResponseEntity<JobBoardActionResponse> purgeQueue(@PathVariable String name) {
        log.info("Job board purge requested for queue {}", name);
        int purged = jobBoardService.purgeQueue(name);
        return ResponseEntity.ok(JobBoardActionResponse.builder()
                .queue(name)
                .action("purge")
                .affected(purged)
                .build());
    }

    @PostMapping("/dead-letters/retry")
    @Operation(summary = "Move dead-lettered jobs back to the dispatch queue")
    public ResponseEntity<JobBoardActionResponse> retryDeadLetters() {
        log.info("Job board dead letter retry requested");
        int moved = jobBoardService.retryDeadLetters();
        return ResponseEntity.ok(JobBoardActionResponse.builder()
                .queue(jobBoardService.getDeadLetterQueue())
                .action("retry")
                .affected(moved)
                .build());
    }
}
