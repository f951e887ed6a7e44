package com.launchpad.messaging;

import com.launchpad.bootstrap.WorkerProcess;
import com.launchpad.service.VerificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically removes expired verification records. Runs in the worker only.
 *
 * A run is skipped if the previous one is still in progress.
 */
@Component
@WorkerProcess
@Slf4j
@RequiredArgsConstructor
public class VerificationCleanupJob {

    private final VerificationService verificationService;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    @Scheduled(cron = "${app.verification.cleanup-cron:0 */15 * * * *}")
    public void purgeExpiredVerifications() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Expired verification cleanup is already running, skipping this run");
            return;
        }

        try {
            int purged = verificationService.purgeExpired();
            if (purged > 0) {
                log.info("Expired verification cleanup removed {} record(s)", purged);
            }
        } catch (DataAccessException e) {
            log.error("Expired verification cleanup failed, will retry on next run", e);
        } finally {
            isRunning.set(false);
        }
    }

    boolean isRunning() {
        return isRunning.get();
    }
}
