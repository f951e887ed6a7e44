package com.launchpad.bootstrap;

/**
 * Role of the running process.
 *
 * MAIN serves primary traffic, WORKER processes background jobs.
 * Both run the same application binary.
 */
public enum ProcessRole {

    MAIN,
    WORKER;

    public boolean isWorker() {
        return this == WORKER;
    }

    /**
     * Parse the {@code app.worker} flag.
     *
     * Only {@code true} and {@code false} (any case) are accepted, the same values
     * {@link MainProcess} and {@link WorkerProcess} match on. Anything else would
     * leave the process with a port but without the beans of either role.
     *
     * @param worker raw flag value
     * @return WORKER for true, MAIN for false
     * @throws IllegalArgumentException for any other value
     */
    public static ProcessRole fromWorkerFlag(String worker) {
        if ("true".equalsIgnoreCase(worker)) {
            return WORKER;
        }
        if ("false".equalsIgnoreCase(worker)) {
            return MAIN;
        }
        throw new IllegalArgumentException(
                "Invalid app.worker value '" + worker + "'. Expected 'true' or 'false'.");
    }
}
