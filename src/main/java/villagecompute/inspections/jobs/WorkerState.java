package villagecompute.inspections.jobs;

/**
 * Observable state of a single worker loop.
 */
public enum WorkerState {
    /**
     * Waiting for the next poll tick.
     */
    IDLE,

    /**
     * Inside the lease transaction.
     */
    LEASING,

    /**
     * Running a handler, outside any transaction.
     */
    EXECUTING,

    /**
     * Recording the outcome of the last execution.
     */
    RESOLVING,

    /**
     * Loop has exited.
     */
    STOPPED
}
