package villagecompute.inspections.jobs;

/**
 * Contract for async job handler implementations.
 *
 * <p>Handlers are CDI-managed beans annotated with {@code @ApplicationScoped}. The {@link JobHandlerRegistry} is built
 * from every discovered handler before the {@link WorkerPool} starts, and routes leased jobs by
 * {@link JobType#getKey()}.
 *
 * <p><b>Execution Model:</b>
 * <ul>
 *   <li>Handlers run on worker pool threads, outside any database transaction</li>
 *   <li>Every execution is bounded by the job timeout carried in the {@link JobContext}</li>
 *   <li>Delivery is at-least-once, so handlers must be idempotent</li>
 * </ul>
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * @ApplicationScoped
 * public class GenerateReportJobHandler implements JobHandler {
 *     @Override
 *     public JobType handlesType() {
 *         return JobType.GENERATE_REPORT;
 *     }
 *
 *     @Override
 *     public void execute(JobContext context, byte[] payload) throws Exception {
 *         GenerateReportPayload request = objectMapper.readValue(payload, GenerateReportPayload.class);
 *         // Render and upload the report...
 *     }
 * }
 * }</pre>
 *
 * @see WorkerPool for dispatcher implementation
 * @see JobType for supported job types
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Executes the job with the given payload.
     *
     * <p><b>Thread Safety:</b> This method may be called concurrently by multiple worker threads.
     *
     * <p><b>Error Handling:</b> Throw {@link villagecompute.inspections.exceptions.PermanentJobException} when retrying
     * can never succeed; the job fails immediately. Any other exception is transient and triggers a retry with
     * exponential backoff until {@code max_attempts} is reached.
     *
     * <p><b>Cancellation:</b> Long-running handlers should poll {@link JobContext#isCancelled()} and use
     * {@link JobContext#sleep(java.time.Duration)} for waits so that timeouts and shutdown take effect promptly.
     *
     * @param context execution context (job id, attempt, deadline)
     * @param payload serialized job parameters (JSON)
     * @throws Exception any error during execution
     */
    void execute(JobContext context, byte[] payload) throws Exception;
}
