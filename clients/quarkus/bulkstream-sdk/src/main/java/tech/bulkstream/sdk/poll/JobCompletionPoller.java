package tech.bulkstream.sdk.poll;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bulkstream.sdk.client.resources.JobController;
import tech.bulkstream.sdk.config.BulkApiConfig;
import tech.bulkstream.sdk.dto.JobInfo;
import tech.bulkstream.sdk.exception.BulkApiException;
import tech.bulkstream.sdk.exception.JobTimeoutException;
import tech.bulkstream.sdk.exception.RemoteStateException;

/**
 * Waits for a job to finish, closing it on success and aborting it on failure.
 *
 * <p>Nothing polls on its own: the caller decides when to wait. Status is read after
 * each interval until the job succeeds, fails or the attempt limit runs out.
 */
@ApplicationScoped
public class JobCompletionPoller {

    private static final Logger LOG = Logger.getLogger(JobCompletionPoller.class);

    private final long intervalMillis;
    private final int maxAttempts;

    @Inject
    public JobCompletionPoller(BulkApiConfig config) {
        this(config.poll().interval(), config.poll().maxAttempts());
    }

    public JobCompletionPoller(long intervalMillis, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.intervalMillis = intervalMillis;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Block until the job finishes.
     *
     * @return the job status after closing, or the last status when the job was already closed
     * @throws RemoteStateException if a batch or record failed; the job is aborted first
     * @throws JobTimeoutException  if the job is still running after the last attempt
     */
    public JobInfo awaitCompletion(JobController job) {
        JobInfo info = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            sleep();
            info = job.getJobInfo();

            if (info.hasFailed()) {
                LOG.warnf("Job %s failed (%d batches, %d records); aborting",
                    info.id(), info.numberBatchesFailed(), info.numberRecordsFailed());
                RemoteStateException failure = RemoteStateException.jobFailed(info);
                try {
                    job.abortJob();
                } catch (BulkApiException e) {
                    failure.addSuppressed(e);
                }
                throw failure;
            }

            if (info.isSuccessful()) {
                LOG.infof("Job %s completed %d batch(es) after %d status read(s)",
                    info.id(), info.numberBatchesTotal(), attempt);
                return info.state().isTerminal() ? info : job.closeJob();
            }
        }
        throw JobTimeoutException.afterAttempts(maxAttempts, info);
    }

    private void sleep() {
        if (intervalMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(intervalMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BulkApiException("Interrupted while waiting for job", e);
        }
    }
}
