package tech.bulkstream.sdk.exception;

import tech.bulkstream.sdk.dto.JobInfo;

/**
 * Exception thrown when a job is still running after the configured number of status reads.
 */
public class JobTimeoutException extends BulkApiException {

    private final JobInfo lastSnapshot;

    public JobTimeoutException(String message, JobInfo lastSnapshot) {
        super(message);
        this.lastSnapshot = lastSnapshot;
    }

    public JobInfo getLastSnapshot() {
        return lastSnapshot;
    }

    public static JobTimeoutException afterAttempts(int attempts, JobInfo lastSnapshot) {
        return new JobTimeoutException(
            "Job " + lastSnapshot.id() + " not finished after " + attempts + " status reads",
            lastSnapshot
        );
    }
}
