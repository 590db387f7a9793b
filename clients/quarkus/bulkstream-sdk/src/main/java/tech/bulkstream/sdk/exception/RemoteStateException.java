package tech.bulkstream.sdk.exception;

import tech.bulkstream.sdk.dto.JobInfo;

import java.util.Map;

/**
 * Exception thrown when a job reports failed batches or failed records.
 *
 * <p>Carries the job status snapshot that triggered the failure.
 */
public class RemoteStateException extends BulkApiException {

    private final JobInfo jobInfo;

    public RemoteStateException(String message, JobInfo jobInfo) {
        super(message, 0, null, Map.of("jobId", String.valueOf(jobInfo.id())));
        this.jobInfo = jobInfo;
    }

    public JobInfo getJobInfo() {
        return jobInfo;
    }

    public static RemoteStateException jobFailed(JobInfo jobInfo) {
        return new RemoteStateException(String.format(
            "Job %s failed: %d of %d batches failed, %d records failed",
            jobInfo.id(), jobInfo.numberBatchesFailed(), jobInfo.numberBatchesTotal(),
            jobInfo.numberRecordsFailed()
        ), jobInfo);
    }
}
