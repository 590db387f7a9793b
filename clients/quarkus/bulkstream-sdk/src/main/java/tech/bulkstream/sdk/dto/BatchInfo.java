package tech.bulkstream.sdk.dto;

import tech.bulkstream.sdk.enums.BatchState;

import java.time.Instant;

/**
 * State and counters of one batch of a job.
 */
public record BatchInfo(
    String id,
    String jobId,
    BatchState state,
    String stateMessage,
    Instant createdDate,
    Instant systemModstamp,
    long numberRecordsProcessed,
    long numberRecordsFailed,
    long totalProcessingTime
) {

    /**
     * Whether the batch carries result data. {@code NotProcessed} batches never do.
     */
    public boolean isEligibleForResults() {
        return state != BatchState.NOT_PROCESSED;
    }
}
