package tech.bulkstream.sdk.dto;

import tech.bulkstream.sdk.enums.ConcurrencyMode;
import tech.bulkstream.sdk.enums.JobState;
import tech.bulkstream.sdk.enums.Operation;

import java.time.Instant;

/**
 * Snapshot of a job's state and counters.
 */
public record JobInfo(
    String id,
    Operation operation,
    String object,
    String externalIdFieldName,
    ConcurrencyMode concurrencyMode,
    String contentType,
    JobState state,
    Instant createdDate,
    Instant systemModstamp,
    int numberBatchesQueued,
    int numberBatchesInProgress,
    int numberBatchesCompleted,
    int numberBatchesFailed,
    int numberBatchesTotal,
    long numberRecordsProcessed,
    long numberRecordsFailed,
    int numberRetries,
    String apiVersion
) {

    /**
     * Every batch completed and nothing failed. Close the job.
     */
    public boolean isSuccessful() {
        return numberBatchesCompleted == numberBatchesTotal
            && numberBatchesFailed == 0
            && numberRecordsFailed == 0;
    }

    /**
     * A batch or record failed. Abort the job.
     */
    public boolean hasFailed() {
        return numberBatchesFailed > 0 || numberRecordsFailed > 0;
    }
}
