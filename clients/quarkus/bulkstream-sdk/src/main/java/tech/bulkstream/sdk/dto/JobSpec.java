package tech.bulkstream.sdk.dto;

import lombok.Builder;
import lombok.With;
import tech.bulkstream.sdk.enums.ConcurrencyMode;
import tech.bulkstream.sdk.enums.Operation;

/**
 * Parameters used to create a job.
 */
@Builder(toBuilder = true)
@With
public record JobSpec(
    Operation operation,
    String object,
    String externalIdFieldName,
    ConcurrencyMode concurrencyMode,
    boolean pkChunking
) {
    public JobSpec {
        if (concurrencyMode == null) {
            concurrencyMode = ConcurrencyMode.PARALLEL;
        }
    }

    /**
     * Query job on {@code object} with default settings.
     */
    public static JobSpec query(String object) {
        return JobSpec.builder()
            .operation(Operation.QUERY)
            .object(object)
            .build();
    }
}
