package tech.bulkstream.sdk.dto;

/**
 * One size-capped chunk of a batch's query results.
 */
public record ResultSegment(
    String id,
    String batchId,
    String jobId
) {}
