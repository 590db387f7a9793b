package tech.bulkstream.sdk.stream;

/**
 * Outcome of a {@link LineStage} for one line.
 */
public enum LineDecision {
    EMIT,
    DROP
}
