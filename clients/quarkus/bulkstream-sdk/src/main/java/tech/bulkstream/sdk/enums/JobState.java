package tech.bulkstream.sdk.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a job as reported by the remote service.
 */
public enum JobState {
    OPEN("Open"),
    CLOSED("Closed"),
    ABORTED("Aborted"),
    FAILED("Failed");

    private final String wireValue;

    JobState(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Closed, aborted and failed jobs accept no further batches.
     */
    public boolean isTerminal() {
        return this != OPEN;
    }

    @JsonCreator
    public static JobState fromValue(String value) {
        for (JobState state : values()) {
            if (state.wireValue.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown job state: " + value);
    }
}
