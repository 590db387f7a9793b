package tech.bulkstream.sdk.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Processing state of a single batch.
 */
public enum BatchState {
    QUEUED("Queued"),
    IN_PROGRESS("InProgress"),
    COMPLETED("Completed"),
    FAILED("Failed"),

    /**
     * Never processed. With PK chunking the original batch stays in this state
     * permanently while the chunked batches do the work.
     */
    NOT_PROCESSED("NotProcessed");

    private final String wireValue;

    BatchState(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static BatchState fromValue(String value) {
        for (BatchState state : values()) {
            if (state.wireValue.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown batch state: " + value);
    }
}
