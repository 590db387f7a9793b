package tech.bulkstream.sdk.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the remote service schedules the batches of a job.
 */
public enum ConcurrencyMode {
    /** Batches may run at the same time */
    PARALLEL("Parallel"),

    /** Batches run one after another */
    SERIAL("Serial");

    private final String wireValue;

    ConcurrencyMode(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ConcurrencyMode fromValue(String value) {
        for (ConcurrencyMode mode : values()) {
            if (mode.wireValue.equals(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown concurrency mode: " + value);
    }
}
