package tech.bulkstream.sdk.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operation a job performs against its target object.
 */
public enum Operation {
    INSERT("insert"),
    UPSERT("upsert"),
    UPDATE("update"),
    DELETE("delete"),
    HARD_DELETE("hardDelete"),
    QUERY("query"),
    QUERY_ALL("queryAll");

    private final String wireValue;

    Operation(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Query operations take SOQL text as their single batch payload.
     */
    public boolean isQuery() {
        return this == QUERY || this == QUERY_ALL;
    }

    @JsonCreator
    public static Operation fromValue(String value) {
        for (Operation operation : values()) {
            if (operation.wireValue.equals(value)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + value);
    }
}
