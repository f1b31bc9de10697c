package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ConditionStatus {
    @JsonProperty("True")
    TRUE,
    @JsonProperty("False")
    FALSE,
    @JsonProperty("Unknown")
    UNKNOWN;

    public static ConditionStatus of(boolean value) {
        return value ? TRUE : FALSE;
    }
}
