package at.sv.lock.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ActionStatus {
    @JsonProperty("success")
    SUCCESS,
    @JsonProperty("skipped")
    SKIPPED,
    @JsonProperty("error")
    ERROR
}
