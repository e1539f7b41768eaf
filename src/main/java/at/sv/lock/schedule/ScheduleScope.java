package at.sv.lock.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ScheduleScope {
    @JsonProperty("owner")
    OWNER,
    @JsonProperty("global")
    GLOBAL
}
