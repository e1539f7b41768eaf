package at.sv.lock.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RecurrenceType {
    @JsonProperty("one_shot")
    ONE_SHOT,
    @JsonProperty("daily")
    DAILY,
    @JsonProperty("weekly")
    WEEKLY,
    @JsonProperty("monthly")
    MONTHLY
}
