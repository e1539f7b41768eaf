package at.sv.lock.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CopyMode {
    /**
     * Keeps the existing owner schedules of the target next to the copies.
     */
    @JsonProperty("merge")
    MERGE,
    /**
     * Deletes the existing owner schedules of the target before copying.
     */
    @JsonProperty("replace")
    REPLACE
}
