package at.sv.lock.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public enum LockAction {
    @JsonProperty("lock")
    LOCK,
    @JsonProperty("unlock")
    UNLOCK;

    public boolean isUnlock() {
        return this == UNLOCK;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
