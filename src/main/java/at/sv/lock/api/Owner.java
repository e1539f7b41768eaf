package at.sv.lock.api;

public record Owner(String key, String displayName) {
}
