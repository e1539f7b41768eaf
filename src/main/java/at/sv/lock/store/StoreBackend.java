package at.sv.lock.store;

public enum StoreBackend {
    MEMORY,
    FILE
}
