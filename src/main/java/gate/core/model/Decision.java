package gate.core.model;

public enum Decision {
    AVAILABLE,
    BUSY
}
