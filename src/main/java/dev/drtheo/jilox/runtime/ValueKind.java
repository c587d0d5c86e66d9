package dev.drtheo.jilox.runtime;

public enum ValueKind {
    NUMBER("number"),
    STRING("string"),
    BOOLEAN("boolean"),
    NIL("nil");

    private final String displayName;

    ValueKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
