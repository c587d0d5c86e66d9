package dev.drtheo.jilox.runtime;

public enum LoxNil implements LoxValue {
    INSTANCE;

    @Override
    public ValueKind kind() {
        return ValueKind.NIL;
    }

    @Override
    public String toString() {
        return "nil";
    }
}
