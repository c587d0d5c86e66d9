package dev.drtheo.jilox.runtime;

import java.util.Objects;

public record LoxString(String value) implements LoxValue {

    public LoxString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public ValueKind kind() {
        return ValueKind.STRING;
    }

    @Override
    public String toString() {
        return value;
    }
}
