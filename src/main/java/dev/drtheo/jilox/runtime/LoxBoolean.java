package dev.drtheo.jilox.runtime;

public record LoxBoolean(boolean value) implements LoxValue {

    public static final LoxBoolean TRUE = new LoxBoolean(true);
    public static final LoxBoolean FALSE = new LoxBoolean(false);

    public static LoxBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public LoxBoolean not() {
        return of(!value);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.BOOLEAN;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
