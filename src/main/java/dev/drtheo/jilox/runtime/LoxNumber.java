package dev.drtheo.jilox.runtime;

public record LoxNumber(float value) implements LoxValue {

    @Override
    public ValueKind kind() {
        return ValueKind.NUMBER;
    }

    @Override
    public String toString() {
        String text = Float.toString(value);

        if (text.endsWith(".0"))
            text = text.substring(0, text.length() - 2);

        return text;
    }
}
