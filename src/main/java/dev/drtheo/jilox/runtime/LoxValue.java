package dev.drtheo.jilox.runtime;

/**
 * A runtime value. Values compare by content and are never mutated;
 * {@link #toString()} gives the form a user sees.
 */
public sealed interface LoxValue permits LoxNumber, LoxString, LoxBoolean, LoxNil {

    ValueKind kind();
}
