package com.specmend.constraint;

/**
 * What a {@link Constraint} checks.
 *
 * DEPENDENCY is reserved for cross-field rules and always evaluates as satisfied.
 */
public enum ConstraintKind {

    /** A value must be present. */
    REQUIRED,

    /** A value must match a pattern; {@code *} means any non-empty value. */
    FORMAT,

    /** A value must be a local reference ({@code #/...}). */
    REFERENCE,

    DEPENDENCY
}
