package com.specmend.constraint;

/**
 * A constraint that failed evaluation, with its message and severity.
 */
public final class ConstraintViolation {

    private final Constraint constraint;
    private final String     message;
    private final Severity   severity;

    public ConstraintViolation(Constraint constraint, String message, Severity severity) {
        this.constraint = constraint;
        this.message    = message;
        this.severity   = severity;
    }

    public Constraint getConstraint() { return constraint; }

    public String getMessage() { return message; }

    public Severity getSeverity() { return severity; }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + message;
    }
}
