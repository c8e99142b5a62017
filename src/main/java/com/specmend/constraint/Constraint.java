package com.specmend.constraint;

import com.specmend.document.DocumentNode;

/**
 * One declarative rule derived from a parsed document.
 *
 * Immutable. {@code source} is the node the rule was derived from and may be
 * null when the rule exists because something is absent (e.g. no version line).
 */
public final class Constraint {

    private final ConstraintKind kind;
    private final String         path;
    private final String         requirement;
    private final String         expectedValue;
    private final String         actualValue;
    private final Severity       severity;
    private final DocumentNode   source;

    private Constraint(
            ConstraintKind kind,
            String path,
            String requirement,
            String expectedValue,
            String actualValue,
            Severity severity,
            DocumentNode source
    ) {
        this.kind          = kind;
        this.path          = path;
        this.requirement   = requirement;
        this.expectedValue = expectedValue;
        this.actualValue   = actualValue;
        this.severity      = severity;
        this.source        = source;
    }

    // =========================================================================
    // Factories
    // =========================================================================

    public static Constraint required(String path, String requirement, String actualValue,
                                      Severity severity, DocumentNode source) {
        return new Constraint(ConstraintKind.REQUIRED, path, requirement, null, actualValue, severity, source);
    }

    public static Constraint format(String path, String requirement, String pattern, String actualValue,
                                    Severity severity, DocumentNode source) {
        return new Constraint(ConstraintKind.FORMAT, path, requirement, pattern, actualValue, severity, source);
    }

    public static Constraint reference(String path, String requirement, String actualValue,
                                       Severity severity, DocumentNode source) {
        return new Constraint(ConstraintKind.REFERENCE, path, requirement, "#/", actualValue, severity, source);
    }

    public static Constraint dependency(String path, String requirement, Severity severity, DocumentNode source) {
        return new Constraint(ConstraintKind.DEPENDENCY, path, requirement, null, null, severity, source);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public ConstraintKind getKind() { return kind; }

    public String getPath() { return path; }

    public String getRequirement() { return requirement; }

    public String getExpectedValue() { return expectedValue; }

    public String getActualValue() { return actualValue; }

    public Severity getSeverity() { return severity; }

    public DocumentNode getSource() { return source; }

    @Override
    public String toString() {
        return "Constraint{" + kind + " " + path + ": " + requirement + "}";
    }
}
