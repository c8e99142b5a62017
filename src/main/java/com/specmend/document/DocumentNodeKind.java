package com.specmend.document;

/**
 * Structural role of a parsed line.
 *
 * Inferred from the key itself for the well-known top-level sections, and from
 * the enclosing path ("paths" / "schemas") for everything nested below them.
 */
public enum DocumentNodeKind {
    VERSION,
    INFO,
    PATHS,
    COMPONENTS,
    SERVERS,
    OPERATION,
    SCHEMA,
    PROPERTY
}
