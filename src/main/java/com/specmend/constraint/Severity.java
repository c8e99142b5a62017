package com.specmend.constraint;

public enum Severity {
    CRITICAL,
    MAJOR,
    MINOR
}
