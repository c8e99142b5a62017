package com.specmend.validator;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Severity tag carried at the front of every structural issue string.
 *
 * ERROR    the document is structurally broken and must be fixed.
 * WARNING  the document is usable but incomplete or ambiguous.
 * HINT     coverage recommendation; never blocks validity on its own.
 *
 * Issues from other sources (oracle review text) usually carry no tag and are
 * classified as WARNING.
 */
public enum IssueSeverity {

    ERROR("[ERROR]"),
    WARNING("[WARN]"),
    HINT("[HINT]");

    private final String tag;

    IssueSeverity(String tag) {
        this.tag = tag;
    }

    public String format(String message) {
        return tag + " " + message;
    }

    public static IssueSeverity of(String issue) {
        if (issue == null) return WARNING;
        if (issue.contains(ERROR.tag)) return ERROR;
        if (issue.contains(HINT.tag))  return HINT;
        return WARNING;
    }

    public static boolean isCritical(String issue) {
        return of(issue) == ERROR;
    }

    /** Groups issues by severity, preserving input order inside each group. */
    public static Map<IssueSeverity, List<String>> partition(List<String> issues) {
        Map<IssueSeverity, List<String>> grouped = new EnumMap<>(IssueSeverity.class);
        for (IssueSeverity severity : values()) {
            grouped.put(severity, new ArrayList<>());
        }
        for (String issue : issues) {
            grouped.get(of(issue)).add(issue);
        }
        return grouped;
    }
}
