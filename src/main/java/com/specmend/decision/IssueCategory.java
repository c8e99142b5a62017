package com.specmend.decision;

import java.util.List;

/**
 * Issue categories used both as decision-tree branch labels and as buckets in
 * {@link IssueAnalysis}.
 *
 * Keyword sets are matched as substrings of a lowercased issue string.
 * CONSTRAINT is the bucket for issues no keyword set claims.
 */
public enum IssueCategory {

    ROOT("root", List.of()),
    STRUCTURAL("structural", List.of("path", "duplicate", "endpoint")),
    SECURITY("security", List.of("security", "auth", "bearer", "apikey")),
    SCHEMA("schema", List.of("schema", "property", "type", "example")),
    OPERATIONS("operations", List.of("operation", "response", "request")),
    CONSTRAINT("constraint", List.of());

    private final String       label;
    private final List<String> keywords;

    IssueCategory(String label, List<String> keywords) {
        this.label    = label;
        this.keywords = keywords;
    }

    public String getLabel() {
        return label;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    /** @param normalizedIssue lowercased, trimmed issue text */
    public boolean matches(String normalizedIssue) {
        for (String keyword : keywords) {
            if (normalizedIssue.contains(keyword)) return true;
        }
        return false;
    }

    /**
     * First category whose keywords match, in declaration order;
     * CONSTRAINT when none does.
     */
    public static IssueCategory classify(String issue) {
        String normalized = DecisionTreeSearcher.normalize(issue);
        for (IssueCategory category : List.of(STRUCTURAL, SECURITY, SCHEMA, OPERATIONS)) {
            if (category.matches(normalized)) return category;
        }
        return CONSTRAINT;
    }
}
