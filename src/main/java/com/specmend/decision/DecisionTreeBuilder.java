package com.specmend.decision;

import java.util.List;

/**
 * Builds the static fix catalogue.
 *
 *   root
 *    ├── structural  (version, info, paths, duplicate path, http method)
 *    ├── security    (schemes, references, bearer, api key)
 *    ├── schema      (type, required, $ref, example, array items)
 *    └── operations  (operationId, responses, 200, error responses, request body)
 *
 * Branch patterns are "<category> issue" so a branch only matches when an
 * issue names the category itself; otherwise lookup falls through to the
 * leaves via the category keywords.
 */
public final class DecisionTreeBuilder {

    private DecisionTreeBuilder() {}

    public static DecisionNode buildTree() {
        return new DecisionNode(IssueCategory.ROOT, "", "", 1.0, List.of(
                structuralBranch(),
                securityBranch(),
                schemaBranch(),
                operationsBranch()
        ));
    }

    // =========================================================================
    // Branches
    // =========================================================================

    private static DecisionNode structuralBranch() {
        IssueCategory c = IssueCategory.STRUCTURAL;
        return new DecisionNode(c, "structural issue", "Review OpenAPI structure", 0.9, List.of(
                leaf(c, "missing openapi version",
                        "Add 'openapi: 3.1.0' at the top of the specification", 1.0),
                leaf(c, "missing info section",
                        "Add 'info:' section with title and version", 1.0),
                leaf(c, "missing paths",
                        "Add 'paths:' section with at least one endpoint", 1.0),
                leaf(c, "duplicate path",
                        "Ensure each path is unique or merge duplicate definitions", 0.95),
                leaf(c, "invalid http method",
                        "Use valid HTTP methods: get, post, put, patch, delete, head, options", 1.0)
        ));
    }

    private static DecisionNode securityBranch() {
        IssueCategory c = IssueCategory.SECURITY;
        return new DecisionNode(c, "security issue", "Review security definitions", 0.85, List.of(
                leaf(c, "missing security scheme",
                        "Add security scheme definition in components/securitySchemes", 0.95),
                leaf(c, "undefined security reference",
                        "Ensure security references match defined schemes", 0.9),
                leaf(c, "bearer token",
                        "Define Bearer token scheme: type: http, scheme: bearer", 1.0),
                leaf(c, "api key",
                        "Define API key scheme with name and in (header/query/cookie)", 1.0)
        ));
    }

    private static DecisionNode schemaBranch() {
        IssueCategory c = IssueCategory.SCHEMA;
        return new DecisionNode(c, "schema issue", "Review schema definitions", 0.8, List.of(
                leaf(c, "missing schema type",
                        "Add 'type' property to schema (object, array, string, number, boolean)", 0.95),
                leaf(c, "missing required properties",
                        "Add 'required' array for object schemas with mandatory fields", 0.9),
                leaf(c, "invalid $ref",
                        "Ensure $ref points to existing component: '#/components/schemas/ModelName'", 0.95),
                leaf(c, "missing example",
                        "Add 'example' field to improve documentation", 0.7),
                leaf(c, "array without items",
                        "Add 'items' property to define array element type", 1.0)
        ));
    }

    private static DecisionNode operationsBranch() {
        IssueCategory c = IssueCategory.OPERATIONS;
        return new DecisionNode(c, "operations issue", "Review operation definitions", 0.85, List.of(
                leaf(c, "missing operationid",
                        "Add unique 'operationId' to each operation", 0.95),
                leaf(c, "missing responses",
                        "Add 'responses' section with at least one status code", 1.0),
                leaf(c, "missing 200 response",
                        "Add '200' response for successful operations", 0.9),
                leaf(c, "missing error responses",
                        "Add error responses (400, 401, 403, 404, 500)", 0.8),
                leaf(c, "missing request body",
                        "Add 'requestBody' with content type and schema", 0.85)
        ));
    }

    private static DecisionNode leaf(IssueCategory category, String pattern, String solution, double confidence) {
        return new DecisionNode(category, pattern, solution, confidence);
    }
}
