package com.specmend.constraint;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.specmend.document.DocumentNode;
import com.specmend.document.DocumentTree;

/**
 * Derives a fixed rule set from a parsed document and
 * evaluates it.
 *
 * Extraction is a single walk over the tree:
 *   - openapi version present, and shaped 3.x.y when present
 *   - info and paths sections present
 *   - every operation has operationId and responses
 *   - every component schema has type and example (arrays also need items)
 *   - every $ref is a local reference
 *
 * Violation messages are phrased so {@code DecisionTree} can match them.
 * The rule set is closed: no completeness guarantee beyond these checks.
 */
@Component
public class ConstraintSolver {

    private static final Logger log = LoggerFactory.getLogger(ConstraintSolver.class);

    static final String VERSION_PATTERN = "3\\.\\d+\\.\\d+";
    static final String ANY_VALUE       = "*";

    // =========================================================================
    // Extraction
    // =========================================================================

    public List<Constraint> extractConstraints(DocumentTree tree) {

        List<Constraint> constraints = new ArrayList<>();

        addVersionConstraints(tree, constraints);
        addSectionConstraints(tree, constraints);

        for (DocumentNode node : tree.getAllNodes()) {
            if (isOperation(node)) {
                addOperationConstraints(node, constraints);
            } else if (isComponentSchema(node)) {
                addSchemaConstraints(node, constraints);
            }
            if ("$ref".equals(node.getKey())) {
                constraints.add(Constraint.reference(
                        node.getQualifiedName(),
                        "Invalid $ref '" + node.getValue() + "' at " + String.join(".", node.getPath()),
                        node.getValue(),
                        Severity.MAJOR,
                        node));
            }
        }

        log.debug("[Solver] Extracted {} constraints from {} nodes", constraints.size(), tree.size());
        return constraints;
    }

    private static void addVersionConstraints(DocumentTree tree, List<Constraint> out) {
        Optional<DocumentNode> version = tree.root("openapi");
        String value = version.map(DocumentNode::getValue).orElse(null);

        out.add(Constraint.required(
                "openapi", "Missing openapi version", value, Severity.CRITICAL, version.orElse(null)));

        if (value != null) {
            out.add(Constraint.format(
                    "openapi",
                    "Invalid openapi version format '" + value + "', expected 3.x.y",
                    VERSION_PATTERN,
                    value,
                    Severity.CRITICAL,
                    version.get()));
        }
    }

    private static void addSectionConstraints(DocumentTree tree, List<Constraint> out) {
        for (String section : List.of("info", "paths")) {
            Optional<DocumentNode> node = tree.root(section);
            out.add(Constraint.required(
                    section,
                    "Missing " + section + " section",
                    node.map(DocumentNode::getKey).orElse(null),
                    Severity.CRITICAL,
                    node.orElse(null)));
        }
    }

    private static void addOperationConstraints(DocumentNode operation, List<Constraint> out) {
        String label = operation.getKey().toUpperCase() + " " + lastSegment(operation);

        out.add(Constraint.required(
                operation.getQualifiedName() + ".operationId",
                "Missing operationId in " + label,
                operation.child("operationId").map(DocumentNode::getValue).orElse(null),
                Severity.MAJOR,
                operation));

        out.add(Constraint.required(
                operation.getQualifiedName() + ".responses",
                "Missing responses in " + label,
                operation.hasChild("responses") ? "responses" : null,
                Severity.CRITICAL,
                operation));
    }

    private static void addSchemaConstraints(DocumentNode schema, List<Constraint> out) {
        String name = schema.getKey();
        String type = schema.child("type").map(DocumentNode::getValue).orElse(null);

        out.add(Constraint.required(
                schema.getQualifiedName() + ".type",
                "Missing schema type for " + name,
                type,
                Severity.MAJOR,
                schema));

        out.add(Constraint.required(
                schema.getQualifiedName() + ".example",
                "Missing example for schema " + name,
                schema.child("example").map(n -> n.isBlock() ? n.getKey() : n.getValue()).orElse(null),
                Severity.MINOR,
                schema));

        if ("array".equals(type)) {
            out.add(Constraint.required(
                    schema.getQualifiedName() + ".items",
                    "Array without items in schema " + name,
                    schema.hasChild("items") ? "items" : null,
                    Severity.MAJOR,
                    schema));
        }
    }

    private static boolean isOperation(DocumentNode node) {
        List<String> path = node.getPath();
        return node.isHttpMethod() && path.size() == 2 && "paths".equals(path.get(0));
    }

    private static boolean isComponentSchema(DocumentNode node) {
        return node.getPath().equals(List.of("components", "schemas"));
    }

    private static String lastSegment(DocumentNode node) {
        List<String> path = node.getPath();
        return path.isEmpty() ? "" : path.get(path.size() - 1);
    }

    // =========================================================================
    // Evaluation
    // =========================================================================

    public SolutionResult solve(List<Constraint> constraints) {

        List<Constraint>          satisfied  = new ArrayList<>();
        List<ConstraintViolation> violations = new ArrayList<>();

        for (Constraint constraint : constraints) {
            if (evaluate(constraint)) {
                satisfied.add(constraint);
            } else {
                log.debug("[Solver] Violated '{}' at line {}",
                        constraint.getRequirement(),
                        constraint.getSource() != null ? constraint.getSource().getLine() : "-");
                violations.add(new ConstraintViolation(
                        constraint,
                        constraint.getRequirement(),
                        constraint.getSeverity()));
            }
        }

        SolutionResult result = new SolutionResult(satisfied, violations);
        log.debug("[Solver] {}", result);
        return result;
    }

    boolean evaluate(Constraint constraint) {
        String actual = constraint.getActualValue();

        return switch (constraint.getKind()) {
            case REQUIRED   -> actual != null;
            case FORMAT     -> matchesFormat(constraint.getExpectedValue(), actual);
            case REFERENCE  -> actual != null && actual.startsWith("#/");
            case DEPENDENCY -> true;
        };
    }

    private static boolean matchesFormat(String expected, String actual) {
        if (actual == null) return false;
        if (expected == null || ANY_VALUE.equals(expected)) return !actual.isEmpty();
        try {
            return Pattern.matches(expected, actual);
        } catch (PatternSyntaxException e) {
            log.warn("[Solver] Unusable format pattern '{}': {}", expected, e.getDescription());
            return false;
        }
    }
}
