package com.specmend.validator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pattern-based defect scan over the raw document text.
 *
 * Works on text, not on the parsed tree, so it still reports useful issues for
 * documents the lenient parser can only partially read.
 *
 * Every check is independent and stateless; the result is simply the
 * concatenation of what each check reports. Duplicates across checks are
 * possible and left to the caller.
 *
 * Issue strings start with an {@link IssueSeverity} tag.
 */
@Component
public class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    private static final Pattern PATH_LINE =
            Pattern.compile("^\\s*(/[^:]+):");

    private static final Pattern UNQUOTED_STATUS_CODE =
            Pattern.compile("responses:\\s*\\n\\s*(\\d{3}):");

    private static final Pattern RESPONSE_BLOCK =
            Pattern.compile("responses:\\s*\\n\\s*'?\\d+");

    private static final List<String> HTTP_METHODS =
            List.of("get", "post", "put", "patch", "delete", "head", "options");

    public List<String> validate(String text) {

        List<String> issues = new ArrayList<>();
        if (text == null) {
            text = "";
        }
        String[] lines = text.split("\\r?\\n", -1);

        issues.addAll(checkDuplicatePaths(lines));
        issues.addAll(checkHttpMethods(lines));
        issues.addAll(checkComponentsStructure(text, lines));
        issues.addAll(checkRequiredFields(text));
        issues.addAll(checkSchemaDefinitions(text));
        issues.addAll(checkResponseStructure(text));
        issues.addAll(checkSecurityDefinitions(text));
        issues.addAll(checkCoverage(text));
        issues.addAll(checkContentTypes(text));

        log.debug("[Validator] {} structural issues found", issues.size());
        return issues;
    }

    // =========================================================================
    // Paths
    // =========================================================================

    List<String> checkDuplicatePaths(String[] lines) {
        Map<String, Integer> counts = new LinkedHashMap<>();

        for (String line : lines) {
            Matcher m = PATH_LINE.matcher(line);
            if (m.find()) {
                counts.merge(m.group(1).trim(), 1, Integer::sum);
            }
        }

        List<String> issues = new ArrayList<>();
        counts.forEach((path, count) -> {
            if (count > 1) {
                issues.add(IssueSeverity.ERROR.format(
                        "Duplicate path '" + path + "' defined " + count + " times. "
                        + "Fix: Merge duplicate paths so every HTTP method sits under a single path definition."));
            }
        });
        return issues;
    }

    /** A GET line immediately followed by requestBody is flagged; anything in between resets. */
    List<String> checkHttpMethods(String[] lines) {
        List<String> issues = new ArrayList<>();
        String currentPath   = "";
        String currentMethod = "";

        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].trim();

            if (trimmed.startsWith("/") && trimmed.contains(":")) {
                currentPath = trimmed.substring(0, trimmed.indexOf(':'));
            }

            if ("GET".equals(currentMethod) && trimmed.startsWith("requestBody:")) {
                issues.add(IssueSeverity.ERROR.format(
                        "GET " + currentPath + " has requestBody at line " + (i + 1) + ". "
                        + "Fix: Remove requestBody from GET operations and use query parameters instead."));
            }

            currentMethod = httpMethodOf(trimmed);
        }
        return issues;
    }

    private static String httpMethodOf(String trimmed) {
        for (String method : HTTP_METHODS) {
            if (trimmed.equals(method + ":")) {
                return method.toUpperCase();
            }
        }
        return "";
    }

    // =========================================================================
    // Components
    // =========================================================================

    List<String> checkComponentsStructure(String text, String[] lines) {
        List<String> issues = new ArrayList<>();

        boolean hasComponents      = text.contains("components:");
        boolean hasSecuritySchemes = text.contains("securitySchemes:");

        if (hasSecuritySchemes && !hasComponents) {
            issues.add(IssueSeverity.ERROR.format(
                    "Missing components section. securitySchemes must be declared under components."));
        } else if (hasSecuritySchemes && !securitySchemesNestedUnderComponents(lines)) {
            issues.add(IssueSeverity.WARNING.format(
                    "securitySchemes must be nested directly under the components section."));
        }

        if (text.contains("schemas:") && !hasComponents) {
            issues.add(IssueSeverity.WARNING.format(
                    "Schema definitions should be placed under components.schemas."));
        }
        return issues;
    }

    /** Every securitySchemes line's nearest shallower line must be components:. */
    private static boolean securitySchemesNestedUnderComponents(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].trim().startsWith("securitySchemes:")) continue;

            int indent = leadingSpaces(lines[i]);
            String enclosing = null;
            for (int j = i - 1; j >= 0; j--) {
                if (lines[j].isBlank()) continue;
                if (leadingSpaces(lines[j]) < indent) {
                    enclosing = lines[j].trim();
                    break;
                }
            }
            if (!"components:".equals(enclosing)) {
                return false;
            }
        }
        return true;
    }

    private static int leadingSpaces(String line) {
        int n = 0;
        while (n < line.length() && line.charAt(n) == ' ') n++;
        return n;
    }

    // =========================================================================
    // Required fields
    // =========================================================================

    List<String> checkRequiredFields(String text) {
        List<String> issues = new ArrayList<>();

        if (!text.contains("openapi:")) {
            issues.add(IssueSeverity.ERROR.format(
                    "Missing openapi version field. Fix: Add 'openapi: 3.1.0' at the beginning."));
        }
        if (!text.contains("info:")) {
            issues.add(IssueSeverity.ERROR.format(
                    "Missing info section. Fix: Add info with title, description and version."));
        }
        if (!text.contains("paths:")) {
            issues.add(IssueSeverity.ERROR.format(
                    "Missing paths section. Fix: Add paths with at least one endpoint."));
        }

        if (text.contains("info:")) {
            if (!text.contains("title:")) {
                issues.add(IssueSeverity.WARNING.format("Missing 'title' in info section."));
            }
            if (!text.contains("description:")) {
                issues.add(IssueSeverity.WARNING.format("Missing 'description' in info section."));
            }
        }
        return issues;
    }

    // =========================================================================
    // Schemas
    // =========================================================================

    List<String> checkSchemaDefinitions(String text) {
        List<String> issues = new ArrayList<>();

        if (text.contains("possibleValues:")) {
            issues.add(IssueSeverity.ERROR.format(
                    "Invalid 'possibleValues' in schema. Fix: Use the 'enum' keyword for allowed values."));
        }
        if (text.contains("properties: [")) {
            issues.add(IssueSeverity.ERROR.format(
                    "Schema properties defined as array. Fix: Use object syntax, one entry per property name."));
        }
        if (text.contains("parameters:") && !hasParameterDescriptions(text)) {
            issues.add(IssueSeverity.WARNING.format(
                    "Parameters missing descriptions."));
        }
        return issues;
    }

    private static boolean hasParameterDescriptions(String text) {
        int first = text.indexOf("parameters:");
        if (first < 0) return false;
        String afterFirst = text.substring(first + "parameters:".length());
        int next = afterFirst.indexOf("parameters:");
        String section = next >= 0 ? afterFirst.substring(0, next) : afterFirst;
        return section.contains("description:");
    }

    // =========================================================================
    // Responses
    // =========================================================================

    List<String> checkResponseStructure(String text) {
        List<String> issues = new ArrayList<>();

        if (text.contains("responses:")) {
            if (UNQUOTED_STATUS_CODE.matcher(text).find()) {
                issues.add(IssueSeverity.WARNING.format(
                        "HTTP status codes should be quoted ('200' not 200)."));
            }
            if (!hasStatusCode(text, "200")) {
                issues.add(IssueSeverity.WARNING.format(
                        "Missing 200 response for successful operations."));
            }
            if (!hasStatusCode(text, "400")) {
                issues.add(IssueSeverity.WARNING.format(
                        "Missing error responses: no 400 bad request response defined."));
            }
            if (!text.contains("description:")) {
                issues.add(IssueSeverity.WARNING.format(
                        "Response definitions lack descriptions."));
            }
        }

        if (RESPONSE_BLOCK.matcher(text).find() && !text.contains("application/json:")) {
            issues.add(IssueSeverity.WARNING.format(
                    "Response definitions missing content type (application/json)."));
        }
        return issues;
    }

    private static boolean hasStatusCode(String text, String code) {
        return text.contains("'" + code + "'")
                || text.contains("\"" + code + "\"")
                || text.contains(code + ":");
    }

    // =========================================================================
    // Security, coverage, content types
    // =========================================================================

    List<String> checkSecurityDefinitions(String text) {
        boolean mentionsAuth = text.contains("bearer")
                || text.contains("Bearer")
                || text.contains("apiKey");

        if (mentionsAuth && !text.contains("securitySchemes:")) {
            return List.of(IssueSeverity.ERROR.format(
                    "Missing security scheme: authentication is mentioned but no securitySchemes are defined."));
        }
        return List.of();
    }

    List<String> checkCoverage(String text) {
        List<String> issues = new ArrayList<>();

        if (!text.contains("operationId:")) {
            issues.add(IssueSeverity.HINT.format(
                    "Missing operationId fields. Fix: Give every operation a unique operationId."));
        }
        if (!text.contains("example:") && !text.contains("examples:")) {
            issues.add(IssueSeverity.HINT.format(
                    "Missing example values. Consider adding 'example' to schemas and responses."));
        }
        return issues;
    }

    List<String> checkContentTypes(String text) {
        if (text.contains("content:") && !text.contains("application/json")) {
            return List.of(IssueSeverity.WARNING.format(
                    "No application/json content type found."));
        }
        return List.of();
    }
}
