package com.specmend.response;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pulls a validity flag, a confidence score and an issue list
 * out of free-form oracle text.
 *
 * Keyword/regex heuristics over single lines, one pass, no lookahead.
 * Matching is loose: any line containing "VALID:" counts as positive because
 * "VALID" is itself a positive indicator. Callers rely on the exact outputs.
 *
 * Never throws; unrecognised text yields an invalid result with no issues.
 */
@Component
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    static final double DEFAULT_VALID_CONFIDENCE = 0.7;
    static final int    MINIMUM_ISSUE_LENGTH     = 5;

    private static final List<String> VALID_MARKERS =
            List.of("VALID:", "IS VALID:", "VALIDATION:", "VALIDATED:");
    private static final List<String> INVALID_MARKERS =
            List.of("INVALID:", "NOT VALID:", "VALIDATION FAILED:");
    private static final List<String> POSITIVE =
            List.of("YES", "TRUE", "PASSED", "SUCCESS", "VALID");
    private static final List<String> NEGATIVE =
            List.of("NO", "FALSE", "FAILED", "INVALID");

    private static final List<String> CONFIDENCE_MARKERS =
            List.of("CONFIDENCE:", "CONFIDENCE SCORE:", "SCORE:", "CONFIDENCE LEVEL:");
    private static final List<String> ISSUE_SECTION_MARKERS =
            List.of("ISSUES:", "PROBLEMS:", "ERRORS:", "FAILURES:", "WARNINGS:", "VIOLATIONS:");
    private static final List<String> SECTION_END_MARKERS =
            List.of("VALID", "CONFIDENCE", "RECOMMENDATION", "SUGGESTION", "NOTE");

    private static final List<String> LIST_PREFIXES =
            List.of("- ", "• ", "* ", "→ ", "> ", "+ ");
    private static final List<String> EXCLUDED_TERMS =
            List.of("none", "n/a", "not applicable", "no issues", "all good");

    private static final List<Pattern> NUMERIC_PATTERNS = List.of(
            Pattern.compile("([0-9]+\\.?[0-9]*)"),
            Pattern.compile("([0-9]+)%"),
            Pattern.compile(":\\s*([0-9]+\\.?[0-9]*)")
    );
    private static final Pattern NUMBER        = Pattern.compile("[0-9]+\\.?[0-9]*");
    private static final Pattern NUMBERED_ITEM = Pattern.compile("^[0-9]+[.):]\\s*");

    public ValidationResult parseValidationResponse(String response) {

        boolean      valid      = false;
        double       confidence = 0.0;
        List<String> issues     = new ArrayList<>();
        ParsingState state      = new ParsingState();

        String text = response != null ? response : "";

        for (String line : text.split("\\R", -1)) {
            String trimmed = line.trim();
            String upper   = trimmed.toUpperCase(Locale.ROOT);

            Boolean status = validityOf(upper);
            if (status != null) {
                valid = status;
            }

            if (!state.foundConfidence) {
                Double parsed = confidenceOf(line, upper);
                if (parsed != null) {
                    confidence = parsed;
                    state.foundConfidence = true;
                }
            }

            processIssueLine(trimmed, upper, state, issues);
        }

        if (!state.foundConfidence && valid) {
            confidence = DEFAULT_VALID_CONFIDENCE;
        }

        ValidationResult result = new ValidationResult(valid, issues, confidence);
        log.debug("[ResponseParser] {}", result);
        return result;
    }

    // =========================================================================
    // Validity
    // =========================================================================

    private static Boolean validityOf(String upper) {
        for (String marker : VALID_MARKERS) {
            if (!upper.contains(marker)) continue;
            if (containsAny(upper, POSITIVE)) return Boolean.TRUE;
            if (containsAny(upper, NEGATIVE)) return Boolean.FALSE;
        }
        if (containsAny(upper, INVALID_MARKERS)) {
            return Boolean.FALSE;
        }
        return null;
    }

    // =========================================================================
    // Confidence
    // =========================================================================

    private static Double confidenceOf(String line, String upper) {
        if (!containsAny(upper, CONFIDENCE_MARKERS)) return null;

        for (Pattern pattern : NUMERIC_PATTERNS) {
            Matcher m = pattern.matcher(line);
            if (!m.find()) continue;

            Matcher number = NUMBER.matcher(m.group());
            if (number.find()) {
                double value = Double.parseDouble(number.group());
                // values above 1 are percentages
                return value > 1.0 ? value / 100.0 : value;
            }
        }
        return null;
    }

    // =========================================================================
    // Issues
    // =========================================================================

    private static void processIssueLine(String trimmed, String upper, ParsingState state, List<String> issues) {

        if (containsAny(upper, ISSUE_SECTION_MARKERS)) {
            state.inIssuesSection = true;
            return;
        }
        if (!state.inIssuesSection) return;

        if (trimmed.contains(":") && containsAny(upper, SECTION_END_MARKERS)) {
            state.inIssuesSection = false;
            return;
        }

        String issue = cleanIssue(trimmed);
        if (issue != null) {
            issues.add(issue);
        }
    }

    static String cleanIssue(String trimmed) {
        if (trimmed.isEmpty()) return null;

        String cleaned = trimmed;
        for (String prefix : LIST_PREFIXES) {
            if (cleaned.startsWith(prefix)) {
                cleaned = cleaned.substring(prefix.length());
                break;
            }
        }
        cleaned = NUMBERED_ITEM.matcher(cleaned).replaceFirst("");

        String lower = cleaned.toLowerCase(Locale.ROOT);
        if (containsAny(lower, EXCLUDED_TERMS)) return null;

        return cleaned.length() > MINIMUM_ISSUE_LENGTH ? cleaned : null;
    }

    private static boolean containsAny(String text, List<String> needles) {
        for (String needle : needles) {
            if (text.contains(needle)) return true;
        }
        return false;
    }

    private static final class ParsingState {
        boolean foundConfidence;
        boolean inIssuesSection;
    }
}
