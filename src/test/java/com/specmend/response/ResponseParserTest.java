package com.specmend.response;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser();

    @Test
    void testTypicalReview() {
        String review = """
                VALID: YES
                CONFIDENCE: 0.85
                ISSUES:
                - Missing operationId in GET /widgets
                - none
                1. Schema Widget lacks example
                RECOMMENDATION: add them
                - Collected after the section closed
                """;

        ValidationResult result = parser.parseValidationResponse(review);

        assertTrue(result.isValid());
        assertEquals(0.85, result.getConfidence(), 1e-9);
        assertEquals(
                List.of("Missing operationId in GET /widgets", "Schema Widget lacks example"),
                result.getIssues());
    }

    @Test
    void testCleanReview() {
        ValidationResult result = parser.parseValidationResponse("VALID: YES\nCONFIDENCE: 0.92\nISSUES:\n- none");

        assertTrue(result.isValid());
        assertEquals(0.92, result.getConfidence(), 1e-9);
        assertTrue(result.getIssues().isEmpty());
    }

    @Test
    void testValidMarkerWithNegativeAnswerStillCountsAsValid() {
        // "VALID" is itself in the positive keyword set
        assertTrue(parser.parseValidationResponse("VALID: NO").isValid());
    }

    @Test
    void testValidationFailedMarker() {
        ValidationResult result = parser.parseValidationResponse("VALID: YES\nVALIDATION FAILED: see below");

        assertFalse(result.isValid());
        assertEquals(0.0, result.getConfidence());
    }

    @Test
    void testPercentageConfidence() {
        assertEquals(0.85, parser.parseValidationResponse("Confidence: 85%").getConfidence(), 1e-9);
    }

    @Test
    void testOnlyFirstConfidenceIsKept() {
        ValidationResult result = parser.parseValidationResponse("CONFIDENCE: 0.6\nCONFIDENCE: 0.9");

        assertEquals(0.6, result.getConfidence(), 1e-9);
    }

    @Test
    void testDefaultConfidenceForValidResult() {
        ValidationResult result = parser.parseValidationResponse("VALID: TRUE");

        assertTrue(result.isValid());
        assertEquals(ResponseParser.DEFAULT_VALID_CONFIDENCE, result.getConfidence());
    }

    @Test
    void testShortAndExcludedIssuesAreDropped() {
        String review = """
                PROBLEMS:
                - bad
                - n/a
                * All good here
                • Missing info section
                2) Response lacks description
                """;

        List<String> issues = parser.parseValidationResponse(review).getIssues();

        assertEquals(List.of("Missing info section", "Response lacks description"), issues);
    }

    @Test
    void testNoteClosesIssueSection() {
        String review = """
                WARNINGS:
                - Parameters missing descriptions
                NOTE: everything else looks fine
                - Trailing line outside any section
                """;

        assertEquals(
                List.of("Parameters missing descriptions"),
                parser.parseValidationResponse(review).getIssues());
    }

    @Test
    void testUnrecognisedInput() {
        for (String text : new String[] {null, "", "The weather is nice today."}) {
            ValidationResult result = parser.parseValidationResponse(text);

            assertFalse(result.isValid());
            assertFalse(result.hasIssues());
            assertEquals(0.0, result.getConfidence());
        }
    }
}
