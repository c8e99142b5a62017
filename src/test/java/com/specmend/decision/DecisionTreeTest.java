package com.specmend.decision;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DecisionTreeTest {

    private static final String OPERATION_ID_HINT =
            "[HINT] Missing operationId fields. Fix: Give every operation a unique operationId.";
    private static final String DUPLICATE_PATH =
            "[ERROR] Duplicate path '/widgets' defined 2 times. Fix: Merge duplicate paths.";
    private static final String UNKNOWN =
            "Widget payload is malformed somehow";

    private final DecisionTree tree = new DecisionTree();

    // =========================================================================
    // Lookup
    // =========================================================================

    @Test
    void testOperationIdIssueResolvesToOperationsLeaf() {
        Optional<Solution> solution = tree.findSolution(OPERATION_ID_HINT);

        assertTrue(solution.isPresent());
        assertEquals(IssueCategory.OPERATIONS, solution.get().getCategory());
        assertTrue(solution.get().getText().contains("operationId"));
        assertEquals(0.95, solution.get().getConfidence());
        assertEquals(IssueCategory.OPERATIONS, IssueCategory.classify(OPERATION_ID_HINT));
    }

    @Test
    void testConstraintMessageResolves() {
        Optional<Solution> solution = tree.findSolution("Missing operationId in GET /widgets");

        assertTrue(solution.isPresent());
        assertEquals("Add unique 'operationId' to each operation", solution.get().getText());
    }

    @Test
    void testLookupIsPure() {
        assertEquals(tree.findSolution(OPERATION_ID_HINT), tree.findSolution(OPERATION_ID_HINT));
        assertEquals(tree.findSolution("  MISSING OPERATIONID  "), tree.findSolution(OPERATION_ID_HINT));
    }

    @Test
    void testDuplicatePath() {
        Solution solution = tree.findSolution(DUPLICATE_PATH).orElseThrow();

        assertEquals(IssueCategory.STRUCTURAL, solution.getCategory());
        assertEquals(0.95, solution.getConfidence());
        assertEquals("Ensure each path is unique or merge duplicate definitions", solution.getText());
    }

    @Test
    void testMissingSecurityScheme() {
        Solution solution = tree.findSolution(
                "[ERROR] Missing security scheme: authentication is mentioned but no securitySchemes are defined.")
                .orElseThrow();

        assertEquals(IssueCategory.SECURITY, solution.getCategory());
        assertEquals(0.95, solution.getConfidence());
    }

    @Test
    void testCategoryMentionFallsBackToBranch() {
        Solution solution = tree.findSolution("Something about a response looks odd").orElseThrow();

        assertEquals("Review operation definitions", solution.getText());
        assertEquals(0.85, solution.getConfidence());
    }

    @Test
    void testUnknownIssueHasNoSolution() {
        assertTrue(tree.findSolution(UNKNOWN).isEmpty());
        assertTrue(tree.findSolution("").isEmpty());
        assertTrue(tree.findSolution(null).isEmpty());
        assertEquals(IssueCategory.CONSTRAINT, IssueCategory.classify(UNKNOWN));
    }

    // =========================================================================
    // Analysis
    // =========================================================================

    @Test
    void testAnalyzeMixedIssues() {
        IssueAnalysis analysis = tree.analyzeIssues(List.of(OPERATION_ID_HINT, DUPLICATE_PATH, UNKNOWN));

        assertEquals(3, analysis.getTotalIssues());
        assertEquals(2, analysis.getResolvedIssues());
        assertEquals(2.0 / 3.0, analysis.getResolutionRate(), 1e-9);
        assertEquals(0.95, analysis.getConfidence(), 1e-9);

        assertEquals(1, analysis.getCategories().get(IssueCategory.OPERATIONS));
        assertEquals(1, analysis.getCategories().get(IssueCategory.STRUCTURAL));
        assertEquals(1, analysis.getCategories().get(IssueCategory.CONSTRAINT));
        assertEquals(IssueCategory.STRUCTURAL, analysis.getTopCategory());

        assertEquals(2, analysis.getRecommendations().size());
        assertFalse(analysis.isFullyResolved(0.9));
    }

    @Test
    void testAnalyzeNoIssues() {
        IssueAnalysis analysis = tree.analyzeIssues(List.of());

        assertEquals(0.0, analysis.getResolutionRate());
        assertNull(analysis.getTopCategory());
        assertEquals(DecisionTree.GENERIC_RECOMMENDATIONS, analysis.getRecommendations());
        assertFalse(analysis.isFullyResolved(0.9));
    }

    @Test
    void testLowConfidenceSolutionsGiveGenericRecommendations() {
        IssueAnalysis analysis = tree.analyzeIssues(List.of("Missing example for schema Widget"));

        assertEquals(1.0, analysis.getResolutionRate());
        assertEquals(0.7, analysis.getConfidence(), 1e-9);
        assertEquals(DecisionTree.GENERIC_RECOMMENDATIONS, analysis.getRecommendations());
        assertFalse(analysis.isFullyResolved(0.9));
    }

    @Test
    void testFullyResolved() {
        IssueAnalysis analysis = tree.analyzeIssues(List.of(OPERATION_ID_HINT, "Missing operationId in GET /widgets"));

        assertTrue(analysis.isFullyResolved(0.9));
        assertFalse(analysis.isFullyResolved(0.99));
    }

    // =========================================================================
    // Structure
    // =========================================================================

    @Test
    void testTreeShape() {
        DecisionNode root = tree.getRoot();

        assertEquals(4, root.getChildren().size());
        assertEquals(2, root.depth());
        assertEquals(23, root.allDescendants().size());
        assertTrue(root.allDescendants().stream()
                .filter(DecisionNode::isLeaf)
                .allMatch(n -> n.getConfidence() > 0.0 && n.getConfidence() <= 1.0));

        DecisionNode bearer = root.findNode("bearer token").orElseThrow();
        assertEquals(IssueCategory.SECURITY, bearer.getCategory());
        assertTrue(root.findNode("no such pattern").isEmpty());
    }
}
