package com.specmend.decision;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Read-only catalogue of known issues and their canned fixes.
 *
 * The tree is built once in the constructor and never mutated, so the single
 * Spring bean is shared safely by every repair loop.
 */
@Component
public class DecisionTree {

    private static final Logger log = LoggerFactory.getLogger(DecisionTree.class);

    static final double RECOMMENDATION_CONFIDENCE = 0.8;
    static final int    MAX_RECOMMENDATIONS       = 5;

    static final List<String> GENERIC_RECOMMENDATIONS = List.of(
            "Review OpenAPI specification for structural integrity",
            "Ensure all required fields are present",
            "Validate schema definitions"
    );

    private final DecisionNode root;

    public DecisionTree() {
        this.root = DecisionTreeBuilder.buildTree();
    }

    public DecisionNode getRoot() {
        return root;
    }

    /** Pure lookup: the same issue text always yields the same answer. */
    public Optional<Solution> findSolution(String issue) {
        return DecisionTreeSearcher.search(root, issue);
    }

    public List<ResolvedIssue> getAllSolutions(List<String> issues) {
        List<ResolvedIssue> resolved = new ArrayList<>();
        for (String issue : issues) {
            findSolution(issue).ifPresent(s -> resolved.add(new ResolvedIssue(issue, s)));
        }
        return resolved;
    }

    public IssueAnalysis analyzeIssues(List<String> issues) {

        List<ResolvedIssue> solutions = getAllSolutions(issues);

        Map<IssueCategory, Integer> categories = new EnumMap<>(IssueCategory.class);
        for (String issue : issues) {
            categories.merge(IssueCategory.classify(issue), 1, Integer::sum);
        }

        double confidence = solutions.stream()
                .mapToDouble(ResolvedIssue::getConfidence)
                .average()
                .orElse(0.0);

        IssueAnalysis analysis = new IssueAnalysis(
                issues.size(), solutions, categories, confidence, recommendationsFrom(solutions));

        log.debug("[DecisionTree] {}", analysis);
        return analysis;
    }

    private static List<String> recommendationsFrom(List<ResolvedIssue> solutions) {
        List<String> recommendations = solutions.stream()
                .filter(s -> s.getConfidence() > RECOMMENDATION_CONFIDENCE)
                .limit(MAX_RECOMMENDATIONS)
                .map(ResolvedIssue::getSolutionText)
                .toList();

        return recommendations.isEmpty() ? GENERIC_RECOMMENDATIONS : recommendations;
    }
}
