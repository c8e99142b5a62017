package com.specmend.search;

import org.junit.jupiter.api.Test;

import com.specmend.config.SearchSettings;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SearchStateTest {

    private final SearchSettings settings = SearchSettings.defaults();

    @Test
    void testActionsForManyIssues() {
        SearchState state = SearchState.initial("spec", List.of("a", "b", "c", "d", "e"));

        List<RepairAction> actions = state.availableActions();

        assertEquals(4, actions.size());
        assertEquals(
                List.of(RepairAction.fix("a"), RepairAction.fix("b"), RepairAction.fix("c"),
                        RepairAction.validate("full")),
                actions);
    }

    @Test
    void testActionsForFewIssuesIncludeEnhancements() {
        assertEquals(4, SearchState.initial("spec", List.of("a", "b", "c")).availableActions().size());

        List<RepairAction> actions = SearchState.initial("spec", List.of("a", "b")).availableActions();
        assertEquals(5, actions.size());
        assertTrue(actions.contains(RepairAction.enhance("schemas")));
        assertTrue(actions.contains(RepairAction.enhance("examples")));
        assertEquals(ActionType.VALIDATE, actions.get(actions.size() - 1).getType());
    }

    @Test
    void testApplyFixMovesIssueAndDecaysConfidence() {
        SearchState initial = SearchState.initial("spec", List.of("a", "b", "c"));

        SearchState first = initial.apply(RepairAction.fix("a"));
        assertEquals(List.of("b", "c"), first.getOutstandingIssues());
        assertEquals(List.of("a"), first.getFixedIssues());
        assertEquals(1, first.getDepth());
        assertEquals(0.25, first.getConfidence(), 1e-9);

        SearchState second = first.apply(RepairAction.fix("b"));
        assertEquals(2, second.getDepth());
        assertEquals(0.49, second.getConfidence(), 1e-9);
        assertEquals(0.46, second.reward(), 1e-9);
        assertFalse(second.isValid());
    }

    @Test
    void testNonFixActionsOnlyDeepen() {
        SearchState initial = SearchState.initial("spec", List.of("a"));

        SearchState validated = initial.apply(RepairAction.validate("full"));
        SearchState unknownFix = initial.apply(RepairAction.fix("not outstanding"));

        assertEquals(List.of("a"), validated.getOutstandingIssues());
        assertEquals(1, validated.getDepth());
        assertEquals(List.of("a"), unknownFix.getOutstandingIssues());
        assertTrue(unknownFix.getFixedIssues().isEmpty());
    }

    @Test
    void testValidStateRewardIsNotClamped() {
        SearchState state = new SearchState("spec", List.of(), List.of("a", "b", "c"), 1, 0.9, settings);

        assertTrue(state.isValid());
        assertTrue(state.isTerminal());
        assertEquals(1.23, state.reward(), 1e-9);
    }

    @Test
    void testDepthLimitIsTerminal() {
        SearchState state = new SearchState("spec", List.of("a"), List.of(), 10, 0.0, settings);

        assertTrue(state.isTerminal());
        assertFalse(state.isValid());
        assertTrue(state.availableActions().isEmpty());
        assertEquals(0.0, state.reward());
    }

    @Test
    void testTransitionsReturnNewInstances() {
        SearchState initial = SearchState.initial("spec", List.of("a", "b"));

        SearchState applied = initial.apply(RepairAction.fix("a"));
        SearchState rewritten = initial.withSpecification("other");

        assertNotSame(initial, applied);
        assertEquals(List.of("a", "b"), initial.getOutstandingIssues());
        assertEquals(0, initial.getDepth());
        assertEquals("spec", initial.getSpecification());
        assertEquals("other", rewritten.getSpecification());
        assertThrows(UnsupportedOperationException.class, () -> initial.getOutstandingIssues().add("c"));
    }

    @Test
    void testWithIssuesRecordsVanishedIssuesAsFixed() {
        SearchState state = SearchState.initial("spec", List.of("a", "b", "c")).withIssues(List.of("c"));

        assertEquals(List.of("c"), state.getOutstandingIssues());
        assertEquals(List.of("a", "b"), state.getFixedIssues());
        assertEquals(0.5, state.progress(), 1e-9);
    }

    @Test
    void testIssueReportedAgainIsNoLongerFixed() {
        SearchState initial = SearchState.initial("spec", List.of("a", "b"));

        SearchState unchanged = initial.apply(RepairAction.fix("a")).withIssues(List.of("a", "b"));
        SearchState validated = initial.apply(RepairAction.validate("full")).withIssues(List.of("a", "b"));

        assertEquals(List.of("a", "b"), unchanged.getOutstandingIssues());
        assertTrue(unchanged.getFixedIssues().isEmpty());
        assertEquals(0.0, unchanged.progress());
        assertEquals(validated.reward(), unchanged.reward());
    }
}
