package com.specmend.search;

import org.junit.jupiter.api.Test;

import com.specmend.config.SearchSettings;
import com.specmend.oracle.OracleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SearchEngineTest {

    private static final List<String> ISSUES = List.of("a", "b", "c");

    private final SearchEngine engine = new SearchEngine(SearchSettings.defaults());

    /** Engine that never stops early. */
    private final SearchEngine exhaustive =
            new SearchEngine(new SearchSettings(50, 1.414, 3, 10, 2.0, 10, 0.85));

    private static SearchTreeNode rootOf(SearchTreeNode node) {
        SearchTreeNode current = node;
        while (current.getParent() != null) {
            current = current.getParent();
        }
        return current;
    }

    @Test
    void testEveryIterationVisitsRoot() throws Exception {
        SearchTreeNode best = engine.search(SearchState.initial("spec", ISSUES), 7, node -> 0.5);

        SearchTreeNode root = rootOf(best);
        assertEquals(7, root.getVisitCount());

        Deque<SearchTreeNode> pending = new ArrayDeque<>(List.of(root));
        while (!pending.isEmpty()) {
            SearchTreeNode node = pending.pop();
            for (SearchTreeNode child : node.getChildren()) {
                assertEquals(node.getDepth() + 1, child.getDepth());
                assertNotNull(child.getAction());
                pending.push(child);
            }
        }
    }

    @Test
    void testEveryRootActionIsTriedBeforeGoingDeeper() throws Exception {
        SearchTreeNode best = exhaustive.search(SearchState.initial("spec", ISSUES), 4, node -> 0.5);
        SearchTreeNode root = rootOf(best);

        assertEquals(4, root.getChildren().size());
        assertTrue(root.getChildren().stream().allMatch(SearchTreeNode::isLeaf));

        best = exhaustive.search(SearchState.initial("spec", ISSUES), 5, node -> 0.5);
        root = rootOf(best);

        assertEquals(1, root.getChildren().get(0).getChildren().size());
    }

    @Test
    void testBestPathFollowsHighestReward() throws Exception {
        SimulationOracle oracle = node ->
                node.getAction().equals(RepairAction.fix("b")) ? 0.9 : 0.1;

        SearchTreeNode best = exhaustive.search(SearchState.initial("spec", ISSUES), 4, oracle);

        assertEquals(RepairAction.fix("b"), best.getAction());
        assertEquals(List.of("a", "c"), best.getState().getOutstandingIssues());
    }

    @Test
    void testOracleStateReplacementAndEarlyStop() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        SimulationOracle oracle = node -> {
            calls.incrementAndGet();
            node.setState(node.getState().withIssues(List.of()));
            node.updateSpecification("repaired");
            return node.getState().getFixedIssues().size() / 3.0;
        };

        SearchTreeNode best = engine.search(SearchState.initial("spec", ISSUES), oracle);

        assertEquals(1, calls.get());
        assertEquals(1, rootOf(best).getVisitCount());
        assertTrue(best.getState().getOutstandingIssues().isEmpty());
        assertTrue(best.getState().isTerminal());
        assertEquals("repaired", best.getState().getSpecification());
    }

    @Test
    void testOracleFixingOneIssuePerCallConvergesInThreeIterations() throws Exception {
        List<String>  remaining = new ArrayList<>(ISSUES);
        AtomicInteger calls     = new AtomicInteger();

        SimulationOracle oracle = node -> {
            calls.incrementAndGet();
            remaining.remove(0);
            node.setState(node.getState().withIssues(List.copyOf(remaining)));
            return (ISSUES.size() - remaining.size()) / 3.0;
        };

        SearchTreeNode best = engine.search(SearchState.initial("spec", ISSUES), oracle);

        assertEquals(3, calls.get());
        assertEquals(3, rootOf(best).getVisitCount());
        assertTrue(best.getState().getOutstandingIssues().isEmpty());
        assertTrue(best.getState().isTerminal());
    }

    @Test
    void testNoIterationsFindsNoPath() {
        SearchEngine.SearchException e = assertThrows(SearchEngine.SearchException.class,
                () -> engine.search(SearchState.initial("spec", ISSUES), 0, node -> 0.5));

        assertEquals(SearchEngine.SearchException.Reason.NO_VALID_PATH_FOUND, e.getReason());
    }

    @Test
    void testTerminalRootFindsNoPath() {
        SearchEngine.SearchException e = assertThrows(SearchEngine.SearchException.class,
                () -> engine.search(SearchState.initial("spec", List.of()), 5, node -> 0.5));

        assertEquals(SearchEngine.SearchException.Reason.NO_VALID_PATH_FOUND, e.getReason());
    }

    @Test
    void testMissingInitialState() {
        SearchEngine.SearchException e = assertThrows(SearchEngine.SearchException.class,
                () -> engine.search(null, 5, node -> 0.5));

        assertEquals(SearchEngine.SearchException.Reason.INITIALIZATION_FAILED, e.getReason());
    }

    @Test
    void testOracleFailurePropagates() {
        OracleException failure = new OracleException("service unavailable");

        OracleException thrown = assertThrows(OracleException.class,
                () -> engine.search(SearchState.initial("spec", ISSUES), 5, node -> { throw failure; }));

        assertSame(failure, thrown);
    }

    @Test
    void testUcb1() {
        SearchTreeNode root  = SearchTreeNode.root(SearchState.initial("spec", ISSUES));
        SearchTreeNode child = root.expand(root.untriedAction().orElseThrow());

        assertEquals(Double.POSITIVE_INFINITY, engine.ucb1(child));
        assertEquals(Double.POSITIVE_INFINITY, engine.ucb1(root));

        engine.backpropagate(child, 0.5);
        root.update(0.0);

        double expected = 0.5 + 1.414 * Math.sqrt(Math.log(2) / 1);
        assertEquals(expected, engine.ucb1(child), 1e-9);
    }
}
