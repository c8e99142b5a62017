package com.specmend.search;

import com.specmend.oracle.OracleException;

/**
 * Scores a freshly expanded node, usually by asking the generative service to
 * act on it. May replace the node's state as a side effect.
 *
 * Rewards are conventionally in [0, 1] but are not checked.
 */
@FunctionalInterface
public interface SimulationOracle {

    double simulate(SearchTreeNode node) throws OracleException;
}
