package com.specmend.oracle;

import java.util.List;

/**
 * The external generative service the repair loop and
 * search delegate to.
 *
 * One method per kind of request. Every method returns the raw response text
 * (a full document, or free-form review text for {@link #review}) and never
 * returns null. How each request is phrased is up to the implementation.
 */
public interface SpecificationOracle {

    /** Produce a first document from a natural-language description. */
    String generate(String context) throws OracleException;

    /**
     * Review a document. The answer is free text that
     * {@code ResponseParser} understands (VALID / CONFIDENCE / ISSUES lines).
     */
    String review(String specification, List<String> knownIssues) throws OracleException;

    /** Apply one targeted fix and return the whole corrected document. */
    String applyFix(String specification, String issue, String solution) throws OracleException;

    /** Correct a batch of issues; {@code fixedIssues} must not regress. */
    String correct(String specification, List<String> issues, List<String> fixedIssues) throws OracleException;

    /** Correct issues that survived earlier attempts. */
    String correctPersistent(String specification, List<String> persistentIssues, List<String> fixedIssues)
            throws OracleException;

    /** Last resort: fix everything at once. */
    String forceCorrect(String specification, List<String> issues) throws OracleException;
}
