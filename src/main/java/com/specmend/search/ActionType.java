package com.specmend.search;

/**
 * Kinds of step the search can take from a state.
 */
public enum ActionType {

    /** Resolve one named outstanding issue. */
    FIX,

    /** Improve quality (schemas, examples) without touching the issue lists. */
    ENHANCE,

    /** Re-check the whole document; leaves the issue lists unchanged. */
    VALIDATE
}
