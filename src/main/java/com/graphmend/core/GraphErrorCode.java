package com.graphmend.core;

/**
 * Error codes surfaced to callers when a graph cannot be made analysis-ready.
 * None of these is retryable inside the engine; re-drafting is the caller's job.
 */
public enum GraphErrorCode {

    /** Required node kinds (goal, decision, option) or outcome/risk missing entirely. */
    CEE_GRAPH_INVALID,

    /** All required kinds present, but no decision reaches both an option and a goal. */
    CEE_GRAPH_CONNECTIVITY_FAILED,

    /** Node or edge count above the configured limit; rejected before repair. */
    CEE_GRAPH_TOO_LARGE,

    /** Payload could not be read as a graph (wrong types, missing ids, duplicates). */
    CEE_GRAPH_MALFORMED
}
