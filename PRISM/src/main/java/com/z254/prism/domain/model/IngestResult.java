package com.z254.prism.domain.model;

/**
 * Outcome of a single ingest call.
 */
public enum IngestResult {
    /** Stored as a new, correlatable alert */
    ACCEPTED,
    /** Folded into a firing alert with the same fingerprint */
    DEDUPLICATED,
    /** Stored but marked as recurring noise */
    NOISE,
    /** Resolved the matching firing alert */
    RESOLVED
}
