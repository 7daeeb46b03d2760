package com.hiring.refnet.api;

/**
 * The kinds of failure an engine operation can report.
 *
 * <p>
 * Every kind is raised synchronously at the point where the precondition is
 * violated. None of them is retried internally, and a rejected mutation leaves
 * the graph exactly as it was before the call.
 */
public enum ReferralError {
    /** Missing or empty user identifier, or a self-referral. */
    INVALID_INPUT,
    /** The candidate already has a referrer. */
    DUPLICATE_REFERRER,
    /** The referral would close a directed cycle. */
    CYCLE_DETECTED,
    /** A probability outside {@code [0, 1]}. */
    INVALID_PROBABILITY,
    /** A negative number of days. */
    INVALID_DURATION,
    /** A non-positive tolerance. */
    INVALID_TOLERANCE,
    /** An adoption curve returned a value outside {@code [0, 1]}. */
    INVALID_PROBABILITY_FUNCTION,
    /** An adoption curve that cannot be invoked with a single bonus amount. */
    INVALID_SIGNATURE
}
