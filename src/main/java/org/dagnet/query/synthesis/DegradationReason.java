package org.dagnet.query.synthesis;

/**
 * Why a synthesis loop stopped before reaching a fixed point.
 */
public enum DegradationReason {
    CHECK_CAP,
    ITERATION_CAP,
    NO_PROGRESS
}
