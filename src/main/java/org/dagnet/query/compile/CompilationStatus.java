package org.dagnet.query.compile;

/**
 * Exactness of an inclusion-exclusion compilation.
 */
public enum CompilationStatus {
    /** The signed terms reproduce the exclusion count exactly. */
    EXACT,
    /** The term budget stopped enumeration; terms are incomplete. */
    DEGRADED
}
