package org.eqschema.engine;

/**
 * What to do with a line that has no top-level relation, e.g. "2x".
 */
public enum BareExpressionPolicy {
    /**
     * Fail the line with NO_RELATION_FOUND.
     */
    REJECT,
    /**
     * Read the line as "expression = 0".
     */
    IMPLICIT_ZERO
}
