package org.eqschema.engine;

/**
 * What a batch run does with a line that fails to parse.
 */
public enum ErrorPolicy {
    /**
     * Log a warning and leave the line out of the output.
     */
    SKIP,
    /**
     * Abort the whole run at the first failing line.
     */
    FAIL
}
