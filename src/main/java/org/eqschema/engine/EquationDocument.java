package org.eqschema.engine;

import java.util.List;
import java.util.Objects;

/**
 * All records parsed from one input file.
 *
 * @param sourceFile File name of the input (no directory)
 * @param equations  Records in input order
 */
public record EquationDocument(String sourceFile, List<EquationRecord> equations) {

    public EquationDocument {
        Objects.requireNonNull(sourceFile, "Source file cannot be null");
        equations = List.copyOf(equations);
    }

    public int count() {
        return equations.size();
    }
}
