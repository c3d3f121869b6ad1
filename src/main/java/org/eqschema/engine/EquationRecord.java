package org.eqschema.engine;

import org.eqschema.dsl.Expression;
import org.eqschema.dsl.RelationSymbol;
import org.eqschema.engine.classify.EquationType;

import java.util.List;
import java.util.Objects;

/**
 * The parsed and classified form of one input line.
 *
 * @param id           1-based line number
 * @param raw          The line text, trimmed
 * @param variables    Sorted, de-duplicated variable names of both sides
 * @param equationType Structural classification
 * @param relation     Relation between the sides
 * @param lhs          Left side
 * @param rhs          Right side
 */
public record EquationRecord(
        int id,
        String raw,
        List<String> variables,
        EquationType equationType,
        RelationSymbol relation,
        Expression lhs,
        Expression rhs) {

    public EquationRecord {
        if (id < 1) {
            throw new IllegalArgumentException("Equation id must be at least 1, got " + id);
        }
        Objects.requireNonNull(raw, "Raw text cannot be null");
        Objects.requireNonNull(equationType, "Equation type cannot be null");
        Objects.requireNonNull(relation, "Relation cannot be null");
        Objects.requireNonNull(lhs, "Left side cannot be null");
        Objects.requireNonNull(rhs, "Right side cannot be null");
        variables = List.copyOf(variables);
    }
}
