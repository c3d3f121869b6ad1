package org.eqschema.dsl;

import java.util.Objects;

/**
 * Comparison inside a piecewise branch condition, e.g. x >= 0.
 *
 * @param relation The comparison operator
 * @param lhs      The left operand
 * @param rhs      The right operand
 */
public record Relational(
        RelationSymbol relation,
        Expression lhs,
        Expression rhs) implements Expression {

    public Relational {
        Objects.requireNonNull(relation, "Relation cannot be null");
        Objects.requireNonNull(lhs, "Left operand cannot be null");
        Objects.requireNonNull(rhs, "Right operand cannot be null");
    }
}
