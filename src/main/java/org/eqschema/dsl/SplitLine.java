package org.eqschema.dsl;

import java.util.List;
import java.util.Objects;

/**
 * A tokenized line split at its top-level relational operator.
 *
 * @param lhs              Tokens left of the relation (no EOF)
 * @param relation         The top-level relation
 * @param relationPosition Character offset of the relation in the line
 * @param rhs              Tokens right of the relation (no EOF)
 * @param piecewise        True when the right side is a single { ... } block
 */
public record SplitLine(
        List<Token> lhs,
        RelationSymbol relation,
        int relationPosition,
        List<Token> rhs,
        boolean piecewise) {

    public SplitLine {
        Objects.requireNonNull(relation, "Relation cannot be null");
        lhs = List.copyOf(lhs);
        rhs = List.copyOf(rhs);
    }
}
