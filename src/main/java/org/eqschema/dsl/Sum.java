package org.eqschema.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Addition of signed terms. Subtraction is stored as addition of a negated term.
 *
 * @param terms Two or more terms, none of them a Sum
 */
public record Sum(List<Expression> terms) implements Expression {

    public Sum {
        Objects.requireNonNull(terms, "Terms cannot be null");
        terms = List.copyOf(terms);
        if (terms.size() < 2) {
            throw new IllegalArgumentException("Sum needs at least two terms, use Sum.of() to collapse");
        }
    }

    /**
     * Builds the sum of the given terms, flattening nested sums and collapsing a
     * single term to itself.
     */
    public static Expression of(List<? extends Expression> terms) {
        List<Expression> flat = new ArrayList<>();
        for (Expression term : terms) {
            if (term instanceof Sum nested) {
                flat.addAll(nested.terms());
            } else {
                flat.add(term);
            }
        }
        if (flat.isEmpty()) {
            throw new IllegalArgumentException("Sum needs at least one term");
        }
        return flat.size() == 1 ? flat.get(0) : new Sum(flat);
    }
}
