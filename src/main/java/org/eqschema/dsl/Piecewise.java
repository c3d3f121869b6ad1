package org.eqschema.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Piecewise definition body: { expr , condition ; expr , condition ; ... }
 *
 * @param branches The branches in source order
 */
public record Piecewise(List<Branch> branches) implements Expression {

    public Piecewise {
        Objects.requireNonNull(branches, "Branches cannot be null");
        branches = List.copyOf(branches);
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("Piecewise needs at least one branch");
        }
    }

    /**
     * One case of a piecewise definition. The "otherwise" case has the
     * always-true condition Constant(1).
     */
    public record Branch(Expression condition, Expression expression) {

        public Branch {
            Objects.requireNonNull(condition, "Condition cannot be null");
            Objects.requireNonNull(expression, "Expression cannot be null");
        }

        public static Branch otherwise(Expression expression) {
            return new Branch(Constant.ONE, expression);
        }

        public boolean isOtherwise() {
            return Constant.ONE.equals(condition);
        }
    }
}
