package org.eqschema.engine.classify;

import org.eqschema.dsl.Constant;
import org.eqschema.dsl.Expression;
import org.eqschema.dsl.Power;
import org.eqschema.dsl.Product;
import org.eqschema.dsl.Sum;
import org.eqschema.dsl.Variable;

import java.util.OptionalInt;

/**
 * Total polynomial degree of an expression.
 *
 * Constant 0, Variable 1, Sum the maximum over its terms, Product the sum over
 * its factors, Power with a non-negative integer constant exponent n the degree
 * of its base times n. A node without variables has degree 0. Everything else is
 * not a polynomial and yields an empty result.
 */
public final class Degree {

    private Degree() {
    }

    public static OptionalInt of(Expression expression) {
        if (expression instanceof Constant) {
            return OptionalInt.of(0);
        }
        if (expression instanceof Variable) {
            return OptionalInt.of(1);
        }
        if (expression instanceof Sum sum) {
            int max = 0;
            for (Expression term : sum.terms()) {
                OptionalInt degree = of(term);
                if (degree.isEmpty()) {
                    return degree;
                }
                max = Math.max(max, degree.getAsInt());
            }
            return OptionalInt.of(max);
        }
        if (expression instanceof Product product) {
            int total = 0;
            for (Expression factor : product.factors()) {
                OptionalInt degree = of(factor);
                if (degree.isEmpty()) {
                    return degree;
                }
                total = (int) Math.min((long) total + degree.getAsInt(), Integer.MAX_VALUE);
            }
            return OptionalInt.of(total);
        }
        if (!ExpressionQueries.containsVariable(expression)) {
            return OptionalInt.of(0);
        }
        if (expression instanceof Power power
                && power.exponent() instanceof Constant exponent
                && exponent.isInteger()
                && exponent.value() >= 0) {
            OptionalInt base = of(power.base());
            if (base.isEmpty()) {
                return base;
            }
            return OptionalInt.of((int) Math.min(base.getAsInt() * exponent.value(), Integer.MAX_VALUE));
        }
        return OptionalInt.empty();
    }

    /**
     * Maximum degree over both sides, empty when either side is not a polynomial.
     */
    public static OptionalInt ofEquation(Expression lhs, Expression rhs) {
        OptionalInt left = of(lhs);
        OptionalInt right = of(rhs);
        if (left.isEmpty() || right.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Math.max(left.getAsInt(), right.getAsInt()));
    }
}
