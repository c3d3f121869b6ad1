package org.eqschema.engine.classify;

import org.eqschema.dsl.AbsoluteValue;
import org.eqschema.dsl.Expression;
import org.eqschema.dsl.FunctionCall;
import org.eqschema.dsl.Piecewise;
import org.eqschema.dsl.Power;
import org.eqschema.dsl.Product;
import org.eqschema.dsl.Relational;
import org.eqschema.dsl.Sum;
import org.eqschema.engine.render.ExpressionRenderer;

import java.util.Comparator;
import java.util.List;

/**
 * Canonical ordering of commutative operands.
 *
 * Sum terms and Product factors are sorted by their rendered text, recursively,
 * so x + 1 and 1 + x share one canonical tree. No other rewriting happens.
 */
public final class CanonicalForm {

    private static final Comparator<Expression> BY_RENDERING = Comparator.comparing(ExpressionRenderer::render);

    private CanonicalForm() {
    }

    public static Expression of(Expression expression) {
        if (expression instanceof Sum sum) {
            return Sum.of(sorted(sum.terms()));
        }
        if (expression instanceof Product product) {
            return Product.of(sorted(product.factors()));
        }
        if (expression instanceof Power power) {
            return new Power(of(power.base()), of(power.exponent()));
        }
        if (expression instanceof AbsoluteValue abs) {
            return new AbsoluteValue(of(abs.operand()));
        }
        if (expression instanceof FunctionCall call) {
            return new FunctionCall(call.name(), call.arguments().stream().map(CanonicalForm::of).toList());
        }
        if (expression instanceof Relational relational) {
            return new Relational(relational.relation(), of(relational.lhs()), of(relational.rhs()));
        }
        if (expression instanceof Piecewise piecewise) {
            return new Piecewise(piecewise.branches().stream()
                    .map(branch -> new Piecewise.Branch(of(branch.condition()), of(branch.expression())))
                    .toList());
        }
        return expression;
    }

    public static boolean equivalent(Expression left, Expression right) {
        return of(left).equals(of(right));
    }

    private static List<Expression> sorted(List<Expression> operands) {
        return operands.stream()
                .map(CanonicalForm::of)
                .sorted(BY_RENDERING)
                .toList();
    }
}
