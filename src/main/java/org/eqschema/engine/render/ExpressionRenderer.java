package org.eqschema.engine.render;

import org.eqschema.dsl.AbsoluteValue;
import org.eqschema.dsl.Constant;
import org.eqschema.dsl.Expression;
import org.eqschema.dsl.FunctionCall;
import org.eqschema.dsl.FunctionDef;
import org.eqschema.dsl.Piecewise;
import org.eqschema.dsl.Power;
import org.eqschema.dsl.Product;
import org.eqschema.dsl.Relational;
import org.eqschema.dsl.Sum;
import org.eqschema.dsl.Variable;

import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Renders an expression tree back into canonical ASCII notation.
 *
 * The output uses explicit operators only ('*' everywhere, '^' for powers,
 * brackets where precedence needs them), so parsing the rendered text yields the
 * same tree again.
 */
public final class ExpressionRenderer {

    private ExpressionRenderer() {
    }

    public static String render(Expression expression) {
        if (expression instanceof Constant constant) {
            return formatNumber(constant.value());
        }
        if (expression instanceof Variable variable) {
            return variable.name();
        }
        if (expression instanceof Sum sum) {
            return sum.terms().stream()
                    .map(ExpressionRenderer::render)
                    .collect(Collectors.joining(" + "));
        }
        if (expression instanceof Product product) {
            return product.factors().stream()
                    .map(factor -> factor instanceof Sum ? "(" + render(factor) + ")" : render(factor))
                    .collect(Collectors.joining("*"));
        }
        if (expression instanceof Power power) {
            return renderBase(power.base()) + "^" + renderExponent(power.exponent());
        }
        if (expression instanceof AbsoluteValue abs) {
            return "|" + render(abs.operand()) + "|";
        }
        if (expression instanceof FunctionCall call) {
            return call.name() + "(" + call.arguments().stream()
                    .map(ExpressionRenderer::render)
                    .collect(Collectors.joining(", ")) + ")";
        }
        if (expression instanceof Relational relational) {
            return render(relational.lhs()) + " " + relational.relation().symbol() + " " + render(relational.rhs());
        }
        if (expression instanceof FunctionDef def) {
            return def.name() + "(" + def.variable() + ")";
        }
        if (expression instanceof Piecewise piecewise) {
            return "{ " + piecewise.branches().stream()
                    .map(branch -> render(branch.expression()) + " , "
                            + (branch.isOtherwise() ? "otherwise" : render(branch.condition())))
                    .collect(Collectors.joining(" ; ")) + " }";
        }
        throw new IllegalArgumentException("Unknown expression node: " + expression);
    }

    /**
     * Formats a constant without exponent notation; integral values print with
     * no fractional part (2, not 2.0).
     */
    public static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String renderBase(Expression base) {
        boolean atomic = base instanceof Variable
                || base instanceof AbsoluteValue
                || base instanceof FunctionCall
                || (base instanceof Constant constant && constant.value() >= 0);
        return atomic ? render(base) : "(" + render(base) + ")";
    }

    // Powers nest to the right without brackets: x^2^3 is x^(2^3)
    private static String renderExponent(Expression exponent) {
        boolean bare = exponent instanceof Variable
                || exponent instanceof Constant
                || exponent instanceof AbsoluteValue
                || exponent instanceof FunctionCall
                || exponent instanceof Power;
        return bare ? render(exponent) : "(" + render(exponent) + ")";
    }
}
