package org.eqschema.engine.classify;

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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Structural queries over expression trees.
 */
public final class ExpressionQueries {

    private ExpressionQueries() {
    }

    /**
     * Direct children of a node, in source order.
     */
    public static List<Expression> children(Expression expression) {
        if (expression instanceof Sum sum) {
            return sum.terms();
        }
        if (expression instanceof Product product) {
            return product.factors();
        }
        if (expression instanceof Power power) {
            return List.of(power.base(), power.exponent());
        }
        if (expression instanceof AbsoluteValue abs) {
            return List.of(abs.operand());
        }
        if (expression instanceof FunctionCall call) {
            return call.arguments();
        }
        if (expression instanceof Relational relational) {
            return List.of(relational.lhs(), relational.rhs());
        }
        if (expression instanceof Piecewise piecewise) {
            List<Expression> nodes = new ArrayList<>();
            for (Piecewise.Branch branch : piecewise.branches()) {
                nodes.add(branch.condition());
                nodes.add(branch.expression());
            }
            return nodes;
        }
        if (expression instanceof Constant || expression instanceof Variable || expression instanceof FunctionDef) {
            return List.of();
        }
        throw new IllegalArgumentException("Unknown expression node: " + expression);
    }

    /**
     * True when the node or any of its descendants satisfies the predicate.
     */
    public static boolean anyMatch(Expression expression, Predicate<Expression> predicate) {
        if (predicate.test(expression)) {
            return true;
        }
        for (Expression child : children(expression)) {
            if (anyMatch(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsVariable(Expression expression) {
        return anyMatch(expression, node -> node instanceof Variable);
    }

    public static boolean callsFunction(Expression expression, Set<String> names) {
        return anyMatch(expression, node -> node instanceof FunctionCall call && names.contains(call.name()));
    }

    /**
     * Sorted, de-duplicated names of every Variable node in the given trees.
     */
    public static Set<String> variables(Expression... expressions) {
        Set<String> names = new TreeSet<>();
        for (Expression expression : expressions) {
            collectVariables(expression, names);
        }
        return names;
    }

    private static void collectVariables(Expression expression, Set<String> names) {
        if (expression instanceof Variable variable) {
            names.add(variable.name());
            return;
        }
        for (Expression child : children(expression)) {
            collectVariables(child, names);
        }
    }
}
