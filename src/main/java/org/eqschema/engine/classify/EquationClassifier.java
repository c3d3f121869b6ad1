package org.eqschema.engine.classify;

import org.eqschema.dsl.AbsoluteValue;
import org.eqschema.dsl.Constant;
import org.eqschema.dsl.EquationLexer;
import org.eqschema.dsl.Expression;
import org.eqschema.dsl.FunctionCall;
import org.eqschema.dsl.FunctionDef;
import org.eqschema.dsl.Piecewise;
import org.eqschema.dsl.Power;
import org.eqschema.dsl.RelationSymbol;
import org.eqschema.dsl.Variable;

import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Assigns an {@link EquationType} from the shape of the two sides.
 *
 * Rules are tried in order and the first match wins:
 * <ol>
 * <li>function definition = piecewise block: piecewise</li>
 * <li>log-family call: logarithmic; variable exponent or exp(): exponential</li>
 * <li>sqrt/cbrt or a fractional constant exponent: radical</li>
 * <li>absolute value anywhere: absolute</li>
 * <li>relation other than '=': inequality by degree</li>
 * <li>no variables: constant</li>
 * <li>y = expression in x, f(x) = expression: functional</li>
 * <li>sides equal after sorting terms: identity</li>
 * <li>degree 0/1/2/more: constant/linear/quadratic/polynomial</li>
 * <li>negative integer power of a variable expression: rational; other powers: power</li>
 * <li>otherwise: other</li>
 * </ol>
 */
public final class EquationClassifier {

    static final Set<String> LOG_FUNCTIONS = Set.of("log", "ln", "lg");
    static final Set<String> EXP_FUNCTIONS = Set.of("exp");
    static final Set<String> ROOT_FUNCTIONS = Set.of("sqrt", "cbrt");
    static final Set<String> ABS_FUNCTIONS = Set.of("abs");

    private EquationClassifier() {
    }

    /**
     * Classifies an equation.
     *
     * @param lhs       Left side
     * @param rhs       Right side
     * @param relation  Relation between the sides
     * @param variables Variable names appearing in either side
     * @return The equation type
     */
    public static EquationType classify(Expression lhs, Expression rhs, RelationSymbol relation,
            Set<String> variables) {
        if (lhs instanceof FunctionDef && rhs instanceof Piecewise) {
            return EquationType.PIECEWISE;
        }

        if (ExpressionQueries.callsFunction(lhs, LOG_FUNCTIONS) || ExpressionQueries.callsFunction(rhs, LOG_FUNCTIONS)) {
            return EquationType.LOGARITHMIC;
        }
        if (eitherSide(lhs, rhs, EquationClassifier::isExponential)) {
            return EquationType.EXPONENTIAL;
        }

        if (eitherSide(lhs, rhs, EquationClassifier::isRadical)) {
            return EquationType.RADICAL;
        }

        if (eitherSide(lhs, rhs, node -> node instanceof AbsoluteValue
                || (node instanceof FunctionCall call && ABS_FUNCTIONS.contains(call.name())))) {
            return EquationType.ABSOLUTE;
        }

        if (relation != RelationSymbol.EQ) {
            OptionalInt degree = Degree.ofEquation(lhs, rhs);
            if (degree.isEmpty()) {
                return EquationType.INEQUALITY;
            }
            return degree.getAsInt() <= 1 ? EquationType.INEQUALITY_LINEAR : EquationType.INEQUALITY_POLYNOMIAL;
        }

        if (variables.isEmpty()) {
            return EquationType.CONSTANT;
        }

        if (isFunctional(lhs, rhs)) {
            return EquationType.FUNCTIONAL;
        }

        if (CanonicalForm.equivalent(lhs, rhs)) {
            return EquationType.IDENTITY;
        }

        OptionalInt degree = Degree.ofEquation(lhs, rhs);
        if (degree.isPresent()) {
            int d = degree.getAsInt();
            if (d == 0) {
                return EquationType.CONSTANT;
            }
            if (d == 1) {
                return EquationType.LINEAR;
            }
            return d == 2 ? EquationType.QUADRATIC : EquationType.POLYNOMIAL;
        }

        if (eitherSide(lhs, rhs, EquationClassifier::isReciprocalPower)) {
            return EquationType.RATIONAL;
        }
        if (eitherSide(lhs, rhs, node -> node instanceof Power power
                && ExpressionQueries.containsVariable(power.base()))) {
            return EquationType.POWER;
        }

        return EquationType.OTHER;
    }

    private static boolean eitherSide(Expression lhs, Expression rhs,
            Predicate<Expression> predicate) {
        return ExpressionQueries.anyMatch(lhs, predicate) || ExpressionQueries.anyMatch(rhs, predicate);
    }

    private static boolean isExponential(Expression node) {
        if (node instanceof Power power) {
            return ExpressionQueries.containsVariable(power.exponent());
        }
        return node instanceof FunctionCall call && EXP_FUNCTIONS.contains(call.name());
    }

    private static boolean isRadical(Expression node) {
        if (node instanceof FunctionCall call) {
            return ROOT_FUNCTIONS.contains(call.name());
        }
        return node instanceof Power power && isFractional(power.exponent());
    }

    /**
     * A non-integer constant, or a constant quotient such as 1/2 (stored as
     * Product[1, Power[2, -1]]).
     */
    private static boolean isFractional(Expression exponent) {
        if (exponent instanceof Constant constant) {
            return !constant.isInteger();
        }
        if (ExpressionQueries.containsVariable(exponent)) {
            return false;
        }
        return ExpressionQueries.anyMatch(exponent, node -> node instanceof Power power
                && power.base() instanceof Constant divisor
                && Math.abs(divisor.value()) != 1
                && Constant.MINUS_ONE.equals(power.exponent()));
    }

    private static boolean isReciprocalPower(Expression node) {
        return node instanceof Power power
                && power.exponent() instanceof Constant exponent
                && exponent.isInteger()
                && exponent.value() < 0
                && ExpressionQueries.containsVariable(power.base());
    }

    /**
     * Exactly one side is a bare variable or user function call (y, f(x)) and the
     * other side is an expression in other variables.
     */
    private static boolean isFunctional(Expression lhs, Expression rhs) {
        String lhsName = bareName(lhs);
        String rhsName = bareName(rhs);
        if ((lhsName == null) == (rhsName == null)) {
            return false;
        }
        String name = lhsName != null ? lhsName : rhsName;
        Set<String> otherVariables = ExpressionQueries.variables(lhsName != null ? rhs : lhs);
        return !otherVariables.isEmpty() && !otherVariables.contains(name);
    }

    private static String bareName(Expression side) {
        if (side instanceof Variable variable) {
            return variable.name();
        }
        if (side instanceof FunctionCall call
                && !EquationLexer.isKnownFunction(call.name())
                && call.arguments().stream().allMatch(argument -> argument instanceof Variable)) {
            return call.name();
        }
        return null;
    }
}
