package org.eqschema.engine;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;

import java.util.List;

/**
 * Generators for equation lines in the shapes found in hand-written equation files.
 */
public class EquationGenerators {

    private static final String SUPERSCRIPT_DIGITS = "⁰¹²³⁴⁵⁶⁷⁸⁹";

    private EquationGenerators() {
    }

    private static Arbitrary<Integer> coefficients() {
        return Arbitraries.integers().between(-500, 500);
    }

    // ==================== Equation Shapes ====================

    /**
     * a*x + b = c
     */
    public static Arbitrary<String> linear() {
        return Combinators.combine(coefficients(), coefficients(), coefficients())
                .as((a, b, c) -> a + "*x + " + b + " = " + c);
    }

    /**
     * Dense polynomial of degree 2 to 5 in x with a positive leading coefficient.
     */
    public static Arbitrary<String> polynomial() {
        return Arbitraries.integers().between(2, 5).flatMap(degree -> Combinators.combine(
                Arbitraries.integers().between(1, 500),
                coefficients().list().ofSize(degree),
                coefficients())
                .as((lead, rest, rhs) -> polynomialLine(degree, lead, rest, rhs)));
    }

    /**
     * (x + a)(x + b) = c
     */
    public static Arbitrary<String> factored() {
        return Combinators.combine(
                Arbitraries.integers().between(-50, 50),
                Arbitraries.integers().between(-50, 50),
                coefficients())
                .as((a, b, c) -> "(x + " + a + ")(x + " + b + ") = " + c);
    }

    /**
     * (a*x + b)^0.5 = c or sqrt(a*x + b) = c
     */
    public static Arbitrary<String> radical() {
        return Combinators.combine(
                Arbitraries.integers().between(1, 20),
                Arbitraries.integers().between(-50, 50),
                Arbitraries.integers().between(0, 50),
                Arbitraries.of(true, false))
                .as((a, b, c, halfPower) -> halfPower
                        ? "(" + a + "*x + " + b + ")^0.5 = " + c
                        : "sqrt(" + a + "*x + " + b + ") = " + c);
    }

    /**
     * Any of the well-formed shapes above.
     */
    public static Arbitrary<String> wellFormed() {
        return Arbitraries.oneOf(linear(), polynomial(), factored(), radical());
    }

    /**
     * Short strings over the equation alphabet, mostly malformed.
     */
    public static Arbitrary<String> noise() {
        return Arbitraries.strings()
                .withChars("0123456789.xyf+-*/^()[]{}|<>=,; ²⁻≤")
                .ofMaxLength(24);
    }

    // ==================== Notation ====================

    public static String superscript(int exponent) {
        StringBuilder text = new StringBuilder();
        for (char digit : String.valueOf(exponent).toCharArray()) {
            text.append(SUPERSCRIPT_DIGITS.charAt(digit - '0'));
        }
        return text.toString();
    }

    private static String polynomialLine(int degree, int lead, List<Integer> rest, int rhs) {
        StringBuilder line = new StringBuilder();
        line.append(lead).append("*x^").append(degree);
        for (int power = degree - 1; power >= 0; power--) {
            line.append(" + ").append(rest.get(degree - 1 - power));
            if (power > 0) {
                line.append("*x^").append(power);
            }
        }
        return line.append(" = ").append(rhs).toString();
    }
}
