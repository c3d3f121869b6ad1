package org.eqschema.dsl;

/**
 * Numeric literal. Values are kept exactly as written; nothing is evaluated.
 *
 * @param value The literal value
 */
public record Constant(double value) implements Expression {

    public static final Constant ZERO = new Constant(0);
    public static final Constant ONE = new Constant(1);
    public static final Constant MINUS_ONE = new Constant(-1);

    public Constant {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Constant must be finite: " + value);
        }
        // -0.0 and 0.0 must compare equal in record equality
        if (value == 0) {
            value = 0;
        }
    }

    public boolean isInteger() {
        return value == Math.rint(value);
    }

    public Constant negate() {
        return new Constant(-value);
    }
}
