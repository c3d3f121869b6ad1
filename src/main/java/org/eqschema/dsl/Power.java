package org.eqschema.dsl;

import java.util.Objects;

/**
 * Exponentiation: base ^ exponent.
 *
 * @param base     The base
 * @param exponent The exponent
 */
public record Power(Expression base, Expression exponent) implements Expression {

    public Power {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(exponent, "Exponent cannot be null");
    }

    /**
     * The reciprocal 1/divisor as it appears in a quotient.
     */
    public static Power reciprocal(Expression divisor) {
        return new Power(divisor, Constant.MINUS_ONE);
    }
}
