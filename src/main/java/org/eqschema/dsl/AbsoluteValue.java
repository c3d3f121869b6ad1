package org.eqschema.dsl;

import java.util.Objects;

/**
 * Absolute value: |operand|
 */
public record AbsoluteValue(Expression operand) implements Expression {

    public AbsoluteValue {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }
}
