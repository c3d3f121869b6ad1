package org.eqschema.dsl;

import java.util.Objects;

/**
 * Left side of a piecewise definition: name(variable), e.g. f(x).
 */
public record FunctionDef(String name, String variable) implements Expression {

    public FunctionDef {
        Objects.requireNonNull(name, "Function name cannot be null");
        Objects.requireNonNull(variable, "Variable cannot be null");
    }
}
