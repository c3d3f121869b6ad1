package org.eqschema.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Function call expression: name(arg1, arg2, ...)
 */
public record FunctionCall(
        String name,
        List<Expression> arguments) implements Expression {

    public FunctionCall {
        Objects.requireNonNull(name, "Function name cannot be null");
        arguments = List.copyOf(arguments);
    }
}
