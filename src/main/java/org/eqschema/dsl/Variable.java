package org.eqschema.dsl;

import java.util.Objects;

/**
 * A single-letter variable such as x or y.
 *
 * @param name The variable name
 */
public record Variable(String name) implements Expression {

    public Variable {
        Objects.requireNonNull(name, "Variable name cannot be null");
    }
}
