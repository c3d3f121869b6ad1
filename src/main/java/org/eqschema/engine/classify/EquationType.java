package org.eqschema.engine.classify;

/**
 * Structural type assigned to an equation.
 */
public enum EquationType {
    LINEAR,
    QUADRATIC,
    POLYNOMIAL,
    RATIONAL,
    POWER,
    RADICAL,
    EXPONENTIAL,
    LOGARITHMIC,
    INEQUALITY_LINEAR,
    INEQUALITY_POLYNOMIAL,
    INEQUALITY,
    PIECEWISE,
    ABSOLUTE,
    PARAMETRIC,
    FUNCTIONAL,
    IDENTITY,
    CONSTANT,
    OTHER;

    /**
     * Identifier used in the serialized output, e.g. "inequality_linear".
     */
    public String id() {
        return name().toLowerCase();
    }
}
