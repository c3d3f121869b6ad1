package org.eqschema.dsl;

/**
 * Sealed interface representing nodes of the equation AST.
 *
 * Type hierarchy:
 * Expression
 * ├── Constant, Variable (leaves)
 * ├── Sum, Product, Power (algebraic structure)
 * ├── AbsoluteValue, FunctionCall
 * └── Relational, FunctionDef, Piecewise (piecewise definitions only)
 *
 * Nodes carry no behavior; classification and rendering are functions over this
 * variant that live outside the AST.
 */
public sealed interface Expression
        permits Constant, Variable, Sum, Product, Power, AbsoluteValue, FunctionCall,
        Relational, FunctionDef, Piecewise {
}
