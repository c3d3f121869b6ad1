package org.eqschema.dsl;

/**
 * Relational operators accepted between the two sides of an equation.
 */
public enum RelationSymbol {
    EQ("="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">=");

    private final String symbol;

    RelationSymbol(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static RelationSymbol fromSymbol(String symbol) {
        for (RelationSymbol relation : values()) {
            if (relation.symbol.equals(symbol)) {
                return relation;
            }
        }
        throw new IllegalArgumentException("Unknown relation: " + symbol);
    }
}
