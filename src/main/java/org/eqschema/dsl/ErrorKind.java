package org.eqschema.dsl;

/**
 * Kinds of failure reported while turning one equation line into an AST.
 */
public enum ErrorKind {
    UNRECOGNIZED_CHARACTER(true),
    MALFORMED_NUMBER(true),
    UNEXPECTED_TOKEN(false),
    UNBALANCED_BRACKETS(false),
    UNBALANCED_BARS(false),
    NO_RELATION_FOUND(false),
    EMPTY_EXPRESSION(false);

    private final boolean lexical;

    ErrorKind(boolean lexical) {
        this.lexical = lexical;
    }

    public boolean isLexical() {
        return lexical;
    }

    /**
     * Lower snake case name, as written to reports and logs.
     */
    public String id() {
        return name().toLowerCase();
    }
}
