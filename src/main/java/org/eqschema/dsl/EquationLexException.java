package org.eqschema.dsl;

/**
 * Lexical failure: a character outside the supported symbol set or a malformed number.
 */
public class EquationLexException extends EquationParseException {

    public EquationLexException(ErrorKind kind, String message, int position) {
        super(kind, message, position);
        if (!kind.isLexical()) {
            throw new IllegalArgumentException("Not a lexical error kind: " + kind);
        }
    }
}
