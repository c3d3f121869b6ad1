package org.eqschema.dsl;

/**
 * Exception thrown when an equation line cannot be parsed.
 * Carries the failure kind and the character offset of the offending token.
 */
public class EquationParseException extends RuntimeException {

    private final ErrorKind kind;
    private final int position;

    public EquationParseException(ErrorKind kind, String message, int position) {
        super(message + " at position " + position);
        this.kind = kind;
        this.position = position;
    }

    public EquationParseException(ErrorKind kind, String message, Token token) {
        this(kind, message + ", got: " + token, token.position());
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }
}
