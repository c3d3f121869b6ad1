package org.eqschema.dsl;

/**
 * Represents a token produced by the equation lexer.
 *
 * @param type     The token type
 * @param value    The token text (number digits, variable letter, operator symbol, ...)
 * @param position The character offset in the source line
 */
public record Token(TokenType type, String value, int position) {

    public enum TokenType {
        // Operands
        NUMBER, // 42, 3.14
        IDENTIFIER, // x (one letter per token), otherwise
        FUNCTION, // sin, log, f (only when followed by '(')

        // Operators
        OPERATOR, // + - * / ^
        RELATIONAL, // = < > <= >=

        // Delimiters
        LPAREN, // (
        RPAREN, // )
        LBRACKET, // [
        RBRACKET, // ]
        LBRACE, // {
        RBRACE, // }
        PIPE, // |
        COMMA, // ,
        SEMICOLON, // ;

        // Special
        EOF, // End of input
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && symbol.equals(value);
    }

    public boolean isOpening() {
        return type == TokenType.LPAREN || type == TokenType.LBRACKET || type == TokenType.LBRACE;
    }

    public boolean isClosing() {
        return type == TokenType.RPAREN || type == TokenType.RBRACKET || type == TokenType.RBRACE;
    }

    @Override
    public String toString() {
        return type + (value != null ? "(" + value + ")" : "") + "@" + position;
    }
}
