package org.eqschema.dsl;

import org.eqschema.dsl.Token.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Helpers over token spans shared by the splitter and the parser.
 */
final class TokenSpans {

    private TokenSpans() {
    }

    /**
     * Verifies that brackets pair up and that every bracket level holds an even
     * number of absolute-value bars.
     *
     * @throws EquationParseException with UNBALANCED_BRACKETS or UNBALANCED_BARS
     */
    static void checkBalanced(List<Token> tokens) {
        Deque<Token> open = new ArrayDeque<>();
        Deque<int[]> bars = new ArrayDeque<>();
        Deque<Token> lastBar = new ArrayDeque<>();
        bars.push(new int[1]);

        for (Token token : tokens) {
            if (token.isOpening()) {
                open.push(token);
                bars.push(new int[1]);
            } else if (token.isClosing()) {
                if (open.isEmpty() || !pairs(open.peek(), token)) {
                    throw new EquationParseException(ErrorKind.UNBALANCED_BRACKETS,
                            "Closing '" + token.value() + "' has no matching opening bracket", token.position());
                }
                Token opening = open.pop();
                if (bars.pop()[0] % 2 != 0) {
                    throw new EquationParseException(ErrorKind.UNBALANCED_BARS,
                            "Unmatched '|' inside '" + opening.value() + "'", opening.position());
                }
            } else if (token.is(TokenType.PIPE)) {
                bars.peek()[0]++;
                lastBar.push(token);
            }
        }

        if (!open.isEmpty()) {
            Token unclosed = open.peek();
            throw new EquationParseException(ErrorKind.UNBALANCED_BRACKETS,
                    "Opening '" + unclosed.value() + "' is never closed", unclosed.position());
        }
        if (bars.peek()[0] % 2 != 0) {
            throw new EquationParseException(ErrorKind.UNBALANCED_BARS, "Odd number of '|' bars",
                    lastBar.peek().position());
        }
    }

    /**
     * Returns the span terminated by an EOF token, appending one when missing.
     */
    static List<Token> withEof(List<Token> span) {
        if (!span.isEmpty() && span.get(span.size() - 1).is(TokenType.EOF)) {
            return span;
        }
        int end = 0;
        if (!span.isEmpty()) {
            Token last = span.get(span.size() - 1);
            end = last.position() + (last.value() != null ? last.value().length() : 0);
        }
        List<Token> terminated = new ArrayList<>(span);
        terminated.add(new Token(TokenType.EOF, null, end));
        return terminated;
    }

    /**
     * Drops a trailing EOF token, if any.
     */
    static List<Token> withoutEof(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            return tokens.subList(0, tokens.size() - 1);
        }
        return tokens;
    }

    private static boolean pairs(Token opening, Token closing) {
        return switch (opening.type()) {
            case LPAREN -> closing.is(TokenType.RPAREN);
            case LBRACKET -> closing.is(TokenType.RBRACKET);
            case LBRACE -> closing.is(TokenType.RBRACE);
            default -> false;
        };
    }
}
