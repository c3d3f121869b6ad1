package org.eqschema.dsl;

import org.eqschema.dsl.Token.TokenType;

import java.util.List;

/**
 * Locates the relational operator that separates the two sides of a line.
 *
 * Only a relation at bracket depth 0 and outside any |...| pair counts, so the
 * comparisons inside piecewise conditions ({ x+1 , x<0 }) never split the line.
 */
public final class RelationSplitter {

    private RelationSplitter() {
    }

    /**
     * Splits a tokenized line at its first top-level relation.
     *
     * @param tokens Tokens of the whole line, with or without the trailing EOF
     * @return The two sides and the relation
     * @throws EquationParseException NO_RELATION_FOUND when no top-level relation
     *                                exists, or a bracket/bar balance error
     */
    public static SplitLine split(List<Token> tokens) {
        List<Token> line = TokenSpans.withoutEof(tokens);
        TokenSpans.checkBalanced(line);

        int depth = 0;
        boolean insideBars = false;
        for (int i = 0; i < line.size(); i++) {
            Token token = line.get(i);
            if (token.isOpening()) {
                depth++;
            } else if (token.isClosing()) {
                depth--;
            } else if (token.is(TokenType.PIPE) && depth == 0) {
                insideBars = !insideBars;
            } else if (token.is(TokenType.RELATIONAL) && depth == 0 && !insideBars) {
                List<Token> lhs = line.subList(0, i);
                List<Token> rhs = line.subList(i + 1, line.size());
                return new SplitLine(lhs, RelationSymbol.fromSymbol(token.value()), token.position(), rhs,
                        isBraceBlock(rhs));
            }
        }

        List<Token> terminated = TokenSpans.withEof(tokens);
        int end = terminated.get(terminated.size() - 1).position();
        throw new EquationParseException(ErrorKind.NO_RELATION_FOUND, "No top-level relational operator", end);
    }

    /**
     * True when the span is exactly one brace block: '{' ... '}' with the
     * matching brace as last token.
     */
    private static boolean isBraceBlock(List<Token> span) {
        if (span.isEmpty() || !span.get(0).is(TokenType.LBRACE)) {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < span.size(); i++) {
            Token token = span.get(i);
            if (token.isOpening()) {
                depth++;
            } else if (token.isClosing()) {
                depth--;
                if (depth == 0) {
                    return i == span.size() - 1;
                }
            }
        }
        return false;
    }
}
