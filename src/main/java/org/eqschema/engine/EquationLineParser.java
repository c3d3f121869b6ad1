package org.eqschema.engine;

import org.eqschema.dsl.Constant;
import org.eqschema.dsl.EquationLexer;
import org.eqschema.dsl.EquationParseException;
import org.eqschema.dsl.ErrorKind;
import org.eqschema.dsl.Expression;
import org.eqschema.dsl.ExpressionParser;
import org.eqschema.dsl.RelationSplitter;
import org.eqschema.dsl.RelationSymbol;
import org.eqschema.dsl.SplitLine;
import org.eqschema.dsl.Token;
import org.eqschema.engine.classify.EquationClassifier;
import org.eqschema.engine.classify.EquationType;
import org.eqschema.engine.classify.ExpressionQueries;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns one line of equation text into an {@link EquationRecord}.
 *
 * Pipeline: lexer, relation splitter, expression parser on each side, classifier.
 * Instances hold only immutable options and may be shared between threads.
 */
public final class EquationLineParser {

    private final ParserOptions options;

    public EquationLineParser() {
        this(ParserOptions.defaults());
    }

    public EquationLineParser(ParserOptions options) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
    }

    /**
     * Parses and classifies one line.
     *
     * @param raw The line text
     * @param id  1-based line number
     * @return The equation record
     * @throws EquationParseException when the line is not a valid equation; its
     *                                position counts from the start of {@code raw}
     */
    public EquationRecord parseLine(String raw, int id) {
        Objects.requireNonNull(raw, "Line cannot be null");
        if (id < 1) {
            throw new IllegalArgumentException("Equation id must be at least 1, got " + id);
        }

        String text = raw.strip();
        if (text.isEmpty()) {
            throw new EquationParseException(ErrorKind.EMPTY_EXPRESSION, "Empty line", 0);
        }

        // Lex the untrimmed line so that error positions match the caller's text
        List<Token> tokens = EquationLexer.lex(raw);
        SplitLine split;
        try {
            split = RelationSplitter.split(tokens);
        } catch (EquationParseException e) {
            if (e.getKind() == ErrorKind.NO_RELATION_FOUND
                    && options.bareExpressions() == BareExpressionPolicy.IMPLICIT_ZERO) {
                return bareExpression(text, id, tokens);
            }
            throw e;
        }

        Expression lhs;
        Expression rhs;
        if (split.piecewise()) {
            if (split.relation() != RelationSymbol.EQ) {
                throw new EquationParseException(ErrorKind.UNEXPECTED_TOKEN,
                        "Piecewise definition needs '=' but got '" + split.relation().symbol() + "'",
                        split.relationPosition());
            }
            lhs = new ExpressionParser(split.lhs()).parseFunctionDef();
            rhs = new ExpressionParser(split.rhs()).parsePiecewise();
        } else {
            lhs = ExpressionParser.parse(split.lhs());
            rhs = ExpressionParser.parse(split.rhs());
        }

        Set<String> variables = ExpressionQueries.variables(lhs, rhs);
        EquationType type = EquationClassifier.classify(lhs, rhs, split.relation(), variables);
        return new EquationRecord(id, text, List.copyOf(variables), type, split.relation(), lhs, rhs);
    }

    /**
     * A line without relation read as "expression = 0". Such a record is only
     * told apart as constant (no variables) or other.
     */
    private EquationRecord bareExpression(String text, int id, List<Token> tokens) {
        Expression lhs = ExpressionParser.parse(tokens);
        Set<String> variables = ExpressionQueries.variables(lhs);
        EquationType type = variables.isEmpty() ? EquationType.CONSTANT : EquationType.OTHER;
        return new EquationRecord(id, text, List.copyOf(variables), type, RelationSymbol.EQ, lhs, Constant.ZERO);
    }
}
