package org.eqschema.dsl;

import org.eqschema.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Precedence-climbing parser for one side of an equation.
 *
 * Grammar, lowest to highest precedence:
 * <pre>
 * sum     := product (('+' | '-') product)*
 * product := unary (('*' | '/') unary | implicit-power)*
 * unary   := ('-' | '+') unary | power
 * power   := atom ('^' unary)?
 * atom    := NUMBER | IDENTIFIER | FUNCTION '(' sum (',' sum)* ')'
 *          | '(' sum ')' | '[' sum ']' | '|' sum '|'
 * </pre>
 *
 * Implicit multiplication applies when an operand is directly followed by a
 * variable, a function, an opening bracket, or a '|' that cannot close an open
 * absolute value. The parser only structures; it never evaluates.
 */
public final class ExpressionParser {

    // Nesting allowed for brackets, bars, calls, unary signs and exponents
    static final int MAX_DEPTH = 200;

    private final List<Token> tokens;
    private int position;
    // Number of |...| pairs opened at the current bracket level
    private int openBars;
    private int depth;

    public ExpressionParser(List<Token> span) {
        this.tokens = TokenSpans.withEof(span);
        this.position = 0;
        this.openBars = 0;
        this.depth = 0;
    }

    /**
     * Parses a complete token span as one expression.
     *
     * @param span Tokens of one side of an equation
     * @return The expression AST
     */
    public static Expression parse(List<Token> span) {
        return new ExpressionParser(span).parseExpression();
    }

    /**
     * Parses the whole span as a sum-level expression.
     */
    public Expression parseExpression() {
        TokenSpans.checkBalanced(tokens);
        if (check(TokenType.EOF)) {
            throw new EquationParseException(ErrorKind.EMPTY_EXPRESSION, "Empty expression", peek().position());
        }
        Expression expression = parseSum();
        expectEnd();
        return expression;
    }

    /**
     * Parses the left side of a piecewise definition: name '(' variable ')'.
     */
    public FunctionDef parseFunctionDef() {
        TokenSpans.checkBalanced(tokens);
        if (check(TokenType.EOF)) {
            throw new EquationParseException(ErrorKind.EMPTY_EXPRESSION, "Missing function definition",
                    peek().position());
        }
        if (!check(TokenType.FUNCTION) && !checkVariable()) {
            throw error("Expected function name before a piecewise block");
        }
        Token name = advance();
        consume(TokenType.LPAREN, "Expected '(' after function name");
        if (!checkVariable()) {
            throw error("Expected the function variable");
        }
        Token variable = advance();
        consume(TokenType.RPAREN, "Expected ')' after function variable");
        expectEnd();
        return new FunctionDef(name.value(), variable.value());
    }

    /**
     * Parses a piecewise block.
     *
     * Branches are separated by ';'. A branch is written either
     * {@code expr , condition} or as two segments {@code expr ; condition} where
     * the second segment is a comparison. A branch without a condition, or with
     * the condition {@code otherwise}, is stored with the always-true Constant(1).
     */
    public Piecewise parsePiecewise() {
        TokenSpans.checkBalanced(tokens);
        consume(TokenType.LBRACE, "Expected '{' to start piecewise block");
        if (check(TokenType.RBRACE)) {
            throw new EquationParseException(ErrorKind.EMPTY_EXPRESSION, "Piecewise block has no branches",
                    peek().position());
        }

        List<Piecewise.Branch> branches = new ArrayList<>();
        Expression pending = null;

        while (true) {
            if (pending == null) {
                Expression expression = parseSum();
                if (consumeIf(TokenType.COMMA)) {
                    branches.add(new Piecewise.Branch(parseCondition(), expression));
                } else {
                    pending = expression;
                }
            } else if (segmentIsCondition()) {
                branches.add(new Piecewise.Branch(parseCondition(), pending));
                pending = null;
            } else {
                // The previous segment had no condition; this segment starts a new branch
                branches.add(Piecewise.Branch.otherwise(pending));
                pending = null;
                continue;
            }

            if (consumeIf(TokenType.SEMICOLON)) {
                if (check(TokenType.RBRACE)) {
                    break;
                }
                continue;
            }
            break;
        }

        if (pending != null) {
            branches.add(Piecewise.Branch.otherwise(pending));
        }

        consume(TokenType.RBRACE, "Expected '}' to end piecewise block");
        expectEnd();
        return new Piecewise(branches);
    }

    // ==================== Precedence Levels ====================

    private Expression parseSum() {
        List<Expression> terms = new ArrayList<>();
        terms.add(parseProduct());

        while (checkOperator("+") || checkOperator("-")) {
            boolean subtract = advance().value().equals("-");
            Expression term = parseProduct();
            terms.add(subtract ? Product.negate(term) : term);
        }

        return Sum.of(terms);
    }

    private Expression parseProduct() {
        List<Expression> factors = new ArrayList<>();
        factors.add(parseUnary());

        while (true) {
            if (checkOperator("*")) {
                advance();
                factors.add(parseUnary());
            } else if (checkOperator("/")) {
                advance();
                factors.add(Power.reciprocal(parseUnary()));
            } else if (startsImplicitFactor()) {
                factors.add(parsePower());
            } else if (check(TokenType.NUMBER)) {
                throw error("Number directly after an operand needs an operator");
            } else {
                break;
            }
        }

        return Product.of(factors);
    }

    private Expression parseUnary() {
        if (checkOperator("-")) {
            enter();
            advance();
            Expression operand = parseUnary();
            depth--;
            return Product.negate(operand);
        }
        if (checkOperator("+")) {
            enter();
            advance();
            Expression operand = parseUnary();
            depth--;
            return operand;
        }
        return parsePower();
    }

    /**
     * Right associative: the exponent is itself a unary expression, so x^2^3 is
     * x^(2^3) and x^-2 is accepted.
     */
    private Expression parsePower() {
        Expression base = parseAtom();
        if (checkOperator("^")) {
            enter();
            advance();
            Expression exponent = parseUnary();
            depth--;
            return new Power(base, exponent);
        }
        return base;
    }

    private Expression parseAtom() {
        if (check(TokenType.NUMBER)) {
            return new Constant(Double.parseDouble(advance().value()));
        }

        if (checkVariable()) {
            return new Variable(advance().value());
        }

        if (check(TokenType.FUNCTION)) {
            return parseFunctionCall();
        }

        if (check(TokenType.LPAREN)) {
            return parseGroup(TokenType.LPAREN, TokenType.RPAREN, "')'");
        }

        if (check(TokenType.LBRACKET)) {
            return parseGroup(TokenType.LBRACKET, TokenType.RBRACKET, "']'");
        }

        if (check(TokenType.PIPE)) {
            return parseAbsoluteValue();
        }

        if (check(TokenType.EOF)) {
            throw error("Unexpected end of expression");
        }
        throw error("Unexpected token");
    }

    private Expression parseGroup(TokenType opening, TokenType closing, String closingText) {
        Token open = consume(opening, "Expected opening bracket");
        if (check(closing)) {
            throw new EquationParseException(ErrorKind.EMPTY_EXPRESSION, "Empty brackets", open.position());
        }

        enter();
        int savedBars = openBars;
        openBars = 0;
        Expression inner = parseSum();
        openBars = savedBars;

        consume(closing, "Expected " + closingText);
        depth--;
        return inner;
    }

    private Expression parseAbsoluteValue() {
        Token open = consume(TokenType.PIPE, "Expected '|'");
        // "||" is empty unless the second bar opens a nested absolute value: ||x| - 1|
        if (check(TokenType.PIPE) && !startsOperand(tokens.get(position + 1))) {
            throw new EquationParseException(ErrorKind.EMPTY_EXPRESSION, "Empty absolute value", open.position());
        }

        enter();
        openBars++;
        Expression operand = parseSum();
        openBars--;
        depth--;

        if (!check(TokenType.PIPE)) {
            if (check(TokenType.EOF) || peek().isClosing()) {
                throw new EquationParseException(ErrorKind.UNBALANCED_BARS, "Absolute value opened here is not closed",
                        open.position());
            }
            throw error("Expected '|' to close absolute value");
        }
        advance();
        return new AbsoluteValue(operand);
    }

    private Expression parseFunctionCall() {
        Token name = advance();
        consume(TokenType.LPAREN, "Expected '(' after function name");
        if (check(TokenType.RPAREN)) {
            throw new EquationParseException(ErrorKind.EMPTY_EXPRESSION,
                    "Function '" + name.value() + "' called without arguments", name.position());
        }

        enter();
        int savedBars = openBars;
        openBars = 0;
        List<Expression> arguments = new ArrayList<>();
        do {
            arguments.add(parseSum());
        } while (consumeIf(TokenType.COMMA));
        openBars = savedBars;
        depth--;

        consume(TokenType.RPAREN, "Expected ')' after function arguments");
        return new FunctionCall(name.value(), arguments);
    }

    /**
     * Parses a branch condition: a comparison, a bare expression, or the keyword otherwise.
     * A comparison may be wrapped in one pair of parentheses.
     */
    private Expression parseCondition() {
        if (check(TokenType.IDENTIFIER) && EquationLexer.OTHERWISE.equals(peek().value())) {
            advance();
            return Constant.ONE;
        }

        if (isBracketedCondition()) {
            enter();
            advance();
            int savedBars = openBars;
            openBars = 0;
            Expression inner = parseCondition();
            openBars = savedBars;
            consume(TokenType.RPAREN, "Expected ')' after condition");
            depth--;
            return inner;
        }

        Expression left = parseSum();
        if (!check(TokenType.RELATIONAL)) {
            return left;
        }

        RelationSymbol relation = RelationSymbol.fromSymbol(advance().value());
        Expression right = parseSum();
        if (check(TokenType.RELATIONAL)) {
            throw error("Chained comparisons are not supported in a condition");
        }
        return new Relational(relation, left, right);
    }

    /**
     * True when the segment starting at the current token (up to the next ';' or
     * the closing '}' at the same depth) is a condition rather than an expression.
     */
    private boolean segmentIsCondition() {
        if (check(TokenType.IDENTIFIER) && EquationLexer.OTHERWISE.equals(peek().value())) {
            return true;
        }
        if (isBracketedCondition()) {
            return true;
        }
        int level = 0;
        for (int i = position; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isOpening()) {
                level++;
            } else if (token.isClosing()) {
                if (level == 0) {
                    return false;
                }
                level--;
            } else if (level == 0 && (token.is(TokenType.SEMICOLON) || token.is(TokenType.EOF))) {
                return false;
            } else if (level == 0 && token.is(TokenType.RELATIONAL)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the current '(' encloses a whole condition segment, as in
     * {@code { x+1 ; (x<0) }}: the group holds a comparison at its own level and
     * is directly followed by ';', ',' or the closing '}'.
     */
    private boolean isBracketedCondition() {
        if (!check(TokenType.LPAREN)) {
            return false;
        }
        int level = 0;
        boolean comparison = false;
        for (int i = position; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isOpening()) {
                level++;
            } else if (token.isClosing()) {
                level--;
                if (level == 0) {
                    Token next = tokens.get(i + 1);
                    return comparison && (next.is(TokenType.SEMICOLON) || next.is(TokenType.COMMA)
                            || next.is(TokenType.RBRACE) || next.is(TokenType.EOF));
                }
            } else if (level == 1 && token.is(TokenType.RELATIONAL)) {
                comparison = true;
            } else if (token.is(TokenType.EOF)) {
                return false;
            }
        }
        return false;
    }

    private boolean startsImplicitFactor() {
        return checkVariable()
                || check(TokenType.FUNCTION)
                || check(TokenType.LPAREN)
                || check(TokenType.LBRACKET)
                || (check(TokenType.PIPE) && openBars == 0);
    }

    private static boolean startsOperand(Token token) {
        return token.is(TokenType.NUMBER)
                || (token.is(TokenType.IDENTIFIER) && !EquationLexer.OTHERWISE.equals(token.value()))
                || token.is(TokenType.FUNCTION)
                || token.is(TokenType.LPAREN)
                || token.is(TokenType.LBRACKET)
                || token.is(TokenType.PIPE)
                || token.isOperator("-")
                || token.isOperator("+");
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw new EquationParseException(ErrorKind.UNEXPECTED_TOKEN, "Expression nested too deeply", peek());
        }
    }

    private void expectEnd() {
        if (check(TokenType.EOF)) {
            return;
        }
        if (peek().isClosing()) {
            throw new EquationParseException(ErrorKind.UNBALANCED_BRACKETS,
                    "Closing '" + peek().value() + "' has no matching opening bracket", peek().position());
        }
        throw error("Unexpected token after expression");
    }

    // ==================== Helper Methods ====================

    private Token peek() {
        return tokens.get(position);
    }

    private boolean check(TokenType type) {
        return position < tokens.size() && peek().type() == type;
    }

    private boolean checkOperator(String symbol) {
        return position < tokens.size() && peek().isOperator(symbol);
    }

    private boolean checkVariable() {
        return check(TokenType.IDENTIFIER) && !EquationLexer.OTHERWISE.equals(peek().value());
    }

    private Token advance() {
        Token token = peek();
        if (!token.is(TokenType.EOF)) {
            position++;
        }
        return token;
    }

    private boolean consumeIf(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private EquationParseException error(String message) {
        return new EquationParseException(ErrorKind.UNEXPECTED_TOKEN, message, peek());
    }
}
