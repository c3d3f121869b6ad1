package org.eqschema.dsl;

import org.eqschema.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Lexer for one equation line.
 * Converts the raw text into a list of tokens terminated by EOF, normalizing the
 * notation variants found in hand-typed equations (unicode relations, superscript
 * exponents, {@code **} powers, typographic operators).
 *
 * Letter runs are split into one variable per letter so that {@code xy} reads as
 * {@code x*y}; only known function names followed by {@code (} stay whole.
 */
public final class EquationLexer {

    /**
     * Mathematical function names recognized when directly followed by '('.
     */
    public static final Set<String> KNOWN_FUNCTIONS = Set.of(
            "log", "ln", "lg", "exp",
            "sin", "cos", "tan", "sec", "csc", "cot",
            "arcsin", "arccos", "arctan", "sinh", "cosh", "tanh",
            "sqrt", "cbrt", "abs");

    /**
     * Single letters read as user function names when followed by '(' (f(x), g(t)).
     */
    public static final Set<String> USER_FUNCTIONS = Set.of("f", "g", "h");

    public static final String OTHERWISE = "otherwise";

    private static final List<String> FUNCTIONS_LONGEST_FIRST = KNOWN_FUNCTIONS.stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .toList();

    private static final String SUPERSCRIPT_DIGITS = "⁰¹²³⁴⁵⁶⁷⁸⁹";
    private static final char SUPERSCRIPT_MINUS = '⁻';

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private int position;

    public EquationLexer(String input) {
        this.input = input;
        this.position = 0;
    }

    /**
     * Tokenizes a line in one call.
     */
    public static List<Token> lex(String line) {
        return new EquationLexer(line).tokenize();
    }

    /**
     * Tokenizes the entire input string.
     *
     * @return List of tokens ending with EOF
     * @throws EquationLexException on an unsupported character or malformed number
     */
    public List<Token> tokenize() {
        tokens.clear();
        position = 0;

        while (position < input.length()) {
            skipWhitespace();
            if (position >= input.length())
                break;

            nextToken();
        }

        tokens.add(new Token(TokenType.EOF, null, position));
        return List.copyOf(tokens);
    }

    public static boolean isKnownFunction(String name) {
        return KNOWN_FUNCTIONS.contains(name);
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private void nextToken() {
        char c = input.charAt(position);
        int start = position;

        // Two-character symbols
        if (input.startsWith("<=", position) || input.startsWith(">=", position)) {
            position += 2;
            emit(TokenType.RELATIONAL, input.substring(start, start + 2), start);
            return;
        }
        if (input.startsWith("**", position)) {
            position += 2;
            emit(TokenType.OPERATOR, "^", start);
            return;
        }

        String relational = switch (c) {
            case '=' -> "=";
            case '<' -> "<";
            case '>' -> ">";
            case '≤' -> "<=";
            case '≥' -> ">=";
            default -> null;
        };
        if (relational != null) {
            position++;
            emit(TokenType.RELATIONAL, relational, start);
            return;
        }

        String operator = switch (c) {
            case '+' -> "+";
            case '-', '−' -> "-";
            case '*', '×', '·' -> "*";
            case '/', '÷' -> "/";
            case '^' -> "^";
            default -> null;
        };
        if (operator != null) {
            position++;
            emit(TokenType.OPERATOR, operator, start);
            return;
        }

        TokenType delimiter = switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '|' -> TokenType.PIPE;
            case ',' -> TokenType.COMMA;
            case ';' -> TokenType.SEMICOLON;
            default -> null;
        };
        if (delimiter != null) {
            position++;
            emit(delimiter, String.valueOf(c), start);
            return;
        }

        if (c == SUPERSCRIPT_MINUS || SUPERSCRIPT_DIGITS.indexOf(c) >= 0) {
            readSuperscript();
            return;
        }

        if (isDigit(c) || (c == '.' && position + 1 < input.length() && isDigit(input.charAt(position + 1)))) {
            readNumber();
            return;
        }

        if (Character.isLetter(c)) {
            readLetters();
            return;
        }

        throw new EquationLexException(ErrorKind.UNRECOGNIZED_CHARACTER, "Unexpected character: '" + c + "'", start);
    }

    private void readNumber() {
        int start = position;
        boolean hasDecimal = false;

        while (position < input.length()) {
            char c = input.charAt(position);
            if (isDigit(c)) {
                position++;
            } else if (c == '.') {
                if (hasDecimal) {
                    throw new EquationLexException(ErrorKind.MALFORMED_NUMBER,
                            "Second decimal point in number '" + input.substring(start, position + 1) + "'", position);
                }
                hasDecimal = true;
                position++;
            } else {
                break;
            }
        }

        String text = input.substring(start, position);
        if (text.endsWith(".")) {
            throw new EquationLexException(ErrorKind.MALFORMED_NUMBER, "Number '" + text + "' ends with a decimal point",
                    start);
        }
        if (Double.isInfinite(Double.parseDouble(text))) {
            throw new EquationLexException(ErrorKind.MALFORMED_NUMBER, "Number '" + text + "' is out of range", start);
        }
        emit(TokenType.NUMBER, text, start);
    }

    /**
     * Rewrites a superscript exponent into the '^' form: x² becomes x ^ 2, x⁻¹ becomes x ^ - 1.
     */
    private void readSuperscript() {
        int start = position;
        Token previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
        if (previous == null || !(previous.is(TokenType.NUMBER) || previous.is(TokenType.IDENTIFIER)
                || previous.is(TokenType.RPAREN) || previous.is(TokenType.RBRACKET) || previous.is(TokenType.PIPE))) {
            throw new EquationLexException(ErrorKind.UNRECOGNIZED_CHARACTER,
                    "Superscript exponent '" + input.charAt(start) + "' does not follow an operand", start);
        }

        boolean negative = false;
        if (input.charAt(position) == SUPERSCRIPT_MINUS) {
            negative = true;
            position++;
        }

        StringBuilder digits = new StringBuilder();
        while (position < input.length()) {
            int digit = SUPERSCRIPT_DIGITS.indexOf(input.charAt(position));
            if (digit < 0) {
                break;
            }
            digits.append((char) ('0' + digit));
            position++;
        }
        if (digits.length() == 0) {
            throw new EquationLexException(ErrorKind.UNRECOGNIZED_CHARACTER,
                    "Superscript minus without digits", start);
        }

        emit(TokenType.OPERATOR, "^", start);
        if (negative) {
            emit(TokenType.OPERATOR, "-", start);
        }
        emit(TokenType.NUMBER, digits.toString(), start);
    }

    private void readLetters() {
        int start = position;
        while (position < input.length() && Character.isLetter(input.charAt(position))) {
            position++;
        }
        String run = input.substring(start, position);

        if (OTHERWISE.equals(run)) {
            emit(TokenType.IDENTIFIER, run, start);
            return;
        }

        if (nextNonWhitespaceIs('(')) {
            String function = functionSuffix(run);
            if (function != null) {
                int functionStart = start + run.length() - function.length();
                emitLetters(run.substring(0, run.length() - function.length()), start);
                emit(TokenType.FUNCTION, function, functionStart);
                return;
            }
        }

        emitLetters(run, start);
    }

    private String functionSuffix(String run) {
        if (USER_FUNCTIONS.contains(run)) {
            return run;
        }
        for (String name : FUNCTIONS_LONGEST_FIRST) {
            if (run.endsWith(name)) {
                return name;
            }
        }
        return null;
    }

    private void emitLetters(String letters, int start) {
        for (int i = 0; i < letters.length(); i++) {
            emit(TokenType.IDENTIFIER, String.valueOf(letters.charAt(i)), start + i);
        }
    }

    private boolean nextNonWhitespaceIs(char expected) {
        int i = position;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i < input.length() && input.charAt(i) == expected;
    }

    // ASCII only: other unicode digits are not numbers here
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void emit(TokenType type, String value, int start) {
        tokens.add(new Token(type, value, start));
    }
}
