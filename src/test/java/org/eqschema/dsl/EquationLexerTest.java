package org.eqschema.dsl;

import org.eqschema.dsl.Token.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EquationLexer: token kinds, positions and notation normalization.
 */
class EquationLexerTest {

    private static List<TokenType> types(String line) {
        return EquationLexer.lex(line).stream().map(Token::type).toList();
    }

    private static List<String> values(String line) {
        return EquationLexer.lex(line).stream()
                .filter(token -> !token.is(TokenType.EOF))
                .map(Token::value)
                .toList();
    }

    // ==================== Basic Tokens ====================

    @Test
    @DisplayName("Simple linear equation produces positioned tokens")
    void testSimpleEquation() {
        List<Token> tokens = EquationLexer.lex("2*x + 3 = 7");

        assertEquals(List.of(
                new Token(TokenType.NUMBER, "2", 0),
                new Token(TokenType.OPERATOR, "*", 1),
                new Token(TokenType.IDENTIFIER, "x", 2),
                new Token(TokenType.OPERATOR, "+", 4),
                new Token(TokenType.NUMBER, "3", 6),
                new Token(TokenType.RELATIONAL, "=", 8),
                new Token(TokenType.NUMBER, "7", 10),
                new Token(TokenType.EOF, null, 11)), tokens);
    }

    @Test
    @DisplayName("Token list always ends with EOF")
    void testEofTerminates() {
        List<Token> tokens = EquationLexer.lex("   ");
        assertEquals(1, tokens.size());
        assertTrue(tokens.get(0).is(TokenType.EOF));
    }

    @Test
    @DisplayName("Decimal numbers are one token")
    void testDecimalNumber() {
        assertEquals(List.of("3.14", "+", ".5"), values("3.14 + .5"));
        assertEquals(List.of(TokenType.NUMBER, TokenType.OPERATOR, TokenType.NUMBER, TokenType.EOF),
                types("3.14 + .5"));
    }

    @Test
    @DisplayName("Delimiters get their own token types")
    void testDelimiters() {
        assertEquals(List.of(
                TokenType.LBRACE, TokenType.LPAREN, TokenType.RPAREN, TokenType.LBRACKET, TokenType.RBRACKET,
                TokenType.PIPE, TokenType.COMMA, TokenType.SEMICOLON, TokenType.RBRACE, TokenType.EOF),
                types("{ ( ) [ ] | , ; }"));
    }

    @Test
    @DisplayName("Two-character relations are single tokens")
    void testTwoCharacterRelations() {
        List<Token> tokens = EquationLexer.lex("x<=1>=y");
        assertEquals(new Token(TokenType.RELATIONAL, "<=", 1), tokens.get(1));
        assertEquals(new Token(TokenType.RELATIONAL, ">=", 4), tokens.get(3));
    }

    // ==================== Normalization ====================

    @Test
    @DisplayName("Unicode relations and operators normalize to ASCII")
    void testUnicodeNormalization() {
        assertEquals(List.of("x", "<=", "1"), values("x ≤ 1"));
        assertEquals(List.of("x", ">=", "1"), values("x ≥ 1"));
        assertEquals(List.of("x", "-", "1"), values("x − 1"));
        assertEquals(List.of("2", "*", "x", "*", "y", "/", "3"), values("2×x·y÷3"));
    }

    @Test
    @DisplayName("Double star is a power operator")
    void testDoubleStarPower() {
        List<Token> tokens = EquationLexer.lex("x**2");
        assertEquals(new Token(TokenType.OPERATOR, "^", 1), tokens.get(1));
        assertEquals(new Token(TokenType.NUMBER, "2", 3), tokens.get(2));
    }

    @Test
    @DisplayName("Superscript digits become an explicit power")
    void testSuperscriptExponent() {
        assertEquals(List.of("x", "^", "2"), values("x²"));
        assertEquals(List.of("x", "^", "23"), values("x²³"));
        assertEquals(List.of("x", "^", "-", "1"), values("x⁻¹"));
        assertEquals(List.of(")", "^", "3"), values("(x+1)³").subList(4, 7));
    }

    @Test
    @DisplayName("Superscript without a preceding operand is rejected")
    void testSuperscriptWithoutOperand() {
        EquationLexException e = assertThrows(EquationLexException.class, () -> EquationLexer.lex("²x"));
        assertEquals(ErrorKind.UNRECOGNIZED_CHARACTER, e.getKind());
        assertEquals(0, e.getPosition());

        EquationLexException minus = assertThrows(EquationLexException.class, () -> EquationLexer.lex("x⁻"));
        assertEquals(ErrorKind.UNRECOGNIZED_CHARACTER, minus.getKind());
    }

    // ==================== Letters and Functions ====================

    @Test
    @DisplayName("Letter runs split into one variable per letter")
    void testImplicitVariables() {
        assertEquals(List.of(TokenType.NUMBER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF),
                types("2xy"));
        assertEquals(List.of("2", "x", "y"), values("2xy"));
    }

    @Test
    @DisplayName("Known function followed by '(' is a function token")
    void testKnownFunction() {
        List<Token> tokens = EquationLexer.lex("sin(x)");
        assertEquals(new Token(TokenType.FUNCTION, "sin", 0), tokens.get(0));
        assertEquals(TokenType.LPAREN, tokens.get(1).type());

        assertEquals(TokenType.FUNCTION, EquationLexer.lex("cosh (x)").get(0).type());
        assertEquals("cosh", EquationLexer.lex("cosh (x)").get(0).value());
        assertEquals("lg", EquationLexer.lex("lg(x)").get(0).value());
    }

    @Test
    @DisplayName("Function name without '(' is read as letters")
    void testFunctionNameWithoutParen() {
        assertEquals(List.of("s", "i", "n", "x"), values("sin x"));
    }

    @Test
    @DisplayName("Letter prefix before a function name splits off as variables")
    void testPrefixBeforeFunction() {
        List<Token> tokens = EquationLexer.lex("2xsin(x)");
        assertEquals(new Token(TokenType.IDENTIFIER, "x", 1), tokens.get(1));
        assertEquals(new Token(TokenType.FUNCTION, "sin", 2), tokens.get(2));
    }

    @Test
    @DisplayName("f, g and h followed by '(' are user functions")
    void testUserFunctions() {
        assertEquals(TokenType.FUNCTION, EquationLexer.lex("f(x)").get(0).type());
        assertEquals(TokenType.FUNCTION, EquationLexer.lex("g(t)").get(0).type());
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.LPAREN),
                types("ab(x)").subList(0, 3));
    }

    @Test
    @DisplayName("otherwise stays one keyword token")
    void testOtherwiseKeyword() {
        assertEquals(List.of("otherwise"), values("otherwise"));
    }

    // ==================== Errors ====================

    @Test
    @DisplayName("Unsupported character reports its position")
    void testUnrecognizedCharacter() {
        EquationLexException e = assertThrows(EquationLexException.class, () -> EquationLexer.lex("x # 1"));
        assertEquals(ErrorKind.UNRECOGNIZED_CHARACTER, e.getKind());
        assertEquals(2, e.getPosition());
        assertTrue(e.getKind().isLexical());
    }

    @Test
    @DisplayName("Second decimal point is a malformed number")
    void testSecondDecimalPoint() {
        EquationLexException e = assertThrows(EquationLexException.class, () -> EquationLexer.lex("1.2.3 = x"));
        assertEquals(ErrorKind.MALFORMED_NUMBER, e.getKind());
        assertEquals(3, e.getPosition());
    }

    @Test
    @DisplayName("Trailing decimal point is a malformed number")
    void testTrailingDecimalPoint() {
        EquationLexException e = assertThrows(EquationLexException.class, () -> EquationLexer.lex("x = 5."));
        assertEquals(ErrorKind.MALFORMED_NUMBER, e.getKind());
        assertEquals(4, e.getPosition());
    }

    @Test
    @DisplayName("Number beyond double range is a malformed number")
    void testNumberOutOfRange() {
        String huge = "9".repeat(400);
        EquationLexException e = assertThrows(EquationLexException.class, () -> EquationLexer.lex(huge));
        assertEquals(ErrorKind.MALFORMED_NUMBER, e.getKind());
    }

    @Test
    @DisplayName("Lex exceptions are parse exceptions")
    void testLexExceptionHierarchy() {
        EquationParseException e = assertThrows(EquationParseException.class, () -> EquationLexer.lex("x @ y"));
        assertInstanceOf(EquationLexException.class, e);
        assertTrue(e.getMessage().contains("position 2"), "Message should carry the position: " + e.getMessage());
    }
}
