package org.eqschema.engine;

import org.eqschema.dsl.AbsoluteValue;
import org.eqschema.dsl.Constant;
import org.eqschema.dsl.EquationParseException;
import org.eqschema.dsl.ErrorKind;
import org.eqschema.dsl.FunctionCall;
import org.eqschema.dsl.FunctionDef;
import org.eqschema.dsl.Piecewise;
import org.eqschema.dsl.Power;
import org.eqschema.dsl.Product;
import org.eqschema.dsl.RelationSymbol;
import org.eqschema.dsl.Sum;
import org.eqschema.dsl.Variable;
import org.eqschema.engine.classify.EquationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for single lines: text in, classified record out.
 */
class EquationLineParserTest {

    private static final Variable X = new Variable("x");

    private final EquationLineParser parser = new EquationLineParser();

    @Nested
    @DisplayName("Records")
    class Records {

        @Test
        @DisplayName("Linear equation with explicit multiplication")
        void testLinearRecord() {
            EquationRecord record = parser.parseLine("2*x + 3 = 7", 1);

            assertEquals(1, record.id());
            assertEquals("2*x + 3 = 7", record.raw());
            assertEquals(List.of("x"), record.variables());
            assertEquals(EquationType.LINEAR, record.equationType());
            assertEquals(RelationSymbol.EQ, record.relation());
            assertEquals(new Sum(List.of(new Product(List.of(new Constant(2), X)), new Constant(3))), record.lhs());
            assertEquals(new Constant(7), record.rhs());
        }

        @Test
        @DisplayName("Quadratic equation keeps the subtraction as a negative constant")
        void testQuadraticRecord() {
            EquationRecord record = parser.parseLine("x^2 - 4 = 0", 2);

            assertEquals(2, record.id());
            assertEquals(EquationType.QUADRATIC, record.equationType());
            assertEquals(new Sum(List.of(new Power(X, new Constant(2)), new Constant(-4))), record.lhs());
            assertEquals(Constant.ZERO, record.rhs());
        }

        @Test
        @DisplayName("Absolute value inequality")
        void testAbsoluteRecord() {
            EquationRecord record = parser.parseLine("|x - 1| <= 3", 3);

            assertEquals(EquationType.ABSOLUTE, record.equationType());
            assertEquals(RelationSymbol.LE, record.relation());
            assertEquals(new AbsoluteValue(new Sum(List.of(X, new Constant(-1)))), record.lhs());
        }

        @Test
        @DisplayName("Piecewise definition")
        void testPiecewiseRecord() {
            EquationRecord record = parser.parseLine("f(x) = { 9x + 10 , x >= 0 ; 6x + -14 , x < 0 }", 4);

            assertEquals(EquationType.PIECEWISE, record.equationType());
            assertEquals(new FunctionDef("f", "x"), record.lhs());
            assertEquals(2, ((Piecewise) record.rhs()).branches().size());
            assertEquals(List.of("x"), record.variables());
        }

        @Test
        @DisplayName("Logarithmic equation")
        void testLogarithmicRecord() {
            EquationRecord record = parser.parseLine("log(x) = 1", 6);

            assertEquals(EquationType.LOGARITHMIC, record.equationType());
            assertEquals(new FunctionCall("log", List.of(X)), record.lhs());
        }

        @Test
        @DisplayName("Variables are sorted and de-duplicated")
        void testVariablesSorted() {
            EquationRecord record = parser.parseLine("z + 2xy + x = 1", 1);
            assertEquals(List.of("x", "y", "z"), record.variables());
        }

        @Test
        @DisplayName("Raw text is trimmed")
        void testRawTrimmed() {
            assertEquals("x = 1", parser.parseLine("   x = 1\t", 1).raw());
        }
    }

    @Nested
    @DisplayName("Bare Expressions")
    class BareExpressions {

        @Test
        @DisplayName("Rejected by default")
        void testRejectedByDefault() {
            EquationParseException e = assertThrows(EquationParseException.class, () -> parser.parseLine("2x", 5));
            assertEquals(ErrorKind.NO_RELATION_FOUND, e.getKind());
        }

        @Test
        @DisplayName("Implicit zero right side when enabled")
        void testImplicitZero() {
            EquationLineParser lenient = new EquationLineParser(
                    ParserOptions.defaults().withBareExpressions(BareExpressionPolicy.IMPLICIT_ZERO));

            EquationRecord record = lenient.parseLine("2x", 5);
            assertEquals(RelationSymbol.EQ, record.relation());
            assertEquals(new Product(List.of(new Constant(2), X)), record.lhs());
            assertEquals(Constant.ZERO, record.rhs());
            assertEquals(EquationType.OTHER, record.equationType());
            assertEquals(List.of("x"), record.variables());

            assertEquals(EquationType.CONSTANT, lenient.parseLine("2 + 3", 6).equationType());
        }

        @Test
        @DisplayName("Implicit zero does not hide other errors")
        void testImplicitZeroKeepsOtherErrors() {
            EquationLineParser lenient = new EquationLineParser(
                    ParserOptions.defaults().withBareExpressions(BareExpressionPolicy.IMPLICIT_ZERO));

            EquationParseException e = assertThrows(EquationParseException.class, () -> lenient.parseLine("(2x", 1));
            assertEquals(ErrorKind.UNBALANCED_BRACKETS, e.getKind());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        private ErrorKind failure(String line) {
            return assertThrows(EquationParseException.class, () -> parser.parseLine(line, 1)).getKind();
        }

        @Test
        @DisplayName("Each failure kind is reported")
        void testErrorKinds() {
            assertEquals(ErrorKind.UNRECOGNIZED_CHARACTER, failure("x $ 1 = 2"));
            assertEquals(ErrorKind.MALFORMED_NUMBER, failure("1.2.3 = x"));
            assertEquals(ErrorKind.UNEXPECTED_TOKEN, failure("x + * 2 = 1"));
            assertEquals(ErrorKind.UNBALANCED_BRACKETS, failure("(x + 1 = 2"));
            assertEquals(ErrorKind.UNBALANCED_BARS, failure("|x = 2"));
            assertEquals(ErrorKind.NO_RELATION_FOUND, failure("x + 1"));
            assertEquals(ErrorKind.EMPTY_EXPRESSION, failure("x = "));
            assertEquals(ErrorKind.EMPTY_EXPRESSION, failure("   "));
        }

        @Test
        @DisplayName("Piecewise block needs an equals sign")
        void testPiecewiseNeedsEquals() {
            assertEquals(ErrorKind.UNEXPECTED_TOKEN, failure("f(x) < { x , x < 0 }"));
        }

        @Test
        @DisplayName("Piecewise block needs a function head")
        void testPiecewiseNeedsHead() {
            assertEquals(ErrorKind.UNEXPECTED_TOKEN, failure("2 = { x , x < 0 }"));
        }

        @Test
        @DisplayName("Error positions count from the start of the untrimmed line")
        void testPositionInIndentedLine() {
            EquationParseException e = assertThrows(EquationParseException.class,
                    () -> parser.parseLine("   x + ) = 1", 1));
            assertEquals(ErrorKind.UNBALANCED_BRACKETS, e.getKind());
            assertEquals(7, e.getPosition());

            assertEquals("x + 1 = 2", parser.parseLine("   x + 1 = 2  ", 1).raw());
        }

        @Test
        @DisplayName("Deep nesting is a parse error")
        void testDeepNesting() {
            assertEquals(ErrorKind.UNEXPECTED_TOKEN, failure("(".repeat(20000) + "x" + ")".repeat(20000) + " = 1"));
            assertEquals(ErrorKind.UNEXPECTED_TOKEN, failure("-".repeat(50000) + "x = 1"));
        }

        @Test
        @DisplayName("Ids start at one")
        void testInvalidId() {
            assertThrows(IllegalArgumentException.class, () -> parser.parseLine("x = 1", 0));
        }
    }
}
