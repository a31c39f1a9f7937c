import static org.junit.Assert.*;

import org.junit.Test;

public class ParserTest {
    private final Var x = new Var("x");

    private static String simplified(String text) {
        return Printer.render(new Simplifier().simplify(Parser.parse(text)));
    }

    @Test
    public void precedenceAndFolding() {
        assertEquals(Number.of(7), Parser.parse("1 + 2 * 3"));
        assertEquals(Number.of(9), Parser.parse("(1 + 2) * 3"));
        assertEquals(Number.ONE.divide(Number.TWO), Parser.parse(".5"));
    }

    @Test
    public void subtractionAndDivisionDesugar() {
        assertEquals(Sum.of(x, Product.negate(new Var("y"))), Parser.parse("x - y"));
        assertEquals(Product.of(x, Pow.reciprocal(new Var("y"))), Parser.parse("x / y"));
    }

    @Test
    public void powerBindsTighterThanUnaryMinus() {
        assertEquals(Product.negate(Pow.of(x, Number.TWO)), Parser.parse("-x^2"));
        assertEquals("-4", simplified("-2^2"));
    }

    @Test
    public void powerIsRightAssociative() {
        assertEquals("512", simplified("2^3^2"));
        assertEquals("0.25", simplified("2^-2"));
    }

    @Test
    public void calls() {
        assertEquals(new Call(Function.SIN, Sum.of(x, Number.ONE)), Parser.parse("sin(x + 1)"));
        assertEquals(new Var("foo"), Parser.parse("foo"));
    }

    @Test(expected = ParseException.class)
    public void danglingOperator() {
        Parser.parse("x +");
    }

    @Test(expected = ParseException.class)
    public void unknownFunction() {
        Parser.parse("foo(x)");
    }

    @Test(expected = ParseException.class)
    public void tooManyArguments() {
        Parser.parse("sin(x, y)");
    }

    @Test(expected = ParseException.class)
    public void unclosedParenthesis() {
        Parser.parse("(x + 1");
    }

    @Test(expected = ParseException.class)
    public void trailingInput() {
        Parser.parse("x y");
    }

    @Test(expected = ParseException.class)
    public void malformedNumber() {
        Parser.parse("1.2.3");
    }

    @Test(expected = ParseException.class)
    public void emptyInput() {
        Parser.parse("");
    }

    @Test
    public void errorsCarryPosition() {
        try {
            Parser.parse("x $ y");
            fail();
        } catch (ParseException e) {
            assertEquals(2, e.getPosition());
            assertTrue(e.getMessage().contains("position 2"));
        }
    }

    @Test
    public void lexerTokens() {
        Lexer lexer = new Lexer("  sin(2.5*x1)");
        assertTrue(lexer.isIdentifier());
        assertEquals("sin", lexer.peek());
        assertEquals(2, lexer.getPosition());
        lexer.next();
        assertEquals("(", lexer.peek());
        lexer.next();
        assertTrue(lexer.isNumber());
        assertEquals("2.5", lexer.peek());
        lexer.next();
        lexer.next();
        assertEquals("x1", lexer.peek());
        lexer.next();
        lexer.next();
        assertTrue(lexer.atEnd());
    }
}
