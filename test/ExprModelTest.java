import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

public class ExprModelTest {
    private final Var x = new Var("x");
    private final Var y = new Var("y");

    @Test
    public void sumFlattensAndFoldsConstants() {
        Expr e = Sum.of(x, Sum.of(Number.of(1), y), Number.of(2));
        assertTrue(e instanceof Sum);
        assertEquals(Arrays.asList(Number.of(3), x, y), ((Sum) e).getTerms());
    }

    @Test
    public void productFlattensAndFoldsCoefficient() {
        Expr e = Product.of(Number.of(2), Product.of(y, Number.of(3)), x);
        assertTrue(e instanceof Product);
        assertEquals(Arrays.asList(Number.of(6), x, y), ((Product) e).getFactors());
        assertEquals(Number.of(6), ((Product) e).getCoefficient());
    }

    @Test
    public void identitiesCollapse() {
        assertEquals(x, Sum.of(x, Number.ZERO));
        assertEquals(x, Product.of(x, Number.ONE));
        assertEquals(Number.ZERO, Product.of(x, Number.ZERO));
        assertEquals(Number.ONE, Pow.of(x, Number.ZERO));
        assertEquals(x, Pow.of(x, Number.ONE));
        assertEquals(Number.ONE, Pow.of(Number.ONE, x));
        assertEquals(Number.ZERO, Sum.of());
        assertEquals(Number.ONE, Product.of());
    }

    @Test
    public void zeroTimesReciprocalOfZeroIsKept() {
        Expr e = Product.of(Number.ZERO, Pow.reciprocal(Number.ZERO));
        assertTrue(e instanceof Product);
    }

    @Test
    public void childrenAreSortedCanonically() {
        Expr sin = new Call(Function.SIN, x);
        Expr cos = new Call(Function.COS, x);
        assertEquals(Product.of(sin, Number.of(2), cos), Product.of(cos, sin, Number.of(2)));
        assertEquals(Arrays.asList(Number.of(2), cos, sin),
            ((Product) Product.of(sin, Number.of(2), cos)).getFactors());
        // constant, then ascending degree
        Expr sum = Sum.of(Pow.of(x, Number.TWO), x, Number.ONE);
        assertEquals(Arrays.asList(Number.ONE, x, Pow.of(x, Number.TWO)), ((Sum) sum).getTerms());
    }

    @Test
    public void structuralEquality() {
        assertEquals(Parser.parse("x + 1"), Sum.of(new Var("x"), Number.ONE));
        assertEquals(Parser.parse("x + 1").hashCode(), Sum.of(new Var("x"), Number.ONE).hashCode());
        assertNotEquals(Parser.parse("x + 1"), Parser.parse("x + 2"));
        assertNotEquals(new Call("sin", x), new Call("cos", x));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void childListsAreImmutable() {
        ((Sum) Sum.of(x, y)).getTerms().add(x);
    }

    @Test
    public void dependsOnLooksThroughTheTree() {
        Expr e = Parser.parse("y * sin(x^2) + 3");
        assertTrue(e.dependsOn("x"));
        assertTrue(e.dependsOn("y"));
        assertFalse(e.dependsOn("z"));
    }

    @Test
    public void coefficientAndUnitOfTerms() {
        Expr term = Product.of(Number.of(-3), x, y);
        assertEquals(Number.of(-3), Product.coefficientOf(term));
        assertEquals(Product.of(x, y), Product.unitOf(term));
        assertEquals(Number.ONE, Product.unitOf(Number.of(4)));
        assertEquals(x, Product.unitOf(x));
    }

    @Test
    public void totalDegree() {
        assertEquals(Number.of(3), Sum.degree(Parser.parse("x^2 * y")));
        assertEquals(Number.of(2), Sum.degree(Parser.parse("1 + x + x^2")));
        assertEquals(Number.ZERO, Sum.degree(Parser.parse("sin(x)")));
    }

    @Test
    public void unknownFunctionNamesAreRepresentable() {
        Call call = new Call("sqrt", x);
        assertNull(call.getFunction());
        assertEquals("sqrt(x)", Printer.render(call));
    }

    @Test
    public void variableNames() {
        assertTrue(Var.isValidName("x1"));
        assertFalse(Var.isValidName("1x"));
        assertFalse(Var.isValidName(""));
        assertFalse(Var.isValidName(null));
    }
}
