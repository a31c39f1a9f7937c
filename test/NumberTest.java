import static org.junit.Assert.*;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.Test;

public class NumberTest {

    private static Number q(long num, long den) {
        return Number.of(BigInteger.valueOf(num), BigInteger.valueOf(den));
    }

    @Test
    public void reducesAndNormalizesSign() {
        Number n = q(6, -4);
        assertEquals(BigInteger.valueOf(-3), n.getNumerator());
        assertEquals(BigInteger.valueOf(2), n.getDenominator());
        assertEquals(Number.ZERO, q(0, -7));
    }

    @Test
    public void arithmeticIsExact() {
        assertEquals(q(1, 2), q(1, 3).add(q(1, 6)));
        assertEquals(q(1, 6), q(1, 2).subtract(q(1, 3)));
        assertEquals(Number.ONE, q(2, 3).multiply(q(3, 2)));
        assertEquals(q(-3, 2), q(2, -3).reciprocal());
        assertEquals(q(1, 4), Number.of(-2).pow(-2));
        assertEquals(Number.of(-8), Number.of(-2).pow(3));
    }

    @Test
    public void decimalInputBecomesRational() {
        assertEquals(q(5, 2), Number.of(new BigDecimal("2.50")));
        assertEquals(Number.of(1200), Number.of(new BigDecimal("1.2E3")));
    }

    @Test
    public void printsIntegersDecimalsAndFractions() {
        assertEquals("7", Number.of(7).toString());
        assertEquals("0.5", q(1, 2).toString());
        assertEquals("0.375", q(3, 8).toString());
        assertEquals("-1.25", q(-5, 4).toString());
        assertEquals("1/3", q(1, 3).toString());
        assertEquals("-2/7", q(-2, 7).toString());
    }

    @Test
    public void terminatingOnlyForPowersOfTwoAndFive() {
        assertTrue(q(7, 40).isTerminating());
        assertFalse(q(1, 6).isTerminating());
        assertTrue(Number.of(3).isTerminating());
    }

    @Test(expected = DivisionByZeroException.class)
    public void zeroDenominator() {
        q(1, 0);
    }

    @Test(expected = DivisionByZeroException.class)
    public void reciprocalOfZero() {
        Number.ZERO.reciprocal();
    }

    @Test(expected = DivisionByZeroException.class)
    public void zeroToNegativePower() {
        Number.ZERO.pow(-1);
    }

    @Test
    public void ordersByValue() {
        assertTrue(q(1, 3).compareValue(q(1, 2)) < 0);
        assertTrue(Number.of(-1).compareValue(Number.ZERO) < 0);
        assertEquals(0, q(2, 4).compareValue(q(1, 2)));
        assertFalse(Number.of(5).dependsOn("x"));
    }
}
