import java.math.BigDecimal;
import java.math.BigInteger;

public final class Number implements Expr {
    public static final Number ZERO = new Number(BigInteger.ZERO, BigInteger.ONE);
    public static final Number ONE = new Number(BigInteger.ONE, BigInteger.ONE);
    public static final Number MINUS_ONE = new Number(BigInteger.ONE.negate(), BigInteger.ONE);
    public static final Number TWO = new Number(BigInteger.TWO, BigInteger.ONE);
    private static final BigInteger FIVE = BigInteger.valueOf(5);

    // numerator and denominator are coprime, denominator positive
    private final BigInteger num;
    private final BigInteger den;

    private Number(BigInteger num, BigInteger den) {
        this.num = num;
        this.den = den;
    }

    public static Number of(long val) {
        return of(BigInteger.valueOf(val));
    }

    public static Number of(BigInteger val) {
        return new Number(val, BigInteger.ONE);
    }

    public static Number of(BigInteger num, BigInteger den) {
        if (den.signum() == 0) {
            throw new DivisionByZeroException(num + "/0");
        }
        if (den.signum() < 0) {
            num = num.negate();
            den = den.negate();
        }
        BigInteger gcd = num.gcd(den);
        if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
            num = num.divide(gcd);
            den = den.divide(gcd);
        }
        if (num.signum() == 0) {
            den = BigInteger.ONE;
        }
        return new Number(num, den);
    }

    public static Number of(BigDecimal val) {
        if (val.scale() <= 0) {
            return of(val.toBigIntegerExact());
        }
        return of(val.unscaledValue(), BigInteger.TEN.pow(val.scale()));
    }

    public BigInteger getNumerator() {
        return num;
    }

    public BigInteger getDenominator() {
        return den;
    }

    public boolean isZero() {
        return num.signum() == 0;
    }

    public boolean isOne() {
        return num.equals(BigInteger.ONE) && den.equals(BigInteger.ONE);
    }

    public boolean isMinusOne() {
        return num.equals(BigInteger.ONE.negate()) && den.equals(BigInteger.ONE);
    }

    public boolean isInteger() {
        return den.equals(BigInteger.ONE);
    }

    public boolean isNegative() {
        return num.signum() < 0;
    }

    public int signum() {
        return num.signum();
    }

    public Number add(Number other) {
        return of(num.multiply(other.den).add(other.num.multiply(den)), den.multiply(other.den));
    }

    public Number subtract(Number other) {
        return add(other.negate());
    }

    public Number multiply(Number other) {
        return of(num.multiply(other.num), den.multiply(other.den));
    }

    public Number negate() {
        return new Number(num.negate(), den);
    }

    public Number abs() {
        return isNegative() ? negate() : this;
    }

    public Number reciprocal() {
        if (isZero()) {
            throw new DivisionByZeroException("1/0");
        }
        return of(den, num);
    }

    public Number divide(Number other) {
        return multiply(other.reciprocal());
    }

    public Number pow(int exponent) {
        if (exponent < 0) {
            if (isZero()) {
                throw new DivisionByZeroException("0^" + exponent);
            }
            return reciprocal().pow(-exponent);
        }
        return new Number(num.pow(exponent), den.pow(exponent));
    }

    // terminating decimal expansion iff the denominator has no prime factors but 2 and 5
    public boolean isTerminating() {
        BigInteger rest = den;
        while (!rest.testBit(0)) {
            rest = rest.shiftRight(1);
        }
        while (rest.mod(FIVE).signum() == 0) {
            rest = rest.divide(FIVE);
        }
        return rest.equals(BigInteger.ONE);
    }

    public int compareValue(Number other) {
        return num.multiply(other.den).compareTo(other.num.multiply(den));
    }

    @Override
    public boolean dependsOn(String variable) {
        return false;
    }

    @Override
    public int rank() {
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Number)) {
            return false;
        }
        Number other = (Number) o;
        return num.equals(other.num) && den.equals(other.den);
    }

    @Override
    public int hashCode() {
        return 31 * num.hashCode() + den.hashCode();
    }

    public String toString() {
        if (isInteger()) {
            return num.toString();
        }
        if (isTerminating()) {
            return new BigDecimal(num).divide(new BigDecimal(den)).stripTrailingZeros().toPlainString();
        }
        return num + "/" + den;
    }
}
