public final class Pow implements Expr {
    private final Expr base;
    private final Expr exponent;

    private Pow(Expr base, Expr exponent) {
        this.base = base;
        this.exponent = exponent;
    }

    public static Expr of(Expr base, Expr exponent) {
        if (exponent instanceof Number) {
            Number n = (Number) exponent;
            if (n.isZero()) {
                return Number.ONE;
            }
            if (n.isOne()) {
                return base;
            }
        }
        if (base instanceof Number && ((Number) base).isOne()) {
            return Number.ONE;
        }
        return new Pow(base, exponent);
    }

    public static Expr reciprocal(Expr base) {
        return of(base, Number.MINUS_ONE);
    }

    public Expr getBase() {
        return base;
    }

    public Expr getExponent() {
        return exponent;
    }

    public boolean hasIntegerExponent() {
        return exponent instanceof Number && ((Number) exponent).isInteger();
    }

    // x^-n with integer n, rendered as a divisor
    public boolean isDivisor() {
        return hasIntegerExponent() && ((Number) exponent).isNegative();
    }

    public boolean isReciprocalOfZero() {
        return base instanceof Number && ((Number) base).isZero()
            && exponent instanceof Number && ((Number) exponent).isNegative();
    }

    @Override
    public boolean dependsOn(String variable) {
        return base.dependsOn(variable) || exponent.dependsOn(variable);
    }

    @Override
    public int rank() {
        return 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Pow)) {
            return false;
        }
        Pow other = (Pow) o;
        return base.equals(other.base) && exponent.equals(other.exponent);
    }

    @Override
    public int hashCode() {
        return 31 * base.hashCode() + exponent.hashCode() + 7;
    }

    public String toString() {
        return Printer.render(this);
    }
}
