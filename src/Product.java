import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class Product implements Expr {
    // numeric coefficient (if any, never 1) first, then the other factors in canonical order
    private final List<Expr> factors;

    private Product(List<Expr> factors) {
        this.factors = Collections.unmodifiableList(factors);
    }

    public static Expr of(Expr... factors) {
        return of(Arrays.asList(factors));
    }

    public static Expr of(List<Expr> factors) {
        Number coefficient = Number.ONE;
        boolean dividesByZero = false;
        ArrayList<Expr> rest = new ArrayList<>();
        for (Expr factor : factors) {
            List<Expr> flat = factor instanceof Product
                ? ((Product) factor).factors : Collections.singletonList(factor);
            for (Expr f : flat) {
                if (f instanceof Number) {
                    coefficient = coefficient.multiply((Number) f);
                }
                else {
                    if (f instanceof Pow && ((Pow) f).isReciprocalOfZero()) {
                        dividesByZero = true;
                    }
                    rest.add(f);
                }
            }
        }
        // keep 0 * (1/0) around so the simplifier can report it
        if (coefficient.isZero() && !dividesByZero) {
            return Number.ZERO;
        }
        if (rest.isEmpty()) {
            return coefficient;
        }
        Collections.sort(rest);
        if (coefficient.isOne()) {
            if (rest.size() == 1) {
                return rest.get(0);
            }
            return new Product(rest);
        }
        rest.add(0, coefficient);
        return new Product(rest);
    }

    public static Expr negate(Expr e) {
        return of(Number.MINUS_ONE, e);
    }

    public static Expr divide(Expr dividend, Expr divisor) {
        return of(dividend, Pow.reciprocal(divisor));
    }

    public static Number coefficientOf(Expr term) {
        if (term instanceof Number) {
            return (Number) term;
        }
        if (term instanceof Product) {
            Expr first = ((Product) term).factors.get(0);
            if (first instanceof Number) {
                return (Number) first;
            }
        }
        return Number.ONE;
    }

    // the term with its numeric coefficient stripped; 1 for a bare number
    public static Expr unitOf(Expr term) {
        if (term instanceof Number) {
            return Number.ONE;
        }
        if (term instanceof Product) {
            List<Expr> all = ((Product) term).factors;
            if (all.get(0) instanceof Number) {
                return of(all.subList(1, all.size()));
            }
        }
        return term;
    }

    public List<Expr> getFactors() {
        return factors;
    }

    public Number getCoefficient() {
        return coefficientOf(this);
    }

    @Override
    public boolean dependsOn(String variable) {
        for (Expr factor : factors) {
            if (factor.dependsOn(variable)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int rank() {
        return 3;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Product && ((Product) o).factors.equals(factors));
    }

    @Override
    public int hashCode() {
        return factors.hashCode() * 17;
    }

    public String toString() {
        return Printer.render(this);
    }
}
