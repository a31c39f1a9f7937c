import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

public final class Sum implements Expr {
    // Terms: the constant (if any, never 0) first, then ascending total degree of the unit part,
    // then the rendered unit part, then the coefficient.
    public static final Comparator<Expr> TERM_ORDER = (a, b) -> {
        Expr unitA = Product.unitOf(a);
        Expr unitB = Product.unitOf(b);
        int cmp = degree(unitA).compareValue(degree(unitB));
        if (cmp != 0) {
            return cmp;
        }
        cmp = unitA.compareTo(unitB);
        if (cmp != 0) {
            return cmp;
        }
        return Product.coefficientOf(a).compareValue(Product.coefficientOf(b));
    };

    private final List<Expr> terms;

    private Sum(List<Expr> terms) {
        this.terms = Collections.unmodifiableList(terms);
    }

    public static Expr of(Expr... terms) {
        return of(Arrays.asList(terms));
    }

    public static Expr of(List<Expr> terms) {
        Number constant = Number.ZERO;
        ArrayList<Expr> rest = new ArrayList<>();
        for (Expr term : terms) {
            List<Expr> flat = term instanceof Sum
                ? ((Sum) term).terms : Collections.singletonList(term);
            for (Expr t : flat) {
                if (t instanceof Number) {
                    constant = constant.add((Number) t);
                }
                else {
                    rest.add(t);
                }
            }
        }
        if (rest.isEmpty()) {
            return constant;
        }
        rest.sort(TERM_ORDER);
        if (!constant.isZero()) {
            rest.add(0, constant);
        }
        else if (rest.size() == 1) {
            return rest.get(0);
        }
        return new Sum(rest);
    }

    public static Expr subtract(Expr minuend, Expr subtrahend) {
        return of(minuend, Product.negate(subtrahend));
    }

    // total polynomial degree over all variables; non-polynomial parts count as 0
    public static Number degree(Expr e) {
        if (e instanceof Var) {
            return Number.ONE;
        }
        if (e instanceof Pow) {
            Pow pow = (Pow) e;
            if (pow.getExponent() instanceof Number) {
                return degree(pow.getBase()).multiply((Number) pow.getExponent());
            }
            return Number.ZERO;
        }
        if (e instanceof Product) {
            Number total = Number.ZERO;
            for (Expr factor : ((Product) e).getFactors()) {
                total = total.add(degree(factor));
            }
            return total;
        }
        if (e instanceof Sum) {
            Number max = Number.ZERO;
            for (Expr term : ((Sum) e).terms) {
                Number d = degree(term);
                if (d.compareValue(max) > 0) {
                    max = d;
                }
            }
            return max;
        }
        return Number.ZERO;
    }

    public List<Expr> getTerms() {
        return terms;
    }

    @Override
    public boolean dependsOn(String variable) {
        for (Expr term : terms) {
            if (term.dependsOn(variable)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int rank() {
        return 4;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Sum && ((Sum) o).terms.equals(terms));
    }

    @Override
    public int hashCode() {
        return terms.hashCode() * 13;
    }

    public String toString() {
        return Printer.render(this);
    }
}
