import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Canonical form by repeated bottom-up passes; stops at a fixpoint or after maxPasses.
public class Simplifier {
    private static final Logger LOG = LoggerFactory.getLogger(Simplifier.class);

    public static final int DEFAULT_MAX_PASSES = Integer.getInteger("symcalc.simplify.maxPasses", 64);
    private static final BigInteger MAX_FOLDED_EXPONENT = BigInteger.valueOf(1024);

    private final int maxPasses;

    public Simplifier() {
        this(DEFAULT_MAX_PASSES);
    }

    public Simplifier(int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be positive: " + maxPasses);
        }
        this.maxPasses = maxPasses;
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    public Expr simplify(Expr e) {
        Expr current = e;
        for (int pass = 0; pass < maxPasses; pass++) {
            Expr next = rewrite(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
        LOG.warn("no fixpoint after {} passes, returning {}", maxPasses, current);
        return current;
    }

    // one bottom-up pass; subtrees that come out equal are returned by reference
    private Expr rewrite(Expr e) {
        Expr result;
        if (e instanceof Number || e instanceof Var) {
            return e;
        }
        else if (e instanceof Call) {
            result = rewriteCall((Call) e);
        }
        else if (e instanceof Pow) {
            result = rewritePow((Pow) e);
        }
        else if (e instanceof Product) {
            result = rewriteProduct((Product) e);
        }
        else if (e instanceof Sum) {
            result = rewriteSum((Sum) e);
        }
        else {
            throw new IllegalArgumentException("unknown expression kind " + e.getClass().getName());
        }
        return result.equals(e) ? e : result;
    }

    private List<Expr> rewriteAll(List<Expr> children) {
        List<Expr> result = new ArrayList<>(children.size());
        for (Expr child : children) {
            result.add(rewrite(child));
        }
        return result;
    }

    private Expr rewriteCall(Call call) {
        Expr argument = rewrite(call.getArgument());
        Function function = call.getFunction();
        if (function != null) {
            Expr folded = foldCall(function, argument);
            if (folded != null) {
                return folded;
            }
        }
        return call.withArgument(argument);
    }

    private Expr foldCall(Function function, Expr argument) {
        boolean zero = argument instanceof Number && ((Number) argument).isZero();
        boolean negative = !(argument instanceof Sum) && Product.coefficientOf(argument).isNegative();
        switch (function) {
            case SIN:
                if (zero) {
                    return Number.ZERO;
                }
                if (negative) {
                    return Product.negate(new Call(Function.SIN, Product.negate(argument)));
                }
                return null;
            case COS:
                if (zero) {
                    return Number.ONE;
                }
                if (negative) {
                    return new Call(Function.COS, Product.negate(argument));
                }
                return null;
            case EXP:
                if (zero) {
                    return Number.ONE;
                }
                if (argument instanceof Call && ((Call) argument).getFunction() == Function.LN) {
                    return ((Call) argument).getArgument();
                }
                return null;
            case LN:
                if (argument instanceof Number && ((Number) argument).isOne()) {
                    return Number.ZERO;
                }
                if (argument instanceof Call && ((Call) argument).getFunction() == Function.EXP) {
                    return ((Call) argument).getArgument();
                }
                return null;
            default:
                return null;
        }
    }

    private Expr rewritePow(Pow pow) {
        Expr base = rewrite(pow.getBase());
        Expr exponent = rewrite(pow.getExponent());
        if (exponent instanceof Number && ((Number) exponent).isInteger()) {
            Number n = (Number) exponent;
            if (base instanceof Number && n.getNumerator().abs().compareTo(MAX_FOLDED_EXPONENT) <= 0) {
                return ((Number) base).pow(n.getNumerator().intValueExact());
            }
            if (base instanceof Pow && ((Pow) base).getExponent() instanceof Number) {
                Pow inner = (Pow) base;
                return Pow.of(inner.getBase(), ((Number) inner.getExponent()).multiply(n));
            }
            if (base instanceof Product) {
                List<Expr> factors = new ArrayList<>();
                for (Expr factor : ((Product) base).getFactors()) {
                    if (factor instanceof Number && n.getNumerator().abs().compareTo(MAX_FOLDED_EXPONENT) <= 0) {
                        factors.add(((Number) factor).pow(n.getNumerator().intValueExact()));
                    }
                    else {
                        factors.add(Pow.of(factor, n));
                    }
                }
                return Product.of(factors);
            }
            // (2x + 2)^n -> 2^n * (x + 1)^n
            if (base instanceof Sum && n.getNumerator().abs().compareTo(MAX_FOLDED_EXPONENT) <= 0) {
                Number lead = leadingCoefficient((Sum) base);
                if (!lead.isOne()) {
                    return Product.of(lead.pow(n.getNumerator().intValueExact()),
                        Pow.of(scale((Sum) base, lead.reciprocal()), n));
                }
            }
        }
        if (base == pow.getBase() && exponent == pow.getExponent()) {
            return pow;
        }
        return Pow.of(base, exponent);
    }

    private Expr rewriteProduct(Product product) {
        Expr rebuilt = Product.of(rewriteAll(product.getFactors()));
        if (!(rebuilt instanceof Product)) {
            return rebuilt;
        }
        Number coefficient = Product.coefficientOf(rebuilt);
        List<Expr> symbolic = new ArrayList<>();
        for (Expr factor : ((Product) rebuilt).getFactors()) {
            if (!(factor instanceof Number)) {
                symbolic.add(factor);
            }
        }
        // a sum next to other factors keeps only its monic part; a lone c * sum is distributed below
        if (symbolic.size() >= 2) {
            for (int i = 0; i < symbolic.size(); i++) {
                Expr factor = symbolic.get(i);
                if (factor instanceof Sum) {
                    Number lead = leadingCoefficient((Sum) factor);
                    coefficient = coefficient.multiply(lead);
                    symbolic.set(i, scale((Sum) factor, lead.reciprocal()));
                }
            }
        }
        List<Expr> factors = combinePowers(symbolic);
        factors.add(coefficient);
        Expr combined = Product.of(factors);
        return distribute(combined);
    }

    // coefficient of the highest-order term, which sorts last
    private static Number leadingCoefficient(Sum sum) {
        List<Expr> terms = sum.getTerms();
        return Product.coefficientOf(terms.get(terms.size() - 1));
    }

    private static Expr scale(Sum sum, Number factor) {
        if (factor.isOne()) {
            return sum;
        }
        List<Expr> terms = new ArrayList<>();
        for (Expr term : sum.getTerms()) {
            terms.add(Product.of(factor, term));
        }
        return Sum.of(terms);
    }

    // x * x^2 -> x^3, x / x -> 1: factors with the same base add their exponents
    private static List<Expr> combinePowers(List<Expr> factors) {
        Map<Expr, List<Expr>> exponentsByBase = new LinkedHashMap<>();
        Map<Expr, Expr> originals = new LinkedHashMap<>();
        for (Expr factor : factors) {
            Expr base = factor;
            Expr exponent = Number.ONE;
            if (factor instanceof Pow) {
                base = ((Pow) factor).getBase();
                exponent = ((Pow) factor).getExponent();
            }
            exponentsByBase.computeIfAbsent(base, k -> new ArrayList<>()).add(exponent);
            originals.putIfAbsent(base, factor);
        }
        List<Expr> result = new ArrayList<>();
        for (Map.Entry<Expr, List<Expr>> entry : exponentsByBase.entrySet()) {
            if (entry.getValue().size() == 1) {
                result.add(originals.get(entry.getKey()));
            }
            else {
                result.add(Pow.of(entry.getKey(), Sum.of(entry.getValue())));
            }
        }
        return result;
    }

    // c * (a + b) -> c*a + c*b, only for a lone coefficient times a lone sum
    private static Expr distribute(Expr e) {
        if (!(e instanceof Product)) {
            return e;
        }
        List<Expr> factors = ((Product) e).getFactors();
        if (factors.size() != 2 || !(factors.get(0) instanceof Number) || !(factors.get(1) instanceof Sum)) {
            return e;
        }
        return scale((Sum) factors.get(1), (Number) factors.get(0));
    }

    private Expr rewriteSum(Sum sum) {
        Expr rebuilt = Sum.of(rewriteAll(sum.getTerms()));
        if (!(rebuilt instanceof Sum)) {
            return rebuilt;
        }
        // like terms: group by unit part, add coefficients; the sign lives in the coefficient
        Map<Expr, Number> coefficients = new LinkedHashMap<>();
        for (Expr term : ((Sum) rebuilt).getTerms()) {
            coefficients.merge(Product.unitOf(term), Product.coefficientOf(term), Number::add);
        }
        applyTrigIdentities(coefficients);
        List<Expr> terms = new ArrayList<>();
        for (Map.Entry<Expr, Number> entry : coefficients.entrySet()) {
            terms.add(Product.of(entry.getValue(), entry.getKey()));
        }
        return Sum.of(terms);
    }

    // a*sin(u)^2 + b*cos(u)^2: the smaller magnitude c is taken out as c (same signs)
    // or as c*cos(2u) (opposite signs), so at most one of the two squares is left
    private static void applyTrigIdentities(Map<Expr, Number> coefficients) {
        List<Expr> sineSquares = new ArrayList<>();
        for (Expr unit : coefficients.keySet()) {
            if (isSquareOf(unit, Function.SIN)) {
                sineSquares.add(unit);
            }
        }
        for (Expr sineSquare : sineSquares) {
            Expr argument = ((Call) ((Pow) sineSquare).getBase()).getArgument();
            Expr cosineSquare = Pow.of(new Call(Function.COS, argument), Number.TWO);
            Number a = coefficients.get(sineSquare);
            Number b = coefficients.get(cosineSquare);
            if (a == null || b == null || a.isZero() || b.isZero()) {
                continue;
            }
            boolean sineSmaller = a.abs().compareValue(b.abs()) <= 0;
            if (a.signum() == b.signum()) {
                Number c = sineSmaller ? a : b;
                coefficients.put(sineSquare, a.subtract(c));
                coefficients.put(cosineSquare, b.subtract(c));
                coefficients.merge(Number.ONE, c, Number::add);
            }
            else {
                Number c = sineSmaller ? a.negate() : b;
                coefficients.put(sineSquare, a.add(c));
                coefficients.put(cosineSquare, b.subtract(c));
                Expr doubleAngle = new Call(Function.COS, Product.of(Number.TWO, argument));
                coefficients.merge(doubleAngle, c, Number::add);
            }
        }
    }

    private static boolean isSquareOf(Expr e, Function function) {
        if (!(e instanceof Pow)) {
            return false;
        }
        Pow pow = (Pow) e;
        return Number.TWO.equals(pow.getExponent()) && pow.getBase() instanceof Call
            && ((Call) pow.getBase()).getFunction() == function;
    }
}
