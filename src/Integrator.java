import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Heuristic antiderivatives: base rules, linear argument, reverse chain rule, substitution; first match wins.
public class Integrator {
    private static final Logger LOG = LoggerFactory.getLogger(Integrator.class);
    private static final Number HALF = Number.ONE.divide(Number.TWO);

    private final Simplifier simplifier;
    private final Differentiator differentiator;

    public Integrator() {
        this(new Simplifier());
    }

    public Integrator(Simplifier simplifier) {
        this(simplifier, new Differentiator(simplifier));
    }

    public Integrator(Simplifier simplifier, Differentiator differentiator) {
        this.simplifier = simplifier;
        this.differentiator = differentiator;
    }

    private static final class Search {
        private final String variable;
        private Expr failedAt;

        private Search(String variable) {
            this.variable = variable;
        }
    }

    public IntegrationResult integrate(Expr e, String variable) {
        if (!Var.isValidName(variable)) {
            throw new UnsupportedExpressionException("cannot integrate with respect to '" + variable + "'");
        }
        Expr simplified = simplifier.simplify(e);
        Call unsupported = findUnsupportedCall(simplified);
        if (unsupported != null) {
            LOG.debug("{} calls unsupported function {}", simplified, unsupported.getName());
            return IntegrationResult.failed(unsupported);
        }
        Search search = new Search(variable);
        Expr result = integrateNode(simplified, search);
        if (result == null) {
            Expr failedAt = search.failedAt == null ? simplified : search.failedAt;
            LOG.debug("no heuristic matched {} (while integrating {})", failedAt, simplified);
            return IntegrationResult.failed(failedAt);
        }
        return IntegrationResult.succeeded(simplifier.simplify(result));
    }

    private static Call findUnsupportedCall(Expr e) {
        if (e instanceof Call) {
            Call call = (Call) e;
            return call.getFunction() == null ? call : findUnsupportedCall(call.getArgument());
        }
        List<Expr> children = new ArrayList<>();
        if (e instanceof Pow) {
            children.add(((Pow) e).getBase());
            children.add(((Pow) e).getExponent());
        }
        else if (e instanceof Product) {
            children.addAll(((Product) e).getFactors());
        }
        else if (e instanceof Sum) {
            children.addAll(((Sum) e).getTerms());
        }
        for (Expr child : children) {
            Call found = findUnsupportedCall(child);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private Expr integrateNode(Expr e, Search search) {
        Expr result = integrateBase(e, search);
        if (result == null) {
            result = integrateLinearArgument(e, search);
        }
        if (result == null) {
            result = integrateReverseChain(e, search);
        }
        if (result == null) {
            result = integrateSubstitution(e, search);
        }
        return result;
    }

    private Expr integrateBase(Expr e, Search search) {
        String variable = search.variable;
        if (!e.dependsOn(variable)) {
            return Product.of(e, new Var(variable));
        }
        if (e instanceof Var) {
            return Product.of(HALF, Pow.of(e, Number.TWO));
        }
        if (e instanceof Sum) {
            List<Expr> terms = new ArrayList<>();
            for (Expr term : ((Sum) e).getTerms()) {
                Expr integral = integrateNode(term, search);
                if (integral == null) {
                    search.failedAt = term;
                    return null;
                }
                terms.add(integral);
            }
            return Sum.of(terms);
        }
        if (e instanceof Pow) {
            Pow pow = (Pow) e;
            if (pow.getBase() instanceof Var && pow.getExponent() instanceof Number) {
                return powerRule(pow.getBase(), (Number) pow.getExponent());
            }
            return null;
        }
        if (e instanceof Call) {
            Call call = (Call) e;
            if (call.getArgument() instanceof Var) {
                return antiderivative(call.getFunction(), call.getArgument());
            }
            return null;
        }
        if (e instanceof Product) {
            // constant factors move outside: int(c * f) = c * int(f)
            List<Expr> constants = new ArrayList<>();
            List<Expr> rest = new ArrayList<>();
            for (Expr factor : ((Product) e).getFactors()) {
                if (factor.dependsOn(variable)) {
                    rest.add(factor);
                }
                else {
                    constants.add(factor);
                }
            }
            if (constants.isEmpty()) {
                return null;
            }
            Expr integral = integrateNode(Product.of(rest), search);
            if (integral == null) {
                return null;
            }
            constants.add(integral);
            return Product.of(constants);
        }
        return null;
    }

    // u^n -> u^(n+1) / (n+1), u^-1 -> ln(u)
    private static Expr powerRule(Expr u, Number n) {
        if (n.isMinusOne()) {
            return new Call(Function.LN, u);
        }
        Number raised = n.add(Number.ONE);
        return Product.of(raised.reciprocal(), Pow.of(u, raised));
    }

    private static Expr antiderivative(Function function, Expr u) {
        switch (function) {
            case SIN:
                return Product.negate(new Call(Function.COS, u));
            case COS:
                return new Call(Function.SIN, u);
            case EXP:
                return new Call(Function.EXP, u);
            case LN:
                return Sum.subtract(Product.of(u, new Call(Function.LN, u)), u);
            default:
                throw new UnsupportedExpressionException("no antiderivative for " + function.getName());
        }
    }

    private Expr integrateLinearArgument(Expr e, Search search) {
        Expr inner;
        if (e instanceof Call) {
            inner = ((Call) e).getArgument();
        }
        else if (e instanceof Pow && ((Pow) e).getExponent() instanceof Number) {
            inner = ((Pow) e).getBase();
        }
        else {
            return null;
        }
        Expr slope = linearSlope(inner, search.variable);
        if (slope == null) {
            return null;
        }
        slope = simplifier.simplify(slope);
        if (slope instanceof Number && ((Number) slope).isZero()) {
            return null;
        }
        Expr outer = e instanceof Call
            ? antiderivative(((Call) e).getFunction(), inner)
            : powerRule(inner, (Number) ((Pow) e).getExponent());
        return Product.of(Pow.reciprocal(slope), outer);
    }

    // a for e = a*x + b with a, b free of x; null when e is not of that shape
    private static Expr linearSlope(Expr e, String variable) {
        if (!e.dependsOn(variable)) {
            return Number.ZERO;
        }
        if (e instanceof Var) {
            return Number.ONE;
        }
        if (e instanceof Product) {
            List<Expr> others = new ArrayList<>();
            boolean seen = false;
            for (Expr factor : ((Product) e).getFactors()) {
                if (factor instanceof Var && factor.dependsOn(variable) && !seen) {
                    seen = true;
                }
                else if (factor.dependsOn(variable)) {
                    return null;
                }
                else {
                    others.add(factor);
                }
            }
            return Product.of(others);
        }
        if (e instanceof Sum) {
            List<Expr> slopes = new ArrayList<>();
            for (Expr term : ((Sum) e).getTerms()) {
                Expr slope = linearSlope(term, variable);
                if (slope == null) {
                    return null;
                }
                slopes.add(slope);
            }
            return Sum.of(slopes);
        }
        return null;
    }

    // u^n * (k * u') -> k * u^(n+1) / (n+1); a bare factor u counts as u^1
    private Expr integrateReverseChain(Expr e, Search search) {
        if (!(e instanceof Product)) {
            return null;
        }
        List<Expr> factors = ((Product) e).getFactors();
        for (int i = 0; i < factors.size(); i++) {
            Expr factor = factors.get(i);
            Expr u = factor;
            Number n = Number.ONE;
            if (factor instanceof Pow && ((Pow) factor).getExponent() instanceof Number) {
                u = ((Pow) factor).getBase();
                n = (Number) ((Pow) factor).getExponent();
            }
            if (!u.dependsOn(search.variable)) {
                continue;
            }
            Expr k = cofactorRatio(factors, i, u, search.variable);
            if (k != null) {
                return Product.of(k, powerRule(u, n));
            }
        }
        return null;
    }

    // f(u) * (k * u') -> k * F(u)
    private Expr integrateSubstitution(Expr e, Search search) {
        if (!(e instanceof Product)) {
            return null;
        }
        List<Expr> factors = ((Product) e).getFactors();
        for (int i = 0; i < factors.size(); i++) {
            if (!(factors.get(i) instanceof Call)) {
                continue;
            }
            Call call = (Call) factors.get(i);
            Expr u = call.getArgument();
            if (!u.dependsOn(search.variable)) {
                continue;
            }
            Expr k = cofactorRatio(factors, i, u, search.variable);
            if (k != null) {
                return Product.of(k, antiderivative(call.getFunction(), u));
            }
        }
        return null;
    }

    // k when the factors other than factors[skip] equal k * u' for a constant k, else null
    private Expr cofactorRatio(List<Expr> factors, int skip, Expr u, String variable) {
        Expr du = differentiator.diff(u, variable);
        if (du instanceof Number && ((Number) du).isZero()) {
            return null;
        }
        List<Expr> rest = new ArrayList<>(factors);
        rest.remove(skip);
        Expr ratio = simplifier.simplify(Product.divide(Product.of(rest), du));
        return ratio.dependsOn(variable) ? null : ratio;
    }
}
