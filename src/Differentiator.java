import java.util.ArrayList;
import java.util.List;

public class Differentiator {
    private final Simplifier simplifier;

    public Differentiator() {
        this(new Simplifier());
    }

    public Differentiator(Simplifier simplifier) {
        this.simplifier = simplifier;
    }

    public Expr diff(Expr e, String variable) {
        if (!Var.isValidName(variable)) {
            throw new UnsupportedExpressionException("cannot differentiate with respect to '" + variable + "'");
        }
        return simplifier.simplify(derive(e, variable));
    }

    // raw derivative, one rule per node kind; simplified by the caller
    private Expr derive(Expr e, String variable) {
        if (e instanceof Number) {
            return Number.ZERO;
        }
        else if (e instanceof Var) {
            return ((Var) e).getName().equals(variable) ? Number.ONE : Number.ZERO;
        }
        else if (e instanceof Sum) {
            List<Expr> terms = new ArrayList<>();
            for (Expr term : ((Sum) e).getTerms()) {
                terms.add(derive(term, variable));
            }
            return Sum.of(terms);
        }
        else if (e instanceof Product) {
            return deriveProduct((Product) e, variable);
        }
        else if (e instanceof Pow) {
            return derivePow((Pow) e, variable);
        }
        else if (e instanceof Call) {
            return deriveCall((Call) e, variable);
        }
        throw new UnsupportedExpressionException("cannot differentiate " + e.getClass().getName());
    }

    // (f1 f2 ... fn)' = sum over i of f1 ... fi' ... fn
    private Expr deriveProduct(Product product, String variable) {
        List<Expr> factors = product.getFactors();
        List<Expr> terms = new ArrayList<>();
        for (int i = 0; i < factors.size(); i++) {
            List<Expr> term = new ArrayList<>(factors);
            term.set(i, derive(factors.get(i), variable));
            terms.add(Product.of(term));
        }
        return Sum.of(terms);
    }

    private Expr derivePow(Pow pow, String variable) {
        Expr base = pow.getBase();
        Expr exponent = pow.getExponent();
        if (!exponent.dependsOn(variable)) {
            Expr lowered = Pow.of(base, Sum.of(exponent, Number.MINUS_ONE));
            return Product.of(exponent, lowered, derive(base, variable));
        }
        if (!base.dependsOn(variable)) {
            return Product.of(pow, new Call(Function.LN, base), derive(exponent, variable));
        }
        // (b^e)' = b^e * (e' ln b + e b' / b)
        Expr logPart = Product.of(derive(exponent, variable), new Call(Function.LN, base));
        Expr basePart = Product.of(exponent, derive(base, variable), Pow.reciprocal(base));
        return Product.of(pow, Sum.of(logPart, basePart));
    }

    private Expr deriveCall(Call call, String variable) {
        Function function = call.getFunction();
        if (function == null) {
            throw new UnsupportedExpressionException("cannot differentiate function '" + call.getName() + "'");
        }
        Expr argument = call.getArgument();
        Expr outer;
        switch (function) {
            case SIN:
                outer = new Call(Function.COS, argument);
                break;
            case COS:
                outer = Product.negate(new Call(Function.SIN, argument));
                break;
            case EXP:
                outer = call;
                break;
            case LN:
                outer = Pow.reciprocal(argument);
                break;
            default:
                throw new UnsupportedExpressionException("cannot differentiate function '" + call.getName() + "'");
        }
        return Product.of(outer, derive(argument, variable));
    }
}
