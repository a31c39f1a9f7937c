import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Canonical text form. Numbers: integers as is, terminating rationals as plain decimals, others as p/q.
public final class Printer {
    private static final int SUM = 1;
    private static final int PRODUCT = 2;
    private static final int UNARY = 3;
    private static final int POWER = 4;
    private static final int ATOM = 5;

    private Printer() {
    }

    public static String render(Expr e) {
        return print(e).text;
    }

    private static final class Printed {
        private final String text;
        private final int precedence;

        private Printed(String text, int precedence) {
            this.text = text;
            this.precedence = precedence;
        }
    }

    private static Printed print(Expr e) {
        if (e instanceof Number) {
            return printNumber((Number) e);
        }
        else if (e instanceof Var) {
            return new Printed(((Var) e).getName(), ATOM);
        }
        else if (e instanceof Call) {
            Call call = (Call) e;
            return new Printed(call.getName() + "(" + render(call.getArgument()) + ")", ATOM);
        }
        else if (e instanceof Pow) {
            return printPow((Pow) e);
        }
        else if (e instanceof Product) {
            return printProduct((Product) e);
        }
        else if (e instanceof Sum) {
            return printSum((Sum) e);
        }
        throw new IllegalArgumentException("unknown expression kind " + e.getClass().getName());
    }

    private static String wrap(Printed printed, int minimum) {
        if (printed.precedence < minimum) {
            return "(" + printed.text + ")";
        }
        return printed.text;
    }

    private static Printed printNumber(Number n) {
        if (!n.isTerminating()) {
            return new Printed(n.toString(), PRODUCT);
        }
        return new Printed(n.toString(), n.isNegative() ? UNARY : ATOM);
    }

    private static Printed printPow(Pow pow) {
        if (pow.isDivisor()) {
            return new Printed("1 / " + printDenominators(Collections.singletonList(pow)), PRODUCT);
        }
        // ^ is right-associative: a nested power only needs parentheses on the left
        String base = wrap(print(pow.getBase()), ATOM);
        String exponent = wrap(print(pow.getExponent()), POWER);
        return new Printed(base + "^" + exponent, POWER);
    }

    private static String printDenominators(List<Pow> divisors) {
        List<String> parts = new ArrayList<>();
        Printed last = null;
        for (Pow divisor : divisors) {
            Number positive = ((Number) divisor.getExponent()).negate();
            last = print(Pow.of(divisor.getBase(), positive));
            parts.add(wrap(last, UNARY));
        }
        if (parts.size() == 1) {
            return wrap(last, UNARY);
        }
        return "(" + String.join(" * ", parts) + ")";
    }

    private static Printed printProduct(Product product) {
        Number coefficient = product.getCoefficient();
        List<String> numerators = new ArrayList<>();
        List<Pow> divisors = new ArrayList<>();
        Printed single = null;
        for (Expr factor : product.getFactors()) {
            if (factor instanceof Number) {
                continue;
            }
            if (factor instanceof Pow && ((Pow) factor).isDivisor()) {
                divisors.add((Pow) factor);
            }
            else {
                single = print(factor);
                numerators.add(wrap(single, UNARY));
            }
        }
        if (numerators.isEmpty()) {
            String lead = coefficient.isOne() ? "1" : print(coefficient).text;
            return new Printed(lead + " / " + printDenominators(divisors), PRODUCT);
        }
        Printed body;
        if (numerators.size() == 1 && divisors.isEmpty()) {
            body = single;
        }
        else {
            String text = String.join(" * ", numerators);
            if (!divisors.isEmpty()) {
                text += " / " + printDenominators(divisors);
            }
            body = new Printed(text, PRODUCT);
        }
        if (coefficient.isOne()) {
            return body;
        }
        if (coefficient.isMinusOne()) {
            return new Printed("-" + wrap(body, UNARY), UNARY);
        }
        // the coefficient scales the whole unit part: 2 * (cos(x) * sin(x))
        return new Printed(print(coefficient).text + " * " + wrap(body, UNARY), PRODUCT);
    }

    private static Printed printSum(Sum sum) {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (Expr term : sum.getTerms()) {
            if (first) {
                sb.append(wrap(print(term), SUM));
                first = false;
            }
            else if (Product.coefficientOf(term).isNegative()) {
                sb.append(" - ").append(wrap(print(Product.negate(term)), PRODUCT));
            }
            else {
                sb.append(" + ").append(wrap(print(term), PRODUCT));
            }
        }
        return new Printed(sb.toString(), SUM);
    }
}
