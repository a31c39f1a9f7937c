import java.math.BigDecimal;
import java.util.ArrayList;

public class Parser {
    private final Lexer lexer;

    public Parser(Lexer lexer) {
        this.lexer = lexer;
    }

    public static Expr parse(String text) {
        Lexer lexer = new Lexer(text);
        Parser parser = new Parser(lexer);
        Expr expr = parser.parseExpr();
        if (!lexer.atEnd()) {
            throw new ParseException("unexpected '" + lexer.peek() + "'", lexer.getPosition());
        }
        return expr;
    }

    public Expr parseExpr() {
        ArrayList<Expr> terms = new ArrayList<>();
        terms.add(parseTerm());
        while (lexer.peek().equals("+") || lexer.peek().equals("-")) {
            boolean negative = lexer.peek().equals("-");
            lexer.next();
            Expr term = parseTerm();
            terms.add(negative ? Product.negate(term) : term);
        }
        return Sum.of(terms);
    }

    private Expr parseTerm() {
        ArrayList<Expr> factors = new ArrayList<>();
        factors.add(parseUnary());
        while (lexer.peek().equals("*") || lexer.peek().equals("/")) {
            boolean divide = lexer.peek().equals("/");
            lexer.next();
            Expr factor = parseUnary();
            factors.add(divide ? Pow.reciprocal(factor) : factor);
        }
        return Product.of(factors);
    }

    private Expr parseUnary() {
        if (lexer.peek().equals("-")) {
            lexer.next();
            return Product.negate(parseUnary());
        }
        else if (lexer.peek().equals("+")) {
            lexer.next();
            return parseUnary();
        }
        return parsePower();
    }

    // ^ binds tighter than unary minus and associates to the right: -x^2 = -(x^2), 2^3^2 = 2^9
    private Expr parsePower() {
        Expr base = parseAtom();
        if (lexer.peek().equals("^")) {
            lexer.next();
            return Pow.of(base, parseUnary());
        }
        return base;
    }

    private Expr parseAtom() {
        if (lexer.isNumber()) {
            return parseNumber();
        }
        else if (lexer.isIdentifier()) {
            String name = lexer.peek();
            int position = lexer.getPosition();
            lexer.next();
            if (lexer.peek().equals("(")) {
                return parseCall(name, position);
            }
            return new Var(name);
        }
        else if (lexer.peek().equals("(")) {
            lexer.next();
            Expr expr = parseExpr();
            expect(")");
            return expr;
        }
        if (lexer.atEnd()) {
            throw new ParseException("unexpected end of input", lexer.getPosition());
        }
        throw new ParseException("unexpected '" + lexer.peek() + "'", lexer.getPosition());
    }

    private Number parseNumber() {
        String token = lexer.peek();
        int position = lexer.getPosition();
        lexer.next();
        try {
            return Number.of(new BigDecimal(token));
        } catch (NumberFormatException e) {
            throw new ParseException("malformed number '" + token + "'", position, e);
        }
    }

    private Call parseCall(String name, int position) {
        Function function = Function.lookup(name);
        if (function == null) {
            throw new ParseException("unknown function '" + name + "'", position);
        }
        lexer.next();
        Expr argument = parseExpr();
        if (lexer.peek().equals(",")) {
            throw new ParseException(name + " takes exactly one argument", lexer.getPosition());
        }
        expect(")");
        return new Call(function, argument);
    }

    private void expect(String token) {
        if (!lexer.peek().equals(token)) {
            String found = lexer.atEnd() ? "end of input" : "'" + lexer.peek() + "'";
            throw new ParseException("expected '" + token + "' but found " + found, lexer.getPosition());
        }
        lexer.next();
    }
}
