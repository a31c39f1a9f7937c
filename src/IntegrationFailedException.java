public class IntegrationFailedException extends RuntimeException {
    private final Expr expression;

    public IntegrationFailedException(Expr expression) {
        super("no antiderivative found for " + Printer.render(expression));
        this.expression = expression;
    }

    public Expr getExpression() {
        return expression;
    }
}
