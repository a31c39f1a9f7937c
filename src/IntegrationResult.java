// Outcome of Integrator.integrate: an antiderivative, or the sub-expression no heuristic matched.
public final class IntegrationResult {
    private final Expr antiderivative;
    private final Expr failedAt;

    private IntegrationResult(Expr antiderivative, Expr failedAt) {
        this.antiderivative = antiderivative;
        this.failedAt = failedAt;
    }

    public static IntegrationResult succeeded(Expr antiderivative) {
        return new IntegrationResult(antiderivative, null);
    }

    public static IntegrationResult failed(Expr failedAt) {
        return new IntegrationResult(null, failedAt);
    }

    public boolean isSuccess() {
        return antiderivative != null;
    }

    public Expr getAntiderivative() {
        if (antiderivative == null) {
            throw new IntegrationFailedException(failedAt);
        }
        return antiderivative;
    }

    public Expr getFailedAt() {
        return failedAt;
    }

    public String toString() {
        if (isSuccess()) {
            return Printer.render(antiderivative);
        }
        return "integration failed: " + Printer.render(failedAt);
    }
}
