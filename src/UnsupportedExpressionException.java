public class UnsupportedExpressionException extends UnsupportedOperationException {
    public UnsupportedExpressionException(String message) {
        super(message);
    }
}
