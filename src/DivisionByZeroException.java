public class DivisionByZeroException extends ArithmeticException {
    public DivisionByZeroException(String expression) {
        super("division by zero: " + expression);
    }
}
