public class ParseException extends IllegalArgumentException {
    private final int position;

    public ParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public ParseException(String message, int position, Throwable cause) {
        super(message + " at position " + position, cause);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
