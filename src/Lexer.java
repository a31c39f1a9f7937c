public class Lexer {
    private final String input;
    private int pos = 0;
    private int tokenStart = 0;
    private String curToken;

    public Lexer(String input) {
        this.input = input;
        this.next();
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private String getNumber() {
        StringBuilder sb = new StringBuilder();
        boolean point = false;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '.' && !point) {
                point = true;
            }
            else if (!isDigit(c)) {
                break;
            }
            sb.append(c);
            ++pos;
        }
        return sb.toString();
    }

    private String getIdentifier() {
        StringBuilder sb = new StringBuilder();
        while (pos < input.length() && (isLetter(input.charAt(pos)) || isDigit(input.charAt(pos)))) {
            sb.append(input.charAt(pos));
            ++pos;
        }
        return sb.toString();
    }

    public void next() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            ++pos;
        }
        tokenStart = pos;
        if (pos == input.length()) {
            curToken = "";
            return;
        }
        char c = input.charAt(pos);
        if (isDigit(c) || c == '.') {
            curToken = getNumber();
        }
        else if (isLetter(c)) {
            curToken = getIdentifier();
        }
        else if ("+-*/^(),".indexOf(c) >= 0) {
            pos += 1;
            curToken = String.valueOf(c);
        }
        else {
            throw new ParseException("unexpected character '" + c + "'", pos);
        }
    }

    public String peek() {
        return curToken;
    }

    public boolean atEnd() {
        return curToken.isEmpty();
    }

    public boolean isNumber() {
        return !atEnd() && (isDigit(curToken.charAt(0)) || curToken.charAt(0) == '.');
    }

    public boolean isIdentifier() {
        return !atEnd() && isLetter(curToken.charAt(0));
    }

    public int getPosition() {
        return tokenStart;
    }
}
