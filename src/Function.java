public enum Function {
    SIN("sin"),
    COS("cos"),
    EXP("exp"),
    LN("ln");

    private final String name;

    Function(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static Function lookup(String name) {
        for (Function function : values()) {
            if (function.name.equals(name)) {
                return function;
            }
        }
        return null;
    }
}
