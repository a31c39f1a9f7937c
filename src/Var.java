import java.util.regex.Pattern;

public final class Var implements Expr {
    private static final Pattern NAME = Pattern.compile("[A-Za-z][A-Za-z0-9]*");
    private final String name;

    public Var(String name) {
        this.name = name;
    }

    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches();
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean dependsOn(String variable) {
        return name.equals(variable);
    }

    @Override
    public int rank() {
        return 1;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Var && ((Var) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    public String toString() {
        return name;
    }
}
