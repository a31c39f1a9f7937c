public final class Call implements Expr {
    private final String name;
    private final Expr argument;

    public Call(String name, Expr argument) {
        this.name = name;
        this.argument = argument;
    }

    public Call(Function function, Expr argument) {
        this(function.getName(), argument);
    }

    public String getName() {
        return name;
    }

    // null when the name is outside the supported table
    public Function getFunction() {
        return Function.lookup(name);
    }

    public Expr getArgument() {
        return argument;
    }

    public Call withArgument(Expr newArgument) {
        if (newArgument == argument) {
            return this;
        }
        return new Call(name, newArgument);
    }

    @Override
    public boolean dependsOn(String variable) {
        return argument.dependsOn(variable);
    }

    @Override
    public int rank() {
        return 5;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Call)) {
            return false;
        }
        Call other = (Call) o;
        return name.equals(other.name) && argument.equals(other.argument);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + argument.hashCode();
    }

    public String toString() {
        return Printer.render(this);
    }
}
