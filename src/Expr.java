public interface Expr extends Comparable<Expr> {
    // precedence-free kind rank, used only to break ties between equal renderings
    int rank();

    boolean dependsOn(String variable);

    default int compareTo(Expr other) {
        int cmp = Printer.render(this).compareTo(Printer.render(other));
        if (cmp != 0) {
            return cmp;
        }
        return Integer.compare(rank(), other.rank());
    }
}
