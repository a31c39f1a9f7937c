import java.io.PrintStream;
import java.util.Scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Solver {
    private static final Logger LOG = LoggerFactory.getLogger(Solver.class);

    private final Scanner sc;
    private final PrintStream out;
    private final Simplifier simplifier = new Simplifier();
    private final Differentiator differentiator = new Differentiator(simplifier);
    private final Integrator integrator = new Integrator(simplifier, differentiator);

    public Solver(Scanner sc, PrintStream out) {
        this.sc = sc;
        this.out = out;
    }

    public void solve() {
        while (sc.hasNextLine()) {
            String line = sc.nextLine().trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                out.println(execute(line));
            } catch (IllegalArgumentException | UnsupportedOperationException | ArithmeticException e) {
                LOG.warn("cannot evaluate '{}': {}", line, e.getMessage());
                out.println("error: " + e.getMessage());
            }
        }
    }

    // simplify <expr> | diff <var> <expr> | integrate <var> <expr> | <expr>
    public String execute(String line) {
        String[] parts = line.split("\\s+", 2);
        String command = parts[0];
        LOG.debug("command '{}'", line);
        if (command.equals("simplify")) {
            return Printer.render(simplifier.simplify(Parser.parse(argument(parts, "simplify <expression>"))));
        }
        else if (command.equals("diff")) {
            String[] args = argument(parts, "diff <variable> <expression>").split("\\s+", 2);
            String expr = argument(args, "diff <variable> <expression>");
            return Printer.render(differentiator.diff(Parser.parse(expr), args[0]));
        }
        else if (command.equals("integrate")) {
            String[] args = argument(parts, "integrate <variable> <expression>").split("\\s+", 2);
            String expr = argument(args, "integrate <variable> <expression>");
            return integrator.integrate(Parser.parse(expr), args[0]).toString();
        }
        return Printer.render(simplifier.simplify(Parser.parse(line)));
    }

    private static String argument(String[] parts, String usage) {
        if (parts.length < 2 || parts[1].trim().isEmpty()) {
            throw new IllegalArgumentException("usage: " + usage);
        }
        return parts[1];
    }
}
