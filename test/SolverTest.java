import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Scanner;

import org.junit.Test;

public class SolverTest {

    private String[] run(String input) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true);
        new Solver(new Scanner(input), out).solve();
        return bytes.toString().split("\\R");
    }

    @Test
    public void commands() {
        String[] lines = run(String.join("\n",
            "3*x+2*x",
            "diff x x^2 + 2*x + 1",
            "",
            "integrate x x*exp(x^2+1)",
            "simplify cos(x)^2 - sin(x)^2",
            "integrate x exp(x^2)"));
        assertArrayEquals(new String[]{
            "5 * x",
            "2 + 2 * x",
            "0.5 * exp(1 + x^2)",
            "cos(2 * x)",
            "integration failed: exp(x^2)",
        }, lines);
    }

    @Test
    public void errorsAreReportedAndProcessingContinues() {
        String[] lines = run("1/0\nsin(x\ndiff\nx+x\n");
        assertEquals(4, lines.length);
        assertTrue(lines[0], lines[0].startsWith("error: division by zero"));
        assertTrue(lines[1], lines[1].startsWith("error: expected ')'"));
        assertEquals("error: usage: diff <variable> <expression>", lines[2]);
        assertEquals("2 * x", lines[3]);
    }

    @Test
    public void unsupportedVariableIsAnError() {
        String[] lines = run("diff 1x x^2");
        assertEquals(1, lines.length);
        assertTrue(lines[0], lines[0].startsWith("error: cannot differentiate"));
    }
}
