import java.util.Scanner;

public class Main {
    public static void main(String[] args) {
        Solver solver = new Solver(new Scanner(System.in), System.out);
        solver.solve();
    }
}
