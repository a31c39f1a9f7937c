import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collection;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

// differentiating a found antiderivative gives back the simplified integrand
@RunWith(Parameterized.class)
public class IntegrationConsistencyTest {
    private final Simplifier simplifier = new Simplifier();
    private final Differentiator differentiator = new Differentiator(simplifier);
    private final Integrator integrator = new Integrator(simplifier, differentiator);
    private final String integrand;

    public IntegrationConsistencyTest(String integrand) {
        this.integrand = integrand;
    }

    @Parameters
    public static Collection<Object[]> prepareData() {
        return Arrays.asList(new Object[][]{
            {"5"},
            {"x"},
            {"x^2"},
            {"x + 1"},
            {"1/x"},
            {"sin(x)"},
            {"ln(x)"},
            {"sin(2*x+1)"},
            {"exp(3*x)"},
            {"(2*x+1)^3"},
            {"x*exp(x^2+1)"},
            {"2*x/(1+x^2)"},
            {"x*(x^2+1)^3"},
            {"sin(x)*cos(x)"},
            {"cos(x^2)*x"},
            {"(2+y)^2"},
            {"(4+2*y)^2"},
            {"1/(2*x+2)"},
            {"(1-x)^3"},
        });
    }

    @Test
    public void derivativeOfAntiderivativeIsIntegrand() {
        Expr e = Parser.parse(integrand);
        IntegrationResult result = integrator.integrate(e, "x");
        assertTrue(integrand, result.isSuccess());
        Expr back = differentiator.diff(result.getAntiderivative(), "x");
        assertEquals(integrand, simplifier.simplify(e), simplifier.simplify(back));
    }
}
