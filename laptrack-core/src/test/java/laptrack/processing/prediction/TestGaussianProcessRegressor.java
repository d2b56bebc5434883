package laptrack.processing.prediction;

import org.junit.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class TestGaussianProcessRegressor {

    @Test
    public void testLinearMotion() throws RegressionException {
        double[] t = new double[]{0, 1, 2, 3, 4};
        double[] x = new double[]{0, 2, 4, 6, 8};
        Estimate e = new GaussianProcessRegressor().predict(t, x, 5, 1);
        assertEquals("extrapolated position", 10, e.value, 1e-6);
        assertTrue("non-negative variance", e.variance>=0);
    }

    @Test
    public void testQuadraticMotion() throws RegressionException {
        double[] t = new double[]{1, 2, 3, 4, 5};
        double[] x = new double[]{1, 4, 9, 16, 25};
        Estimate e = new GaussianProcessRegressor().predict(t, x, 6, 1);
        assertEquals("extrapolated position", 36, e.value, 1e-6);
    }

    @Test
    public void testLinearRegressionModel() throws RegressionException {
        Map<String, Object> options = new HashMap<>();
        options.put(GaussianProcessRegressor.KEY_REGRESSION, "linear");
        options.put(GaussianProcessRegressor.KEY_CORRELATION, "absolute_exponential");
        options.put(GaussianProcessRegressor.KEY_THETA, 0.5);
        GaussianProcessRegressor gp = new GaussianProcessRegressor(options);
        assertEquals("options", options, gp.getOptions());
        Estimate e = gp.predict(new double[]{0, 1, 2}, new double[]{3, 2, 1}, 3, 1);
        assertEquals("extrapolated position", 0, e.value, 1e-6);
    }

    @Test
    public void testConstantSeries() throws RegressionException {
        Estimate e = new GaussianProcessRegressor().predict(new double[]{0, 1, 2, 3}, new double[]{5, 5, 5, 5}, 4, 1);
        assertEquals("constant series", 5, e.value, 1e-6);
    }

    @Test(expected = RegressionException.class)
    public void testNotEnoughSamples() throws RegressionException {
        new GaussianProcessRegressor().predict(new double[]{0, 1}, new double[]{0, 1}, 2, 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownOption() {
        new GaussianProcessRegressor(Collections.singletonMap("nugget", 0.1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownModel() {
        new GaussianProcessRegressor(Collections.singletonMap(GaussianProcessRegressor.KEY_CORRELATION, "cubic"));
    }
}
