/* 
 * Copyright (C) 2026 LAPTrack developers
 *
 * This File is part of LAPTrack
 *
 * LAPTrack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * LAPTrack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with LAPTrack.  If not, see <http://www.gnu.org/licenses/>.
 */
package laptrack.processing.prediction;

import laptrack.utils.SettingsUtils;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.*;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Universal kriging of a one-dimensional time series: a polynomial trend (regression model) plus a stationary Gaussian process (correlation model), with a fixed correlation parameter.
 * Inputs and outputs are centered and scaled before fitting. Each sample carries its own noise term (nugget) added to the diagonal of the correlation matrix.
 * See Sacks et al., Statistical Science 1989 and Lophaven et al., DACE, 2002.
 */
public class GaussianProcessRegressor implements Regressor {
    public static final Logger logger = LoggerFactory.getLogger(GaussianProcessRegressor.class);
    public static final String KEY_REGRESSION = "regr";
    public static final String KEY_CORRELATION = "corr";
    public static final String KEY_THETA = "theta0";

    public enum RegressionModel {
        CONSTANT("constant", 1), LINEAR("linear", 2), QUADRATIC("quadratic", 3);
        final String name;
        final int size;
        RegressionModel(String name, int size) {
            this.name = name;
            this.size = size;
        }
        public String getName() {
            return name;
        }
        public double[] basis(double x) {
            switch (this) {
                case CONSTANT:
                default:
                    return new double[]{1};
                case LINEAR:
                    return new double[]{1, x};
                case QUADRATIC:
                    return new double[]{1, x, x * x};
            }
        }
        public static RegressionModel get(String name) {
            return Arrays.stream(values()).filter(r -> r.name.equals(name)).findAny().orElseThrow(() -> new IllegalArgumentException("Unknown regression model: "+name));
        }
    }

    public enum CorrelationModel {
        SQUARED_EXPONENTIAL("squared_exponential", d -> d * d), ABSOLUTE_EXPONENTIAL("absolute_exponential", Math::abs);
        final String name;
        final DoubleUnaryOperator distance;
        CorrelationModel(String name, DoubleUnaryOperator distance) {
            this.name = name;
            this.distance = distance;
        }
        public String getName() {
            return name;
        }
        public double correlation(double theta, double d) {
            return Math.exp(-theta * distance.applyAsDouble(d));
        }
        public static CorrelationModel get(String name) {
            return Arrays.stream(values()).filter(r -> r.name.equals(name)).findAny().orElseThrow(() -> new IllegalArgumentException("Unknown correlation model: "+name));
        }
    }

    RegressionModel regression = RegressionModel.QUADRATIC;
    CorrelationModel correlation = CorrelationModel.SQUARED_EXPONENTIAL;
    double theta = 0.1;

    public GaussianProcessRegressor() { }

    /**
     *
     * @param options values for keys {@link #KEY_REGRESSION}, {@link #KEY_CORRELATION} and {@link #KEY_THETA}. Missing keys take default values
     * @throws IllegalArgumentException if a key or a value is invalid
     */
    public GaussianProcessRegressor(Map<String, ?> options) {
        StringBuilder errors = new StringBuilder();
        boolean ok = SettingsUtils.checkMapKeys(options, null, Arrays.asList(KEY_REGRESSION, KEY_CORRELATION, KEY_THETA), errors);
        ok = ok & SettingsUtils.checkOptionalParameter(options, KEY_REGRESSION, String.class, errors);
        ok = ok & SettingsUtils.checkOptionalParameter(options, KEY_CORRELATION, String.class, errors);
        ok = ok & SettingsUtils.checkOptionalParameter(options, KEY_THETA, Number.class, errors);
        if (!ok) throw new IllegalArgumentException("Invalid predictor options:\n"+errors);
        if (options.containsKey(KEY_REGRESSION)) setRegression(RegressionModel.get((String)options.get(KEY_REGRESSION)));
        if (options.containsKey(KEY_CORRELATION)) setCorrelation(CorrelationModel.get((String)options.get(KEY_CORRELATION)));
        if (options.containsKey(KEY_THETA)) setTheta(((Number)options.get(KEY_THETA)).doubleValue());
    }

    public GaussianProcessRegressor setRegression(RegressionModel regression) {
        this.regression = regression;
        return this;
    }

    public GaussianProcessRegressor setCorrelation(CorrelationModel correlation) {
        this.correlation = correlation;
        return this;
    }

    public GaussianProcessRegressor setTheta(double theta) {
        if (!(theta>0)) throw new IllegalArgumentException(KEY_THETA+" should be positive");
        this.theta = theta;
        return this;
    }

    public Map<String, Object> getOptions() {
        Map<String, Object> res = new HashMap<>();
        res.put(KEY_REGRESSION, regression.getName());
        res.put(KEY_CORRELATION, correlation.getName());
        res.put(KEY_THETA, theta);
        return res;
    }

    @Override
    public Estimate predict(double[] times, double[] values, double queryTime, double sigma) throws RegressionException {
        if (times.length!=values.length) throw new IllegalArgumentException("times and values should have same length");
        final int n = times.length;
        final int p = regression.size;
        if (n<p) throw new RegressionException("Not enough samples for "+regression.getName()+" regression: "+n);
        // normalization
        double xMean = StatUtils.mean(times);
        double xStd = std(times, xMean);
        double yMean = StatUtils.mean(values);
        double yStd = std(values, yMean);
        double[] x = Arrays.stream(times).map(t -> (t - xMean) / xStd).toArray();
        double[] y = Arrays.stream(values).map(v -> (v - yMean) / yStd).toArray();
        try {
            RealMatrix R = MatrixUtils.createRealMatrix(n, n);
            for (int i = 0; i<n; ++i) {
                double nugget = sigma / (Math.abs(values[i]) + sigma);
                R.setEntry(i, i, 1 + nugget * nugget);
                for (int j = 0; j<i; ++j) {
                    double c = correlation.correlation(theta, x[i] - x[j]);
                    R.setEntry(i, j, c);
                    R.setEntry(j, i, c);
                }
            }
            RealMatrix F = MatrixUtils.createRealMatrix(n, p);
            for (int i = 0; i<n; ++i) F.setRow(i, regression.basis(x[i]));
            RealMatrix L = new CholeskyDecomposition(R).getL();
            RealMatrix Ft = solveLower(L, F);
            RealVector Yt = new ArrayRealVector(y);
            MatrixUtils.solveLowerTriangularSystem(L, Yt);
            QRDecomposition qr = new QRDecomposition(Ft, 1e-10);
            RealMatrix G = qr.getR().getSubMatrix(0, p-1, 0, p-1);
            RealVector beta = qr.getSolver().solve(Yt);
            RealVector rho = Yt.subtract(Ft.operate(beta));
            double sigma2 = rho.dotProduct(rho) / n;
            RealVector gamma = rho.copy();
            MatrixUtils.solveUpperTriangularSystem(L.transpose(), gamma);

            double xq = (queryTime - xMean) / xStd;
            RealVector f = new ArrayRealVector(regression.basis(xq));
            RealVector r = new ArrayRealVector(n);
            for (int i = 0; i<n; ++i) r.setEntry(i, correlation.correlation(theta, xq - x[i]));
            double value = yMean + yStd * (f.dotProduct(beta) + r.dotProduct(gamma));
            RealVector rt = r.copy();
            MatrixUtils.solveLowerTriangularSystem(L, rt);
            RealVector u = Ft.transpose().operate(rt).subtract(f);
            MatrixUtils.solveLowerTriangularSystem(G.transpose(), u);
            double mse = sigma2 * yStd * yStd * (1 - rt.dotProduct(rt) + u.dotProduct(u));
            return new Estimate(value, Math.max(0, mse));
        } catch (MathIllegalArgumentException | MathArithmeticException e) {
            throw new RegressionException("Gaussian process regression failed on "+n+" samples", e);
        }
    }

    private static double std(double[] values, double mean) {
        double std = Math.sqrt(StatUtils.populationVariance(values, mean));
        return std == 0 ? 1 : std;
    }

    private static RealMatrix solveLower(RealMatrix L, RealMatrix B) {
        RealMatrix res = B.copy();
        for (int c = 0; c<B.getColumnDimension(); ++c) {
            RealVector col = B.getColumnVector(c);
            MatrixUtils.solveLowerTriangularSystem(L, col);
            res.setColumnVector(c, col);
        }
        return res;
    }

    @Override
    public String toString() {
        return "GaussianProcessRegressor: regr="+regression.getName()+" corr="+correlation.getName()+" theta0="+theta;
    }
}
