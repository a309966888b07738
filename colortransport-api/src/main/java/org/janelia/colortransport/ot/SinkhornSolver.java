package org.janelia.colortransport.ot;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entropy regularized optimal transport between two pixel sets with uniform marginals.
 */
public class SinkhornSolver {

    private static final Logger LOG = LoggerFactory.getLogger(SinkhornSolver.class);

    public static final double DEFAULT_REG = 0.1;
    public static final int DEFAULT_MAX_ITER = 100;
    public static final double DEFAULT_TOLERANCE = 1e-6;

    private static final double EPS = 1e-10;

    private final double reg;
    private final int maxIter;
    private final double tolerance;

    public SinkhornSolver() {
        this(DEFAULT_REG, DEFAULT_MAX_ITER, DEFAULT_TOLERANCE);
    }

    /**
     * @param reg regularization - smaller values give a sharper plan
     * @param maxIter maximum number of scaling iterations
     * @param tolerance iterations stop once no entry of the source scaling vector changes by more than this
     */
    public SinkhornSolver(double reg, int maxIter, double tolerance) {
        if (reg <= 0) {
            throw new InvalidTransportInputException("Regularization must be positive - current value is " + reg);
        }
        if (maxIter < 1) {
            throw new InvalidTransportInputException("Max iterations must be at least 1 - current value is " + maxIter);
        }
        if (tolerance < 0) {
            throw new InvalidTransportInputException("Tolerance cannot be negative - current value is " + tolerance);
        }
        this.reg = reg;
        this.maxIter = maxIter;
        this.tolerance = tolerance;
    }

    /**
     * Solve the regularized problem. If the iterations do not converge the current estimate is returned.
     *
     * @param source N source colors
     * @param target M target colors
     * @return N x M transport plan diag(u) K diag(v)
     */
    public TransportPlan solve(PixelSet source, PixelSet target) {
        CostMatrix costMatrix = CostModel.euclideanCost(source, target);
        int n = costMatrix.getRows();
        int m = costMatrix.getCols();

        double[] kernel = new double[n * m];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                kernel[i * m + j] = Math.exp(-costMatrix.get(i, j) / reg);
            }
        }
        double a = 1. / n;
        double b = 1. / m;
        double[] u = new double[n];
        double[] v = new double[m];
        Arrays.fill(u, a);
        Arrays.fill(v, b);

        int iter = 0;
        boolean converged = false;
        while (iter < maxIter && !converged) {
            double maxChange = 0;
            for (int i = 0; i < n; i++) {
                double kv = 0;
                for (int j = 0; j < m; j++) {
                    kv += kernel[i * m + j] * v[j];
                }
                double ui = a / (kv + EPS);
                maxChange = Math.max(maxChange, Math.abs(ui - u[i]));
                u[i] = ui;
            }
            for (int j = 0; j < m; j++) {
                double ktu = 0;
                for (int i = 0; i < n; i++) {
                    ktu += kernel[i * m + j] * u[i];
                }
                v[j] = b / (ktu + EPS);
            }
            iter++;
            converged = maxChange < tolerance;
        }
        if (converged) {
            LOG.debug("Sinkhorn converged for {}x{} problem after {} iterations", n, m, iter);
        } else {
            LOG.debug("Sinkhorn stopped for {}x{} problem after {} iterations without converging", n, m, iter);
        }

        double[] plan = new double[n * m];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                plan[i * m + j] = u[i] * kernel[i * m + j] * v[j];
            }
        }
        return new TransportPlan(n, m, plan);
    }
}
