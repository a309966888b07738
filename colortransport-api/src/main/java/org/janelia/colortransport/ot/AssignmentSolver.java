package org.janelia.colortransport.ot;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact minimum cost matching between two pixel sets. The matching problem is cubic in the number of
 * pixels so the larger sets are reduced to an evenly spaced sample of at most sampleSize pixels.
 */
public class AssignmentSolver {

    private static final Logger LOG = LoggerFactory.getLogger(AssignmentSolver.class);

    public static final int DEFAULT_SAMPLE_SIZE = 2000;

    private final int sampleSize;

    public AssignmentSolver() {
        this(DEFAULT_SAMPLE_SIZE);
    }

    public AssignmentSolver(int sampleSize) {
        if (sampleSize < 1) {
            throw new InvalidTransportInputException("Sample size must be at least 1 - current value is " + sampleSize);
        }
        this.sampleSize = sampleSize;
    }

    /**
     * Pair min(N, M, sampleSize) source pixels with the same number of target pixels
     * so that the sum of the pair costs is minimal.
     */
    public Assignment solve(PixelSet source, PixelSet target) {
        if (source.isEmpty() || target.isEmpty()) {
            throw new InvalidTransportInputException("Cannot match " + source.size() + " source pixels with "
                    + target.size() + " target pixels");
        }
        int n = Math.min(Math.min(source.size(), target.size()), sampleSize);
        int[] sourceSample = evenlySpacedIndices(source.size(), n);
        int[] targetSample = evenlySpacedIndices(target.size(), n);
        boolean subsampled = source.size() > n || target.size() > n;

        LOG.info("Computing cost matrix for {}x{} pixels", n, n);
        CostMatrix costMatrix = CostModel.euclideanCost(source.select(sourceSample), target.select(targetSample));

        long startTime = System.currentTimeMillis();
        int[] rowToCol = minCostPerfectMatching(costMatrix);
        LOG.info("Solved {}x{} assignment in {}s", n, n, (System.currentTimeMillis() - startTime) / 1000.);

        int[] sourceIndices = new int[n];
        int[] targetIndices = new int[n];
        double totalCost = 0;
        for (int i = 0; i < n; i++) {
            sourceIndices[i] = sourceSample[i];
            targetIndices[i] = targetSample[rowToCol[i]];
            totalCost += costMatrix.get(i, rowToCol[i]);
        }
        return new Assignment(sourceIndices, targetIndices, totalCost, subsampled);
    }

    /**
     * @return n indices spread evenly over [0, size - 1], or all indices if size <= n
     */
    static int[] evenlySpacedIndices(int size, int n) {
        int[] indices = new int[n];
        if (size <= n) {
            for (int k = 0; k < n; k++) {
                indices[k] = k;
            }
        } else if (n > 1) {
            for (int k = 0; k < n; k++) {
                indices[k] = (int) ((long) k * (size - 1) / (n - 1));
            }
        }
        return indices;
    }

    /**
     * Shortest augmenting path variant of the Hungarian algorithm with row and column potentials.
     *
     * @param costMatrix square cost matrix
     * @return the column matched to each row
     */
    static int[] minCostPerfectMatching(CostMatrix costMatrix) {
        int n = costMatrix.getRows();
        if (costMatrix.getCols() != n) {
            throw new IllegalArgumentException("Expected a square cost matrix but got "
                    + n + "x" + costMatrix.getCols());
        }
        // 1-based - row and column 0 are sentinels
        double[] rowPotential = new double[n + 1];
        double[] colPotential = new double[n + 1];
        int[] colMatch = new int[n + 1];
        int[] way = new int[n + 1];
        double[] minSlack = new double[n + 1];
        boolean[] visited = new boolean[n + 1];

        for (int row = 1; row <= n; row++) {
            colMatch[0] = row;
            int col0 = 0;
            Arrays.fill(minSlack, Double.POSITIVE_INFINITY);
            Arrays.fill(visited, false);
            do {
                visited[col0] = true;
                int row0 = colMatch[col0];
                double delta = Double.POSITIVE_INFINITY;
                int col1 = 0;
                for (int col = 1; col <= n; col++) {
                    if (!visited[col]) {
                        double slack = costMatrix.get(row0 - 1, col - 1) - rowPotential[row0] - colPotential[col];
                        if (slack < minSlack[col]) {
                            minSlack[col] = slack;
                            way[col] = col0;
                        }
                        if (minSlack[col] < delta) {
                            delta = minSlack[col];
                            col1 = col;
                        }
                    }
                }
                for (int col = 0; col <= n; col++) {
                    if (visited[col]) {
                        rowPotential[colMatch[col]] += delta;
                        colPotential[col] -= delta;
                    } else {
                        minSlack[col] -= delta;
                    }
                }
                col0 = col1;
            } while (colMatch[col0] != 0);
            // flip the augmenting path
            do {
                int col1 = way[col0];
                colMatch[col0] = colMatch[col1];
                col0 = col1;
            } while (col0 != 0);
        }

        int[] rowToCol = new int[n];
        for (int col = 1; col <= n; col++) {
            rowToCol[colMatch[col] - 1] = col - 1;
        }
        return rowToCol;
    }
}
