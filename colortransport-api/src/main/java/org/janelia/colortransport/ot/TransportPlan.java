package org.janelia.colortransport.ot;

/**
 * Dense N x M matrix of non negative weights - entry (i, j) is the mass moved from source i to target j.
 */
public class TransportPlan {
    private final int rows;
    private final int cols;
    private final double[] weights;

    public TransportPlan(int rows, int cols, double[] weights) {
        if (weights.length != rows * cols) {
            throw new IllegalArgumentException("Expected " + rows * cols + " weights for a "
                    + rows + "x" + cols + " plan but got " + weights.length);
        }
        this.rows = rows;
        this.cols = cols;
        this.weights = weights;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public double get(int i, int j) {
        return weights[i * cols + j];
    }

    public double rowSum(int i) {
        double s = 0;
        for (int j = 0; j < cols; j++) {
            s += weights[i * cols + j];
        }
        return s;
    }

    public double colSum(int j) {
        double s = 0;
        for (int i = 0; i < rows; i++) {
            s += weights[i * cols + j];
        }
        return s;
    }
}
