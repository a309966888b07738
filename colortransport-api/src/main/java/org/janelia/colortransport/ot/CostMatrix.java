package org.janelia.colortransport.ot;

/**
 * Dense rows x cols matrix of normalized distances, all entries are in [0, 1].
 */
public class CostMatrix {
    private final int rows;
    private final int cols;
    private final double[] values;

    CostMatrix(int rows, int cols, double[] values) {
        this.rows = rows;
        this.cols = cols;
        this.values = values;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public double get(int i, int j) {
        return values[i * cols + j];
    }
}
