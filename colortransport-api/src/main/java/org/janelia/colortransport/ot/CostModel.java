package org.janelia.colortransport.ot;

/**
 * Pairwise color distances between two pixel sets.
 */
public class CostModel {

    /**
     * Compute the euclidean distance between every source and every target color and divide
     * all entries by the largest one. If all distances are 0 the matrix is left as is.
     *
     * @param source N source colors
     * @param target M target colors
     * @return N x M normalized cost matrix
     */
    public static CostMatrix euclideanCost(PixelSet source, PixelSet target) {
        if (source.isEmpty() || target.isEmpty()) {
            throw new InvalidTransportInputException("Cannot compute the cost between " + source.size() + " source pixels and "
                    + target.size() + " target pixels");
        }
        int n = source.size();
        int m = target.size();
        double[] values = new double[n * m];
        double maxValue = 0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                double d = source.distance(i, target, j);
                values[i * m + j] = d;
                if (d > maxValue) {
                    maxValue = d;
                }
            }
        }
        double norm = maxValue > 0 ? maxValue : 1;
        for (int k = 0; k < values.length; k++) {
            values[k] /= norm;
        }
        return new CostMatrix(n, m, values);
    }
}
