package org.janelia.colortransport.ot;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * One to one pairing between source and target pixel indices.
 * The pair k is (getSourceIndex(k), getTargetIndex(k)). Indices refer to the full,
 * not subsampled, pixel sets.
 */
public class Assignment {
    private final int[] sourceIndices;
    private final int[] targetIndices;
    private final double totalCost;
    private final boolean subsampled;

    Assignment(int[] sourceIndices, int[] targetIndices, double totalCost, boolean subsampled) {
        this.sourceIndices = sourceIndices;
        this.targetIndices = targetIndices;
        this.totalCost = totalCost;
        this.subsampled = subsampled;
    }

    public int size() {
        return sourceIndices.length;
    }

    public int getSourceIndex(int k) {
        return sourceIndices[k];
    }

    public int getTargetIndex(int k) {
        return targetIndices[k];
    }

    /**
     * @return sum of the normalized costs of all pairs
     */
    public double getTotalCost() {
        return totalCost;
    }

    /**
     * @return true if the pairing was computed on a sample of the pixels, in which case it is only
     * optimal for the sample
     */
    public boolean isSubsampled() {
        return subsampled;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("pairs", size())
                .append("totalCost", totalCost)
                .append("subsampled", subsampled)
                .toString();
    }
}
