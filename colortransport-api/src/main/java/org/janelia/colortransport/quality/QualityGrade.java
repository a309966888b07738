package org.janelia.colortransport.quality;

/**
 * Grade of a transformed image based on its structural similarity with the target.
 */
public enum QualityGrade {
    EXCELLENT(0.75),
    ACCEPTABLE(0.70),
    BELOW_THRESHOLD(Double.NEGATIVE_INFINITY);

    private final double minScore;

    QualityGrade(double minScore) {
        this.minScore = minScore;
    }

    public boolean isPublishable() {
        return this != BELOW_THRESHOLD;
    }

    public static QualityGrade forScore(double score) {
        for (QualityGrade grade : values()) {
            if (score >= grade.minScore) {
                return grade;
            }
        }
        // only NaN gets here
        return BELOW_THRESHOLD;
    }
}
