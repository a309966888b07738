package org.janelia.colortransport.ot;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * Named transport parameters. Values that are not set fall back to the defaults of each solver.
 */
public class TransportParams {

    /**
     * Regularization of a standalone {@link SinkhornSolver} created with {@link #createSinkhornSolver()}.
     * The blockwise method uses {@link #BLOCK_REG} instead.
     */
    public static final String REG = "reg";
    public static final String MAX_ITER = "maxIter";
    public static final String TOLERANCE = "tolerance";
    public static final String BLOCK_SIZE = "blockSize";
    public static final String BLOCK_REG = "blockReg";
    public static final String SAMPLE_SIZE = "sampleSize";
    public static final String BIN_COUNT = "binCount";

    private final Map<String, Object> params = new LinkedHashMap<>();

    public TransportParams setParam(String name, Object value) {
        if (value == null) {
            params.remove(name);
        } else {
            params.put(name, value);
        }
        return this;
    }

    public Integer getIntParam(String name, Integer defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Number) {
            return ((Number) value).intValue();
        } else if (StringUtils.isBlank(value.toString())) {
            return defaultValue;
        } else {
            return Integer.valueOf(value.toString().trim());
        }
    }

    public Double getDoubleParam(String name, Double defaultValue) {
        Object value = params.get(name);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Number) {
            return ((Number) value).doubleValue();
        } else if (StringUtils.isBlank(value.toString())) {
            return defaultValue;
        } else {
            return Double.valueOf(value.toString().trim());
        }
    }

    public double getReg() {
        return getDoubleParam(REG, SinkhornSolver.DEFAULT_REG);
    }

    public SinkhornSolver createSinkhornSolver() {
        return new SinkhornSolver(getReg(), getMaxIter(), getTolerance());
    }

    public int getMaxIter() {
        return getIntParam(MAX_ITER, SinkhornSolver.DEFAULT_MAX_ITER);
    }

    public double getTolerance() {
        return getDoubleParam(TOLERANCE, SinkhornSolver.DEFAULT_TOLERANCE);
    }

    public int getBlockSize() {
        return getIntParam(BLOCK_SIZE, BlockDecomposer.DEFAULT_BLOCK_SIZE);
    }

    public double getBlockReg() {
        return getDoubleParam(BLOCK_REG, BlockDecomposer.DEFAULT_BLOCK_REG);
    }

    public int getSampleSize() {
        return getIntParam(SAMPLE_SIZE, AssignmentSolver.DEFAULT_SAMPLE_SIZE);
    }

    public int getBinCount() {
        return getIntParam(BIN_COUNT, HistogramMatcher.DEFAULT_BIN_COUNT);
    }

    /**
     * @return the values, including the defaults, of the parameters used by the transport methods
     */
    public Map<String, Object> asMap() {
        Map<String, Object> effectiveParams = new LinkedHashMap<>();
        effectiveParams.put(MAX_ITER, getMaxIter());
        effectiveParams.put(TOLERANCE, getTolerance());
        effectiveParams.put(BLOCK_SIZE, getBlockSize());
        effectiveParams.put(BLOCK_REG, getBlockReg());
        effectiveParams.put(SAMPLE_SIZE, getSampleSize());
        effectiveParams.put(BIN_COUNT, getBinCount());
        return effectiveParams;
    }
}
