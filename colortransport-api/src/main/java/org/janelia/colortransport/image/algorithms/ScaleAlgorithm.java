package org.janelia.colortransport.image.algorithms;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import org.janelia.colortransport.image.ColorImages;
import org.janelia.colortransport.image.type.RGBPixelType;

/**
 * Separable cubic resampling. Pixel centers are aligned, i.e. destination pixel x is centered at
 * (x + 0.5) / scale in source coordinates. When shrinking, the kernel is stretched by 1 / scale so that
 * every source pixel contributes. Kernel taps outside the image are dropped and the remaining weights
 * renormalized. Results are clipped to [0, 255].
 */
public class ScaleAlgorithm {

    static final double ALPHA = 0.5; // Catmull-Rom interpolation
    static final double SUPPORT = 2.0;

    /**
     * Taps of the 1-D resampling kernel for every destination position.
     */
    private static class AxisWeights {
        final int[] first;
        final double[][] weights;

        AxisWeights(int srcSize, int dstSize) {
            double scale = (double) dstSize / srcSize;
            double filterScale = Math.max(1.0, 1.0 / scale);
            double support = SUPPORT * filterScale;
            first = new int[dstSize];
            weights = new double[dstSize][];
            for (int x = 0; x < dstSize; x++) {
                double center = (x + 0.5) / scale;
                int xmin = Math.max((int) (center - support + 0.5), 0);
                int xmax = Math.min((int) (center + support + 0.5), srcSize);
                double[] w = new double[Math.max(xmax - xmin, 0)];
                double wsum = 0;
                for (int i = 0; i < w.length; i++) {
                    w[i] = cubic((xmin + i - center + 0.5) / filterScale);
                    wsum += w[i];
                }
                if (wsum != 0) {
                    for (int i = 0; i < w.length; i++) {
                        w[i] /= wsum;
                    }
                }
                first[x] = xmin;
                weights[x] = w;
            }
        }
    }

    /**
     * Resize a [width, height, 3] channel array.
     */
    public static Img<DoubleType> scaleChannelArray(RandomAccessibleInterval<? extends RealType<?>> img,
                                                    int dstWidth, int dstHeight) {
        checkSize(dstWidth, dstHeight);
        AxisWeights xWeights = new AxisWeights((int) img.dimension(0), dstWidth);
        AxisWeights yWeights = new AxisWeights((int) img.dimension(1), dstHeight);
        Img<DoubleType> scaledImg = ColorImages.createChannelArray(dstWidth, dstHeight);
        for (int c = 0; c < RGBPixelType.CHANNELS; c++) {
            scalePlane(
                    Views.hyperSlice(Views.zeroMin(img), ColorImages.CHANNEL_AXIS, c),
                    xWeights, yWeights,
                    Views.hyperSlice(scaledImg, ColorImages.CHANNEL_AXIS, c));
        }
        return scaledImg;
    }

    /**
     * Resize a single 2-D plane, e.g. a luminance image.
     */
    public static Img<DoubleType> scale2DImage(RandomAccessibleInterval<? extends RealType<?>> img,
                                               int dstWidth, int dstHeight) {
        checkSize(dstWidth, dstHeight);
        Img<DoubleType> scaledImg = ArrayImgs.doubles(dstWidth, dstHeight);
        scalePlane(
                Views.zeroMin(img),
                new AxisWeights((int) img.dimension(0), dstWidth),
                new AxisWeights((int) img.dimension(1), dstHeight),
                scaledImg);
        return scaledImg;
    }

    private static void checkSize(int dstWidth, int dstHeight) {
        if (dstWidth <= 0 || dstHeight <= 0) {
            throw new IllegalArgumentException("Invalid target size " + dstWidth + "x" + dstHeight);
        }
    }

    private static void scalePlane(RandomAccessibleInterval<? extends RealType<?>> src,
                                   AxisWeights xWeights, AxisWeights yWeights,
                                   RandomAccessibleInterval<DoubleType> dst) {
        int srcHeight = (int) src.dimension(1);
        int dstWidth = xWeights.weights.length;
        int dstHeight = yWeights.weights.length;

        // scale along x first then along y
        double[] xScaled = new double[dstWidth * srcHeight];
        RandomAccess<? extends RealType<?>> srcRA = src.randomAccess();
        for (int y = 0; y < srcHeight; y++) {
            for (int x = 0; x < dstWidth; x++) {
                double[] w = xWeights.weights[x];
                double value = 0;
                for (int i = 0; i < w.length; i++) {
                    value += srcRA.setPositionAndGet(xWeights.first[x] + i, y).getRealDouble() * w[i];
                }
                xScaled[y * dstWidth + x] = value;
            }
        }

        RandomAccess<DoubleType> dstRA = dst.randomAccess();
        for (int y = 0; y < dstHeight; y++) {
            double[] w = yWeights.weights[y];
            for (int x = 0; x < dstWidth; x++) {
                double value = 0;
                for (int i = 0; i < w.length; i++) {
                    value += xScaled[(yWeights.first[y] + i) * dstWidth + x] * w[i];
                }
                // cubic kernels overshoot near edges
                dstRA.setPositionAndGet(x, y).set(ColorImages.clip(value));
            }
        }
    }

    private static double cubic(double x) {
        if (x < 0.0) x = -x;
        double z = 0.0;
        if (x < 1.0)
            z = x * x * (x * (-ALPHA + 2.0) + (ALPHA - 3.0)) + 1.0;
        else if (x < 2.0)
            z = -ALPHA * x * x * x + 5.0 * ALPHA * x * x - 8.0 * ALPHA * x + 4.0 * ALPHA;
        return z;
    }
}
