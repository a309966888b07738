package org.janelia.colortransport.quality;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import org.janelia.colortransport.image.ColorImages;
import org.janelia.colortransport.image.algorithms.ScaleAlgorithm;
import org.janelia.colortransport.image.type.RGBPixelType;
import org.janelia.colortransport.ot.InvalidTransportInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mean structural similarity (SSIM) of the luminance of two color images, computed with a 7x7 uniform
 * window and sample covariances.
 */
public class StructuralSimilarity {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralSimilarity.class);

    static final int WINDOW_SIZE = 7;
    private static final double K1 = 0.01;
    private static final double K2 = 0.03;
    private static final double DATA_RANGE = 255.;

    /**
     * @param img1 [width, height, 3] reference array
     * @param img2 [width, height, 3] array - its luminance is resized to the shape of img1 if needed
     * @return mean SSIM in [-1, 1], 1 for identical images
     */
    public static double compute(RandomAccessibleInterval<? extends RealType<?>> img1,
                                 RandomAccessibleInterval<? extends RealType<?>> img2) {
        int width = (int) ColorImages.width(img1);
        int height = (int) ColorImages.height(img1);
        if (width < WINDOW_SIZE || height < WINDOW_SIZE) {
            throw new InvalidTransportInputException("SSIM requires images of at least " + WINDOW_SIZE + "x" + WINDOW_SIZE
                    + " pixels but got " + width + "x" + height);
        }
        double[] x = luminance(img1);
        double[] y;
        if (ColorImages.differentShape(img1, img2)) {
            y = resizeLuminance(img2, width, height);
        } else {
            y = luminance(img2);
        }

        double[] ux = uniformFilter(x, width, height);
        double[] uy = uniformFilter(y, width, height);
        double[] uxx = uniformFilter(product(x, x), width, height);
        double[] uyy = uniformFilter(product(y, y), width, height);
        double[] uxy = uniformFilter(product(x, y), width, height);

        double np = WINDOW_SIZE * WINDOW_SIZE;
        double covNorm = np / (np - 1);
        double c1 = (K1 * DATA_RANGE) * (K1 * DATA_RANGE);
        double c2 = (K2 * DATA_RANGE) * (K2 * DATA_RANGE);

        int pad = (WINDOW_SIZE - 1) / 2;
        double ssimSum = 0;
        long count = 0;
        for (int r = pad; r < height - pad; r++) {
            for (int c = pad; c < width - pad; c++) {
                int i = r * width + c;
                double vx = covNorm * (uxx[i] - ux[i] * ux[i]);
                double vy = covNorm * (uyy[i] - uy[i] * uy[i]);
                double vxy = covNorm * (uxy[i] - ux[i] * uy[i]);
                double num = (2 * ux[i] * uy[i] + c1) * (2 * vxy + c2);
                double den = (ux[i] * ux[i] + uy[i] * uy[i] + c1) * (vx + vy + c2);
                ssimSum += num / den;
                count++;
            }
        }
        double score = ssimSum / count;
        LOG.debug("SSIM of {}x{} images: {}", width, height, score);
        return score;
    }

    /**
     * ITU-R 601-2 luma of the rounded 8 bit colors, stored row by row.
     */
    static double[] luminance(RandomAccessibleInterval<? extends RealType<?>> img) {
        int width = (int) ColorImages.width(img);
        int height = (int) ColorImages.height(img);
        double[] l = new double[width * height];
        RandomAccess<? extends RealType<?>> imgRA = Views.zeroMin(img).randomAccess();
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                int red = ColorImages.clipAndRound(imgRA.setPositionAndGet(c, r, RGBPixelType.RED).getRealDouble());
                int green = ColorImages.clipAndRound(imgRA.setPositionAndGet(c, r, RGBPixelType.GREEN).getRealDouble());
                int blue = ColorImages.clipAndRound(imgRA.setPositionAndGet(c, r, RGBPixelType.BLUE).getRealDouble());
                l[r * width + c] = (red * 19595 + green * 38470 + blue * 7471 + 0x8000) >> 16;
            }
        }
        return l;
    }

    /**
     * Convert to luminance first and resize the 8 bit luminance plane.
     */
    private static double[] resizeLuminance(RandomAccessibleInterval<? extends RealType<?>> img, int width, int height) {
        int srcWidth = (int) ColorImages.width(img);
        int srcHeight = (int) ColorImages.height(img);
        if (srcWidth == 0 || srcHeight == 0) {
            throw new InvalidTransportInputException("Cannot compare with an empty image");
        }
        Img<DoubleType> scaledLuminance = ScaleAlgorithm.scale2DImage(
                ArrayImgs.doubles(luminance(img), srcWidth, srcHeight), width, height);
        double[] l = new double[width * height];
        int i = 0;
        for (DoubleType px : Views.flatIterable(scaledLuminance)) {
            l[i++] = ColorImages.clipAndRound(px.get());
        }
        return l;
    }

    private static double[] product(double[] a, double[] b) {
        double[] p = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            p[i] = a[i] * b[i];
        }
        return p;
    }

    /**
     * Mean over a WINDOW_SIZE x WINDOW_SIZE window; the border is mirrored including the edge pixel.
     */
    private static double[] uniformFilter(double[] values, int width, int height) {
        int radius = WINDOW_SIZE / 2;
        double[] rowFiltered = new double[values.length];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                double s = 0;
                for (int k = -radius; k <= radius; k++) {
                    s += values[r * width + reflect(c + k, width)];
                }
                rowFiltered[r * width + c] = s / WINDOW_SIZE;
            }
        }
        double[] filtered = new double[values.length];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                double s = 0;
                for (int k = -radius; k <= radius; k++) {
                    s += rowFiltered[reflect(r + k, height) * width + c];
                }
                filtered[r * width + c] = s / WINDOW_SIZE;
            }
        }
        return filtered;
    }

    private static int reflect(int pos, int size) {
        if (pos < 0) return -pos - 1;
        if (pos >= size) return 2 * size - pos - 1;
        return pos;
    }
}
