package org.janelia.colortransport.ot;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.IntervalView;
import net.imglib2.view.Views;
import org.janelia.colortransport.image.ColorImages;
import org.janelia.colortransport.image.type.RGBPixelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approximate color transport that matches the cumulative histograms of every channel independently.
 */
public class HistogramMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(HistogramMatcher.class);

    public static final int DEFAULT_BIN_COUNT = 64;

    private final int binCount;

    public HistogramMatcher() {
        this(DEFAULT_BIN_COUNT);
    }

    public HistogramMatcher(int binCount) {
        if (binCount < 1) {
            throw new InvalidTransportInputException("Bin count must be at least 1 - current value is " + binCount);
        }
        this.binCount = binCount;
    }

    /**
     * Remap every source channel value to the center of the target bin whose cumulative frequency is
     * the closest to the one of the value's source bin.
     *
     * @return channel array with the source's shape holding integer values in [0, 255]
     */
    public Img<DoubleType> transport(RandomAccessibleInterval<? extends RealType<?>> source,
                                     RandomAccessibleInterval<? extends RealType<?>> target) {
        Img<DoubleType> output = ColorImages.copyChannelArray(source);
        for (int c = 0; c < RGBPixelType.CHANNELS; c++) {
            double[] sourceCdf = cdf(histogram(Views.hyperSlice(Views.zeroMin(source), ColorImages.CHANNEL_AXIS, c)));
            double[] targetCdf = cdf(histogram(Views.hyperSlice(Views.zeroMin(target), ColorImages.CHANNEL_AXIS, c)));
            double[] binMapping = binMapping(sourceCdf, targetCdf);

            Cursor<DoubleType> channelCursor = Views.flatIterable(Views.hyperSlice(output, ColorImages.CHANNEL_AXIS, c)).cursor();
            while (channelCursor.hasNext()) {
                DoubleType px = channelCursor.next();
                px.set(ColorImages.clipAndRound(binMapping[binIndex(px.get())]));
            }
        }
        LOG.debug("Matched {} channel histograms using {} bins", RGBPixelType.CHANNELS, binCount);
        return output;
    }

    /**
     * Count the values in [0, 255] falling in each of the binCount equal width bins. The last bin includes 255.
     */
    long[] histogram(IntervalView<? extends RealType<?>> channel) {
        long[] bins = new long[binCount];
        Cursor<? extends RealType<?>> cursor = Views.flatIterable(channel).cursor();
        while (cursor.hasNext()) {
            double v = cursor.next().getRealDouble();
            if (v >= 0 && v <= ColorImages.MAX_CHANNEL_VALUE) {
                bins[binIndex(v)]++;
            }
        }
        return bins;
    }

    /**
     * Normalized cumulative distribution. An empty histogram gives an all zero distribution.
     */
    static double[] cdf(long[] histogram) {
        double[] cdf = new double[histogram.length];
        long total = 0;
        for (int i = 0; i < histogram.length; i++) {
            total += histogram[i];
            cdf[i] = total;
        }
        if (total > 0) {
            for (int i = 0; i < cdf.length; i++) {
                cdf[i] /= total;
            }
        }
        return cdf;
    }

    double[] binMapping(double[] sourceCdf, double[] targetCdf) {
        double[] mapping = new double[binCount];
        for (int i = 0; i < binCount; i++) {
            int closestBin = 0;
            double closestDiff = Double.POSITIVE_INFINITY;
            for (int j = 0; j < binCount; j++) {
                double diff = Math.abs(targetCdf[j] - sourceCdf[i]);
                if (diff < closestDiff) {
                    closestDiff = diff;
                    closestBin = j;
                }
            }
            mapping[i] = binCenter(closestBin);
        }
        return mapping;
    }

    int binIndex(double value) {
        int bin = (int) Math.floor(value * binCount / ColorImages.MAX_CHANNEL_VALUE);
        return Math.max(0, Math.min(binCount - 1, bin));
    }

    double binCenter(int bin) {
        return (bin + 0.5) * ColorImages.MAX_CHANNEL_VALUE / binCount;
    }
}
