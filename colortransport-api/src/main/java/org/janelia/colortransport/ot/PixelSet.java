package org.janelia.colortransport.ot;

import java.util.Arrays;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;
import org.janelia.colortransport.image.ColorImages;
import org.janelia.colortransport.image.type.RGBPixelType;

/**
 * Ordered sequence of RGB color vectors. Pixels taken from an image region are ordered row by row.
 */
public class PixelSet {

    private static final int C = RGBPixelType.CHANNELS;

    public static PixelSet of(double[]... colors) {
        double[] values = new double[colors.length * C];
        for (int i = 0; i < colors.length; i++) {
            if (colors[i].length != C) {
                throw new InvalidTransportInputException("Color " + i + " has " + colors[i].length + " channels instead of " + C);
            }
            System.arraycopy(colors[i], 0, values, i * C, C);
        }
        return new PixelSet(values);
    }

    public static PixelSet fromChannelArray(RandomAccessibleInterval<? extends RealType<?>> channels) {
        return fromRegion(channels, new Block(0, 0, (int) ColorImages.width(channels), (int) ColorImages.height(channels)));
    }

    /**
     * @param channels [width, height, 3] channel array
     * @param block region to extract
     */
    public static PixelSet fromRegion(RandomAccessibleInterval<? extends RealType<?>> channels, Block block) {
        double[] values = new double[block.getPixelCount() * C];
        RandomAccess<? extends RealType<?>> channelsRA = Views.zeroMin(channels).randomAccess();
        int pi = 0;
        for (int y = block.getY(); y < block.getY() + block.getHeight(); y++) {
            for (int x = block.getX(); x < block.getX() + block.getWidth(); x++) {
                for (int c = 0; c < C; c++) {
                    values[pi++] = channelsRA.setPositionAndGet(x, y, c).getRealDouble();
                }
            }
        }
        return new PixelSet(values);
    }

    private final double[] values;

    private PixelSet(double[] values) {
        this.values = values;
    }

    public int size() {
        return values.length / C;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double get(int i, int c) {
        return values[i * C + c];
    }

    public double[] getColor(int i) {
        return Arrays.copyOfRange(values, i * C, (i + 1) * C);
    }

    /**
     * @return the euclidean distance between color i of this set and color j of the other set
     */
    public double distance(int i, PixelSet other, int j) {
        double d2 = 0;
        for (int c = 0; c < C; c++) {
            double diff = values[i * C + c] - other.values[j * C + c];
            d2 += diff * diff;
        }
        return Math.sqrt(d2);
    }

    /**
     * @return a new set with the colors found at the given indices, in the order of the indices
     */
    public PixelSet select(int[] indices) {
        double[] selected = new double[indices.length * C];
        for (int k = 0; k < indices.length; k++) {
            System.arraycopy(values, indices[k] * C, selected, k * C, C);
        }
        return new PixelSet(selected);
    }
}
