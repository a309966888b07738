package org.janelia.colortransport.image;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import org.janelia.colortransport.image.type.RGBPixelType;
import org.janelia.colortransport.ot.InvalidTransportInputException;

/**
 * Conversions between the image representations used by the transport engine.
 * A channel array is a 3-D image with the dimensions [width, height, 3], where the last axis
 * holds the red, green and blue values.
 */
public class ColorImages {

    public static final int CHANNEL_AXIS = 2;
    public static final double MAX_CHANNEL_VALUE = 255.;

    public static Img<DoubleType> createChannelArray(long width, long height) {
        return ArrayImgs.doubles(width, height, RGBPixelType.CHANNELS);
    }

    public static long width(RandomAccessibleInterval<?> img) {
        return img.dimension(0);
    }

    public static long height(RandomAccessibleInterval<?> img) {
        return img.dimension(1);
    }

    /**
     * Compare only the spatial extent, the channel axis is ignored.
     */
    public static boolean sameShape(RandomAccessibleInterval<?> ref, RandomAccessibleInterval<?> img) {
        return width(ref) == width(img) && height(ref) == height(img);
    }

    public static boolean differentShape(RandomAccessibleInterval<?> ref, RandomAccessibleInterval<?> img) {
        return !sameShape(ref, img);
    }

    /**
     * Copy a raw [width, height, 3] array into a zero based channel array.
     */
    public static Img<DoubleType> copyChannelArray(RandomAccessibleInterval<? extends RealType<?>> rawArray) {
        if (rawArray.numDimensions() != 3 || rawArray.dimension(CHANNEL_AXIS) != RGBPixelType.CHANNELS) {
            throw new InvalidTransportInputException("Expected a [width, height, 3] array but got dimensions "
                    + Arrays.toString(rawArray.dimensionsAsLongArray()));
        }
        checkNotEmpty(rawArray);
        Img<DoubleType> channels = createChannelArray(width(rawArray), height(rawArray));
        Cursor<? extends RealType<?>> sourceCursor = Views.flatIterable(Views.zeroMin(rawArray)).cursor();
        Cursor<DoubleType> targetCursor = Views.flatIterable(channels).cursor();
        while (sourceCursor.hasNext()) {
            targetCursor.next().set(sourceCursor.next().getRealDouble());
        }
        return channels;
    }

    /**
     * Convert a 2-D RGB image into a channel array.
     */
    public static Img<DoubleType> rgbToChannelArray(RandomAccessibleInterval<? extends RGBPixelType<?>> rgbImage) {
        if (rgbImage.numDimensions() != 2) {
            throw new InvalidTransportInputException("Expected a 2-D RGB image but got "
                    + rgbImage.numDimensions() + " dimensions");
        }
        checkNotEmpty(rgbImage);
        Img<DoubleType> channels = createChannelArray(width(rgbImage), height(rgbImage));
        RandomAccess<DoubleType> channelsRA = channels.randomAccess();
        Cursor<? extends RGBPixelType<?>> rgbCursor = Views.flatIterable(Views.zeroMin(rgbImage)).localizingCursor();
        while (rgbCursor.hasNext()) {
            RGBPixelType<?> px = rgbCursor.next();
            long x = rgbCursor.getLongPosition(0);
            long y = rgbCursor.getLongPosition(1);
            for (int c = 0; c < RGBPixelType.CHANNELS; c++) {
                channelsRA.setPositionAndGet(x, y, c).set(px.getChannel(c));
            }
        }
        return channels;
    }

    private static void checkNotEmpty(RandomAccessibleInterval<?> img) {
        if (width(img) == 0 || height(img) == 0) {
            throw new InvalidTransportInputException("Image has no pixels: "
                    + Arrays.toString(img.dimensionsAsLongArray()));
        }
    }

    /**
     * Create the 8 bit output array, values are clipped to [0, 255] and rounded.
     */
    public static Img<UnsignedByteType> toUnsignedByteArray(RandomAccessibleInterval<? extends RealType<?>> channels) {
        Img<UnsignedByteType> output = ArrayImgs.unsignedBytes(channels.dimensionsAsLongArray());
        Cursor<? extends RealType<?>> sourceCursor = Views.flatIterable(Views.zeroMin(channels)).cursor();
        Cursor<UnsignedByteType> targetCursor = Views.flatIterable(output).cursor();
        while (sourceCursor.hasNext()) {
            targetCursor.next().set(clipAndRound(sourceCursor.next().getRealDouble()));
        }
        return output;
    }

    public static int clipAndRound(double value) {
        if (value <= 0) {
            return 0;
        } else if (value >= MAX_CHANNEL_VALUE) {
            return (int) MAX_CHANNEL_VALUE;
        } else {
            return (int) Math.round(value);
        }
    }

    public static double clip(double value) {
        return Math.max(0., Math.min(MAX_CHANNEL_VALUE, value));
    }
}
