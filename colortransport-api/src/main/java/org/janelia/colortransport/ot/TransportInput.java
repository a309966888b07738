package org.janelia.colortransport.ot;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.colortransport.image.ColorImages;
import org.janelia.colortransport.image.type.RGBPixelType;

/**
 * Image given to the transport engine: either a raw [width, height, 3] array or an RGB image handle.
 * The input is converted to a channel array once, when it enters the engine.
 */
public abstract class TransportInput {

    public enum Kind {
        RAW_ARRAY,
        IMAGE_HANDLE
    }

    public static TransportInput rawArray(RandomAccessibleInterval<? extends RealType<?>> channels) {
        return new RawArray(channels);
    }

    public static TransportInput imageHandle(RandomAccessibleInterval<? extends RGBPixelType<?>> rgbImage) {
        return new ImageHandle(rgbImage);
    }

    private TransportInput() {
    }

    public abstract Kind getKind();

    /**
     * @return a new [width, height, 3] channel array with the input's colors
     */
    public abstract Img<DoubleType> toChannelArray();

    private static final class RawArray extends TransportInput {
        private final RandomAccessibleInterval<? extends RealType<?>> channels;

        RawArray(RandomAccessibleInterval<? extends RealType<?>> channels) {
            this.channels = channels;
        }

        @Override
        public Kind getKind() {
            return Kind.RAW_ARRAY;
        }

        @Override
        public Img<DoubleType> toChannelArray() {
            return ColorImages.copyChannelArray(channels);
        }
    }

    private static final class ImageHandle extends TransportInput {
        private final RandomAccessibleInterval<? extends RGBPixelType<?>> rgbImage;

        ImageHandle(RandomAccessibleInterval<? extends RGBPixelType<?>> rgbImage) {
            this.rgbImage = rgbImage;
        }

        @Override
        public Kind getKind() {
            return Kind.IMAGE_HANDLE;
        }

        @Override
        public Img<DoubleType> toChannelArray() {
            return ColorImages.rgbToChannelArray(rgbImage);
        }
    }
}
