package org.janelia.colortransport.image.type;

import net.imglib2.type.NativeType;

/**
 * Pixel type of an RGB image handle. Channel values are always in [0, 255].
 */
public interface RGBPixelType<T extends RGBPixelType<T> & NativeType<T>> extends NativeType<T> {

    int RED = 0;
    int GREEN = 1;
    int BLUE = 2;
    int CHANNELS = 3;

    int getRed();

    int getGreen();

    int getBlue();

    T createFromRGB(int r, int g, int b);

    void setFromRGB(int r, int g, int b);

    /**
     * @param c channel index: {@link #RED}, {@link #GREEN} or {@link #BLUE}
     * @return the value of the channel
     */
    default int getChannel(int c) {
        switch (c) {
            case RED:
                return getRed();
            case GREEN:
                return getGreen();
            case BLUE:
                return getBlue();
            default:
                throw new IllegalArgumentException("Invalid RGB channel " + c);
        }
    }
}
