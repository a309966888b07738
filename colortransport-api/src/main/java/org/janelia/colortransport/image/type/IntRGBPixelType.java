package org.janelia.colortransport.image.type;

import net.imglib2.img.NativeImg;
import net.imglib2.img.basictypeaccess.IntAccess;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.Index;
import net.imglib2.type.NativeType;
import net.imglib2.type.NativeTypeFactory;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.util.Fraction;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * RGB pixel packed in a single int, one int per pixel of the backing image.
 * Writing a color always sets the alpha byte to opaque; reading ignores it.
 */
public class IntRGBPixelType implements RGBPixelType<IntRGBPixelType> {

    private static final NativeTypeFactory<IntRGBPixelType, IntAccess> TYPE_FACTORY = NativeTypeFactory.INT(IntRGBPixelType::new);

    private final NativeImg<?, ? extends IntAccess> imgContainer;
    private final Index i = new Index();
    private IntAccess dataAccess;

    public IntRGBPixelType() {
        this(0, 0, 0);
    }

    public IntRGBPixelType(int r, int g, int b) {
        imgContainer = null;
        dataAccess = new IntArray(1);
        setFromRGB(r, g, b);
    }

    public IntRGBPixelType(NativeImg<?, ? extends IntAccess> imgContainer) {
        this.imgContainer = imgContainer;
    }

    @Override
    public Fraction getEntitiesPerPixel() {
        return new Fraction();
    }

    @Override
    public IntRGBPixelType duplicateTypeOnSameNativeImg() {
        return new IntRGBPixelType(imgContainer);
    }

    @Override
    public NativeTypeFactory<IntRGBPixelType, IntAccess> getNativeTypeFactory() {
        return TYPE_FACTORY;
    }

    @Override
    public void updateContainer(Object c) {
        dataAccess = imgContainer.update(c);
    }

    @Override
    public Index index() {
        return i;
    }

    @Override
    public IntRGBPixelType createVariable() {
        return new IntRGBPixelType();
    }

    @Override
    public IntRGBPixelType copy() {
        return new IntRGBPixelType(getRed(), getGreen(), getBlue());
    }

    @Override
    public void set(IntRGBPixelType c) {
        setFromRGB(c.getRed(), c.getGreen(), c.getBlue());
    }

    @Override
    public boolean valueEquals(IntRGBPixelType other) {
        return getRed() == other.getRed() && getGreen() == other.getGreen() && getBlue() == other.getBlue();
    }

    @Override
    public int getRed() {
        return ARGBType.red(rgba());
    }

    @Override
    public int getGreen() {
        return ARGBType.green(rgba());
    }

    @Override
    public int getBlue() {
        return ARGBType.blue(rgba());
    }

    @Override
    public IntRGBPixelType createFromRGB(int r, int g, int b) {
        return new IntRGBPixelType(r, g, b);
    }

    @Override
    public void setFromRGB(int r, int g, int b) {
        dataAccess.setValue(i.get(), ARGBType.rgba(r & 0xff, g & 0xff, b & 0xff, 0xff));
    }

    private int rgba() {
        return dataAccess.getValue(i.get());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return valueEquals((IntRGBPixelType) o);
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(getRed())
                .append(getGreen())
                .append(getBlue())
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("r", getRed())
                .append("g", getGreen())
                .append("b", getBlue())
                .toString();
    }
}
