package org.janelia.colortransport.image.algorithms;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.colortransport.image.TestUtils;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ScaleAlgorithmTest {

    @Test
    public void scaleToSameSizeKeepsImage() {
        Img<DoubleType> testImage = TestUtils.randomImage(9, 7, 13);

        Img<DoubleType> scaledImage = ScaleAlgorithm.scaleChannelArray(testImage, 9, 7);

        TestUtils.assertSameValues(testImage, scaledImage, 1e-9);
    }

    @Test
    public void scaleSolidImage() {
        class TestData {
            final int width;
            final int height;

            TestData(int width, int height) {
                this.width = width;
                this.height = height;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData(32, 16),
                new TestData(3, 5),
                new TestData(1, 1),
                new TestData(17, 8)
        };
        Img<DoubleType> solidImage = TestUtils.solidImage(10, 6, 30, 60, 90);
        for (TestData td : testData) {
            Img<DoubleType> scaledImage = ScaleAlgorithm.scaleChannelArray(solidImage, td.width, td.height);
            TestUtils.assertSameValues(TestUtils.solidImage(td.width, td.height, 30, 60, 90), scaledImage, 1e-9);
        }
    }

    @Test
    public void shrinkingAveragesAllSourcePixels() {
        // one bright column out of every four
        Img<DoubleType> stripes = ArrayImgs.doubles(64, 2);
        RandomAccess<DoubleType> stripesRA = stripes.randomAccess();
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 64; x += 4) {
                stripesRA.setPositionAndGet(x, y).set(255);
            }
        }

        Img<DoubleType> scaledImage = ScaleAlgorithm.scale2DImage(stripes, 16, 2);

        assertArrayEquals(new long[]{16, 2}, scaledImage.dimensionsAsLongArray());
        RandomAccess<DoubleType> scaledRA = scaledImage.randomAccess();
        // away from the borders the kernel taps are all inside the image
        for (int x = 2; x < 14; x++) {
            assertEquals(63.75, scaledRA.setPositionAndGet(x, 0).get(), 1e-9);
            assertEquals(63.75, scaledRA.setPositionAndGet(x, 1).get(), 1e-9);
        }
    }

    @Test
    public void scaledValuesStayInRange() {
        Img<DoubleType> testImage = TestUtils.randomImage(6, 6, 5);

        Img<DoubleType> scaledImage = ScaleAlgorithm.scaleChannelArray(testImage, 23, 11);

        assertArrayEquals(new long[]{23, 11, 3}, scaledImage.dimensionsAsLongArray());
        for (DoubleType px : scaledImage) {
            if (px.get() < 0 || px.get() > 255) {
                throw new AssertionError("Value out of range: " + px.get());
            }
        }
    }
}
