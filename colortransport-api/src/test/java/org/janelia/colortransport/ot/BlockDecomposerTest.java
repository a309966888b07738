package org.janelia.colortransport.ot;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.colortransport.image.TestUtils;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class BlockDecomposerTest {

    @Test
    public void partitionCoversEveryPixelOnce() {
        class TestData {
            final int width;
            final int height;
            final int blockSize;
            final int expectedBlocks;

            TestData(int width, int height, int blockSize, int expectedBlocks) {
                this.width = width;
                this.height = height;
                this.blockSize = blockSize;
                this.expectedBlocks = expectedBlocks;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData(16, 16, 8, 4),
                new TestData(17, 9, 8, 6),
                new TestData(5, 3, 8, 1),
                new TestData(128, 64, 8, 128),
                new TestData(7, 7, 1, 49)
        };
        for (TestData td : testData) {
            List<Block> blocks = BlockDecomposer.partition(td.width, td.height, td.blockSize);
            assertEquals(td.expectedBlocks, blocks.size());
            int[] coverage = new int[td.width * td.height];
            for (Block b : blocks) {
                for (int y = b.getY(); y < b.getY() + b.getHeight(); y++) {
                    for (int x = b.getX(); x < b.getX() + b.getWidth(); x++) {
                        coverage[y * td.width + x]++;
                    }
                }
            }
            for (int c : coverage) {
                assertEquals(1, c);
            }
        }
    }

    @Test
    public void trailingBlocksAreTruncated() {
        List<Block> blocks = BlockDecomposer.partition(10, 9, 8);

        assertEquals(new Block(0, 0, 8, 8), blocks.get(0));
        assertEquals(new Block(8, 0, 2, 8), blocks.get(1));
        assertEquals(new Block(0, 8, 8, 1), blocks.get(2));
        assertEquals(new Block(8, 8, 2, 1), blocks.get(3));
    }

    @Test
    public void uniformSourceBlockKeepsItsColor() {
        Img<DoubleType> source = TestUtils.solidImage(12, 10, 40, 120, 200);
        Img<DoubleType> target = TestUtils.randomImage(12, 10, 21);

        Img<DoubleType> output = new BlockDecomposer().transport(source, target);

        assertArrayEquals(target.dimensionsAsLongArray(), output.dimensionsAsLongArray());
        TestUtils.assertSameValues(source, output, 1e-6);
    }

    @Test
    public void outputPixelsBlendSourcePixelsOfTheirBlock() {
        // left block is black, right block is white
        Img<DoubleType> source = TestUtils.solidImage(8, 4, 0, 0, 0);
        RandomAccess<DoubleType> sourceRA = source.randomAccess();
        for (int y = 0; y < 4; y++) {
            for (int x = 4; x < 8; x++) {
                for (int c = 0; c < 3; c++) {
                    sourceRA.setPositionAndGet(x, y, c).set(255);
                }
            }
        }
        Img<DoubleType> target = TestUtils.randomImage(8, 4, 3);

        Img<DoubleType> output = new BlockDecomposer(4, new SinkhornSolver(0.05, 100, 1e-6)).transport(source, target);

        assertArrayEquals(new int[]{0, 0, 0}, TestUtils.getColor(output, 1, 2));
        assertArrayEquals(new int[]{255, 255, 255}, TestUtils.getColor(output, 6, 1));
    }

    @Test
    public void emptyPlanColumnCopiesTargetPixel() {
        PixelSet source = PixelSet.of(new double[]{10, 20, 30}, new double[]{30, 40, 50});
        PixelSet target = PixelSet.of(new double[]{1, 2, 3}, new double[]{4, 5, 6});
        TransportPlan plan = new TransportPlan(2, 2, new double[]{
                0.25, 0,
                0.75, 0
        });

        double[][] colors = BlockDecomposer.synthesizeBlock(source, target, plan);

        assertArrayEquals(new double[]{25, 35, 45}, colors[0], 1e-9);
        assertArrayEquals(new double[]{4, 5, 6}, colors[1], 0);
    }

    @Test
    public void parallelTransportMatchesSequentialTransport() {
        Img<DoubleType> source = TestUtils.randomImage(20, 13, 1);
        Img<DoubleType> target = TestUtils.gradientImage(20, 13);
        BlockDecomposer blockDecomposer = new BlockDecomposer();

        ExecutorService executorService = Executors.newFixedThreadPool(3);
        try {
            Img<DoubleType> parallelOutput = blockDecomposer.transportMT(source, target, executorService);
            Img<DoubleType> sequentialOutput = blockDecomposer.transport(source, target);
            TestUtils.assertSameValues(sequentialOutput, parallelOutput, 0);
        } finally {
            executorService.shutdown();
        }
    }

    @Test(expected = InvalidTransportInputException.class)
    public void differentShapesAreRejected() {
        new BlockDecomposer().transport(TestUtils.solidImage(8, 8, 0, 0, 0), TestUtils.solidImage(8, 9, 0, 0, 0));
    }

    @Test(expected = InvalidTransportInputException.class)
    public void blockSizeMustBePositive() {
        new BlockDecomposer(0, new SinkhornSolver());
    }
}
