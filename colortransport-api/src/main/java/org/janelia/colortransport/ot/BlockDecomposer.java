package org.janelia.colortransport.ot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.colortransport.image.ColorImages;
import org.janelia.colortransport.image.type.RGBPixelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tiles the image and solves a small regularized transport problem in every tile.
 * Each output pixel is the blend of the source pixels of its own tile given by the transport plan,
 * so the cost grows with the number of tiles times blockSize^2 instead of the squared pixel count.
 * Tiles are solved independently, which may leave visible seams at tile borders.
 */
public class BlockDecomposer {

    private static final Logger LOG = LoggerFactory.getLogger(BlockDecomposer.class);

    public static final int DEFAULT_BLOCK_SIZE = 8;
    public static final double DEFAULT_BLOCK_REG = 0.05;

    private final int blockSize;
    private final SinkhornSolver blockSolver;

    public BlockDecomposer() {
        this(DEFAULT_BLOCK_SIZE, new SinkhornSolver(DEFAULT_BLOCK_REG, SinkhornSolver.DEFAULT_MAX_ITER, SinkhornSolver.DEFAULT_TOLERANCE));
    }

    public BlockDecomposer(int blockSize, SinkhornSolver blockSolver) {
        if (blockSize < 1) {
            throw new InvalidTransportInputException("Block size must be at least 1 - current value is " + blockSize);
        }
        this.blockSize = blockSize;
        this.blockSolver = blockSolver;
    }

    /**
     * Split a width x height image into a grid of blockSize x blockSize blocks. Blocks on the
     * right and bottom border are truncated. Blocks are listed row by row.
     */
    public static List<Block> partition(int width, int height, int blockSize) {
        List<Block> blocks = new ArrayList<>();
        for (int y = 0; y < height; y += blockSize) {
            for (int x = 0; x < width; x += blockSize) {
                blocks.add(new Block(x, y, Math.min(blockSize, width - x), Math.min(blockSize, height - y)));
            }
        }
        return blocks;
    }

    public Img<DoubleType> transport(RandomAccessibleInterval<? extends RealType<?>> source,
                                     RandomAccessibleInterval<? extends RealType<?>> target) {
        checkShapes(source, target);
        int width = (int) ColorImages.width(target);
        int height = (int) ColorImages.height(target);
        Img<DoubleType> output = ColorImages.createChannelArray(width, height);
        List<Block> blocks = partition(width, height, blockSize);
        LOG.info("Processing {} blocks of size {}x{}", blocks.size(), blockSize, blockSize);
        for (Block block : blocks) {
            transportBlock(source, target, block, output);
        }
        return output;
    }

    /**
     * Same as {@link #transport(RandomAccessibleInterval, RandomAccessibleInterval)} but every row of blocks
     * is solved as a separate task on the given executor. Tasks write to disjoint regions of the output.
     */
    public Img<DoubleType> transportMT(RandomAccessibleInterval<? extends RealType<?>> source,
                                       RandomAccessibleInterval<? extends RealType<?>> target,
                                       ExecutorService executorService) {
        checkShapes(source, target);
        int width = (int) ColorImages.width(target);
        int height = (int) ColorImages.height(target);
        Img<DoubleType> output = ColorImages.createChannelArray(width, height);
        List<Block> blocks = partition(width, height, blockSize);
        LOG.info("Processing {} blocks of size {}x{} on {} block rows", blocks.size(), blockSize, blockSize,
                (height + blockSize - 1) / blockSize);

        List<Callable<Void>> blockRowTasks = new ArrayList<>();
        for (int y = 0; y < height; y += blockSize) {
            int blockRowY = y;
            blockRowTasks.add(() -> {
                long startTime = System.currentTimeMillis();
                for (Block block : blocks) {
                    if (block.getY() == blockRowY) {
                        transportBlock(source, target, block, output);
                    }
                }
                LOG.debug("Completed block row at y={} in {}s", blockRowY, (System.currentTimeMillis() - startTime) / 1000.);
                return null;
            });
        }
        try {
            for (Future<Void> blockRowResult : executorService.invokeAll(blockRowTasks)) {
                blockRowResult.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        }
        return output;
    }

    private void checkShapes(RandomAccessibleInterval<?> source, RandomAccessibleInterval<?> target) {
        if (ColorImages.differentShape(source, target)) {
            throw new InvalidTransportInputException("Source and target must have the same shape: "
                    + Arrays.toString(source.dimensionsAsLongArray()) + " vs " + Arrays.toString(target.dimensionsAsLongArray()));
        }
    }

    private void transportBlock(RandomAccessibleInterval<? extends RealType<?>> source,
                                RandomAccessibleInterval<? extends RealType<?>> target,
                                Block block,
                                Img<DoubleType> output) {
        PixelSet sourcePixels = PixelSet.fromRegion(source, block);
        PixelSet targetPixels = PixelSet.fromRegion(target, block);
        TransportPlan plan = blockSolver.solve(sourcePixels, targetPixels);
        double[][] blockColors = synthesizeBlock(sourcePixels, targetPixels, plan);

        RandomAccess<DoubleType> outputRA = output.randomAccess();
        int k = 0;
        for (int y = block.getY(); y < block.getY() + block.getHeight(); y++) {
            for (int x = block.getX(); x < block.getX() + block.getWidth(); x++) {
                for (int c = 0; c < RGBPixelType.CHANNELS; c++) {
                    outputRA.setPositionAndGet(x, y, c).set(blockColors[k][c]);
                }
                k++;
            }
        }
    }

    /**
     * Compute the color of every target pixel as the average of the source colors weighted by
     * the pixel's column in the plan. A column without any mass keeps the target color.
     *
     * @return one color per target pixel
     */
    static double[][] synthesizeBlock(PixelSet source, PixelSet target, TransportPlan plan) {
        double[][] colors = new double[target.size()][];
        for (int j = 0; j < target.size(); j++) {
            double colSum = plan.colSum(j);
            if (colSum > 0) {
                double[] color = new double[RGBPixelType.CHANNELS];
                for (int i = 0; i < source.size(); i++) {
                    double w = plan.get(i, j) / colSum;
                    for (int c = 0; c < RGBPixelType.CHANNELS; c++) {
                        color[c] += w * source.get(i, c);
                    }
                }
                colors[j] = color;
            } else {
                colors[j] = target.getColor(j);
            }
        }
        return colors;
    }
}
