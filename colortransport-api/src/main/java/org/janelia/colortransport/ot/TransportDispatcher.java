package org.janelia.colortransport.ot;

import java.util.Arrays;
import java.util.concurrent.ExecutorService;

import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.DoubleType;
import org.janelia.colortransport.image.ColorImages;
import org.janelia.colortransport.image.algorithms.ScaleAlgorithm;
import org.janelia.colortransport.image.type.RGBPixelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the transport engine. It brings the source to the target's shape and runs the
 * selected transport method.
 */
public class TransportDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(TransportDispatcher.class);

    private final TransportParams params;
    private final ExecutorService executorService;

    public TransportDispatcher() {
        this(new TransportParams(), null);
    }

    /**
     * @param params solver parameters
     * @param executorService if not null blocks of the blockwise method are solved concurrently on it
     */
    public TransportDispatcher(TransportParams params, ExecutorService executorService) {
        this.params = params;
        this.executorService = executorService;
    }

    public Img<UnsignedByteType> applyTransport(TransportInput source, TransportInput target, String methodName) {
        return applyTransport(source, target, TransportMethod.fromName(methodName));
    }

    /**
     * Transform the source colors to approximate the target.
     *
     * @return [width, height, 3] array with the target's width and height
     */
    public Img<UnsignedByteType> applyTransport(TransportInput source, TransportInput target, TransportMethod method) {
        Img<DoubleType> targetChannels = target.toChannelArray();
        Img<DoubleType> sourceChannels = reconcileShape(source.toChannelArray(), targetChannels);

        LOG.info("Applying {} transport on {} image with {}", method.getMethodName(),
                Arrays.toString(sourceChannels.dimensionsAsLongArray()), params.asMap());
        long startTime = System.currentTimeMillis();
        Img<DoubleType> result;
        switch (method) {
            case BLOCKWISE:
                result = blockwiseTransport(sourceChannels, targetChannels);
                break;
            case HISTOGRAM:
                result = new HistogramMatcher(params.getBinCount()).transport(sourceChannels, targetChannels);
                break;
            case HUNGARIAN:
                result = assignmentTransport(sourceChannels, targetChannels);
                break;
            default:
                throw new InvalidTransportInputException("Unsupported method: " + method);
        }
        LOG.info("Transport computed with {} in {}s", method.getMethodName(), (System.currentTimeMillis() - startTime) / 1000.);
        return ColorImages.toUnsignedByteArray(result);
    }

    private Img<DoubleType> reconcileShape(Img<DoubleType> sourceChannels, Img<DoubleType> targetChannels) {
        if (ColorImages.sameShape(sourceChannels, targetChannels)) {
            return sourceChannels;
        }
        Img<DoubleType> resizedSource = ScaleAlgorithm.scaleChannelArray(
                sourceChannels,
                (int) ColorImages.width(targetChannels),
                (int) ColorImages.height(targetChannels));
        LOG.info("Resized source from {} to {}",
                Arrays.toString(sourceChannels.dimensionsAsLongArray()),
                Arrays.toString(resizedSource.dimensionsAsLongArray()));
        return resizedSource;
    }

    private Img<DoubleType> blockwiseTransport(Img<DoubleType> sourceChannels, Img<DoubleType> targetChannels) {
        BlockDecomposer blockDecomposer = new BlockDecomposer(
                params.getBlockSize(),
                new SinkhornSolver(params.getBlockReg(), params.getMaxIter(), params.getTolerance()));
        if (executorService != null) {
            return blockDecomposer.transportMT(sourceChannels, targetChannels, executorService);
        } else {
            return blockDecomposer.transport(sourceChannels, targetChannels);
        }
    }

    /**
     * Match the flattened images and write every matched source pixel at the position of its target pixel.
     * Output pixels whose target was not part of the matching are left black.
     */
    private Img<DoubleType> assignmentTransport(Img<DoubleType> sourceChannels, Img<DoubleType> targetChannels) {
        PixelSet sourcePixels = PixelSet.fromChannelArray(sourceChannels);
        PixelSet targetPixels = PixelSet.fromChannelArray(targetChannels);
        Assignment assignment = new AssignmentSolver(params.getSampleSize()).solve(sourcePixels, targetPixels);
        if (assignment.isSubsampled()) {
            LOG.info("Matched {} sampled pixels out of {} - unmatched output pixels are left at 0",
                    assignment.size(), targetPixels.size());
        }

        int width = (int) ColorImages.width(targetChannels);
        int height = (int) ColorImages.height(targetChannels);
        Img<DoubleType> output = ColorImages.createChannelArray(width, height);
        RandomAccess<DoubleType> outputRA = output.randomAccess();
        for (int k = 0; k < assignment.size(); k++) {
            int si = assignment.getSourceIndex(k);
            int ti = assignment.getTargetIndex(k);
            int ty = ti / width;
            int tx = ti % width;
            for (int c = 0; c < RGBPixelType.CHANNELS; c++) {
                outputRA.setPositionAndGet(tx, ty, c).set(sourcePixels.get(si, c));
            }
        }
        return output;
    }
}
