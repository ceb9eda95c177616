package org.janelia.pixelops.image.algorithms;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.janelia.pixelops.image.FillPolicy;
import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.image.ImageTransforms;
import org.janelia.pixelops.image.Interpolation;
import org.janelia.pixelops.image.RotateTransform;
import org.janelia.pixelops.image.ScaleTransform;
import org.janelia.pixelops.image.ShiftTransform;
import org.janelia.pixelops.params.EnlargeRegionParams;
import org.janelia.pixelops.params.ReduceResolutionParams;
import org.janelia.pixelops.params.RegionParams;
import org.janelia.pixelops.params.RotateParams;
import org.janelia.pixelops.params.TranslateParams;

/**
 * Operations that move pixels. Every target pixel is mapped back to a source location; locations outside
 * the source take the fill value.
 */
public class GeometricOperations {

    /**
     * Rotate about the image center on a canvas expanded to hold the entire rotated image.
     */
    public static ImageBuffer rotate(ImageBuffer image, RotateParams params) {
        long[] extent = RotateTransform.rotatedExtent(image.getWidth(), image.getHeight(), params.getAngle());
        RandomAccessibleInterval<FloatType> rotated = ImageTransforms.resample(
                image.pixels(),
                extent[0], extent[1],
                new RotateTransform(image.getWidth(), image.getHeight(), extent[0], extent[1], params.getAngle()),
                Interpolation.BILINEAR,
                FillPolicy.withColor(image.getChannelLayout(), params.getFill())
        );
        return image.withSamples(rotated);
    }

    public static ImageBuffer crop(ImageBuffer image, RegionParams region) {
        return image.withSamples(regionView(image, region));
    }

    /**
     * Shift the content by (dx, dy) on the same canvas; the vacated pixels take the fill value.
     */
    public static ImageBuffer translate(ImageBuffer image, TranslateParams params) {
        RandomAccessibleInterval<FloatType> translated = ImageTransforms.resample(
                image.pixels(),
                image.getWidth(), image.getHeight(),
                new ShiftTransform(new long[] {params.getDx(), params.getDy()}),
                Interpolation.NEAREST,
                FillPolicy.withColor(image.getChannelLayout(), params.getFill())
        );
        return image.withSamples(translated);
    }

    /**
     * Down-sample by area averaging. Each target pixel covers a (width / targetWidth) x (height / targetHeight)
     * source area and source pixels that are only partly covered contribute with their covered fraction.
     */
    public static ImageBuffer reduceResolution(ImageBuffer image, ReduceResolutionParams params) {
        int width = image.getWidth();
        int height = image.getHeight();
        int targetWidth = params.getTargetWidth();
        int targetHeight = params.getTargetHeight();
        int nchannels = image.getChannels();
        BoxFilterWeights xWeights = new BoxFilterWeights(width, targetWidth);
        BoxFilterWeights yWeights = new BoxFilterWeights(height, targetHeight);

        ArrayImg<FloatType, FloatArray> reduced = ArrayImgs.floats(targetWidth, targetHeight, nchannels);
        RandomAccess<FloatType> sourceAccess = image.pixels().randomAccess();
        RandomAccess<FloatType> targetAccess = reduced.randomAccess();
        double[] rowReduced = new double[targetWidth * height];
        for (int c = 0; c < nchannels; c++) {
            sourceAccess.setPosition(c, ImageBuffer.CHANNEL_AXIS);
            targetAccess.setPosition(c, ImageBuffer.CHANNEL_AXIS);
            // reduce along x
            for (int y = 0; y < height; y++) {
                sourceAccess.setPosition(y, ImageBuffer.Y_AXIS);
                for (int tx = 0; tx < targetWidth; tx++) {
                    double sum = 0;
                    double[] w = xWeights.getWeights(tx);
                    int first = xWeights.getFirst(tx);
                    for (int i = 0; i < w.length; i++) {
                        sourceAccess.setPosition(first + i, ImageBuffer.X_AXIS);
                        sum += w[i] * sourceAccess.get().getRealDouble();
                    }
                    rowReduced[y * targetWidth + tx] = sum;
                }
            }
            // then along y
            for (int ty = 0; ty < targetHeight; ty++) {
                double[] w = yWeights.getWeights(ty);
                int first = yWeights.getFirst(ty);
                targetAccess.setPosition(ty, ImageBuffer.Y_AXIS);
                for (int tx = 0; tx < targetWidth; tx++) {
                    double sum = 0;
                    for (int i = 0; i < w.length; i++) {
                        sum += w[i] * rowReduced[(first + i) * targetWidth + tx];
                    }
                    targetAccess.setPosition(tx, ImageBuffer.X_AXIS);
                    targetAccess.get().setReal(sum);
                }
            }
        }
        return image.withSamples(reduced);
    }

    /**
     * Up-sample a region with bilinear interpolation. Pixel centers are aligned and only samples
     * inside the region are read.
     */
    public static ImageBuffer enlargeRegion(ImageBuffer image, EnlargeRegionParams params) {
        RegionParams region = params.getRegion();
        RandomAccessibleInterval<FloatType> enlarged = ImageTransforms.resample(
                regionView(image, region),
                params.getTargetWidth(), params.getTargetHeight(),
                new ScaleTransform(
                        new long[] {region.getWidth(), region.getHeight()},
                        new long[] {params.getTargetWidth(), params.getTargetHeight()}),
                Interpolation.BILINEAR,
                FillPolicy.forLayout(image.getChannelLayout())
        );
        return image.withSamples(enlarged);
    }

    private static RandomAccessibleInterval<FloatType> regionView(ImageBuffer image, RegionParams region) {
        long lastChannel = image.getChannels() - 1;
        return Views.zeroMin(Views.interval(
                image.pixels(),
                new long[] {region.getX(), region.getY(), 0},
                new long[] {region.getX() + region.getWidth() - 1, region.getY() + region.getHeight() - 1, lastChannel}
        ));
    }

    /**
     * Normalized coverage of source pixels by the target pixels of a one dimensional box filter.
     */
    static class BoxFilterWeights {
        private final int[] first;
        private final double[][] weights;

        BoxFilterWeights(int sourceLength, int targetLength) {
            this.first = new int[targetLength];
            this.weights = new double[targetLength][];
            double scale = (double) sourceLength / targetLength;
            for (int t = 0; t < targetLength; t++) {
                double start = t * scale;
                double end = Math.min(sourceLength, (t + 1) * scale);
                int firstPixel = (int) Math.floor(start);
                int lastPixel = Math.min(sourceLength - 1, (int) Math.ceil(end) - 1);
                double[] w = new double[lastPixel - firstPixel + 1];
                for (int s = firstPixel; s <= lastPixel; s++) {
                    double coverage = Math.min(end, s + 1) - Math.max(start, s);
                    w[s - firstPixel] = coverage / scale;
                }
                first[t] = firstPixel;
                weights[t] = w;
            }
        }

        int getFirst(int targetIndex) {
            return first[targetIndex];
        }

        double[] getWeights(int targetIndex) {
            return weights[targetIndex];
        }
    }
}
