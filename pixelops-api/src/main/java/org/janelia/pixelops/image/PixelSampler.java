package org.janelia.pixelops.image;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Samples an (x, y, channel) image at real valued (x, y) locations. A sampler holds a random access
 * so it must not be shared between threads.
 */
class PixelSampler {

    private final RandomAccess<FloatType> access;
    private final long[] min;
    private final long width;
    private final long height;
    private final Interpolation interpolation;

    PixelSampler(RandomAccessibleInterval<FloatType> source, Interpolation interpolation) {
        this.access = source.randomAccess();
        this.min = source.minAsLongArray();
        this.width = source.dimension(ImageBuffer.X_AXIS);
        this.height = source.dimension(ImageBuffer.Y_AXIS);
        this.interpolation = interpolation;
    }

    double sample(double x, double y, int channel, double fill) {
        return interpolation.sample(this, CoordUtils.snapToGrid(x), CoordUtils.snapToGrid(y), channel, fill);
    }

    /**
     * @return the value at the integer location relative to the source origin or the fill value
     * if the location is outside the source.
     */
    double getOrFill(long x, long y, int channel, double fill) {
        if (!CoordUtils.contains(width, height, x, y)) {
            return fill;
        }
        access.setPosition(min[ImageBuffer.X_AXIS] + x, ImageBuffer.X_AXIS);
        access.setPosition(min[ImageBuffer.Y_AXIS] + y, ImageBuffer.Y_AXIS);
        access.setPosition(min[ImageBuffer.CHANNEL_AXIS] + channel, ImageBuffer.CHANNEL_AXIS);
        return access.get().getRealDouble();
    }
}
