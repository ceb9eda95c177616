package org.janelia.pixelops.image;

/**
 * Maps a target pixel location to the real valued source location it is sampled from.
 * Both locations are (x, y) pairs.
 */
@FunctionalInterface
public interface GeomTransform {
    void apply(long[] targetPos, double[] sourcePos);
}
