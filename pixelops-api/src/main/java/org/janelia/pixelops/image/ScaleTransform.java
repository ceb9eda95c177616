package org.janelia.pixelops.image;

/**
 * Scales a sourceShape image to a targetShape image. Pixel centers are aligned and the source location
 * is clamped to the source extent so the edges replicate instead of fading into the fill value.
 */
public class ScaleTransform implements GeomTransform {
    private final double[] scaleFactors;
    private final long[] sourceMax;

    public ScaleTransform(long[] sourceShape, long[] targetShape) {
        assert sourceShape.length == targetShape.length;
        this.scaleFactors = new double[sourceShape.length];
        this.sourceMax = ImageAccessUtils.getMax(sourceShape);
        for (int d = 0; d < sourceShape.length; d++) {
            scaleFactors[d] = (double) sourceShape[d] / targetShape[d];
        }
    }

    @Override
    public void apply(long[] targetPos, double[] sourcePos) {
        for (int d = 0; d < scaleFactors.length; d++) {
            double p = (targetPos[d] + 0.5) * scaleFactors[d] - 0.5;
            sourcePos[d] = Math.min(Math.max(p, 0), sourceMax[d]);
        }
    }
}
