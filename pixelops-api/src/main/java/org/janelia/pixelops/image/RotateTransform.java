package org.janelia.pixelops.image;

/**
 * Rotation about the image center. With the y axis pointing down a positive angle turns the content
 * clockwise on screen. The target canvas may differ from the source canvas, the two centers are aligned.
 */
public class RotateTransform implements GeomTransform {
    private final double cos;
    private final double sin;
    private final double sourceCenterX;
    private final double sourceCenterY;
    private final double targetCenterX;
    private final double targetCenterY;

    public RotateTransform(long sourceWidth, long sourceHeight, long targetWidth, long targetHeight, double angleDegrees) {
        double[] cosSin = cosSin(angleDegrees);
        this.cos = cosSin[0];
        this.sin = cosSin[1];
        this.sourceCenterX = (sourceWidth - 1) / 2.;
        this.sourceCenterY = (sourceHeight - 1) / 2.;
        this.targetCenterX = (targetWidth - 1) / 2.;
        this.targetCenterY = (targetHeight - 1) / 2.;
    }

    /**
     * @return [width, height] of the smallest canvas that holds the whole rotated image.
     */
    public static long[] rotatedExtent(long width, long height, double angleDegrees) {
        double[] cosSin = cosSin(angleDegrees);
        double absCos = Math.abs(cosSin[0]);
        double absSin = Math.abs(cosSin[1]);
        return new long[] {
                Math.max(1, CoordUtils.ceilExtent(width * absCos + height * absSin)),
                Math.max(1, CoordUtils.ceilExtent(width * absSin + height * absCos))
        };
    }

    private static double[] cosSin(double angleDegrees) {
        double normalizedAngle = angleDegrees % 360;
        if (normalizedAngle < 0) {
            normalizedAngle += 360;
        }
        // exact values for quarter turns
        if (normalizedAngle == 0) {
            return new double[] {1, 0};
        } else if (normalizedAngle == 90) {
            return new double[] {0, 1};
        } else if (normalizedAngle == 180) {
            return new double[] {-1, 0};
        } else if (normalizedAngle == 270) {
            return new double[] {0, -1};
        }
        double rad = Math.toRadians(normalizedAngle);
        return new double[] {Math.cos(rad), Math.sin(rad)};
    }

    @Override
    public void apply(long[] targetPos, double[] sourcePos) {
        double x = targetPos[0] - targetCenterX;
        double y = targetPos[1] - targetCenterY;
        sourcePos[0] = cos * x + sin * y + sourceCenterX;
        sourcePos[1] = -sin * x + cos * y + sourceCenterY;
    }
}
