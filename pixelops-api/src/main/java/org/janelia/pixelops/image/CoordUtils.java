package org.janelia.pixelops.image;

public class CoordUtils {

    private static final double GRID_TOLERANCE = 1e-9;

    public static boolean contains(long width, long height, long x, long y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Snap coordinates that are within floating point noise of a grid location to that location.
     */
    public static double snapToGrid(double coord) {
        double nearest = Math.rint(coord);
        return Math.abs(coord - nearest) < GRID_TOLERANCE ? nearest : coord;
    }

    /**
     * @return the integer ceiling of a non negative extent ignoring floating point noise.
     */
    public static long ceilExtent(double extent) {
        return (long) Math.ceil(snapToGrid(extent));
    }
}
