package org.janelia.pixelops.image;

public class PixelOps {

    public static float clamp(double v) {
        if (v < 0) {
            return 0f;
        } else if (v > 1) {
            return 1f;
        } else {
            return (float) v;
        }
    }

    public static double luminosity(double r, double g, double b) {
        return 0.299 * r + 0.587 * g + 0.114 * b;
    }

    /**
     * Map a normalized sample to one of nbins bins; 1.0 falls in the last bin.
     */
    public static int toBin(double v, int nbins) {
        int bin = (int) Math.floor(v * (nbins - 1));
        if (bin < 0) {
            return 0;
        } else if (bin >= nbins) {
            return nbins - 1;
        } else {
            return bin;
        }
    }

}
