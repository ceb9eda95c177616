package org.janelia.pixelops.params;

import org.janelia.pixelops.image.PixelOps;

public enum GrayscaleMethod {
    AVERAGE {
        @Override
        public double combine(double r, double g, double b) {
            return (r + g + b) / 3;
        }
    },
    LUMINOSITY {
        @Override
        public double combine(double r, double g, double b) {
            return PixelOps.luminosity(r, g, b);
        }
    },
    /**
     * (max(R,G,B) + min(R,G,B)) / 2, also known as "max" or "midgray".
     */
    LIGHTNESS {
        @Override
        public double combine(double r, double g, double b) {
            return (Math.max(r, Math.max(g, b)) + Math.min(r, Math.min(g, b))) / 2;
        }
    };

    public abstract double combine(double r, double g, double b);
}
