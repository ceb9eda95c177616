package org.janelia.pixelops.image;

public enum Interpolation {
    /**
     * Round to the closest grid location.
     */
    NEAREST {
        @Override
        double sample(PixelSampler sampler, double x, double y, int channel, double fill) {
            return sampler.getOrFill(Math.round(x), Math.round(y), channel, fill);
        }
    },
    /**
     * Weighted average of the four grid neighbors by fractional distance.
     */
    BILINEAR {
        @Override
        double sample(PixelSampler sampler, double x, double y, int channel, double fill) {
            long x0 = (long) Math.floor(x);
            long y0 = (long) Math.floor(y);
            double fx = x - x0;
            double fy = y - y0;
            double v00 = sampler.getOrFill(x0, y0, channel, fill);
            double v10 = fx > 0 ? sampler.getOrFill(x0 + 1, y0, channel, fill) : 0;
            double v01 = fy > 0 ? sampler.getOrFill(x0, y0 + 1, channel, fill) : 0;
            double v11 = fx > 0 && fy > 0 ? sampler.getOrFill(x0 + 1, y0 + 1, channel, fill) : 0;
            return (1 - fx) * (1 - fy) * v00
                    + fx * (1 - fy) * v10
                    + (1 - fx) * fy * v01
                    + fx * fy * v11;
        }
    };

    abstract double sample(PixelSampler sampler, double x, double y, int channel, double fill);
}
