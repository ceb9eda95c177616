package org.janelia.pixelops.params;

import org.janelia.pixelops.image.ImageTransforms.SampleOp;

public enum BrightnessMode {
    /**
     * in + factor
     */
    ADDITIVE {
        @Override
        public SampleOp toSampleOp(double factor) {
            return v -> v + factor;
        }
    },
    /**
     * in * factor
     */
    MULTIPLICATIVE {
        @Override
        public SampleOp toSampleOp(double factor) {
            return v -> v * factor;
        }
    };

    public abstract SampleOp toSampleOp(double factor);
}
