package org.janelia.pixelops.params;

import org.janelia.pixelops.image.ImageTransforms.SampleOp;

public enum ContrastMode {
    /**
     * log(1 + k*in) / log(1 + k)
     */
    LOGARITHMIC("k") {
        @Override
        public SampleOp toSampleOp(double k) {
            double norm = Math.log1p(k);
            return v -> Math.log1p(k * v) / norm;
        }
    },
    /**
     * in ^ gamma
     */
    EXPONENTIAL("gamma") {
        @Override
        public SampleOp toSampleOp(double gamma) {
            return v -> Math.pow(v, gamma);
        }
    };

    private final String coefficientName;

    ContrastMode(String coefficientName) {
        this.coefficientName = coefficientName;
    }

    public String getCoefficientName() {
        return coefficientName;
    }

    public abstract SampleOp toSampleOp(double coefficient);
}
