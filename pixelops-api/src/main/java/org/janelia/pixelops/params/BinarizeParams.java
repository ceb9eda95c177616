package org.janelia.pixelops.params;

import java.util.LinkedHashMap;
import java.util.Map;

public class BinarizeParams implements OperationParams {
    private final double threshold;
    private final boolean grayscaleFirst;

    public BinarizeParams(double threshold, boolean grayscaleFirst) {
        this.threshold = threshold;
        this.grayscaleFirst = grayscaleFirst;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return true if the color image is converted to luminosity gray before thresholding
     */
    public boolean isGrayscaleFirst() {
        return grayscaleFirst;
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        Map<String, Object> resolved = new LinkedHashMap<>();
        resolved.put("threshold", threshold);
        resolved.put("grayscale", grayscaleFirst);
        return resolved;
    }
}
