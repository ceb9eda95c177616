package org.janelia.pixelops.params;

import java.util.LinkedHashMap;
import java.util.Map;

public class ReduceResolutionParams implements OperationParams {
    private final double factor;
    private final int targetWidth;
    private final int targetHeight;

    public ReduceResolutionParams(double factor, int targetWidth, int targetHeight) {
        this.factor = factor;
        this.targetWidth = targetWidth;
        this.targetHeight = targetHeight;
    }

    public double getFactor() {
        return factor;
    }

    public int getTargetWidth() {
        return targetWidth;
    }

    public int getTargetHeight() {
        return targetHeight;
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        Map<String, Object> resolved = new LinkedHashMap<>();
        resolved.put("factor", factor);
        resolved.put("target_width", targetWidth);
        resolved.put("target_height", targetHeight);
        resolved.put("filter", "area-average");
        return resolved;
    }
}
