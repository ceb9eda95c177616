package org.janelia.pixelops.params;

import java.util.LinkedHashMap;
import java.util.Map;

public class BrightnessParams implements OperationParams {
    private final BrightnessMode mode;
    private final double factor;

    public BrightnessParams(BrightnessMode mode, double factor) {
        this.mode = mode;
        this.factor = factor;
    }

    public BrightnessMode getMode() {
        return mode;
    }

    public double getFactor() {
        return factor;
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        Map<String, Object> resolved = new LinkedHashMap<>();
        resolved.put("mode", mode.name().toLowerCase());
        resolved.put("factor", factor);
        return resolved;
    }
}
