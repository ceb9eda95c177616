package org.janelia.pixelops.params;

import java.util.LinkedHashMap;
import java.util.Map;

public class ContrastParams implements OperationParams {
    private final ContrastMode mode;
    private final double coefficient;

    /**
     * @param mode contrast curve
     * @param coefficient k for the logarithmic curve, gamma for the exponential curve
     */
    public ContrastParams(ContrastMode mode, double coefficient) {
        this.mode = mode;
        this.coefficient = coefficient;
    }

    public ContrastMode getMode() {
        return mode;
    }

    public double getCoefficient() {
        return coefficient;
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        Map<String, Object> resolved = new LinkedHashMap<>();
        resolved.put("mode", mode.name().toLowerCase());
        resolved.put(mode.getCoefficientName(), coefficient);
        return resolved;
    }
}
