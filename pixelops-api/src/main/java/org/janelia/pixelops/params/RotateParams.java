package org.janelia.pixelops.params;

import java.util.LinkedHashMap;
import java.util.Map;

public class RotateParams implements OperationParams {
    private final double angle;
    private final double fill;

    public RotateParams(double angle, double fill) {
        this.angle = angle;
        this.fill = fill;
    }

    /**
     * @return rotation angle in degrees; positive values turn the image clockwise
     */
    public double getAngle() {
        return angle;
    }

    public double getFill() {
        return fill;
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        Map<String, Object> resolved = new LinkedHashMap<>();
        resolved.put("angle", angle);
        resolved.put("fill", fill);
        resolved.put("canvas", "expand");
        resolved.put("interpolation", "bilinear");
        return resolved;
    }
}
