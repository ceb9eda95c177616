package org.janelia.pixelops.params;

import java.util.LinkedHashMap;
import java.util.Map;

public class TranslateParams implements OperationParams {
    private final int dx;
    private final int dy;
    private final double fill;

    public TranslateParams(int dx, int dy, double fill) {
        this.dx = dx;
        this.dy = dy;
        this.fill = fill;
    }

    public int getDx() {
        return dx;
    }

    public int getDy() {
        return dy;
    }

    public double getFill() {
        return fill;
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        Map<String, Object> resolved = new LinkedHashMap<>();
        resolved.put("dx", dx);
        resolved.put("dy", dy);
        resolved.put("fill", fill);
        return resolved;
    }
}
