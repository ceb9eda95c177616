package org.janelia.pixelops.params;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rectangular image region given by its top left corner and its size.
 */
public class RegionParams implements OperationParams {
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public RegionParams(int x, int y, int width, int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public long[] getMin() {
        return new long[] {x, y};
    }

    public long[] getMax() {
        return new long[] {x + width - 1, y + height - 1};
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        Map<String, Object> resolved = new LinkedHashMap<>();
        resolved.put("x", x);
        resolved.put("y", y);
        resolved.put("width", width);
        resolved.put("height", height);
        return resolved;
    }
}
