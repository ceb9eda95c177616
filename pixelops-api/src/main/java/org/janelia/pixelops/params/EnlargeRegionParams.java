package org.janelia.pixelops.params;

import java.util.LinkedHashMap;
import java.util.Map;

public class EnlargeRegionParams implements OperationParams {
    private final RegionParams region;
    private final int targetWidth;
    private final int targetHeight;

    public EnlargeRegionParams(RegionParams region, int targetWidth, int targetHeight) {
        this.region = region;
        this.targetWidth = targetWidth;
        this.targetHeight = targetHeight;
    }

    public RegionParams getRegion() {
        return region;
    }

    public int getTargetWidth() {
        return targetWidth;
    }

    public int getTargetHeight() {
        return targetHeight;
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        Map<String, Object> resolved = new LinkedHashMap<>(region.asResolvedMap());
        resolved.put("target_width", targetWidth);
        resolved.put("target_height", targetHeight);
        resolved.put("interpolation", "bilinear");
        return resolved;
    }
}
