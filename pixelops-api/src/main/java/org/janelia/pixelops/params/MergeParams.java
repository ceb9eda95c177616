package org.janelia.pixelops.params;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.annotation.Nullable;

import org.janelia.pixelops.image.ImageBuffer;

public class MergeParams implements OperationParams {
    private final ImageBuffer other;
    private final double alpha;
    private final ImageBuffer alphaMask;

    public MergeParams(ImageBuffer other, double alpha, @Nullable ImageBuffer alphaMask) {
        this.other = other;
        this.alpha = alpha;
        this.alphaMask = alphaMask;
    }

    public ImageBuffer getOther() {
        return other;
    }

    /**
     * @return weight of the first image; the other image is weighted by 1 - alpha
     */
    public double getAlpha() {
        return alpha;
    }

    /**
     * @return gray buffer with a per pixel weight of the first image or null if the global alpha is used
     */
    @Nullable
    public ImageBuffer getAlphaMask() {
        return alphaMask;
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        Map<String, Object> resolved = new LinkedHashMap<>();
        resolved.put("other", Arrays.toString(other.getShape()));
        if (alphaMask != null) {
            resolved.put("alpha_mask", Arrays.toString(alphaMask.getShape()));
        } else {
            resolved.put("alpha", alpha);
        }
        return resolved;
    }
}
