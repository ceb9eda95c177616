package org.janelia.pixelops.params;

import java.util.Collections;
import java.util.Map;

public class GrayscaleParams implements OperationParams {
    private final GrayscaleMethod method;

    public GrayscaleParams(GrayscaleMethod method) {
        this.method = method;
    }

    public GrayscaleMethod getMethod() {
        return method;
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        return Collections.singletonMap("method", method.name().toLowerCase());
    }
}
