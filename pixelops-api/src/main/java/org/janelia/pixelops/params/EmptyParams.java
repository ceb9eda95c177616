package org.janelia.pixelops.params;

import java.util.Collections;
import java.util.Map;

public class EmptyParams implements OperationParams {

    public static final EmptyParams INSTANCE = new EmptyParams();

    private EmptyParams() {
    }

    @Override
    public Map<String, Object> asResolvedMap() {
        return Collections.emptyMap();
    }
}
