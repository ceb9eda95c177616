package org.janelia.pixelops.params;

import java.util.Map;

/**
 * Validated, typed parameters of one operation.
 */
public interface OperationParams {

    /**
     * @return the resolved parameter values, defaults included, as they are reported in the result provenance.
     */
    Map<String, Object> asResolvedMap();
}
