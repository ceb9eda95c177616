package org.janelia.pixelops.processing;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.params.OperationParams;
import org.janelia.pixelops.params.ProcessingParams;

/**
 * Validates the parameters of one catalogue operation and applies it.
 *
 * @param <P> typed operation parameters
 */
public interface ImageOperationProvider<P extends OperationParams> {

    /**
     * @return the parameters used when the caller does not set them
     */
    ProcessingParams getDefaultParams();

    /**
     * @return every parameter name the operation accepts, required or optional
     */
    Set<String> getParamNames();

    /**
     * Check the parameters and the image layout and resolve the defaults. This must fail before
     * any pixel is computed.
     *
     * @throws org.janelia.pixelops.errors.ImageProcessingException if the operation cannot be applied
     */
    P resolveParams(ProcessingParams params, ImageBuffer image);

    ImageBuffer apply(ImageBuffer image, P params);

    /**
     * @return scalar outputs that the operation derives from the input besides the new image
     */
    default Map<String, Object> getDerivedOutputs(ImageBuffer image, P params) {
        return Collections.emptyMap();
    }
}
