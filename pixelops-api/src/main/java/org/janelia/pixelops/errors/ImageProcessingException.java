package org.janelia.pixelops.errors;

import javax.annotation.Nullable;

/**
 * Base of all validation failures raised by the engine. Failures are always detected before
 * any pixel is computed so a caught exception never leaves a partially processed image behind.
 */
public abstract class ImageProcessingException extends IllegalArgumentException {

    private final String operation;

    protected ImageProcessingException(@Nullable String operation, String message) {
        super(message);
        this.operation = operation;
    }

    /**
     * @return the name of the operation that failed or null if the failure is not tied to an operation,
     * e.g. a malformed buffer at the decoding boundary.
     */
    @Nullable
    public String getOperation() {
        return operation;
    }
}
