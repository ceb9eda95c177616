package org.janelia.pixelops.errors;

/**
 * Malformed or empty image buffer.
 */
public class InvalidImageException extends ImageProcessingException {

    public InvalidImageException(String message) {
        super(null, message);
    }
}
