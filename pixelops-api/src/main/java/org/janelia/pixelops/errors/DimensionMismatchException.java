package org.janelia.pixelops.errors;

import java.util.Arrays;

/**
 * Raised by multi-buffer operations when the buffers do not have the same shape.
 */
public class DimensionMismatchException extends ImageProcessingException {

    private final long[] expectedShape;
    private final long[] actualShape;

    public DimensionMismatchException(String operation, long[] expectedShape, long[] actualShape) {
        super(operation, String.format("Operation '%s' requires images of identical shape: expected %s but got %s",
                operation, Arrays.toString(expectedShape), Arrays.toString(actualShape)));
        this.expectedShape = expectedShape.clone();
        this.actualShape = actualShape.clone();
    }

    public long[] getExpectedShape() {
        return expectedShape.clone();
    }

    public long[] getActualShape() {
        return actualShape.clone();
    }
}
