package org.janelia.pixelops.image;

import java.util.Arrays;

/**
 * Moves the image content by the given shifts, i.e. the target pixel p comes from p - shift.
 */
public class ShiftTransform implements GeomTransform {
    private final long[] shifts;

    public ShiftTransform(long[] shifts) {
        this.shifts = Arrays.copyOf(shifts, shifts.length);
    }

    @Override
    public void apply(long[] targetPos, double[] sourcePos) {
        for (int d = 0; d < shifts.length; d++) {
            sourcePos[d] = targetPos[d] - shifts[d];
        }
    }
}
