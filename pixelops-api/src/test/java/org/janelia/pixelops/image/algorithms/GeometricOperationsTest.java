package org.janelia.pixelops.image.algorithms;

import org.janelia.pixelops.image.ChannelLayout;
import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.params.EnlargeRegionParams;
import org.janelia.pixelops.params.ReduceResolutionParams;
import org.janelia.pixelops.params.RegionParams;
import org.janelia.pixelops.params.RotateParams;
import org.janelia.pixelops.params.TranslateParams;
import org.junit.Test;

import static org.janelia.pixelops.ImageTestUtils.EPSILON;
import static org.janelia.pixelops.ImageTestUtils.assertSamples;
import static org.janelia.pixelops.ImageTestUtils.assertShape;
import static org.janelia.pixelops.ImageTestUtils.gray;
import static org.janelia.pixelops.ImageTestUtils.rgb;
import static org.janelia.pixelops.ImageTestUtils.rgba;
import static org.junit.Assert.assertEquals;

public class GeometricOperationsTest {

    @Test
    public void rotateQuarterTurn() {
        // P0 on the left, P1 on the right
        ImageBuffer image = rgb(1, 2, 0.1f, 0.2f, 0.3f, 0.7f, 0.8f, 0.9f);
        ImageBuffer rotated = GeometricOperations.rotate(image, new RotateParams(90, 0));
        assertShape(2, 1, ChannelLayout.RGB, rotated);
        // P0 ends up on top of P1
        assertSamples(new float[] {0.1f, 0.2f, 0.3f, 0.7f, 0.8f, 0.9f}, rotated);

        ImageBuffer rotatedBack = GeometricOperations.rotate(rotated, new RotateParams(-90, 0));
        assertSamples(image.toInterleavedSamples(), rotatedBack);
    }

    @Test
    public void rotateHalfTurn() {
        ImageBuffer image = gray(2, 2, 0.1f, 0.2f, 0.3f, 0.4f);
        ImageBuffer rotated = GeometricOperations.rotate(image, new RotateParams(180, 0));
        assertSamples(new float[] {0.4f, 0.3f, 0.2f, 0.1f}, rotated);
    }

    @Test
    public void rotateExpandsCanvas() {
        ImageBuffer image = ImageBuffer.uniform(10, 10, ChannelLayout.RGBA, 1f, 1f, 1f, 1f);
        ImageBuffer rotated = GeometricOperations.rotate(image, new RotateParams(45, 0));
        assertShape(15, 15, ChannelLayout.RGBA, rotated);
        // the corners are outside the rotated content so they are transparent black
        for (int c = 0; c < 4; c++) {
            assertEquals(0f, rotated.getSample(0, 0, c), EPSILON);
            assertEquals(0f, rotated.getSample(14, 14, c), EPSILON);
        }
        // the center is inside
        assertEquals(1f, rotated.getSample(7, 7, 3), EPSILON);
    }

    @Test
    public void cropThenTranslate() {
        ImageBuffer image = gray(2, 3,
                0.1f, 0.2f, 0.3f,
                0.4f, 0.5f, 0.6f);
        ImageBuffer cropped = GeometricOperations.crop(image, new RegionParams(1, 0, 2, 2));
        assertShape(2, 2, ChannelLayout.GRAY, cropped);
        assertSamples(new float[] {0.2f, 0.3f, 0.5f, 0.6f}, cropped);

        ImageBuffer translated = GeometricOperations.translate(cropped, new TranslateParams(1, 1, 0));
        assertSamples(new float[] {0f, 0f, 0f, 0.2f}, translated);

        ImageBuffer translatedWithFill = GeometricOperations.translate(cropped, new TranslateParams(-1, 0, 1));
        assertSamples(new float[] {0.3f, 1f, 0.6f, 1f}, translatedWithFill);
    }

    @Test
    public void translateKeepsAlphaFillTransparent() {
        ImageBuffer image = rgba(1, 2, 0.1f, 0.2f, 0.3f, 1f, 0.4f, 0.5f, 0.6f, 1f);
        ImageBuffer translated = GeometricOperations.translate(image, new TranslateParams(1, 0, 0.5));
        assertSamples(new float[] {0.5f, 0.5f, 0.5f, 0f, 0.1f, 0.2f, 0.3f, 1f}, translated);
    }

    @Test
    public void reduceResolutionByIntegerFactor() {
        ImageBuffer image = gray(2, 4,
                0.0f, 0.2f, 0.4f, 0.6f,
                0.2f, 0.4f, 0.6f, 0.8f);
        ImageBuffer reduced = GeometricOperations.reduceResolution(image, new ReduceResolutionParams(2, 2, 1));
        assertShape(1, 2, ChannelLayout.GRAY, reduced);
        assertSamples(new float[] {0.2f, 0.6f}, reduced);
    }

    @Test
    public void reduceResolutionByFractionalFactor() {
        ImageBuffer image = gray(1, 3, 0f, 0.3f, 0.6f);
        ImageBuffer reduced = GeometricOperations.reduceResolution(image, new ReduceResolutionParams(1.5, 2, 1));
        // the first target pixel covers all of pixel 0 and half of pixel 1
        assertSamples(new float[] {0.1f, 0.5f}, reduced);
    }

    @Test
    public void enlargeSinglePixelRegion() {
        ImageBuffer image = rgb(1, 2, 0.1f, 0.2f, 0.3f, 0.7f, 0.8f, 0.9f);
        ImageBuffer enlarged = GeometricOperations.enlargeRegion(image,
                new EnlargeRegionParams(new RegionParams(1, 0, 1, 1), 3, 3));
        assertShape(3, 3, ChannelLayout.RGB, enlarged);
        for (int y = 0; y < 3; y++) {
            for (int x = 0; x < 3; x++) {
                assertEquals(0.7f, enlarged.getSample(y, x, 0), EPSILON);
                assertEquals(0.8f, enlarged.getSample(y, x, 1), EPSILON);
                assertEquals(0.9f, enlarged.getSample(y, x, 2), EPSILON);
            }
        }
    }

    @Test
    public void enlargeRegionInterpolatesPixelCenters() {
        ImageBuffer image = gray(1, 3, 0f, 1f, 0.5f);
        ImageBuffer enlarged = GeometricOperations.enlargeRegion(image,
                new EnlargeRegionParams(new RegionParams(0, 0, 2, 1), 4, 1));
        // pixel 2 is outside the region and must not be sampled
        assertSamples(new float[] {0f, 0.25f, 0.75f, 1f}, enlarged);
    }
}
