package org.janelia.pixelops;

import org.janelia.pixelops.image.ChannelLayout;
import org.janelia.pixelops.image.ImageBuffer;

import static org.junit.Assert.assertEquals;

public class ImageTestUtils {

    public static final double EPSILON = 1e-6;

    public static ImageBuffer gray(int height, int width, float... samples) {
        return ImageBuffer.fromInterleavedSamples(height, width, ChannelLayout.GRAY, samples);
    }

    public static ImageBuffer rgb(int height, int width, float... samples) {
        return ImageBuffer.fromInterleavedSamples(height, width, ChannelLayout.RGB, samples);
    }

    public static ImageBuffer rgba(int height, int width, float... samples) {
        return ImageBuffer.fromInterleavedSamples(height, width, ChannelLayout.RGBA, samples);
    }

    public static void assertSamples(float[] expected, ImageBuffer image) {
        float[] actual = image.toInterleavedSamples();
        assertEquals("Number of samples", expected.length, actual.length);
        for (int i = 0; i < expected.length; i++) {
            assertEquals("Sample " + i, expected[i], actual[i], EPSILON);
        }
    }

    public static void assertShape(int height, int width, ChannelLayout channelLayout, ImageBuffer image) {
        assertEquals(height, image.getHeight());
        assertEquals(width, image.getWidth());
        assertEquals(channelLayout, image.getChannelLayout());
    }
}
