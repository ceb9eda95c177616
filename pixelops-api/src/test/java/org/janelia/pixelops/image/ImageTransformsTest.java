package org.janelia.pixelops.image;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;
import org.junit.Test;

import static org.janelia.pixelops.ImageTestUtils.EPSILON;
import static org.janelia.pixelops.ImageTestUtils.assertSamples;
import static org.janelia.pixelops.ImageTestUtils.rgba;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ImageTransformsTest {

    @Test
    public void rotatedExtent() {
        class TestData {
            final long width;
            final long height;
            final double angle;
            final long[] expectedExtent;

            TestData(long width, long height, double angle, long[] expectedExtent) {
                this.width = width;
                this.height = height;
                this.angle = angle;
                this.expectedExtent = expectedExtent;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData(4, 2, 0, new long[] {4, 2}),
                new TestData(4, 2, 90, new long[] {2, 4}),
                new TestData(4, 2, -90, new long[] {2, 4}),
                new TestData(4, 2, 180, new long[] {4, 2}),
                new TestData(4, 2, 450, new long[] {2, 4}),
                new TestData(10, 10, 45, new long[] {15, 15}),
                new TestData(1, 1, 30, new long[] {2, 2}),
        };
        for (TestData td : testData) {
            assertArrayEquals("Angle " + td.angle,
                    td.expectedExtent,
                    RotateTransform.rotatedExtent(td.width, td.height, td.angle));
        }
    }

    @Test
    public void transformColorSamplesKeepsAlpha() {
        ImageBuffer image = rgba(1, 1, 0.2f, 0.4f, 0.6f, 0.3f);
        RandomAccessibleInterval<FloatType> transformed = ImageTransforms.transformColorSamples(image, v -> 1 - v);
        assertSamples(new float[] {0.8f, 0.6f, 0.4f, 0.3f}, image.withSamples(transformed));
    }

    @Test
    public void resampleWithFill() {
        ImageBuffer image = ImageBuffer.fromInterleavedSamples(1, 3, ChannelLayout.RGBA, new float[] {
                0.1f, 0.1f, 0.1f, 1f,
                0.2f, 0.2f, 0.2f, 1f,
                0.3f, 0.3f, 0.3f, 1f
        });
        RandomAccessibleInterval<FloatType> shifted = ImageTransforms.resample(
                image.pixels(), 3, 1,
                new ShiftTransform(new long[] {-2, 0}),
                Interpolation.NEAREST,
                FillPolicy.withColor(ChannelLayout.RGBA, 0.5));
        assertSamples(new float[] {
                0.3f, 0.3f, 0.3f, 1f,
                0.5f, 0.5f, 0.5f, 0f,
                0.5f, 0.5f, 0.5f, 0f
        }, image.withSamples(shifted));
    }

    @Test
    public void snapToGrid() {
        assertEquals(2.0, CoordUtils.snapToGrid(2.0 - 1e-12), 0);
        assertEquals(-1.0, CoordUtils.snapToGrid(-1.0 + 1e-12), 0);
        assertEquals(0.5, CoordUtils.snapToGrid(0.5), 0);
        assertEquals(3, CoordUtils.ceilExtent(3.0000000000004));
        assertEquals(4, CoordUtils.ceilExtent(3.01));
    }

    @Test
    public void histogramBins() {
        ImageBuffer image = ImageBuffer.fromInterleavedSamples(1, 4, ChannelLayout.GRAY, new float[] {0f, 0.5f, 0.999f, 1f});
        long[] bins = ImageAccessUtils.histogram(image.channel(0), 256);
        assertEquals(1, bins[0]);
        assertEquals(1, bins[127]);
        assertEquals(1, bins[254]);
        assertEquals(1, bins[255]);
        assertEquals(4, ImageAccessUtils.getMaxSize(new long[] {2, 2}));
        assertEquals(0.0, PixelOps.clamp(-3), EPSILON);
    }
}
