package org.janelia.pixelops.io;

import java.io.File;

import ij.ImagePlus;
import ij.process.ColorProcessor;
import org.janelia.pixelops.errors.InvalidImageException;
import org.janelia.pixelops.image.ChannelLayout;
import org.janelia.pixelops.image.ImageBuffer;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ImageBufferIOTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void colorImagePlusToBuffer() {
        ColorProcessor colorProcessor = new ColorProcessor(2, 1, new int[] {0xff0000, 0x00ff33});
        ImageBuffer image = ImageBufferIO.fromImagePlus(new ImagePlus("test", colorProcessor));
        assertEquals(ChannelLayout.RGB, image.getChannelLayout());
        assertEquals(2, image.getWidth());
        assertEquals(1, image.getHeight());
        assertArrayEquals(new float[] {1f, 0f, 0f, 0f, 1f, 0x33 / 255f}, image.toInterleavedSamples(), 1e-6f);
    }

    @Test
    public void bufferToImagePlus() {
        ImageBuffer gray = ImageBuffer.fromInterleavedSamples(1, 3, ChannelLayout.GRAY, new float[] {0f, 0.5f, 1f});
        ImagePlus grayImage = ImageBufferIO.toImagePlus("gray", gray);
        assertEquals(ImagePlus.GRAY8, grayImage.getType());
        assertEquals(128, grayImage.getProcessor().get(1, 0));
        assertEquals(255, grayImage.getProcessor().get(2, 0));

        ImageBuffer rgba = ImageBuffer.fromInterleavedSamples(1, 1, ChannelLayout.RGBA, new float[] {1f, 0.5f, 0f, 0.2f});
        ImagePlus rgbImage = ImageBufferIO.toImagePlus("rgba", rgba);
        assertEquals(ImagePlus.COLOR_RGB, rgbImage.getType());
        assertEquals(0xff8000, rgbImage.getProcessor().get(0, 0) & 0xffffff);
    }

    @Test
    public void writeAndReadPng() throws Exception {
        float[] samples = new float[] {
                0f, 0f, 0f,   1f, 0f, 0f,
                0f, 1f, 0f,   0f, 0f, 1f
        };
        ImageBuffer image = ImageBuffer.fromInterleavedSamples(2, 2, ChannelLayout.RGB, samples);
        String target = new File(testFolder.getRoot(), "rgb.png").getAbsolutePath();
        ImageBufferIO.writeImage(image, target);
        ImageBuffer readImage = ImageBufferIO.readImage(target);
        assertEquals(ChannelLayout.RGB, readImage.getChannelLayout());
        assertArrayEquals(samples, readImage.toInterleavedSamples(), 1e-6f);
    }

    @Test(expected = InvalidImageException.class)
    public void readMissingImage() {
        ImageBufferIO.readImage(new File(testFolder.getRoot(), "missing.png").getAbsolutePath());
    }
}
