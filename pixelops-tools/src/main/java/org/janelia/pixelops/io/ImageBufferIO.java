package org.janelia.pixelops.io;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import org.apache.commons.lang3.StringUtils;
import org.janelia.pixelops.errors.InvalidImageException;
import org.janelia.pixelops.image.ChannelLayout;
import org.janelia.pixelops.image.ImageBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes image files into normalized buffers and encodes buffers back to 8 bit images using ImageJ.
 * Color images become RGB buffers; every other image type is converted to 8 bit gray.
 */
public class ImageBufferIO {

    private static final Logger LOG = LoggerFactory.getLogger(ImageBufferIO.class);
    private static final float MAX_8BIT = 255f;

    public static ImageBuffer readImage(String source) {
        ImagePlus imagePlus = new Opener().openImage(source);
        if (imagePlus == null) {
            throw new InvalidImageException("Could not open image " + source);
        }
        return fromImagePlus(imagePlus);
    }

    public static ImageBuffer fromImagePlus(ImagePlus imagePlus) {
        if (imagePlus.getStackSize() > 1) {
            LOG.warn("Only the current slice of the {} slices of {} is processed", imagePlus.getStackSize(), imagePlus.getTitle());
        }
        ImageProcessor imageProcessor = imagePlus.getProcessor();
        int width = imageProcessor.getWidth();
        int height = imageProcessor.getHeight();
        if (imagePlus.getType() == ImagePlus.COLOR_RGB || imagePlus.getType() == ImagePlus.COLOR_256) {
            int[] rgbPixels = (int[]) imageProcessor.convertToRGB().getPixels();
            float[] samples = new float[rgbPixels.length * 3];
            for (int i = 0; i < rgbPixels.length; i++) {
                int rgb = rgbPixels[i];
                samples[3 * i] = ((rgb >> 16) & 0xff) / MAX_8BIT;
                samples[3 * i + 1] = ((rgb >> 8) & 0xff) / MAX_8BIT;
                samples[3 * i + 2] = (rgb & 0xff) / MAX_8BIT;
            }
            return ImageBuffer.fromInterleavedSamples(height, width, ChannelLayout.RGB, samples);
        } else {
            byte[] grayPixels = (byte[]) imageProcessor.convertToByteProcessor().getPixels();
            float[] samples = new float[grayPixels.length];
            for (int i = 0; i < grayPixels.length; i++) {
                samples[i] = (grayPixels[i] & 0xff) / MAX_8BIT;
            }
            return ImageBuffer.fromInterleavedSamples(height, width, ChannelLayout.GRAY, samples);
        }
    }

    /**
     * Quantize the buffer to an 8 bit ImageJ image. The alpha channel of RGBA buffers is not kept.
     */
    public static ImagePlus toImagePlus(String title, ImageBuffer image) {
        int width = image.getWidth();
        int height = image.getHeight();
        float[] samples = image.toInterleavedSamples();
        int nchannels = image.getChannels();
        if (image.getChannelLayout() == ChannelLayout.GRAY) {
            byte[] grayPixels = new byte[width * height];
            for (int i = 0; i < grayPixels.length; i++) {
                grayPixels[i] = (byte) to8Bit(samples[i]);
            }
            return new ImagePlus(title, new ByteProcessor(width, height, grayPixels));
        }
        if (image.getChannelLayout().hasAlpha()) {
            LOG.warn("Alpha channel of {} is dropped", title);
        }
        int[] rgbPixels = new int[width * height];
        for (int i = 0; i < rgbPixels.length; i++) {
            rgbPixels[i] = (to8Bit(samples[nchannels * i]) << 16)
                    | (to8Bit(samples[nchannels * i + 1]) << 8)
                    | to8Bit(samples[nchannels * i + 2]);
        }
        return new ImagePlus(title, new ColorProcessor(width, height, rgbPixels));
    }

    /**
     * Write the image in the format given by the file extension: tif, jpg or png (the default).
     */
    public static void writeImage(ImageBuffer image, String target) {
        ImagePlus imagePlus = toImagePlus(StringUtils.substringAfterLast(target, "/"), image);
        FileSaver fileSaver = new FileSaver(imagePlus);
        String extension = StringUtils.lowerCase(StringUtils.substringAfterLast(target, "."));
        boolean saved;
        if (StringUtils.equalsAny(extension, "tif", "tiff")) {
            saved = fileSaver.saveAsTiff(target);
        } else if (StringUtils.equalsAny(extension, "jpg", "jpeg")) {
            saved = fileSaver.saveAsJpeg(target);
        } else {
            saved = fileSaver.saveAsPng(target);
        }
        if (!saved) {
            throw new IllegalStateException("Error writing " + target);
        }
        LOG.debug("Wrote {} to {}", image, target);
    }

    private static int to8Bit(float v) {
        return Math.round(v * MAX_8BIT);
    }
}
