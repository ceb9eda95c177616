package org.janelia.pixelops.image.algorithms;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;
import org.janelia.pixelops.image.ChannelLayout;
import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.image.ImageTransforms;
import org.janelia.pixelops.params.BinarizeParams;
import org.janelia.pixelops.params.BrightnessParams;
import org.janelia.pixelops.params.ContrastParams;
import org.janelia.pixelops.params.GrayscaleMethod;
import org.janelia.pixelops.params.GrayscaleParams;

/**
 * Per sample tone adjustments. Only color channels are changed, alpha passes through.
 * The parameters and the channel layout must already be validated.
 */
public class ToneOperations {

    public static ImageBuffer brightness(ImageBuffer image, BrightnessParams params) {
        return image.withSamples(
                ImageTransforms.transformColorSamples(image, params.getMode().toSampleOp(params.getFactor())));
    }

    public static ImageBuffer contrast(ImageBuffer image, ContrastParams params) {
        return image.withSamples(
                ImageTransforms.transformColorSamples(image, params.getMode().toSampleOp(params.getCoefficient())));
    }

    public static ImageBuffer negative(ImageBuffer image) {
        return image.withSamples(ImageTransforms.transformColorSamples(image, v -> 1 - v));
    }

    /**
     * Combine the red, green and blue channels into a single gray channel; alpha is dropped.
     */
    public static ImageBuffer grayscale(ImageBuffer image, GrayscaleParams params) {
        return image.withSamples(toGray(image, params.getMethod()), ChannelLayout.GRAY);
    }

    /**
     * Threshold the color channels, or the luminosity if the grayscale flag is set.
     */
    public static ImageBuffer binarize(ImageBuffer image, BinarizeParams params) {
        double threshold = params.getThreshold();
        if (params.isGrayscaleFirst() && image.getChannelLayout() != ChannelLayout.GRAY) {
            RandomAccessibleInterval<FloatType> gray = toGray(image, GrayscaleMethod.LUMINOSITY);
            return image.withSamples(
                    ImageTransforms.createPixelTransformation(gray, (s, t) -> t.set(s.get() >= threshold ? 1f : 0f), FloatType::new),
                    ChannelLayout.GRAY);
        } else {
            return image.withSamples(ImageTransforms.transformColorSamples(image, v -> v >= threshold ? 1 : 0));
        }
    }

    private static RandomAccessibleInterval<FloatType> toGray(ImageBuffer image, GrayscaleMethod method) {
        ArrayImg<FloatType, FloatArray> gray = ArrayImgs.floats(image.getWidth(), image.getHeight(), 1);
        RandomAccess<FloatType> rgbAccess = image.pixels().randomAccess();
        Cursor<FloatType> grayCursor = gray.localizingCursor();
        while (grayCursor.hasNext()) {
            grayCursor.fwd();
            rgbAccess.setPosition(grayCursor.getLongPosition(ImageBuffer.X_AXIS), ImageBuffer.X_AXIS);
            rgbAccess.setPosition(grayCursor.getLongPosition(ImageBuffer.Y_AXIS), ImageBuffer.Y_AXIS);
            rgbAccess.setPosition(0, ImageBuffer.CHANNEL_AXIS);
            double r = rgbAccess.get().getRealDouble();
            rgbAccess.fwd(ImageBuffer.CHANNEL_AXIS);
            double g = rgbAccess.get().getRealDouble();
            rgbAccess.fwd(ImageBuffer.CHANNEL_AXIS);
            double b = rgbAccess.get().getRealDouble();
            grayCursor.get().setReal(method.combine(r, g, b));
        }
        return gray;
    }
}
