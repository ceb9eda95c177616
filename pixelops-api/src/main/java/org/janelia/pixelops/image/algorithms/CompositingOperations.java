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
import org.janelia.pixelops.params.ChannelParams;
import org.janelia.pixelops.params.ColorModel;
import org.janelia.pixelops.params.MergeParams;

/**
 * Operations that combine images or channels. Shapes and layouts must already be validated.
 */
public class CompositingOperations {

    /**
     * alpha * image + (1 - alpha) * other, with alpha either global or read from the alpha mask.
     */
    public static ImageBuffer merge(ImageBuffer image, MergeParams params) {
        ImageBuffer alphaMask = params.getAlphaMask();
        if (alphaMask == null) {
            double alpha = params.getAlpha();
            RandomAccessibleInterval<FloatType> blended = ImageTransforms.createBinaryPixelOperation(
                    image.pixels(),
                    params.getOther().pixels(),
                    (a, b, t) -> t.setReal(alpha * a.getRealDouble() + (1 - alpha) * b.getRealDouble()),
                    FloatType::new
            );
            return image.withSamples(blended);
        }
        ArrayImg<FloatType, FloatArray> blended = ArrayImgs.floats(image.pixels().dimensionsAsLongArray());
        RandomAccess<FloatType> imageAccess = image.pixels().randomAccess();
        RandomAccess<FloatType> otherAccess = params.getOther().pixels().randomAccess();
        RandomAccess<FloatType> maskAccess = alphaMask.channel(0).randomAccess();
        Cursor<FloatType> blendedCursor = blended.localizingCursor();
        while (blendedCursor.hasNext()) {
            blendedCursor.fwd();
            imageAccess.setPosition(blendedCursor);
            otherAccess.setPosition(blendedCursor);
            maskAccess.setPosition(blendedCursor.getLongPosition(ImageBuffer.X_AXIS), ImageBuffer.X_AXIS);
            maskAccess.setPosition(blendedCursor.getLongPosition(ImageBuffer.Y_AXIS), ImageBuffer.Y_AXIS);
            double alpha = maskAccess.get().getRealDouble();
            blendedCursor.get().setReal(alpha * imageAccess.get().getRealDouble() + (1 - alpha) * otherAccess.get().getRealDouble());
        }
        return image.withSamples(blended);
    }

    /**
     * Convert the color samples to the selected model, zero the channels that are not kept, permute them
     * and convert the result to the output model. Alpha is carried over. In extract mode the result is
     * the gray plane of the single kept channel.
     */
    public static ImageBuffer manipulateChannels(ImageBuffer image, ChannelParams params) {
        ColorModel model = params.getModel();
        int width = image.getWidth();
        int height = image.getHeight();
        RandomAccess<FloatType> sourceAccess = image.pixels().randomAccess();
        if (params.isExtract()) {
            int extractedChannel = params.getFirstKeptChannel();
            ArrayImg<FloatType, FloatArray> extracted = ArrayImgs.floats(width, height, 1);
            Cursor<FloatType> extractedCursor = extracted.localizingCursor();
            while (extractedCursor.hasNext()) {
                extractedCursor.fwd();
                sourceAccess.setPosition(extractedCursor);
                sourceAccess.setPosition(extractedChannel, ImageBuffer.CHANNEL_AXIS);
                extractedCursor.get().setReal(model.fromRGB(sourceAccess.get().getRealDouble()));
            }
            return image.withSamples(extracted, ChannelLayout.GRAY);
        }
        int nchannels = image.getChannels();
        ArrayImg<FloatType, FloatArray> result = ArrayImgs.floats(width, height, nchannels);
        RandomAccess<FloatType> resultAccess = result.randomAccess();
        double[] modelSamples = new double[3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                sourceAccess.setPosition(x, ImageBuffer.X_AXIS);
                sourceAccess.setPosition(y, ImageBuffer.Y_AXIS);
                resultAccess.setPosition(x, ImageBuffer.X_AXIS);
                resultAccess.setPosition(y, ImageBuffer.Y_AXIS);
                for (int c = 0; c < 3; c++) {
                    sourceAccess.setPosition(c, ImageBuffer.CHANNEL_AXIS);
                    modelSamples[c] = params.isKept(c) ? model.fromRGB(sourceAccess.get().getRealDouble()) : 0;
                }
                for (int c = 0; c < 3; c++) {
                    double rgb = model.toRGB(modelSamples[params.getSourceChannel(c)]);
                    resultAccess.setPosition(c, ImageBuffer.CHANNEL_AXIS);
                    resultAccess.get().setReal(params.getOutputModel().fromRGB(rgb));
                }
                for (int c = 3; c < nchannels; c++) {
                    sourceAccess.setPosition(c, ImageBuffer.CHANNEL_AXIS);
                    resultAccess.setPosition(c, ImageBuffer.CHANNEL_AXIS);
                    resultAccess.get().set(sourceAccess.get());
                }
            }
        }
        return image.withSamples(result);
    }
}
