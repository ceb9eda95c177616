package org.janelia.pixelops.image;

import java.util.function.Supplier;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.converter.BiConverter;
import net.imglib2.converter.Converter;
import net.imglib2.converter.read.BiConvertedRandomAccessibleInterval;
import net.imglib2.converter.read.ConvertedRandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.Type;
import net.imglib2.type.numeric.real.FloatType;

public class ImageTransforms {

    public static <S extends Type<S>, T extends Type<T>>
    RandomAccessibleInterval<T> createPixelTransformation(RandomAccessibleInterval<S> img,
                                                          Converter<S, T> pixelConverter,
                                                          Supplier<T> targetPixelSupplier) {
        Supplier<Converter<? super S, ? super T>> pixelConverterSupplier = () -> pixelConverter;
        return new ConvertedRandomAccessibleInterval<S, T>(
                img,
                pixelConverterSupplier,
                targetPixelSupplier
        );
    }

    public static <R extends Type<R>, S extends Type<S>, T extends Type<T>>
    RandomAccessibleInterval<T> createBinaryPixelOperation(RandomAccessibleInterval<R> img1,
                                                           RandomAccessibleInterval<S> img2,
                                                           BiConverter<? super R, ? super S, ? super T> op,
                                                           Supplier<T> resultPxTypeSupplier) {
        Supplier<BiConverter<? super R, ? super S, ? super T>> pixelConverterSupplier = () -> op;
        return new BiConvertedRandomAccessibleInterval<R, S, T>(
                img1,
                img2,
                pixelConverterSupplier,
                resultPxTypeSupplier
        );
    }

    /**
     * Apply a sample transformation to the color channels of the image and leave the alpha channel,
     * if there is one, unchanged.
     */
    public static RandomAccessibleInterval<FloatType> transformColorSamples(ImageBuffer image, SampleOp op) {
        ChannelLayout channelLayout = image.getChannelLayout();
        RandomAccessibleInterval<FloatType> transformed = createPixelTransformation(
                image.pixels(),
                (s, t) -> t.set((float) op.apply(s.get())),
                FloatType::new
        );
        if (!channelLayout.hasAlpha()) {
            return transformed;
        }
        int alphaChannel = channelLayout.getChannels() - 1;
        ArrayImg<FloatType, FloatArray> result = ArrayImgs.floats(transformed.dimensionsAsLongArray());
        Cursor<FloatType> resultCursor = result.localizingCursor();
        RandomAccess<FloatType> transformedAccess = transformed.randomAccess();
        RandomAccess<FloatType> originalAccess = image.pixels().randomAccess();
        while (resultCursor.hasNext()) {
            resultCursor.fwd();
            RandomAccess<FloatType> access = resultCursor.getLongPosition(ImageBuffer.CHANNEL_AXIS) == alphaChannel
                    ? originalAccess
                    : transformedAccess;
            access.setPosition(resultCursor);
            resultCursor.get().set(access.get());
        }
        return result;
    }

    /**
     * Resample the image on a width x height canvas. Every target pixel is mapped to a source location
     * by the geometric transformation and the source is sampled at that location with the given interpolation;
     * neighbors that fall outside the source take the fill value.
     */
    public static RandomAccessibleInterval<FloatType> resample(RandomAccessibleInterval<FloatType> source,
                                                               long width, long height,
                                                               GeomTransform geomTransform,
                                                               Interpolation interpolation,
                                                               FillPolicy fillPolicy) {
        long nchannels = source.dimension(ImageBuffer.CHANNEL_AXIS);
        ArrayImg<FloatType, FloatArray> result = ArrayImgs.floats(width, height, nchannels);
        PixelSampler sampler = new PixelSampler(source, interpolation);
        long[] targetPos = new long[2];
        double[] sourcePos = new double[2];
        Cursor<FloatType> resultCursor = result.localizingCursor();
        while (resultCursor.hasNext()) {
            resultCursor.fwd();
            targetPos[0] = resultCursor.getLongPosition(ImageBuffer.X_AXIS);
            targetPos[1] = resultCursor.getLongPosition(ImageBuffer.Y_AXIS);
            int channel = resultCursor.getIntPosition(ImageBuffer.CHANNEL_AXIS);
            geomTransform.apply(targetPos, sourcePos);
            resultCursor.get().set(
                    (float) sampler.sample(sourcePos[0], sourcePos[1], channel, fillPolicy.getValue(channel)));
        }
        return result;
    }

    @FunctionalInterface
    public interface SampleOp {
        double apply(double v);
    }
}
