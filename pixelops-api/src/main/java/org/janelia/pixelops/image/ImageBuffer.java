package org.janelia.pixelops.image;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.pixelops.errors.InvalidImageException;

/**
 * Immutable normalized image. Samples are stored in an imglib2 array image with the axes
 * (x, y, channel) and every sample is in the [0, 1] interval.
 *
 * The only ways to get a buffer are the factory methods, which validate externally supplied samples,
 * and {@link #withSamples(RandomAccessibleInterval, ChannelLayout)}, which is how operations derive
 * their result and which clamps the derived samples.
 */
public class ImageBuffer {

    public static final int X_AXIS = 0;
    public static final int Y_AXIS = 1;
    public static final int CHANNEL_AXIS = 2;

    private final ArrayImg<FloatType, FloatArray> pixels;
    private final ChannelLayout channelLayout;

    private ImageBuffer(ArrayImg<FloatType, FloatArray> pixels, ChannelLayout channelLayout) {
        this.pixels = pixels;
        this.channelLayout = channelLayout;
    }

    public static ImageBuffer fromInterleavedSamples(int height, int width, String channelTag, float[] samples) {
        return fromInterleavedSamples(height, width, ChannelLayout.fromTag(channelTag), samples);
    }

    /**
     * Create a buffer from decoded samples.
     *
     * @param height image height
     * @param width image width
     * @param channelLayout channel layout
     * @param samples samples in row major, pixel interleaved order, i.e. [height][width][channels]
     * @return a new image buffer
     */
    public static ImageBuffer fromInterleavedSamples(int height, int width, ChannelLayout channelLayout, float[] samples) {
        if (channelLayout == null) {
            throw new InvalidImageException("Channel layout is required");
        }
        checkDimensions(width, height);
        int nchannels = channelLayout.getChannels();
        long expectedSamples = (long) height * width * nchannels;
        if (samples == null || samples.length != expectedSamples) {
            throw new InvalidImageException(String.format("Expected %d samples for a %dx%d %s image but got %d",
                    expectedSamples, width, height, channelLayout, samples == null ? 0 : samples.length));
        }
        float[] planarSamples = new float[samples.length];
        int planeSize = width * height;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < nchannels; c++) {
                    float v = samples[(y * width + x) * nchannels + c];
                    if (!(v >= 0f && v <= 1f)) {
                        throw new InvalidImageException(String.format(
                                "Sample %s at row %d, column %d, channel %d is outside [0, 1]", v, y, x, c));
                    }
                    planarSamples[c * planeSize + y * width + x] = v;
                }
            }
        }
        return new ImageBuffer(ArrayImgs.floats(planarSamples, width, height, nchannels), channelLayout);
    }

    /**
     * Create a buffer in which every pixel has the given channel values.
     */
    public static ImageBuffer uniform(int height, int width, ChannelLayout channelLayout, float... channelValues) {
        if (channelValues.length != channelLayout.getChannels()) {
            throw new InvalidImageException(String.format("%s pixels have %d channels but %d values were given",
                    channelLayout, channelLayout.getChannels(), channelValues.length));
        }
        float[] samples = new float[height * width * channelValues.length];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = channelValues[i % channelValues.length];
        }
        return fromInterleavedSamples(height, width, channelLayout, samples);
    }

    private static void checkDimensions(long width, long height) {
        if (width < 1 || height < 1) {
            throw new InvalidImageException(String.format("Image dimensions must be positive: %dx%d", width, height));
        }
    }

    /**
     * Derive a new buffer with the same channel layout as this one.
     */
    public ImageBuffer withSamples(RandomAccessibleInterval<FloatType> samples) {
        return withSamples(samples, channelLayout);
    }

    /**
     * Derive a new buffer from the given samples. The shape is validated against the channel layout and
     * the samples are copied and clamped to [0, 1]. NaN samples are rejected.
     *
     * @param samples (x, y, channel) samples
     * @param targetLayout channel layout of the new buffer
     * @return a new buffer that does not share storage with the samples argument
     */
    public ImageBuffer withSamples(RandomAccessibleInterval<FloatType> samples, ChannelLayout targetLayout) {
        if (samples.numDimensions() != 3) {
            throw new InvalidImageException("Expected (x, y, channel) samples but got " + samples.numDimensions() + " dimensions");
        }
        long[] dims = samples.dimensionsAsLongArray();
        checkDimensions(dims[X_AXIS], dims[Y_AXIS]);
        if (dims[CHANNEL_AXIS] != targetLayout.getChannels()) {
            throw new InvalidImageException(String.format("%s images have %d channels but the samples have %d",
                    targetLayout, targetLayout.getChannels(), dims[CHANNEL_AXIS]));
        }
        ArrayImg<FloatType, FloatArray> derivedPixels = ArrayImgs.floats(dims);
        Cursor<FloatType> sourceCursor = Views.flatIterable(samples).cursor();
        Cursor<FloatType> targetCursor = derivedPixels.cursor();
        while (sourceCursor.hasNext()) {
            float v = sourceCursor.next().get();
            if (Float.isNaN(v)) {
                long[] pos = new long[dims.length];
                sourceCursor.localize(pos);
                throw new InvalidImageException("Derived sample is not a number at " + Arrays.toString(pos));
            }
            targetCursor.next().set(PixelOps.clamp(v));
        }
        return new ImageBuffer(derivedPixels, targetLayout);
    }

    public int getWidth() {
        return (int) pixels.dimension(X_AXIS);
    }

    public int getHeight() {
        return (int) pixels.dimension(Y_AXIS);
    }

    public ChannelLayout getChannelLayout() {
        return channelLayout;
    }

    public int getChannels() {
        return channelLayout.getChannels();
    }

    /**
     * @return the buffer shape as [height, width, channels]
     */
    public long[] getShape() {
        return new long[] {getHeight(), getWidth(), getChannels()};
    }

    public boolean hasSameShape(ImageBuffer other) {
        return Arrays.equals(getShape(), other.getShape());
    }

    public float getSample(int row, int column, int channel) {
        RandomAccess<FloatType> access = pixels.randomAccess();
        access.setPosition(column, X_AXIS);
        access.setPosition(row, Y_AXIS);
        access.setPosition(channel, CHANNEL_AXIS);
        return access.get().get();
    }

    /**
     * @return a read-only (x, y, channel) view of the samples; values written through the view
     * never reach this buffer.
     */
    public RandomAccessibleInterval<FloatType> pixels() {
        return ImageTransforms.createPixelTransformation(pixels, (s, t) -> t.set(s), FloatType::new);
    }

    /**
     * @return a read-only (x, y) view of the given channel plane.
     */
    public RandomAccessibleInterval<FloatType> channel(int channel) {
        return Views.hyperSlice(pixels(), CHANNEL_AXIS, channel);
    }

    /**
     * @return a copy of the samples in [height][width][channels] order.
     */
    public float[] toInterleavedSamples() {
        int width = getWidth();
        int height = getHeight();
        int nchannels = getChannels();
        float[] planarSamples = pixels.update(null).getCurrentStorageArray();
        float[] samples = new float[planarSamples.length];
        int planeSize = width * height;
        for (int c = 0; c < nchannels; c++) {
            for (int i = 0; i < planeSize; i++) {
                samples[i * nchannels + c] = planarSamples[c * planeSize + i];
            }
        }
        return samples;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("width", getWidth())
                .append("height", getHeight())
                .append("channelLayout", channelLayout)
                .toString();
    }
}
