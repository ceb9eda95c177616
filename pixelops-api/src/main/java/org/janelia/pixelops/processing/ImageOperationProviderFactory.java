package org.janelia.pixelops.processing;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.janelia.pixelops.errors.DimensionMismatchException;
import org.janelia.pixelops.errors.UnsupportedChannelLayoutException;
import org.janelia.pixelops.image.ChannelLayout;
import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.image.RotateTransform;
import org.janelia.pixelops.image.algorithms.CompositingOperations;
import org.janelia.pixelops.image.algorithms.GeometricOperations;
import org.janelia.pixelops.image.algorithms.HistogramAnalyzer;
import org.janelia.pixelops.image.algorithms.ToneOperations;
import org.janelia.pixelops.params.BinarizeParams;
import org.janelia.pixelops.params.BrightnessMode;
import org.janelia.pixelops.params.BrightnessParams;
import org.janelia.pixelops.params.ChannelParams;
import org.janelia.pixelops.params.ColorModel;
import org.janelia.pixelops.params.ContrastMode;
import org.janelia.pixelops.params.ContrastParams;
import org.janelia.pixelops.params.EmptyParams;
import org.janelia.pixelops.params.EnlargeRegionParams;
import org.janelia.pixelops.params.GrayscaleMethod;
import org.janelia.pixelops.params.GrayscaleParams;
import org.janelia.pixelops.params.MergeParams;
import org.janelia.pixelops.params.OperationParams;
import org.janelia.pixelops.params.ParamsReader;
import org.janelia.pixelops.params.ProcessingParams;
import org.janelia.pixelops.params.ReduceResolutionParams;
import org.janelia.pixelops.params.RegionParams;
import org.janelia.pixelops.params.RotateParams;
import org.janelia.pixelops.params.TranslateParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for the catalogue operation providers.
 */
public class ImageOperationProviderFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ImageOperationProviderFactory.class);

    private static final Set<String> NO_PARAMS = ImmutableSet.of();
    private static final Set<String> BRIGHTNESS_PARAMS = ImmutableSet.of("mode", "factor");
    private static final Set<String> CONTRAST_PARAMS = ImmutableSet.of("mode", "k", "gamma");
    private static final Set<String> GRAYSCALE_PARAMS = ImmutableSet.of("method");
    private static final Set<String> BINARIZE_PARAMS = ImmutableSet.of("threshold", "grayscale");
    private static final Set<String> ROTATE_PARAMS = ImmutableSet.of("angle", "fill");
    private static final Set<String> REGION_PARAMS = ImmutableSet.of(
            "x", "y", "width", "height", "x_start", "x_end", "y_start", "y_end");
    private static final Set<String> CROP_PARAMS = REGION_PARAMS;
    private static final Set<String> TRANSLATE_PARAMS = ImmutableSet.of("dx", "dy", "fill");
    private static final Set<String> REDUCE_RESOLUTION_PARAMS = ImmutableSet.of("factor");
    private static final Set<String> ENLARGE_REGION_PARAMS = ImmutableSet.<String>builder()
            .addAll(REGION_PARAMS)
            .add("factor", "target_width", "target_height")
            .build();
    private static final Set<String> MERGE_PARAMS = ImmutableSet.of("other", "alpha", "alpha_mask");
    private static final Set<String> CHANNEL_PARAMS = ImmutableSet.of("model", "keep", "order", "output_model", "extract");

    private static final Map<String, ContrastMode> CONTRAST_MODE_ALIASES = ImmutableMap.of(
            "log", ContrastMode.LOGARITHMIC,
            "exp", ContrastMode.EXPONENTIAL);
    private static final Map<String, GrayscaleMethod> GRAYSCALE_METHOD_ALIASES = ImmutableMap.of(
            "max", GrayscaleMethod.LIGHTNESS,
            "midgray", GrayscaleMethod.LIGHTNESS);

    /**
     * Create the providers for the entire catalogue.
     */
    public static Map<ProcessingOperation, ImageOperationProvider<? extends OperationParams>> createProviders(ProcessingSettings settings) {
        LOG.info("Create operation providers with {}", settings);
        Map<ProcessingOperation, ImageOperationProvider<? extends OperationParams>> providers = new EnumMap<>(ProcessingOperation.class);
        providers.put(ProcessingOperation.BRIGHTNESS, createBrightnessProvider(settings.getMaxAdditiveBrightness(), settings.getMaxMultiplicativeBrightness()));
        providers.put(ProcessingOperation.CONTRAST, createContrastProvider());
        providers.put(ProcessingOperation.NEGATIVE, createNegativeProvider());
        providers.put(ProcessingOperation.GRAYSCALE, createGrayscaleProvider());
        providers.put(ProcessingOperation.BINARIZE, createBinarizeProvider(settings.getDefaultBinarizeThreshold()));
        providers.put(ProcessingOperation.ROTATE, createRotateProvider(settings.getMaxOutputPixels()));
        providers.put(ProcessingOperation.CROP, createCropProvider());
        providers.put(ProcessingOperation.TRANSLATE, createTranslateProvider());
        providers.put(ProcessingOperation.REDUCE_RESOLUTION, createReduceResolutionProvider(settings.getDefaultReduceFactor()));
        providers.put(ProcessingOperation.ENLARGE_REGION, createEnlargeRegionProvider(settings.getDefaultEnlargeFactor(), settings.getMaxOutputPixels()));
        providers.put(ProcessingOperation.MERGE, createMergeProvider());
        providers.put(ProcessingOperation.CHANNEL, createChannelProvider());
        providers.put(ProcessingOperation.HISTOGRAM, createHistogramProvider());
        return providers;
    }

    /**
     * @param maxAdditiveFactor additive factors must be in [-maxAdditiveFactor, maxAdditiveFactor]
     * @param maxMultiplicativeFactor multiplicative factors must be in [0, maxMultiplicativeFactor]
     */
    public static ImageOperationProvider<BrightnessParams> createBrightnessProvider(double maxAdditiveFactor,
                                                                                   double maxMultiplicativeFactor) {
        String operationName = ProcessingOperation.BRIGHTNESS.getOperationName();
        return new ImageOperationProvider<BrightnessParams>() {
            final ProcessingParams defaultParams = new ProcessingParams()
                    .setParam("mode", "additive");

            @Override
            public ProcessingParams getDefaultParams() {
                return defaultParams;
            }

            @Override
            public Set<String> getParamNames() {
                return BRIGHTNESS_PARAMS;
            }

            @Override
            public BrightnessParams resolveParams(ProcessingParams params, ImageBuffer image) {
                ParamsReader reader = new ParamsReader(operationName, params);
                BrightnessMode mode = reader.getEnum("mode", BrightnessMode.class, BrightnessMode.ADDITIVE);
                double factor;
                if (mode == BrightnessMode.ADDITIVE) {
                    factor = reader.getDoubleInRange("factor", null, -maxAdditiveFactor, maxAdditiveFactor);
                } else {
                    factor = reader.getDoubleInRange("factor", null, 0, maxMultiplicativeFactor);
                }
                return new BrightnessParams(mode, factor);
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, BrightnessParams params) {
                return ToneOperations.brightness(image, params);
            }
        };
    }

    public static ImageOperationProvider<ContrastParams> createContrastProvider() {
        String operationName = ProcessingOperation.CONTRAST.getOperationName();
        return new ImageOperationProvider<ContrastParams>() {
            final ProcessingParams defaultParams = new ProcessingParams()
                    .setParam("mode", "logarithmic")
                    .setParam("k", 1.)
                    .setParam("gamma", 1.);

            @Override
            public ProcessingParams getDefaultParams() {
                return defaultParams;
            }

            @Override
            public Set<String> getParamNames() {
                return CONTRAST_PARAMS;
            }

            @Override
            public ContrastParams resolveParams(ProcessingParams params, ImageBuffer image) {
                ParamsReader reader = new ParamsReader(operationName, params);
                ContrastMode mode = reader.getEnum("mode", ContrastMode.class, ContrastMode.LOGARITHMIC, CONTRAST_MODE_ALIASES);
                return new ContrastParams(mode, reader.getPositiveDouble(mode.getCoefficientName(), 1.));
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, ContrastParams params) {
                return ToneOperations.contrast(image, params);
            }
        };
    }

    public static ImageOperationProvider<EmptyParams> createNegativeProvider() {
        return new ImageOperationProvider<EmptyParams>() {
            @Override
            public ProcessingParams getDefaultParams() {
                return new ProcessingParams();
            }

            @Override
            public Set<String> getParamNames() {
                return NO_PARAMS;
            }

            @Override
            public EmptyParams resolveParams(ProcessingParams params, ImageBuffer image) {
                return EmptyParams.INSTANCE;
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, EmptyParams params) {
                return ToneOperations.negative(image);
            }
        };
    }

    public static ImageOperationProvider<GrayscaleParams> createGrayscaleProvider() {
        String operationName = ProcessingOperation.GRAYSCALE.getOperationName();
        return new ImageOperationProvider<GrayscaleParams>() {
            final ProcessingParams defaultParams = new ProcessingParams()
                    .setParam("method", "luminosity");

            @Override
            public ProcessingParams getDefaultParams() {
                return defaultParams;
            }

            @Override
            public Set<String> getParamNames() {
                return GRAYSCALE_PARAMS;
            }

            @Override
            public GrayscaleParams resolveParams(ProcessingParams params, ImageBuffer image) {
                requireColorImage(operationName, image);
                ParamsReader reader = new ParamsReader(operationName, params);
                return new GrayscaleParams(
                        reader.getEnum("method", GrayscaleMethod.class, GrayscaleMethod.LUMINOSITY, GRAYSCALE_METHOD_ALIASES));
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, GrayscaleParams params) {
                return ToneOperations.grayscale(image, params);
            }
        };
    }

    public static ImageOperationProvider<BinarizeParams> createBinarizeProvider(double defaultThreshold) {
        String operationName = ProcessingOperation.BINARIZE.getOperationName();
        return new ImageOperationProvider<BinarizeParams>() {
            final ProcessingParams defaultParams = new ProcessingParams()
                    .setParam("threshold", defaultThreshold)
                    .setParam("grayscale", false);

            @Override
            public ProcessingParams getDefaultParams() {
                return defaultParams;
            }

            @Override
            public Set<String> getParamNames() {
                return BINARIZE_PARAMS;
            }

            @Override
            public BinarizeParams resolveParams(ProcessingParams params, ImageBuffer image) {
                ParamsReader reader = new ParamsReader(operationName, params);
                return new BinarizeParams(
                        reader.getDoubleInRange("threshold", defaultThreshold, 0, 1),
                        reader.getBoolean("grayscale", false));
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, BinarizeParams params) {
                return ToneOperations.binarize(image, params);
            }
        };
    }

    public static ImageOperationProvider<RotateParams> createRotateProvider(long maxOutputPixels) {
        String operationName = ProcessingOperation.ROTATE.getOperationName();
        return new ImageOperationProvider<RotateParams>() {
            final ProcessingParams defaultParams = new ProcessingParams()
                    .setParam("fill", 0.);

            @Override
            public ProcessingParams getDefaultParams() {
                return defaultParams;
            }

            @Override
            public Set<String> getParamNames() {
                return ROTATE_PARAMS;
            }

            @Override
            public RotateParams resolveParams(ProcessingParams params, ImageBuffer image) {
                ParamsReader reader = new ParamsReader(operationName, params);
                double angle = reader.getDouble("angle", null);
                double fill = reader.getDoubleInRange("fill", 0., 0, 1);
                long[] extent = RotateTransform.rotatedExtent(image.getWidth(), image.getHeight(), angle);
                checkOutputSize(reader, "angle", angle, extent[0], extent[1], maxOutputPixels);
                return new RotateParams(angle, fill);
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, RotateParams params) {
                return GeometricOperations.rotate(image, params);
            }
        };
    }

    public static ImageOperationProvider<RegionParams> createCropProvider() {
        String operationName = ProcessingOperation.CROP.getOperationName();
        return new ImageOperationProvider<RegionParams>() {
            @Override
            public ProcessingParams getDefaultParams() {
                return new ProcessingParams();
            }

            @Override
            public Set<String> getParamNames() {
                return CROP_PARAMS;
            }

            @Override
            public RegionParams resolveParams(ProcessingParams params, ImageBuffer image) {
                return readRegion(new ParamsReader(operationName, params), image, true);
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, RegionParams params) {
                return GeometricOperations.crop(image, params);
            }
        };
    }

    public static ImageOperationProvider<TranslateParams> createTranslateProvider() {
        String operationName = ProcessingOperation.TRANSLATE.getOperationName();
        return new ImageOperationProvider<TranslateParams>() {
            final ProcessingParams defaultParams = new ProcessingParams()
                    .setParam("fill", 0.);

            @Override
            public ProcessingParams getDefaultParams() {
                return defaultParams;
            }

            @Override
            public Set<String> getParamNames() {
                return TRANSLATE_PARAMS;
            }

            @Override
            public TranslateParams resolveParams(ProcessingParams params, ImageBuffer image) {
                ParamsReader reader = new ParamsReader(operationName, params);
                return new TranslateParams(
                        reader.getInt("dx", null),
                        reader.getInt("dy", null),
                        reader.getDoubleInRange("fill", 0., 0, 1));
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, TranslateParams params) {
                return GeometricOperations.translate(image, params);
            }
        };
    }

    public static ImageOperationProvider<ReduceResolutionParams> createReduceResolutionProvider(double defaultFactor) {
        String operationName = ProcessingOperation.REDUCE_RESOLUTION.getOperationName();
        return new ImageOperationProvider<ReduceResolutionParams>() {
            final ProcessingParams defaultParams = new ProcessingParams()
                    .setParam("factor", defaultFactor);

            @Override
            public ProcessingParams getDefaultParams() {
                return defaultParams;
            }

            @Override
            public Set<String> getParamNames() {
                return REDUCE_RESOLUTION_PARAMS;
            }

            @Override
            public ReduceResolutionParams resolveParams(ProcessingParams params, ImageBuffer image) {
                ParamsReader reader = new ParamsReader(operationName, params);
                double factor = reader.getDoubleInRange("factor", defaultFactor, 1, Double.MAX_VALUE);
                return new ReduceResolutionParams(
                        factor,
                        (int) Math.max(1, Math.floor(image.getWidth() / factor)),
                        (int) Math.max(1, Math.floor(image.getHeight() / factor)));
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, ReduceResolutionParams params) {
                return GeometricOperations.reduceResolution(image, params);
            }
        };
    }

    public static ImageOperationProvider<EnlargeRegionParams> createEnlargeRegionProvider(double defaultFactor, long maxOutputPixels) {
        String operationName = ProcessingOperation.ENLARGE_REGION.getOperationName();
        return new ImageOperationProvider<EnlargeRegionParams>() {
            final ProcessingParams defaultParams = new ProcessingParams()
                    .setParam("x", 0)
                    .setParam("y", 0)
                    .setParam("factor", defaultFactor);

            @Override
            public ProcessingParams getDefaultParams() {
                return defaultParams;
            }

            @Override
            public Set<String> getParamNames() {
                return ENLARGE_REGION_PARAMS;
            }

            @Override
            public EnlargeRegionParams resolveParams(ProcessingParams params, ImageBuffer image) {
                ParamsReader reader = new ParamsReader(operationName, params);
                RegionParams region = readRegion(reader, image, false);
                Integer targetWidth = reader.hasParam("target_width")
                        ? reader.getIntInRange("target_width", null, 1, Integer.MAX_VALUE)
                        : null;
                Integer targetHeight = reader.hasParam("target_height")
                        ? reader.getIntInRange("target_height", null, 1, Integer.MAX_VALUE)
                        : null;
                String sizeParam;
                if (targetWidth == null && targetHeight == null) {
                    double factor = reader.getDoubleInRange("factor", defaultFactor, 1, Double.MAX_VALUE);
                    targetWidth = scaledExtent(region.getWidth(), factor);
                    targetHeight = scaledExtent(region.getHeight(), factor);
                    sizeParam = "factor";
                } else if (targetWidth == null) {
                    // keep the aspect ratio of the region
                    targetWidth = scaledExtent(region.getWidth(), (double) targetHeight / region.getHeight());
                    sizeParam = "target_height";
                } else if (targetHeight == null) {
                    targetHeight = scaledExtent(region.getHeight(), (double) targetWidth / region.getWidth());
                    sizeParam = "target_width";
                } else {
                    sizeParam = "target_width";
                }
                checkOutputSize(reader, sizeParam, params.getParam(sizeParam), targetWidth, targetHeight, maxOutputPixels);
                return new EnlargeRegionParams(region, targetWidth, targetHeight);
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, EnlargeRegionParams params) {
                return GeometricOperations.enlargeRegion(image, params);
            }
        };
    }

    public static ImageOperationProvider<MergeParams> createMergeProvider() {
        String operationName = ProcessingOperation.MERGE.getOperationName();
        return new ImageOperationProvider<MergeParams>() {
            final ProcessingParams defaultParams = new ProcessingParams()
                    .setParam("alpha", 0.5);

            @Override
            public ProcessingParams getDefaultParams() {
                return defaultParams;
            }

            @Override
            public Set<String> getParamNames() {
                return MERGE_PARAMS;
            }

            @Override
            public MergeParams resolveParams(ProcessingParams params, ImageBuffer image) {
                ParamsReader reader = new ParamsReader(operationName, params);
                ImageBuffer other = reader.getImage("other", true);
                if (!image.hasSameShape(other)) {
                    throw new DimensionMismatchException(operationName, image.getShape(), other.getShape());
                }
                double alpha = reader.getDoubleInRange("alpha", 0.5, 0, 1);
                ImageBuffer alphaMask = reader.getImage("alpha_mask", false);
                if (alphaMask != null) {
                    if (alphaMask.getChannelLayout() != ChannelLayout.GRAY) {
                        throw reader.invalid("alpha_mask", "a gray image", alphaMask);
                    }
                    if (alphaMask.getWidth() != image.getWidth() || alphaMask.getHeight() != image.getHeight()) {
                        throw new DimensionMismatchException(operationName,
                                new long[] {image.getHeight(), image.getWidth(), 1},
                                alphaMask.getShape());
                    }
                }
                return new MergeParams(other, alpha, alphaMask);
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, MergeParams params) {
                return CompositingOperations.merge(image, params);
            }
        };
    }

    public static ImageOperationProvider<ChannelParams> createChannelProvider() {
        String operationName = ProcessingOperation.CHANNEL.getOperationName();
        return new ImageOperationProvider<ChannelParams>() {
            final ProcessingParams defaultParams = new ProcessingParams()
                    .setParam("model", "rgb")
                    .setParam("output_model", "rgb")
                    .setParam("extract", false);

            @Override
            public ProcessingParams getDefaultParams() {
                return defaultParams;
            }

            @Override
            public Set<String> getParamNames() {
                return CHANNEL_PARAMS;
            }

            @Override
            public ChannelParams resolveParams(ProcessingParams params, ImageBuffer image) {
                requireColorImage(operationName, image);
                ParamsReader reader = new ParamsReader(operationName, params);
                ColorModel model = reader.getEnum("model", ColorModel.class, ColorModel.RGB);
                List<String> channelNames = model.getChannelNames();

                List<String> keep = reader.getStringList("keep", channelNames);
                boolean[] keptChannels = new boolean[channelNames.size()];
                int nkept = 0;
                for (String channelName : keep) {
                    int c = model.channelIndex(channelName);
                    if (c < 0) {
                        throw reader.invalid("keep", "channel names of " + channelNames, keep);
                    }
                    if (!keptChannels[c]) {
                        keptChannels[c] = true;
                        nkept++;
                    }
                }

                List<String> orderNames = reader.getStringList("order", channelNames);
                String permutationConstraint = "a permutation of " + channelNames;
                if (orderNames.size() != channelNames.size()) {
                    throw reader.invalid("order", permutationConstraint, orderNames);
                }
                int[] order = new int[channelNames.size()];
                boolean[] used = new boolean[channelNames.size()];
                for (int i = 0; i < order.length; i++) {
                    int c = model.channelIndex(orderNames.get(i));
                    if (c < 0 || used[c]) {
                        throw reader.invalid("order", permutationConstraint, orderNames);
                    }
                    used[c] = true;
                    order[i] = c;
                }

                ColorModel outputModel = reader.getEnum("output_model", ColorModel.class, ColorModel.RGB);
                boolean extract = reader.getBoolean("extract", false);
                if (extract && nkept != 1) {
                    throw reader.invalid("keep", "exactly one channel when extract is set", keep);
                }
                return new ChannelParams(model, keptChannels, order, outputModel, extract);
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, ChannelParams params) {
                return CompositingOperations.manipulateChannels(image, params);
            }
        };
    }

    /**
     * The histogram operation returns its input unchanged and reports the histogram table as a derived output.
     */
    public static ImageOperationProvider<EmptyParams> createHistogramProvider() {
        return new ImageOperationProvider<EmptyParams>() {
            @Override
            public ProcessingParams getDefaultParams() {
                return new ProcessingParams();
            }

            @Override
            public Set<String> getParamNames() {
                return NO_PARAMS;
            }

            @Override
            public EmptyParams resolveParams(ProcessingParams params, ImageBuffer image) {
                return EmptyParams.INSTANCE;
            }

            @Override
            public ImageBuffer apply(ImageBuffer image, EmptyParams params) {
                return image;
            }

            @Override
            public Map<String, Object> getDerivedOutputs(ImageBuffer image, EmptyParams params) {
                return Collections.singletonMap("histogram", HistogramAnalyzer.analyze(image));
            }
        };
    }

    private static void requireColorImage(String operationName, ImageBuffer image) {
        if (image.getChannelLayout().getColorChannels() < 3) {
            throw new UnsupportedChannelLayoutException(operationName, image.getChannelLayout(), "an RGB or RGBA image");
        }
    }

    /**
     * Read a region given either as x, y, width, height or as x_start, x_end, y_start, y_end with exclusive ends.
     * If the region is not required the missing values default to the rest of the image.
     */
    private static RegionParams readRegion(ParamsReader reader, ImageBuffer image, boolean required) {
        int imageWidth = image.getWidth();
        int imageHeight = image.getHeight();
        if (reader.hasParam("x_start") || reader.hasParam("x_end") || reader.hasParam("y_start") || reader.hasParam("y_end")) {
            int xStart = reader.getIntInRange("x_start", required ? null : 0, 0, imageWidth - 1);
            int xEnd = reader.getIntInRange("x_end", required ? null : imageWidth, xStart + 1, imageWidth);
            int yStart = reader.getIntInRange("y_start", required ? null : 0, 0, imageHeight - 1);
            int yEnd = reader.getIntInRange("y_end", required ? null : imageHeight, yStart + 1, imageHeight);
            return new RegionParams(xStart, yStart, xEnd - xStart, yEnd - yStart);
        }
        int x = reader.getIntInRange("x", required ? null : 0, 0, imageWidth - 1);
        int y = reader.getIntInRange("y", required ? null : 0, 0, imageHeight - 1);
        int width = reader.getIntInRange("width", required ? null : imageWidth - x, 1, imageWidth - x);
        int height = reader.getIntInRange("height", required ? null : imageHeight - y, 1, imageHeight - y);
        return new RegionParams(x, y, width, height);
    }

    private static int scaledExtent(int extent, double factor) {
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, Math.round(extent * factor)));
    }

    private static void checkOutputSize(ParamsReader reader, String paramName, Object paramValue,
                                        long width, long height, long maxOutputPixels) {
        if (width * height > maxOutputPixels) {
            throw reader.invalid(paramName,
                    String.format("a value that produces at most %d pixels but the output would be %dx%d", maxOutputPixels, width, height),
                    paramValue);
        }
    }
}
