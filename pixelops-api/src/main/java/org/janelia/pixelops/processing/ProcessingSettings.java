package org.janelia.pixelops.processing;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.pixelops.config.Config;

/**
 * Engine limits and defaults.
 */
public class ProcessingSettings {

    static final double DEFAULT_MAX_ADDITIVE_BRIGHTNESS = 1.0;
    static final double DEFAULT_MAX_MULTIPLICATIVE_BRIGHTNESS = 4.0;
    static final double DEFAULT_BINARIZE_THRESHOLD = 0.5;
    static final double DEFAULT_REDUCE_FACTOR = 2;
    static final double DEFAULT_ENLARGE_FACTOR = 2;
    static final long DEFAULT_MAX_OUTPUT_PIXELS = 100_000_000L;

    public static ProcessingSettings defaults() {
        return new ProcessingSettings();
    }

    public static ProcessingSettings fromConfig(Config config) {
        return new ProcessingSettings()
                .setMaxAdditiveBrightness(config.getDoublePropertyValue("Brightness.MaxAdditiveFactor", DEFAULT_MAX_ADDITIVE_BRIGHTNESS))
                .setMaxMultiplicativeBrightness(config.getDoublePropertyValue("Brightness.MaxMultiplicativeFactor", DEFAULT_MAX_MULTIPLICATIVE_BRIGHTNESS))
                .setDefaultBinarizeThreshold(config.getDoublePropertyValue("Binarize.DefaultThreshold", DEFAULT_BINARIZE_THRESHOLD))
                .setDefaultReduceFactor(config.getDoublePropertyValue("ReduceResolution.DefaultFactor", DEFAULT_REDUCE_FACTOR))
                .setDefaultEnlargeFactor(config.getDoublePropertyValue("EnlargeRegion.DefaultFactor", DEFAULT_ENLARGE_FACTOR))
                .setMaxOutputPixels(config.getLongPropertyValue("Geometry.MaxOutputPixels", DEFAULT_MAX_OUTPUT_PIXELS));
    }

    private double maxAdditiveBrightness = DEFAULT_MAX_ADDITIVE_BRIGHTNESS;
    private double maxMultiplicativeBrightness = DEFAULT_MAX_MULTIPLICATIVE_BRIGHTNESS;
    private double defaultBinarizeThreshold = DEFAULT_BINARIZE_THRESHOLD;
    private double defaultReduceFactor = DEFAULT_REDUCE_FACTOR;
    private double defaultEnlargeFactor = DEFAULT_ENLARGE_FACTOR;
    private long maxOutputPixels = DEFAULT_MAX_OUTPUT_PIXELS;

    public double getMaxAdditiveBrightness() {
        return maxAdditiveBrightness;
    }

    public ProcessingSettings setMaxAdditiveBrightness(double maxAdditiveBrightness) {
        this.maxAdditiveBrightness = maxAdditiveBrightness;
        return this;
    }

    public double getMaxMultiplicativeBrightness() {
        return maxMultiplicativeBrightness;
    }

    public ProcessingSettings setMaxMultiplicativeBrightness(double maxMultiplicativeBrightness) {
        this.maxMultiplicativeBrightness = maxMultiplicativeBrightness;
        return this;
    }

    public double getDefaultBinarizeThreshold() {
        return defaultBinarizeThreshold;
    }

    public ProcessingSettings setDefaultBinarizeThreshold(double defaultBinarizeThreshold) {
        this.defaultBinarizeThreshold = defaultBinarizeThreshold;
        return this;
    }

    public double getDefaultReduceFactor() {
        return defaultReduceFactor;
    }

    public ProcessingSettings setDefaultReduceFactor(double defaultReduceFactor) {
        this.defaultReduceFactor = defaultReduceFactor;
        return this;
    }

    public double getDefaultEnlargeFactor() {
        return defaultEnlargeFactor;
    }

    public ProcessingSettings setDefaultEnlargeFactor(double defaultEnlargeFactor) {
        this.defaultEnlargeFactor = defaultEnlargeFactor;
        return this;
    }

    /**
     * @return the largest number of pixels a geometric operation may produce
     */
    public long getMaxOutputPixels() {
        return maxOutputPixels;
    }

    public ProcessingSettings setMaxOutputPixels(long maxOutputPixels) {
        this.maxOutputPixels = maxOutputPixels;
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("maxAdditiveBrightness", maxAdditiveBrightness)
                .append("maxMultiplicativeBrightness", maxMultiplicativeBrightness)
                .append("defaultBinarizeThreshold", defaultBinarizeThreshold)
                .append("defaultReduceFactor", defaultReduceFactor)
                .append("defaultEnlargeFactor", defaultEnlargeFactor)
                .append("maxOutputPixels", maxOutputPixels)
                .toString();
    }
}
