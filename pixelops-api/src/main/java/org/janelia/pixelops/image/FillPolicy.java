package org.janelia.pixelops.image;

import java.util.Arrays;

/**
 * Values given to target pixels whose source location falls outside the source image.
 * The default is zero for every channel: black for gray and RGB, transparent for RGBA.
 */
public class FillPolicy {

    private final float[] values;

    private FillPolicy(float[] values) {
        this.values = values;
    }

    public static FillPolicy forLayout(ChannelLayout channelLayout) {
        return new FillPolicy(new float[channelLayout.getChannels()]);
    }

    /**
     * Fill the color channels with the given value; alpha is always filled with 0.
     */
    public static FillPolicy withColor(ChannelLayout channelLayout, double value) {
        float[] values = new float[channelLayout.getChannels()];
        Arrays.fill(values, 0, channelLayout.getColorChannels(), PixelOps.clamp(value));
        return new FillPolicy(values);
    }

    public float getValue(int channel) {
        return values[channel];
    }
}
