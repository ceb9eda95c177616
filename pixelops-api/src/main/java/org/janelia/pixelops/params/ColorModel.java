package org.janelia.pixelops.params;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Three channel color models. CMY is the complement of RGB: C=1-R, M=1-G, Y=1-B.
 */
public enum ColorModel {
    RGB(Arrays.asList("red", "green", "blue")),
    CMY(Arrays.asList("cyan", "magenta", "yellow"));

    private final List<String> channelNames;

    ColorModel(List<String> channelNames) {
        this.channelNames = channelNames;
    }

    public List<String> getChannelNames() {
        return channelNames;
    }

    /**
     * @return the index of the channel given by its full name or its initial, or -1 if the model has no such channel.
     */
    public int channelIndex(String name) {
        for (int c = 0; c < channelNames.size(); c++) {
            String channelName = channelNames.get(c);
            if (StringUtils.equalsIgnoreCase(channelName, name)
                    || StringUtils.equalsIgnoreCase(channelName.substring(0, 1), name)) {
                return c;
            }
        }
        return -1;
    }

    /**
     * Convert an RGB sample to this model; the conversion is its own inverse.
     */
    public double fromRGB(double v) {
        return this == CMY ? 1 - v : v;
    }

    public double toRGB(double v) {
        return fromRGB(v);
    }
}
