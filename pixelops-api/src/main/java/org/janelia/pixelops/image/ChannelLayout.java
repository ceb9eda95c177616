package org.janelia.pixelops.image;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.janelia.pixelops.errors.InvalidImageException;

/**
 * Color layout of an image buffer. The layout determines the number of samples per pixel.
 */
public enum ChannelLayout {
    GRAY("gray"),
    RGB("red", "green", "blue"),
    RGBA("red", "green", "blue", "alpha");

    private final List<String> channelNames;

    ChannelLayout(String... channelNames) {
        this.channelNames = Collections.unmodifiableList(Arrays.asList(channelNames));
    }

    public int getChannels() {
        return channelNames.size();
    }

    public boolean hasAlpha() {
        return this == RGBA;
    }

    /**
     * @return the number of channels that carry color information, i.e. all except alpha.
     */
    public int getColorChannels() {
        return hasAlpha() ? getChannels() - 1 : getChannels();
    }

    public boolean isAlphaChannel(int channel) {
        return hasAlpha() && channel == getChannels() - 1;
    }

    public String getChannelName(int channel) {
        return channelNames.get(channel);
    }

    public List<String> getChannelNames() {
        return channelNames;
    }

    public static ChannelLayout fromTag(String tag) {
        for (ChannelLayout layout : values()) {
            if (StringUtils.equalsIgnoreCase(layout.name(), StringUtils.trim(tag))) {
                return layout;
            }
        }
        throw new InvalidImageException("Unrecognized channel tag: " + tag);
    }

    public static ChannelLayout fromChannelCount(int nchannels) {
        for (ChannelLayout layout : values()) {
            if (layout.getChannels() == nchannels) {
                return layout;
            }
        }
        throw new InvalidImageException("No channel layout has " + nchannels + " channels");
    }
}
