package org.janelia.pixelops.errors;

import org.janelia.pixelops.image.ChannelLayout;

/**
 * The operation cannot be applied to a buffer with the given channel layout,
 * e.g. a grayscale conversion of an image that is already gray.
 */
public class UnsupportedChannelLayoutException extends ImageProcessingException {

    private final ChannelLayout channelLayout;
    private final String requirement;

    public UnsupportedChannelLayoutException(String operation, ChannelLayout channelLayout, String requirement) {
        super(operation, String.format("Operation '%s' does not support %s images: requires %s",
                operation, channelLayout, requirement));
        this.channelLayout = channelLayout;
        this.requirement = requirement;
    }

    public ChannelLayout getChannelLayout() {
        return channelLayout;
    }

    public String getRequirement() {
        return requirement;
    }
}
