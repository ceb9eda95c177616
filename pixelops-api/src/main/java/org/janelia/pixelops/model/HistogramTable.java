package org.janelia.pixelops.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonValue;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Per channel frequency of the sample values. A sample v falls in bin floor(v * (nbins - 1)).
 */
public class HistogramTable {

    public static final int DEFAULT_BINS = 256;

    private final Map<String, long[]> channelCounts = new LinkedHashMap<>();

    public void setChannelCounts(String channelName, long[] counts) {
        channelCounts.put(channelName, counts.clone());
    }

    public Set<String> getChannelNames() {
        return Collections.unmodifiableSet(channelCounts.keySet());
    }

    public boolean hasChannel(String channelName) {
        return channelCounts.containsKey(channelName);
    }

    public long[] getCounts(String channelName) {
        long[] counts = channelCounts.get(channelName);
        if (counts == null) {
            throw new IllegalArgumentException("No histogram for channel " + channelName + " - available channels: " + channelCounts.keySet());
        }
        return counts.clone();
    }

    public long getCount(String channelName, int bin) {
        return getCounts(channelName)[bin];
    }

    /**
     * @return the number of samples counted for the channel, i.e. the number of pixels.
     */
    public long getTotal(String channelName) {
        long total = 0;
        for (long c : getCounts(channelName)) {
            total += c;
        }
        return total;
    }

    @JsonValue
    public Map<String, long[]> asMap() {
        return Collections.unmodifiableMap(channelCounts);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("channels", channelCounts.keySet())
                .toString();
    }
}
