package org.janelia.pixelops.image.algorithms;

import org.janelia.pixelops.image.ChannelLayout;
import org.janelia.pixelops.image.ImageAccessUtils;
import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.model.HistogramTable;

public class HistogramAnalyzer {

    /**
     * Count the samples of every color channel in {@link HistogramTable#DEFAULT_BINS} bins. Alpha is not counted.
     */
    public static HistogramTable analyze(ImageBuffer image) {
        return analyze(image, HistogramTable.DEFAULT_BINS);
    }

    public static HistogramTable analyze(ImageBuffer image, int nbins) {
        ChannelLayout channelLayout = image.getChannelLayout();
        HistogramTable histogramTable = new HistogramTable();
        for (int c = 0; c < channelLayout.getColorChannels(); c++) {
            histogramTable.setChannelCounts(
                    channelLayout.getChannelName(c),
                    ImageAccessUtils.histogram(image.channel(c), nbins));
        }
        return histogramTable;
    }
}
