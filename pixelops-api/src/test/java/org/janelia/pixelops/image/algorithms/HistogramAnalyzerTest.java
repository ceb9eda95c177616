package org.janelia.pixelops.image.algorithms;

import java.util.Arrays;

import org.janelia.pixelops.image.ChannelLayout;
import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.model.HistogramTable;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class HistogramAnalyzerTest {

    @Test
    public void uniformImages() {
        class TestData {
            final float value;
            final int expectedBin;

            TestData(float value, int expectedBin) {
                this.value = value;
                this.expectedBin = expectedBin;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData(0f, 0),
                new TestData(0.5f, 127),
                new TestData(0.75f, 191),
                new TestData(1f, 255),
        };
        for (TestData td : testData) {
            ImageBuffer image = ImageBuffer.uniform(3, 4, ChannelLayout.RGB, td.value, td.value, td.value);
            HistogramTable histogram = HistogramAnalyzer.analyze(image);
            assertEquals(Arrays.asList("red", "green", "blue"), Arrays.asList(histogram.getChannelNames().toArray()));
            for (String channel : histogram.getChannelNames()) {
                long[] counts = histogram.getCounts(channel);
                assertEquals(HistogramTable.DEFAULT_BINS, counts.length);
                assertEquals("Value " + td.value, 12, counts[td.expectedBin]);
                assertEquals(12, histogram.getTotal(channel));
            }
        }
    }

    @Test
    public void alphaIsExcluded() {
        ImageBuffer image = ImageBuffer.uniform(2, 2, ChannelLayout.RGBA, 0.1f, 0.2f, 0.3f, 1f);
        HistogramTable histogram = HistogramAnalyzer.analyze(image);
        assertEquals(3, histogram.getChannelNames().size());
        assertFalse(histogram.hasChannel("alpha"));
        assertEquals(4, histogram.getCount("red", 25));
        assertEquals(4, histogram.getCount("green", 51));
        assertEquals(4, histogram.getCount("blue", 76));
    }

    @Test
    public void grayChannel() {
        ImageBuffer image = ImageBuffer.fromInterleavedSamples(1, 3, ChannelLayout.GRAY, new float[] {0f, 0f, 1f});
        HistogramTable histogram = HistogramAnalyzer.analyze(image);
        assertEquals(1, histogram.getChannelNames().size());
        assertEquals(2, histogram.getCount("gray", 0));
        assertEquals(1, histogram.getCount("gray", 255));
    }
}
