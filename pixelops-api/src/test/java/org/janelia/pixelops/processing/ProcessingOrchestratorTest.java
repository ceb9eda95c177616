package org.janelia.pixelops.processing;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableMap;

import org.janelia.pixelops.errors.DimensionMismatchException;
import org.janelia.pixelops.errors.InvalidImageException;
import org.janelia.pixelops.errors.InvalidParameterException;
import org.janelia.pixelops.errors.UnknownOperationException;
import org.janelia.pixelops.errors.UnsupportedChannelLayoutException;
import org.janelia.pixelops.image.ChannelLayout;
import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.model.HistogramTable;
import org.janelia.pixelops.model.OperationCategory;
import org.janelia.pixelops.model.OperationMetadata;
import org.janelia.pixelops.model.OperationResult;
import org.janelia.pixelops.params.ProcessingParams;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.janelia.pixelops.ImageTestUtils.assertSamples;
import static org.janelia.pixelops.ImageTestUtils.assertShape;
import static org.janelia.pixelops.ImageTestUtils.gray;
import static org.janelia.pixelops.ImageTestUtils.rgb;
import static org.janelia.pixelops.ImageTestUtils.rgba;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ProcessingOrchestratorTest {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessingOrchestratorTest.class);

    private final ProcessingOrchestrator orchestrator = new ProcessingOrchestrator();

    @Test
    public void processWithResolvedDefaults() {
        ImageBuffer image = rgb(1, 1, 0.2f, 0.1f, 0.05f);
        OperationResult result = orchestrator.process("brightness",
                ImmutableMap.of("mode", "multiplicative", "factor", "1.5"),
                image);
        assertSamples(new float[] {0.3f, 0.15f, 0.075f}, result.getImage());
        OperationMetadata metadata = result.getMetadata();
        assertEquals("brightness", metadata.getOperation());
        assertEquals(OperationCategory.TONE, metadata.getCategory());
        assertEquals("multiplicative", metadata.getParams().get("mode"));
        assertEquals(1.5, metadata.getParams().get("factor"));
        assertArrayEquals(new long[] {1, 1, 3}, metadata.getInputShape());
        assertArrayEquals(new long[] {1, 1, 3}, metadata.getOutputShape());

        OperationResult contrastResult = orchestrator.process("contrast", new ProcessingParams(), image);
        assertEquals("logarithmic", contrastResult.getMetadata().getParams().get("mode"));
        assertEquals(1.0, contrastResult.getMetadata().getParams().get("k"));
    }

    @Test
    public void unknownOperation() {
        try {
            orchestrator.process("sharpen", Collections.emptyMap(), gray(1, 1, 0.5f));
            fail("sharpen is not in the catalogue");
        } catch (UnknownOperationException e) {
            assertEquals("sharpen", e.getOperation());
            assertTrue(e.getKnownOperations().containsAll(ProcessingOperation.getOperationNames()));
            assertTrue(e.getKnownOperations().contains("log_contrast"));
        }
    }

    @Test
    public void invalidParameters() {
        class TestData {
            final String operation;
            final ProcessingParams params;
            final String expectedParameter;

            TestData(String operation, ProcessingParams params, String expectedParameter) {
                this.operation = operation;
                this.params = params;
                this.expectedParameter = expectedParameter;
            }
        }
        TestData[] testData = new TestData[] {
                new TestData("brightness", new ProcessingParams().setParam("factor", 1.5), "factor"),
                new TestData("brightness", new ProcessingParams().setParam("mode", "multiplicative").setParam("factor", -1), "factor"),
                new TestData("brightness", new ProcessingParams().setParam("mode", "exponential"), "mode"),
                new TestData("contrast", new ProcessingParams().setParam("k", 0), "k"),
                new TestData("contrast", new ProcessingParams().setParam("mode", "exp").setParam("gamma", -2), "gamma"),
                new TestData("binarize", new ProcessingParams().setParam("threshold", 1.2), "threshold"),
                new TestData("binarize", new ProcessingParams().setParam("grayscale", "maybe"), "grayscale"),
                new TestData("rotate", new ProcessingParams().setParam("angle", "ninety"), "angle"),
                new TestData("rotate", new ProcessingParams().setParam("angle", Double.NaN), "angle"),
                new TestData("crop", new ProcessingParams().setParam("x", 4), "x"),
                new TestData("crop", new ProcessingParams().setParam("x", 1).setParam("y", 0).setParam("width", 4).setParam("height", 1), "width"),
                new TestData("crop", new ProcessingParams().setParam("x_start", 2).setParam("x_end", 2), "x_end"),
                new TestData("translate", new ProcessingParams().setParam("dx", 1.5), "dx"),
                new TestData("reduce-resolution", new ProcessingParams().setParam("factor", 0.5), "factor"),
                new TestData("enlarge-region", new ProcessingParams().setParam("target_width", 0), "target_width"),
                new TestData("enlarge-region", new ProcessingParams().setParam("factor", 1e6), "factor"),
                new TestData("merge", new ProcessingParams(), "other"),
                new TestData("merge", new ProcessingParams().setParam("other", "image.png"), "other"),
                new TestData("channel", new ProcessingParams().setParam("keep", "red,cyan"), "keep"),
                new TestData("channel", new ProcessingParams().setParam("order", Arrays.asList("red", "red", "blue")), "order"),
                new TestData("channel", new ProcessingParams().setParam("extract", true), "keep"),
                new TestData("channel", new ProcessingParams().setParam("model", "hsv"), "model"),
                // required parameters
                new TestData("brightness", new ProcessingParams(), "factor"),
                new TestData("brightness", new ProcessingParams().setParam("mode", "multiplicative"), "factor"),
                new TestData("rotate", new ProcessingParams(), "angle"),
                new TestData("translate", new ProcessingParams().setParam("dx", 1), "dy"),
                new TestData("crop", new ProcessingParams(), "x"),
                new TestData("crop", new ProcessingParams().setParam("x", 0).setParam("y", 0).setParam("width", 1), "height"),
                new TestData("crop", new ProcessingParams().setParam("x_start", 0), "x_end"),
                // parameters the operation does not know
                new TestData("brightness", new ProcessingParams().setParam("factr", 0.5), "factr"),
                new TestData("translate", new ProcessingParams().setParam("x", 1), "x"),
                new TestData("negative", new ProcessingParams().setParam("factor", 1), "factor"),
                new TestData("histogram", new ProcessingParams().setParam("bins", 16), "bins"),
                new TestData("grayscale", new ProcessingParams().setParam("method", "average").setParam("enabled", true), "enabled"),
        };
        ImageBuffer image = rgb(2, 3,
                0.1f, 0.2f, 0.3f, 0.4f, 0.5f, 0.6f, 0.7f, 0.8f, 0.9f,
                0.9f, 0.8f, 0.7f, 0.6f, 0.5f, 0.4f, 0.3f, 0.2f, 0.1f);
        for (TestData td : testData) {
            try {
                orchestrator.process(td.operation, td.params, image);
                fail("Expected invalid " + td.expectedParameter + " for " + td.operation + " with " + td.params);
            } catch (InvalidParameterException e) {
                LOG.debug("Expected error: {}", e.getMessage());
                assertEquals(td.operation, e.getOperation());
                assertEquals(td.expectedParameter, e.getParameter());
            }
        }
    }

    @Test
    public void unsupportedChannelLayouts() {
        ImageBuffer image = gray(1, 2, 0.2f, 0.4f);
        for (String operation : Arrays.asList("grayscale", "channel", "grayscale_average", "channel_cyan")) {
            try {
                orchestrator.process(operation, new ProcessingParams(), image);
                fail(operation + " must not accept gray images");
            } catch (UnsupportedChannelLayoutException e) {
                assertEquals(ChannelLayout.GRAY, e.getChannelLayout());
            }
        }
    }

    @Test
    public void mergeShapeMismatch() {
        ImageBuffer image = rgb(1, 1, 0.2f, 0.4f, 0.6f);
        List<ImageBuffer> others = Arrays.asList(
                rgb(1, 2, 0.2f, 0.4f, 0.6f, 0.2f, 0.4f, 0.6f),
                rgba(1, 1, 0.2f, 0.4f, 0.6f, 1f),
                gray(1, 1, 0.5f)
        );
        for (ImageBuffer other : others) {
            try {
                orchestrator.process("merge", new ProcessingParams().setParam("other", other), image);
                fail("Expected shape mismatch for " + other);
            } catch (DimensionMismatchException e) {
                assertArrayEquals(image.getShape(), e.getExpectedShape());
                assertArrayEquals(other.getShape(), e.getActualShape());
            }
        }
        try {
            orchestrator.process("merge", new ProcessingParams()
                    .setParam("other", image)
                    .setParam("alpha_mask", gray(2, 1, 1f, 1f)), image);
            fail("Expected alpha mask mismatch");
        } catch (DimensionMismatchException e) {
            assertArrayEquals(new long[] {2, 1, 1}, e.getActualShape());
        }
    }

    @Test
    public void missingImage() {
        try {
            orchestrator.process("negative", new ProcessingParams(), null);
            fail("Expected an invalid image");
        } catch (InvalidImageException e) {
            assertTrue(e.getMessage().contains("negative"));
        }
    }

    @Test
    public void aliases() {
        ImageBuffer image = rgb(1, 1, 0.2f, 0.4f, 0.6f);

        OperationResult expContrast = orchestrator.process("exp_contrast", ImmutableMap.of("k", 2), image);
        assertEquals("contrast", expContrast.getMetadata().getOperation());
        assertEquals("exponential", expContrast.getMetadata().getParams().get("mode"));
        assertEquals(2.0, expContrast.getMetadata().getParams().get("gamma"));
        assertSamples(new float[] {0.04f, 0.16f, 0.36f}, expContrast.getImage());

        assertSamples(new float[] {0.8f, 0.6f, 0.4f},
                orchestrator.process("invert", Collections.emptyMap(), image).getImage());
        assertSamples(new float[] {0.4f},
                orchestrator.process("grayscale_midgray", Collections.emptyMap(), image).getImage());
        assertSamples(new float[] {0.2f, 0f, 0f},
                orchestrator.process("channel_red", Collections.emptyMap(), image).getImage());
        assertSamples(new float[] {0.2f, 0.4f, 0f},
                orchestrator.process("channel_blue", ImmutableMap.of("enabled", false), image).getImage());

        OperationResult yellow = orchestrator.process("channel_yellow", Collections.emptyMap(), image);
        assertShape(1, 1, ChannelLayout.GRAY, yellow.getImage());
        assertSamples(new float[] {0.4f}, yellow.getImage());

        ImageBuffer other = rgb(1, 1, 1f, 1f, 1f);
        OperationResult merged = orchestrator.process("merge_images",
                ImmutableMap.of("other", other, "transparency", 0.25), image);
        assertEquals(0.75, merged.getMetadata().getParams().get("alpha"));
        assertSamples(new float[] {0.4f, 0.55f, 0.7f}, merged.getImage());
    }

    @Test
    public void aliasesPinTheirParameters() {
        ImageBuffer image = rgb(1, 1, 0.2f, 0.4f, 0.6f);

        OperationResult average = orchestrator.process("grayscale_average", ImmutableMap.of("method", "luminosity"), image);
        assertEquals("average", average.getMetadata().getParams().get("method"));
        assertSamples(new float[] {0.4f}, average.getImage());

        OperationResult logContrast = orchestrator.process("log_contrast", ImmutableMap.of("mode", "exponential"), image);
        assertEquals("logarithmic", logContrast.getMetadata().getParams().get("mode"));

        assertSamples(new float[] {0.2f, 0f, 0f},
                orchestrator.process("channel_red", ImmutableMap.of("keep", "blue"), image).getImage());

        OperationResult merged = orchestrator.process("merge_images",
                ImmutableMap.of("other", image, "transparency", 0.25, "alpha", 0.1), image);
        assertEquals(0.75, merged.getMetadata().getParams().get("alpha"));

        try {
            orchestrator.process("grayscale_average", ImmutableMap.of("weights", "equal"), image);
            fail("weights is not a grayscale parameter");
        } catch (InvalidParameterException e) {
            assertEquals("weights", e.getParameter());
        }
    }

    @Test
    public void outputsStayInUnitRange() {
        class TestData {
            final String operation;
            final ProcessingParams params;

            TestData(String operation, ProcessingParams params) {
                this.operation = operation;
                this.params = params;
            }
        }
        List<ImageBuffer> images = Arrays.asList(
                rgb(2, 2,
                        0f, 0f, 0f, 1f, 1f, 1f,
                        1f, 0f, 1f, 0f, 1f, 0f),
                rgba(2, 2,
                        0f, 0f, 0f, 0f, 1f, 1f, 1f, 1f,
                        1f, 0f, 1f, 0f, 0f, 1f, 0f, 1f)
        );
        for (ImageBuffer image : images) {
            ImageBuffer alphaMask = gray(2, 2, 0f, 1f, 1f, 0f);
            TestData[] testData = new TestData[] {
                    new TestData("brightness", new ProcessingParams().setParam("factor", 1)),
                    new TestData("brightness", new ProcessingParams().setParam("factor", -1)),
                    new TestData("brightness", new ProcessingParams().setParam("mode", "multiplicative").setParam("factor", 4)),
                    new TestData("contrast", new ProcessingParams().setParam("k", 1e6)),
                    new TestData("contrast", new ProcessingParams().setParam("mode", "exponential").setParam("gamma", 50)),
                    new TestData("contrast", new ProcessingParams().setParam("mode", "exponential").setParam("gamma", 0.01)),
                    new TestData("negative", new ProcessingParams()),
                    new TestData("grayscale", new ProcessingParams()),
                    new TestData("binarize", new ProcessingParams().setParam("threshold", 0)),
                    new TestData("binarize", new ProcessingParams().setParam("threshold", 1).setParam("grayscale", true)),
                    new TestData("rotate", new ProcessingParams().setParam("angle", 33).setParam("fill", 1)),
                    new TestData("crop", new ProcessingParams().setParam("x", 1).setParam("y", 0).setParam("width", 1).setParam("height", 2)),
                    new TestData("translate", new ProcessingParams().setParam("dx", 1).setParam("dy", -1).setParam("fill", 1)),
                    new TestData("reduce-resolution", new ProcessingParams().setParam("factor", 1.5)),
                    new TestData("enlarge-region", new ProcessingParams().setParam("factor", 3)),
                    new TestData("merge", new ProcessingParams().setParam("other", image).setParam("alpha", 1)),
                    new TestData("merge", new ProcessingParams().setParam("other", image).setParam("alpha_mask", alphaMask)),
                    new TestData("channel", new ProcessingParams().setParam("model", "cmy").setParam("output_model", "cmy")
                            .setParam("order", "yellow,cyan,magenta")),
                    new TestData("histogram", new ProcessingParams()),
            };
            for (TestData td : testData) {
                ImageBuffer result = orchestrator.process(td.operation, td.params, image).getImage();
                for (float v : result.toInterleavedSamples()) {
                    assertTrue(td.operation + " with " + td.params + " produced " + v, v >= 0f && v <= 1f);
                }
            }
        }
    }

    @Test
    public void regionForms() {
        ImageBuffer image = gray(2, 3,
                0.1f, 0.2f, 0.3f,
                0.4f, 0.5f, 0.6f);
        OperationResult cropped = orchestrator.process("crop",
                ImmutableMap.of("x_start", 1, "x_end", 3, "y_start", 1, "y_end", 2), image);
        assertSamples(new float[] {0.5f, 0.6f}, cropped.getImage());
        assertEquals(OperationCategory.STRUCTURAL, cropped.getMetadata().getCategory());
        assertTrue(cropped.getMetadata().isStructural());

        OperationResult enlarged = orchestrator.process("enlarge_region",
                ImmutableMap.of("x", 2, "y", 1, "width", 1, "height", 1), image);
        assertShape(2, 2, ChannelLayout.GRAY, enlarged.getImage());
        assertSamples(new float[] {0.6f, 0.6f, 0.6f, 0.6f}, enlarged.getImage());

        OperationResult enlargedToWidth = orchestrator.process("enlarge-region",
                ImmutableMap.of("target_width", 6), image);
        assertShape(4, 6, ChannelLayout.GRAY, enlargedToWidth.getImage());

        OperationResult reduced = orchestrator.process("reduce_resolution", Collections.emptyMap(), image);
        assertShape(1, 1, ChannelLayout.GRAY, reduced.getImage());
    }

    @Test
    public void rotateOutputGuard() {
        ProcessingOrchestrator limitedOrchestrator = new ProcessingOrchestrator(ProcessingSettings.defaults().setMaxOutputPixels(100));
        ImageBuffer image = ImageBuffer.uniform(10, 10, ChannelLayout.GRAY, 0.5f);
        assertShape(10, 10, ChannelLayout.GRAY,
                limitedOrchestrator.process("rotate", ImmutableMap.of("angle", 90), image).getImage());
        try {
            limitedOrchestrator.process("rotate", ImmutableMap.of("angle", 45), image);
            fail("The rotated image exceeds the output limit");
        } catch (InvalidParameterException e) {
            assertEquals("angle", e.getParameter());
        }
    }

    @Test
    public void histogram() {
        ImageBuffer image = ImageBuffer.uniform(2, 2, ChannelLayout.RGBA, 0.5f, 0.5f, 0.5f, 1f);
        HistogramTable table = orchestrator.analyzeHistogram(image);
        assertEquals(4, table.getCount("red", 127));

        OperationResult result = orchestrator.process("histogram", Collections.emptyMap(), image);
        assertSame(image, result.getImage());
        assertEquals(OperationCategory.ANALYSIS, result.getMetadata().getCategory());
        HistogramTable derivedTable = (HistogramTable) result.getMetadata().getDerivedOutputs().get("histogram");
        assertEquals(4, derivedTable.getCount("blue", 127));
    }

    @Test
    public void pipeline() {
        ImageBuffer root = rgb(2, 2,
                0.2f, 0.4f, 0.6f, 0.2f, 0.4f, 0.6f,
                1.0f, 1.0f, 1.0f, 0.0f, 0.0f, 0.0f);
        List<OperationRequest> requests = Arrays.asList(
                new OperationRequest("crop", ImmutableMap.of("x", 0, "y", 1, "width", 2, "height", 1)),
                new OperationRequest().setOperation("grayscale").setParam("method", "average"),
                new OperationRequest("negative", null)
        );
        OperationResult result = orchestrator.processPipeline(root, requests);
        assertShape(1, 2, ChannelLayout.GRAY, result.getImage());
        assertSamples(new float[] {0f, 1f}, result.getImage());

        OperationMetadata metadata = result.getMetadata();
        assertEquals("pipeline", metadata.getOperation());
        assertEquals(OperationCategory.STRUCTURAL, metadata.getCategory());
        assertEquals(3, metadata.getSteps().size());
        assertEquals("crop", metadata.getSteps().get(0).getOperation());
        assertArrayEquals(new long[] {1, 2, 3}, metadata.getSteps().get(1).getInputShape());
        assertArrayEquals(new long[] {2, 2, 3}, metadata.getInputShape());
        assertArrayEquals(new long[] {1, 2, 1}, metadata.getOutputShape());
        // the root image is never modified
        assertEquals(0.2f, root.getSample(0, 0, 0), 0);
    }

    @Test
    public void pipelineStopsAtFirstFailure() {
        ImageBuffer root = rgb(1, 1, 0.2f, 0.4f, 0.6f);
        List<OperationRequest> requests = Arrays.asList(
                new OperationRequest("grayscale", null),
                new OperationRequest("grayscale", null)
        );
        try {
            orchestrator.processPipeline(root, requests);
            fail("A gray image cannot be converted to grayscale");
        } catch (UnsupportedChannelLayoutException e) {
            assertEquals("grayscale", e.getOperation());
        }
    }
}
