package org.janelia.pixelops.cmd;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import org.janelia.pixelops.model.HistogramTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes per channel 256 bin histograms for a set of images.
 */
class HistogramCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(HistogramCmd.class);

    @Parameters(commandDescription = "Compute the channel histograms of the input images")
    static class HistogramArgs extends AbstractCmdArgs {
        @Parameter(names = {"--input", "-i"}, required = true, variableArity = true, description = "Input images")
        List<String> inputImages;

        @Parameter(names = {"--output", "-o"}, description = "JSON output file. If not set the histograms are written to the standard output")
        String outputFile;

        HistogramArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }
    }

    private final HistogramArgs args;

    HistogramCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new HistogramArgs(commonArgs);
    }

    @Override
    HistogramArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        Map<String, HistogramTable> histograms = new LinkedHashMap<>();
        for (String inputImage : args.inputImages) {
            histograms.put(inputImage, getOrchestrator().analyzeHistogram(readImage(inputImage)));
        }
        if (args.outputFile == null) {
            try {
                System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(histograms));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException(e);
            }
        } else {
            writeJSON(histograms, args.outputFile);
        }
        LOG.info("Computed histograms for {} images", histograms.size());
    }
}
