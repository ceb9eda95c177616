package org.janelia.pixelops.cmd;

import java.util.List;
import java.util.stream.Collectors;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.model.OperationResult;
import org.janelia.pixelops.processing.OperationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a chain of operations read from a JSON file on one image.
 */
class BatchProcessCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(BatchProcessCmd.class);

    @Parameters(commandDescription = "Apply a pipeline of operations, each to the result of the previous one")
    static class BatchProcessArgs extends AbstractCmdArgs {
        @Parameter(names = {"--input", "-i"}, required = true, description = "Input image")
        String inputImage;

        @Parameter(names = {"--requests", "-r"}, required = true,
                description = "JSON file with the list of operation requests: [{\"operation\": ..., \"params\": {...}}]")
        String requestsFile;

        @Parameter(names = {"--output", "-o"}, required = true, description = "Output image")
        String outputImage;

        @Parameter(names = "--metadata", description = "JSON file for the pipeline metadata")
        String metadataFile;

        BatchProcessArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }
    }

    private final BatchProcessArgs args;

    BatchProcessCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new BatchProcessArgs(commonArgs);
    }

    @Override
    BatchProcessArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        long startTime = System.currentTimeMillis();
        List<OperationRequest> requests = readRequests(args.requestsFile).stream()
                .map(this::loadImageParams)
                .collect(Collectors.toList());
        ImageBuffer inputImage = readImage(args.inputImage);
        OperationResult result = getOrchestrator().processPipeline(inputImage, requests);
        writeImage(result.getImage(), args.outputImage);
        writeJSON(result.getMetadata(), args.metadataFile);
        LOG.info("Finished {} operations on {} in {}s",
                requests.size(), args.inputImage, (System.currentTimeMillis() - startTime) / 1000.);
    }
}
