package org.janelia.pixelops.cmd;

import java.util.ArrayList;
import java.util.List;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

import org.apache.commons.lang3.StringUtils;
import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.model.OperationResult;
import org.janelia.pixelops.processing.OperationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a single operation to an image file.
 */
class ProcessImageCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessImageCmd.class);

    @Parameters(commandDescription = "Apply one image operation")
    static class ProcessImageArgs extends AbstractCmdArgs {
        @Parameter(names = {"--input", "-i"}, required = true, description = "Input image")
        String inputImage;

        @Parameter(names = {"--operation", "-op"}, required = true, description = "Operation or operation alias name")
        String operation;

        @Parameter(names = {"--param", "-p"}, converter = NameValueArg.NameValueArgConverter.class,
                description = "Operation parameter as name=value")
        List<NameValueArg> params = new ArrayList<>();

        @Parameter(names = "--other", description = "Second image for the merge operation")
        String otherImage;

        @Parameter(names = "--alpha-mask", description = "Gray image used as per pixel alpha for the merge operation")
        String alphaMaskImage;

        @Parameter(names = {"--output", "-o"}, required = true, description = "Output image; the format is given by the extension")
        String outputImage;

        @Parameter(names = "--metadata", description = "JSON file for the operation metadata")
        String metadataFile;

        ProcessImageArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        OperationRequest getRequest() {
            OperationRequest request = new OperationRequest().setOperation(operation);
            params.forEach(p -> request.setParam(p.name, p.value));
            if (StringUtils.isNotBlank(otherImage)) {
                request.setParam("other", otherImage);
            }
            if (StringUtils.isNotBlank(alphaMaskImage)) {
                request.setParam("alpha_mask", alphaMaskImage);
            }
            return request;
        }
    }

    private final ProcessImageArgs args;

    ProcessImageCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new ProcessImageArgs(commonArgs);
    }

    @Override
    ProcessImageArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        long startTime = System.currentTimeMillis();
        ImageBuffer inputImage = readImage(args.inputImage);
        OperationRequest request = loadImageParams(args.getRequest());
        OperationResult result = getOrchestrator().process(request, inputImage);
        writeImage(result.getImage(), args.outputImage);
        writeJSON(result.getMetadata(), args.metadataFile);
        LOG.info("Finished {} on {} in {}s", args.operation, args.inputImage, (System.currentTimeMillis() - startTime) / 1000.);
    }
}
