package org.janelia.pixelops.cmd;

import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.model.OperationMetadata;
import org.janelia.pixelops.model.OperationResult;
import org.janelia.pixelops.processing.OperationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Applies every request independently to the same source image and writes one output per request.
 */
class VariantsCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(VariantsCmd.class);

    @Parameters(commandDescription = "Generate image variants: each request is applied to the original input")
    static class VariantsArgs extends AbstractCmdArgs {
        @Parameter(names = {"--input", "-i"}, required = true, description = "Input image")
        String inputImage;

        @Parameter(names = {"--requests", "-r"}, required = true, description = "JSON file with the list of operation requests")
        String requestsFile;

        @Parameter(names = {"--output-dir", "-od"}, required = true, description = "Output directory")
        String outputDir;

        @Parameter(names = "--output-format", description = "Output image extension")
        String outputFormat = "png";

        @Parameter(names = "--metadata", description = "JSON file for the list of the variants metadata")
        String metadataFile;

        VariantsArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Override
        List<String> validate() {
            if (StringUtils.equalsAnyIgnoreCase(outputFormat, "png", "tif", "tiff", "jpg", "jpeg")) {
                return super.validate();
            } else {
                return Collections.singletonList("Unsupported output format: " + outputFormat);
            }
        }
    }

    private final VariantsArgs args;

    VariantsCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new VariantsArgs(commonArgs);
    }

    @Override
    VariantsArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        long startTime = System.currentTimeMillis();
        List<OperationRequest> requests = readRequests(args.requestsFile).stream()
                .map(this::loadImageParams)
                .collect(Collectors.toList());
        ImageBuffer inputImage = readImage(args.inputImage);
        String baseName = StringUtils.substringBeforeLast(Paths.get(args.inputImage).getFileName().toString(), ".");
        ExecutorService executorService = CmdUtils.createCmdExecutor(args.commonArgs);
        try {
            Scheduler scheduler = Schedulers.fromExecutorService(executorService);
            List<OperationMetadata> variantsMetadata = Flux.range(0, requests.size())
                    .map(index -> ImmutablePair.of(index, requests.get(index)))
                    .parallel(CmdUtils.getTaskConcurrency(args.commonArgs))
                    .runOn(scheduler)
                    .map(indexedRequest -> {
                        OperationRequest request = indexedRequest.getRight();
                        OperationResult result = getOrchestrator().process(request, inputImage);
                        String outputName = String.format("%s-%02d-%s.%s",
                                baseName, indexedRequest.getLeft(), request.getOperation(), args.outputFormat);
                        writeImage(result.getImage(), Paths.get(args.outputDir, outputName).toString());
                        return ImmutablePair.of(indexedRequest.getLeft(), result.getMetadata());
                    })
                    .sequential()
                    .sort((p1, p2) -> Integer.compare(p1.getLeft(), p2.getLeft()))
                    .map(ImmutablePair::getRight)
                    .collectList()
                    .block();
            writeJSON(variantsMetadata, args.metadataFile);
            LOG.info("Finished {} variants of {} in {}s",
                    requests.size(), args.inputImage, (System.currentTimeMillis() - startTime) / 1000.);
        } finally {
            executorService.shutdown();
        }
    }
}
