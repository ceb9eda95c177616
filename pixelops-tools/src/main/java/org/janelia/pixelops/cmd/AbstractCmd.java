package org.janelia.pixelops.cmd;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.apache.commons.lang3.StringUtils;
import org.janelia.pixelops.config.Config;
import org.janelia.pixelops.config.ConfigProvider;
import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.io.ImageBufferIO;
import org.janelia.pixelops.processing.OperationRequest;
import org.janelia.pixelops.processing.ProcessingOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class AbstractCmd {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractCmd.class);
    // request parameters that may reference an image file instead of an image
    private static final List<String> IMAGE_PARAMS = Arrays.asList("other", "alpha_mask");

    private final String commandName;
    private Config config;
    private ProcessingOrchestrator orchestrator;
    final ObjectMapper mapper;

    AbstractCmd(String commandName) {
        this.commandName = commandName;
        this.config = null;
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        ;
    }

    public String getCommandName() {
        return commandName;
    }

    abstract AbstractCmdArgs getArgs();

    boolean matches(String commandName) {
        return StringUtils.isNotBlank(commandName) && StringUtils.equals(this.commandName, commandName);
    }

    abstract void execute();

    Config getConfig() {
        if (config == null) {
            config = ConfigProvider.getInstance()
                    .fromDefaultResources()
                    .fromFile(getArgs().getConfigFileName())
                    .get();
        }
        return config;
    }

    synchronized ProcessingOrchestrator getOrchestrator() {
        if (orchestrator == null) {
            orchestrator = ProcessingOrchestrator.fromConfig(getConfig());
        }
        return orchestrator;
    }

    /**
     * Replace the image parameters given as file names with the decoded images.
     */
    OperationRequest loadImageParams(OperationRequest request) {
        for (String imageParam : IMAGE_PARAMS) {
            Object value = request.getParams().get(imageParam);
            if (value instanceof String && StringUtils.isNotBlank((String) value)) {
                LOG.debug("Load {} for {} from {}", imageParam, request.getOperation(), value);
                request.setParam(imageParam, readImage((String) value));
            }
        }
        return request;
    }

    ImageBuffer readImage(String imageFileName) {
        LOG.info("Read image from {}", imageFileName);
        return ImageBufferIO.readImage(imageFileName);
    }

    void writeImage(ImageBuffer image, String imageFileName) {
        createParentDir(imageFileName);
        ImageBufferIO.writeImage(image, imageFileName);
        LOG.info("Wrote {} to {}", image, imageFileName);
    }

    List<OperationRequest> readRequests(String requestsFileName) {
        try {
            return mapper.readValue(new File(requestsFileName), new TypeReference<List<OperationRequest>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    void writeJSON(Object value, String jsonFileName) {
        if (StringUtils.isBlank(jsonFileName)) {
            return;
        }
        createParentDir(jsonFileName);
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(new File(jsonFileName), value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void createParentDir(String fileName) {
        Path parentDir = Paths.get(fileName).toAbsolutePath().getParent();
        if (parentDir == null) {
            return;
        }
        try {
            Files.createDirectories(parentDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
