package org.janelia.pixelops.processing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.collections4.CollectionUtils;
import org.janelia.pixelops.config.Config;
import org.janelia.pixelops.errors.InvalidImageException;
import org.janelia.pixelops.errors.UnknownOperationException;
import org.janelia.pixelops.image.ImageBuffer;
import org.janelia.pixelops.image.algorithms.HistogramAnalyzer;
import org.janelia.pixelops.model.HistogramTable;
import org.janelia.pixelops.model.OperationCategory;
import org.janelia.pixelops.model.OperationMetadata;
import org.janelia.pixelops.model.OperationResult;
import org.janelia.pixelops.params.OperationParams;
import org.janelia.pixelops.params.ParamsReader;
import org.janelia.pixelops.params.ProcessingParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the engine. It resolves the operation name, validates the parameters against the image,
 * dispatches to the operation provider and packages the new image with its provenance.
 *
 * The orchestrator holds no mutable state so one instance can be shared between threads.
 */
public class ProcessingOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessingOrchestrator.class);

    private final Map<ProcessingOperation, ImageOperationProvider<? extends OperationParams>> providers;

    public ProcessingOrchestrator() {
        this(ProcessingSettings.defaults());
    }

    public ProcessingOrchestrator(ProcessingSettings settings) {
        this.providers = ImageOperationProviderFactory.createProviders(settings);
    }

    public static ProcessingOrchestrator fromConfig(Config config) {
        return new ProcessingOrchestrator(ProcessingSettings.fromConfig(config));
    }

    /**
     * @return catalogue operation names followed by the alias names
     */
    public List<String> getKnownOperations() {
        List<String> knownOperations = new ArrayList<>(ProcessingOperation.getOperationNames());
        knownOperations.addAll(OperationAliases.getAliasNames());
        return knownOperations;
    }

    public OperationResult process(String operation, Map<String, ?> params, ImageBuffer image) {
        return process(operation, new ProcessingParams(params), image);
    }

    public OperationResult process(OperationRequest request, ImageBuffer image) {
        return process(request.getOperation(), request.toProcessingParams(), image);
    }

    public OperationResult process(String operation, ProcessingParams params, ImageBuffer image) {
        if (image == null) {
            throw new InvalidImageException("No image to process with " + operation);
        }
        ProcessingOperation catalogueOperation = ProcessingOperation.fromName(operation);
        ProcessingParams operationParams = params == null ? new ProcessingParams() : params;
        if (catalogueOperation == null) {
            OperationAliases.OperationAlias alias = OperationAliases.lookup(operation);
            if (alias == null) {
                throw new UnknownOperationException(operation, getKnownOperations());
            }
            catalogueOperation = alias.operation;
            operationParams = alias.paramsMapper.apply(operationParams);
            LOG.debug("Resolved {} to {} with {}", operation, catalogueOperation.getOperationName(), operationParams);
        }
        return runOperation(catalogueOperation, providers.get(catalogueOperation), operationParams, image);
    }

    public HistogramTable analyzeHistogram(ImageBuffer image) {
        if (image == null) {
            throw new InvalidImageException("No image to analyze");
        }
        return HistogramAnalyzer.analyze(image);
    }

    /**
     * Apply the requests in order, each one to the result of the previous one, starting from the root image.
     * Only the final image is returned; its metadata lists the metadata of every step. If any step fails
     * the exception propagates and no result is produced.
     */
    public OperationResult processPipeline(ImageBuffer root, List<OperationRequest> requests) {
        if (root == null) {
            throw new InvalidImageException("No root image for the pipeline");
        }
        OperationMetadata pipelineMetadata = new OperationMetadata()
                .setOperation("pipeline")
                .setInputShape(root.getShape());
        ImageBuffer current = root;
        OperationCategory pipelineCategory = null;
        if (CollectionUtils.isNotEmpty(requests)) {
            LOG.info("Run pipeline of {} operations on {}", requests.size(), root);
            for (OperationRequest request : requests) {
                OperationResult stepResult = process(request, current);
                OperationMetadata stepMetadata = stepResult.getMetadata();
                pipelineMetadata.addStep(stepMetadata);
                if (pipelineCategory == null || !pipelineCategory.isStructural()) {
                    pipelineCategory = stepMetadata.getCategory();
                }
                current = stepResult.getImage();
            }
        }
        pipelineMetadata
                .setCategory(pipelineCategory)
                .setOutputShape(current.getShape());
        return new OperationResult(current, pipelineMetadata);
    }

    private <P extends OperationParams> OperationResult runOperation(ProcessingOperation operation,
                                                                     ImageOperationProvider<P> provider,
                                                                     ProcessingParams params,
                                                                     ImageBuffer image) {
        new ParamsReader(operation.getOperationName(), params).checkKnownParams(provider.getParamNames());
        P resolvedParams = provider.resolveParams(params, image);
        long startTime = System.currentTimeMillis();
        ImageBuffer result = provider.apply(image, resolvedParams);
        OperationMetadata metadata = new OperationMetadata()
                .setOperation(operation.getOperationName())
                .setCategory(operation.getCategory())
                .setParams(resolvedParams.asResolvedMap())
                .setInputShape(image.getShape())
                .setOutputShape(result.getShape());
        provider.getDerivedOutputs(image, resolvedParams).forEach(metadata::addDerivedOutput);
        LOG.debug("Applied {} with {} to {} in {}ms",
                operation.getOperationName(), metadata.getParams(), image, System.currentTimeMillis() - startTime);
        return new OperationResult(result, metadata);
    }
}
