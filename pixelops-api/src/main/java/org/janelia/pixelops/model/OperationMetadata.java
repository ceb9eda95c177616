package org.janelia.pixelops.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Provenance of an operation result: what was applied, with which resolved parameters,
 * and what it produced besides the image.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class OperationMetadata {

    private String operation;
    private OperationCategory category;
    private Map<String, Object> params = new LinkedHashMap<>();
    private Map<String, Object> derivedOutputs = new LinkedHashMap<>();
    private long[] inputShape;
    private long[] outputShape;
    private final List<OperationMetadata> steps = new ArrayList<>();

    @JsonProperty("operation")
    public String getOperation() {
        return operation;
    }

    public OperationMetadata setOperation(String operation) {
        this.operation = operation;
        return this;
    }

    @JsonProperty("category")
    public OperationCategory getCategory() {
        return category;
    }

    public OperationMetadata setCategory(OperationCategory category) {
        this.category = category;
        return this;
    }

    @JsonIgnore
    public boolean isStructural() {
        return category != null && category.isStructural();
    }

    @JsonProperty("params")
    public Map<String, Object> getParams() {
        return Collections.unmodifiableMap(params);
    }

    public OperationMetadata setParams(Map<String, Object> params) {
        this.params = new LinkedHashMap<>(params);
        return this;
    }

    @JsonProperty("derivedOutputs")
    public Map<String, Object> getDerivedOutputs() {
        return Collections.unmodifiableMap(derivedOutputs);
    }

    public OperationMetadata addDerivedOutput(String name, Object value) {
        derivedOutputs.put(name, value);
        return this;
    }

    /**
     * @return the input shape as [height, width, channels]
     */
    @JsonProperty("inputShape")
    public long[] getInputShape() {
        return inputShape == null ? null : inputShape.clone();
    }

    public OperationMetadata setInputShape(long[] inputShape) {
        this.inputShape = inputShape == null ? null : inputShape.clone();
        return this;
    }

    @JsonProperty("outputShape")
    public long[] getOutputShape() {
        return outputShape == null ? null : outputShape.clone();
    }

    public OperationMetadata setOutputShape(long[] outputShape) {
        this.outputShape = outputShape == null ? null : outputShape.clone();
        return this;
    }

    /**
     * @return the metadata of every step if this result was produced by a pipeline
     */
    @JsonProperty("steps")
    public List<OperationMetadata> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public OperationMetadata addStep(OperationMetadata step) {
        steps.add(step);
        return this;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("operation", operation)
                .append("category", category)
                .append("params", params)
                .toString();
    }
}
