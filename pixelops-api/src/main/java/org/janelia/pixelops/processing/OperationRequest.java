package org.janelia.pixelops.processing;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.pixelops.params.ProcessingParams;

/**
 * An operation name, catalogue name or alias, and its raw parameters.
 */
public class OperationRequest {

    private String operation;
    private final Map<String, Object> params = new LinkedHashMap<>();

    public OperationRequest() {
    }

    public OperationRequest(String operation, Map<String, ?> params) {
        this.operation = operation;
        if (params != null) {
            this.params.putAll(params);
        }
    }

    @JsonProperty("operation")
    public String getOperation() {
        return operation;
    }

    public OperationRequest setOperation(String operation) {
        this.operation = operation;
        return this;
    }

    @JsonProperty("params")
    public Map<String, Object> getParams() {
        return params;
    }

    public OperationRequest setParams(Map<String, Object> params) {
        this.params.clear();
        if (params != null) {
            this.params.putAll(params);
        }
        return this;
    }

    public OperationRequest setParam(String name, Object value) {
        params.put(name, value);
        return this;
    }

    public ProcessingParams toProcessingParams() {
        return new ProcessingParams(params);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("operation", operation)
                .append("params", params)
                .toString();
    }
}
