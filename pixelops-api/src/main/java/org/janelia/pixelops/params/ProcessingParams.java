package org.janelia.pixelops.params;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Loosely typed operation parameters as they arrive from a caller. The values are only
 * interpreted when the operation resolves them into its typed parameters.
 */
public class ProcessingParams {

    private final Map<String, Object> params = new LinkedHashMap<>();

    public ProcessingParams() {
    }

    public ProcessingParams(Map<String, ?> params) {
        if (params != null) {
            this.params.putAll(params);
        }
    }

    public ProcessingParams setParam(String name, Object value) {
        params.put(name, value);
        return this;
    }

    public boolean hasParam(String name) {
        return params.get(name) != null;
    }

    public Object getParam(String name) {
        return params.get(name);
    }

    public Set<String> getParamNames() {
        return Collections.unmodifiableSet(params.keySet());
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(params);
    }

    /**
     * @return a new set of parameters in which the pinned values replace the values of this set.
     */
    public ProcessingParams withPinned(ProcessingParams pinned) {
        ProcessingParams merged = new ProcessingParams(params);
        merged.params.putAll(pinned.params);
        return merged;
    }

    public ProcessingParams withoutParam(String name) {
        ProcessingParams result = new ProcessingParams(params);
        result.params.remove(name);
        return result;
    }

    /**
     * @return a new set of parameters in which the parameter oldName is renamed to newName
     * unless newName is already set.
     */
    public ProcessingParams renameParam(String oldName, String newName) {
        ProcessingParams renamed = new ProcessingParams(params);
        if (renamed.params.containsKey(oldName)) {
            Object value = renamed.params.remove(oldName);
            renamed.params.putIfAbsent(newName, value);
        }
        return renamed;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("params", params)
                .toString();
    }
}
