package org.janelia.pixelops.errors;

import java.util.Collection;
import java.util.List;

import com.google.common.collect.ImmutableList;

public class UnknownOperationException extends ImageProcessingException {

    private final List<String> knownOperations;

    public UnknownOperationException(String operation, Collection<String> knownOperations) {
        super(operation, String.format("Unknown operation '%s' - known operations are %s", operation, knownOperations));
        this.knownOperations = ImmutableList.copyOf(knownOperations);
    }

    public List<String> getKnownOperations() {
        return knownOperations;
    }
}
