package org.janelia.pixelops.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.janelia.pixelops.image.ImageBuffer;

public class OperationResult {

    private final ImageBuffer image;
    private final OperationMetadata metadata;

    public OperationResult(ImageBuffer image, OperationMetadata metadata) {
        this.image = image;
        this.metadata = metadata;
    }

    @JsonIgnore
    public ImageBuffer getImage() {
        return image;
    }

    @JsonProperty("metadata")
    public OperationMetadata getMetadata() {
        return metadata;
    }
}
