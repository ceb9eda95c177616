package org.janelia.pixelops.processing;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.janelia.pixelops.model.OperationCategory;

/**
 * The operation catalogue.
 */
public enum ProcessingOperation {
    BRIGHTNESS("brightness", OperationCategory.TONE),
    CONTRAST("contrast", OperationCategory.TONE),
    NEGATIVE("negative", OperationCategory.TONE),
    GRAYSCALE("grayscale", OperationCategory.TONE),
    BINARIZE("binarize", OperationCategory.TONE),
    ROTATE("rotate", OperationCategory.STRUCTURAL),
    CROP("crop", OperationCategory.STRUCTURAL),
    TRANSLATE("translate", OperationCategory.STRUCTURAL),
    REDUCE_RESOLUTION("reduce-resolution", OperationCategory.STRUCTURAL),
    ENLARGE_REGION("enlarge-region", OperationCategory.STRUCTURAL),
    MERGE("merge", OperationCategory.COMPOSITING),
    CHANNEL("channel", OperationCategory.CHANNEL),
    HISTOGRAM("histogram", OperationCategory.ANALYSIS);

    private final String operationName;
    private final OperationCategory category;

    ProcessingOperation(String operationName, OperationCategory category) {
        this.operationName = operationName;
        this.category = category;
    }

    public String getOperationName() {
        return operationName;
    }

    public OperationCategory getCategory() {
        return category;
    }

    /**
     * @return the catalogue operation with the given name or null
     */
    public static ProcessingOperation fromName(String name) {
        String normalizedName = StringUtils.trim(name);
        for (ProcessingOperation op : values()) {
            if (StringUtils.equalsIgnoreCase(op.operationName, normalizedName)) {
                return op;
            }
        }
        return null;
    }

    public static List<String> getOperationNames() {
        return Arrays.stream(values()).map(ProcessingOperation::getOperationName).collect(Collectors.toList());
    }
}
