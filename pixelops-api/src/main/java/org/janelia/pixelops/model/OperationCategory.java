package org.janelia.pixelops.model;

/**
 * Operation families. A STRUCTURAL result changes the geometry of the image so callers typically
 * use it as the base for any further edits.
 */
public enum OperationCategory {
    STRUCTURAL,
    TONE,
    COMPOSITING,
    CHANNEL,
    ANALYSIS;

    public boolean isStructural() {
        return this == STRUCTURAL;
    }
}
