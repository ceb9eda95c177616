package org.janelia.pixelops.errors;

import javax.annotation.Nullable;

/**
 * A parameter is missing, has the wrong type or is outside its allowed range.
 */
public class InvalidParameterException extends ImageProcessingException {

    private final String parameter;
    private final String constraint;
    private final Object value;

    public InvalidParameterException(String operation, String parameter, String constraint, @Nullable Object value) {
        super(operation, String.format("Invalid value %s for parameter '%s' of '%s': expected %s",
                value, parameter, operation, constraint));
        this.parameter = parameter;
        this.constraint = constraint;
        this.value = value;
    }

    public String getParameter() {
        return parameter;
    }

    public String getConstraint() {
        return constraint;
    }

    @Nullable
    public Object getValue() {
        return value;
    }
}
