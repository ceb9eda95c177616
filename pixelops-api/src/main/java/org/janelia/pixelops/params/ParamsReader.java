package org.janelia.pixelops.params;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

import org.apache.commons.lang3.StringUtils;
import org.janelia.pixelops.errors.InvalidParameterException;
import org.janelia.pixelops.image.ImageBuffer;

/**
 * Reads typed values out of {@link ProcessingParams}. Every type or range violation is reported
 * as an {@link InvalidParameterException} naming the operation, the parameter and the expected constraint.
 */
public class ParamsReader {

    private final String operation;
    private final ProcessingParams params;

    public ParamsReader(String operation, ProcessingParams params) {
        this.operation = operation;
        this.params = params == null ? new ProcessingParams() : params;
    }

    public String getOperation() {
        return operation;
    }

    public boolean hasParam(String name) {
        return params.hasParam(name);
    }

    public InvalidParameterException invalid(String name, String constraint, @Nullable Object value) {
        return new InvalidParameterException(operation, name, constraint, value);
    }

    /**
     * Reject the parameter names the operation does not know.
     */
    public void checkKnownParams(Set<String> knownParams) {
        for (String name : params.getParamNames()) {
            if (!knownParams.contains(name)) {
                throw invalid(name, "one of the known parameters " + new TreeSet<>(knownParams), params.getParam(name));
            }
        }
    }

    public double getDouble(String name, @Nullable Double defaultValue) {
        Object value = params.getParam(name);
        if (value == null) {
            if (defaultValue == null) {
                throw invalid(name, "a number (required)", null);
            }
            return defaultValue;
        }
        double v;
        if (value instanceof Number) {
            v = ((Number) value).doubleValue();
        } else if (value instanceof String && StringUtils.isNotBlank((String) value)) {
            try {
                v = Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw invalid(name, "a number", value);
            }
        } else {
            throw invalid(name, "a number", value);
        }
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw invalid(name, "a finite number", value);
        }
        return v;
    }

    public double getDoubleInRange(String name, @Nullable Double defaultValue, double min, double max) {
        double v = getDouble(name, defaultValue);
        if (v < min || v > max) {
            throw invalid(name, String.format("a number in [%s, %s]", min, max), v);
        }
        return v;
    }

    public double getPositiveDouble(String name, @Nullable Double defaultValue) {
        double v = getDouble(name, defaultValue);
        if (v <= 0) {
            throw invalid(name, "a positive number", v);
        }
        return v;
    }

    public int getInt(String name, @Nullable Integer defaultValue) {
        Object value = params.getParam(name);
        if (value == null && defaultValue != null) {
            return defaultValue;
        }
        double v = getDouble(name, null);
        if (v != Math.rint(v) || v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw invalid(name, "an integer", value);
        }
        return (int) v;
    }

    public int getIntInRange(String name, @Nullable Integer defaultValue, int min, int max) {
        int v = getInt(name, defaultValue);
        if (v < min || v > max) {
            throw invalid(name, String.format("an integer in [%d, %d]", min, max), v);
        }
        return v;
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = params.getParam(name);
        if (value == null) {
            return defaultValue;
        } else if (value instanceof Boolean) {
            return (Boolean) value;
        } else if (value instanceof String && StringUtils.equalsAnyIgnoreCase(((String) value).trim(), "true", "false")) {
            return Boolean.parseBoolean(((String) value).trim());
        } else {
            throw invalid(name, "true or false", value);
        }
    }

    /**
     * Enum values are matched ignoring case; '-' and '_' are interchangeable.
     */
    public <E extends Enum<E>> E getEnum(String name, Class<E> enumType, @Nullable E defaultValue) {
        return getEnum(name, enumType, defaultValue, Collections.emptyMap());
    }

    /**
     * Same as {@link #getEnum(String, Class, Enum)} but also accepts alternative names for some of the constants.
     */
    public <E extends Enum<E>> E getEnum(String name, Class<E> enumType, @Nullable E defaultValue, Map<String, E> aliases) {
        Object value = params.getParam(name);
        if (value == null) {
            if (defaultValue == null) {
                throw invalid(name, "one of " + enumNames(enumType) + " (required)", null);
            }
            return defaultValue;
        }
        if (enumType.isInstance(value)) {
            return enumType.cast(value);
        }
        String normalizedValue = StringUtils.replaceChars(value.toString().trim(), '-', '_');
        for (E e : enumType.getEnumConstants()) {
            if (StringUtils.equalsIgnoreCase(e.name(), normalizedValue)) {
                return e;
            }
        }
        for (Map.Entry<String, E> alias : aliases.entrySet()) {
            if (StringUtils.equalsIgnoreCase(alias.getKey(), normalizedValue)) {
                return alias.getValue();
            }
        }
        throw invalid(name, "one of " + enumNames(enumType), value);
    }

    /**
     * Lists may be given as a collection or as a comma separated string.
     */
    public List<String> getStringList(String name, @Nullable List<String> defaultValue) {
        Object value = params.getParam(name);
        if (value == null) {
            if (defaultValue == null) {
                throw invalid(name, "a list of names (required)", null);
            }
            return defaultValue;
        }
        List<String> values = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object v : (Collection<?>) value) {
                values.add(String.valueOf(v).trim());
            }
        } else if (value instanceof String) {
            for (String v : StringUtils.split((String) value, ',')) {
                values.add(v.trim());
            }
        } else {
            throw invalid(name, "a list of names", value);
        }
        return values;
    }

    @Nullable
    public ImageBuffer getImage(String name, boolean required) {
        Object value = params.getParam(name);
        if (value == null) {
            if (required) {
                throw invalid(name, "an image (required)", null);
            }
            return null;
        } else if (value instanceof ImageBuffer) {
            return (ImageBuffer) value;
        } else {
            throw invalid(name, "an image", value);
        }
    }

    private static <E extends Enum<E>> String enumNames(Class<E> enumType) {
        return Arrays.stream(enumType.getEnumConstants())
                .map(e -> e.name().toLowerCase())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
