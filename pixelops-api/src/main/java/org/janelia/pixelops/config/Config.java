package org.janelia.pixelops.config;

import java.util.Properties;

import javax.annotation.Nullable;

import org.apache.commons.lang3.StringUtils;

/**
 * Read-only view of the configured properties.
 */
public class Config {

    private final Properties properties;

    Config(Properties properties) {
        this.properties = properties;
    }

    @Nullable
    public String getStringPropertyValue(String name) {
        return getStringPropertyValue(name, null);
    }

    public String getStringPropertyValue(String name, String defaultValue) {
        String value = StringUtils.trimToNull(properties.getProperty(name));
        return value == null ? defaultValue : value;
    }

    public boolean getBooleanPropertyValue(String name) {
        return getBooleanPropertyValue(name, false);
    }

    public boolean getBooleanPropertyValue(String name, boolean defaultValue) {
        String value = getStringPropertyValue(name);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    public int getIntegerPropertyValue(String name, int defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Property " + name + " must be an integer but it is " + value, e);
        }
    }

    public long getLongPropertyValue(String name, long defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Property " + name + " must be an integer but it is " + value, e);
        }
    }

    public double getDoublePropertyValue(String name, double defaultValue) {
        String value = getStringPropertyValue(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Property " + name + " must be a number but it is " + value, e);
        }
    }

    @Override
    public String toString() {
        return properties.toString();
    }
}
