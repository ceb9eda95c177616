package org.janelia.pixelops.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link Config} from the default classpath resource overridden by an optional properties file.
 */
public class ConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigProvider.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/pixelops.properties";

    public static ConfigProvider getInstance() {
        return new ConfigProvider();
    }

    private final Properties properties = new Properties();

    private ConfigProvider() {
    }

    public ConfigProvider fromDefaultResources() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    public ConfigProvider fromResource(String resourceName) {
        try (InputStream configStream = ConfigProvider.class.getResourceAsStream(resourceName)) {
            if (configStream == null) {
                LOG.warn("Config resource {} not found", resourceName);
            } else {
                LOG.debug("Reading configuration from resource {}", resourceName);
                properties.load(configStream);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config resource " + resourceName, e);
        }
        return this;
    }

    /**
     * Override the properties read so far with the ones from the file. A blank file name is ignored.
     */
    public ConfigProvider fromFile(String fileName) {
        if (StringUtils.isBlank(fileName)) {
            return this;
        }
        try (InputStream configStream = new FileInputStream(fileName)) {
            LOG.info("Reading configuration from {}", fileName);
            properties.load(configStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading config file " + fileName, e);
        }
        return this;
    }

    public ConfigProvider withProperty(String name, String value) {
        properties.setProperty(name, value);
        return this;
    }

    public Config get() {
        Properties configProperties = new Properties();
        configProperties.putAll(properties);
        return new Config(configProperties);
    }
}
