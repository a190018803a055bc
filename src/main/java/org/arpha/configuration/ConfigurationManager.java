package org.arpha.configuration;

import lombok.extern.slf4j.Slf4j;
import org.arpha.exception.ConfigurationException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

@Slf4j
public class ConfigurationManager {

    static final String DEFAULT_RESOURCE = "routing.properties";

    private static ConfigurationManager INSTANCE;
    private final Properties properties;

    private ConfigurationManager() {
        properties = new Properties();

        try (InputStream input = ConfigurationManager.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                log.warn("Configuration resource {} not found on classpath, falling back to defaults", DEFAULT_RESOURCE);
                return;
            }
            properties.load(input);
        } catch (IOException e) {
            log.error("Error loading configuration resource: {}", DEFAULT_RESOURCE, e);
            throw new ConfigurationException("Error loading configuration resource.", e);
        }
    }

    public static synchronized ConfigurationManager getINSTANCE() {
        if (INSTANCE == null) {
            INSTANCE = new ConfigurationManager();
        }

        return INSTANCE;
    }

    /**
     * Replaces the loaded properties with the content of the given file.
     */
    public static synchronized void overrideProperties(String path) {
        ConfigurationManager manager = getINSTANCE();
        Properties loaded = new Properties();

        try (FileInputStream input = new FileInputStream(path)) {
            loaded.load(input);
        } catch (FileNotFoundException e) {
            log.error("Configuration file not found: {}", path, e);
            throw new ConfigurationException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            log.error("Error loading configuration file: {}", path, e);
            throw new ConfigurationException("Error loading configuration file: " + path, e);
        }

        manager.properties.clear();
        manager.properties.putAll(loaded);
        log.info("Configuration overridden from {} ({} properties)", path, loaded.size());
    }

    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            log.warn("Property {} not found in configuration. Using default value: {}", key, defaultValue);
            return defaultValue;
        }
        return value;
    }

}
