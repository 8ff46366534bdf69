package com.alertsentinel.core.config;

import com.alertsentinel.core.model.AlertConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Loads alert definitions from YAML and converts them into validated
 * {@link AlertConfiguration}s.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_ALERTS_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String, DetectorConfigParser)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <p>
 * Loading fails fast: one invalid alert rejects the whole file, with every
 * problem listed in the exception message.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AlertsLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_ALERTS_PATH = "ALERTS_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "alerts.yml";

    private AlertsLoader() {
        // utility class, not instantiable
    }

    /**
     * Load alerts from {@value #ENV_ALERTS_PATH} if it names an existing
     * file, else from {@value #DEFAULT_RESOURCE} on the classpath.
     */
    public static List<AlertConfiguration> load(DetectorConfigParser parser) {
        String envPath = System.getenv(ENV_ALERTS_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading alerts from environment path: {}", envPath);
            return fromFile(envPath, parser);
        }
        LOG.info("Loading alerts from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE, parser);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     */
    public static List<AlertConfiguration> fromFile(String path, DetectorConfigParser parser) {
        Objects.requireNonNull(path, "Alerts file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, parser);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Alerts file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read alerts file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     */
    public static List<AlertConfiguration> fromClasspath(String resource, DetectorConfigParser parser) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AlertsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, parser);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static List<AlertConfiguration> parseAndValidate(InputStream is, DetectorConfigParser parser) {
        Objects.requireNonNull(parser, "DetectorConfigParser must not be null");
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AlertsConfig.class, options));
        AlertsConfig config = yaml.load(is);

        if (config == null || config.getAlerts().isEmpty()) {
            LOG.warn("No alerts defined in configuration");
            return List.of();
        }

        List<AlertConfiguration> alerts = config.toConfigurations(parser);
        LOG.info("Loaded {} alert(s), detectors enabled: {}", alerts.size(), parser.isDetectorsEnabled());
        return alerts;
    }
}
