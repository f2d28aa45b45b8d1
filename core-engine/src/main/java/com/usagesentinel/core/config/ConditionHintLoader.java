package com.usagesentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads the condition-hint catalog that enriches alerts.
 *
 * <p>
 * The service ships {@value #BUNDLED_RESOURCE} on the classpath. An
 * operator may point the service at a replacement file; the choice is made
 * once by {@link #resolve(String)} from the configured path. Whatever the
 * source, the catalog is validated before it is returned, and a source with
 * no hints yields an empty catalog so alerts simply go out without a hint.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConditionHintLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionHintLoader.class);

    /** Catalog bundled with the engine. */
    public static final String BUNDLED_RESOURCE = "condition-hints.yml";

    private ConditionHintLoader() {
        // utility class, not instantiable
    }

    /**
     * Pick the catalog for a configured location.
     *
     * @param configuredPath replacement file, or {@code null}/blank for the
     *                       bundled catalog
     * @return validated catalog
     * @throws IllegalArgumentException if the configured file does not exist
     * @throws IllegalStateException    if the catalog cannot be read or is
     *                                  invalid
     */
    public static ConditionHintCatalog resolve(String configuredPath) {
        if (configuredPath == null || configuredPath.isBlank()) {
            return bundled();
        }
        return fromPath(Path.of(configuredPath.trim()));
    }

    /**
     * @return the validated bundled catalog
     */
    public static ConditionHintCatalog bundled() {
        return fromClasspath(BUNDLED_RESOURCE);
    }

    /**
     * @param file YAML file; must not be {@code null}
     * @return validated catalog
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or is
     *                                  invalid
     */
    public static ConditionHintCatalog fromPath(Path file) {
        Objects.requireNonNull(file, "Condition hints file must not be null");
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toString());
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Condition hints file not found: " + file, e);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read condition hints file: " + file, e);
        }
    }

    static ConditionHintCatalog fromClasspath(String resource) {
        InputStream is = ConditionHintLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Condition hints resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
            return read(reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read condition hints resource: " + resource, e);
        }
    }

    private static ConditionHintCatalog read(Reader reader, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ConditionHintCatalog.class, options));

        ConditionHintCatalog catalog;
        try {
            catalog = yaml.load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed condition hints in " + source + ": " + e.getMessage(), e);
        }
        if (catalog == null) {
            catalog = new ConditionHintCatalog();
        }
        catalog.validate();

        if (catalog.getHints().isEmpty()) {
            LOG.warn("{} defines no condition hints; alerts will carry none", source);
        } else {
            LOG.info("Loaded {} condition hint(s) from {}", catalog.getHints().size(), source);
        }
        return catalog;
    }
}
