package com.driverlens.core.analysis;

import com.driverlens.core.model.DriverMetadata;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link DriverMetadataProvider} backed by a JSON document of the form
 *
 * <pre>
 * {
 *   "drivers": {
 *     "speed": { "description": "Line speed", "unit": "m/min", "normal_range": "80-120" }
 *   }
 * }
 * </pre>
 *
 * <p>
 * A missing or malformed document yields an empty provider and a warning:
 * enrichment is optional and never stops an analysis. Only an I/O failure
 * while reading an existing document is an error.
 * </p>
 *
 * @since 1.0.0
 */
public final class JsonDriverMetadataProvider implements DriverMetadataProvider {

    private static final Logger LOG = LoggerFactory.getLogger(JsonDriverMetadataProvider.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, DriverMetadata> drivers;

    JsonDriverMetadataProvider(Map<String, DriverMetadata> drivers) {
        this.drivers = Collections.unmodifiableMap(new LinkedHashMap<>(drivers));
    }

    /**
     * Load metadata from a file.
     *
     * @param path JSON document path
     * @return the provider; empty if the file does not exist or is malformed
     * @throws IllegalStateException if the file cannot be read
     */
    public static JsonDriverMetadataProvider fromFile(Path path) {
        Objects.requireNonNull(path, "Metadata path must not be null");
        try (InputStream is = Files.newInputStream(path)) {
            JsonDriverMetadataProvider provider = parse(is, path.toString());
            LOG.info("Loaded metadata for {} driver(s) from {}", provider.size(), path);
            return provider;
        } catch (NoSuchFileException e) {
            LOG.warn("Driver metadata file not found: {}, continuing without enrichment", path);
            return new JsonDriverMetadataProvider(Map.of());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read driver metadata file: " + path, e);
        }
    }

    /**
     * Load metadata from a classpath resource.
     *
     * @param resource classpath resource name
     * @return the provider; empty if the resource does not exist or is
     *         malformed
     * @throws IllegalStateException if the resource cannot be read
     */
    public static JsonDriverMetadataProvider fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = JsonDriverMetadataProvider.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            LOG.warn("Driver metadata resource not found: {}, continuing without enrichment", resource);
            return new JsonDriverMetadataProvider(Map.of());
        }
        try (is) {
            return parse(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read driver metadata resource: " + resource, e);
        }
    }

    private static JsonDriverMetadataProvider parse(InputStream is, String source) throws IOException {
        MetadataDocument document;
        try {
            document = MAPPER.readValue(is, MetadataDocument.class);
        } catch (JsonProcessingException e) {
            LOG.warn("Malformed driver metadata in {}: {}, continuing without enrichment",
                    source, e.getOriginalMessage());
            return new JsonDriverMetadataProvider(Map.of());
        }
        if (document == null || document.drivers == null) {
            return new JsonDriverMetadataProvider(Map.of());
        }
        return new JsonDriverMetadataProvider(document.drivers);
    }

    @Override
    public Optional<DriverMetadata> find(String driverKey) {
        return Optional.ofNullable(drivers.get(driverKey));
    }

    public int size() {
        return drivers.size();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class MetadataDocument {
        @JsonProperty("drivers")
        Map<String, DriverMetadata> drivers;
    }
}
