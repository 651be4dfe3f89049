package admit.java.config;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads admission configuration from YAML and flattens nested sections into dotted keys,
 * so {@code rateLimit: {max: 10}} becomes {@code rateLimit.max=10}.
 */
public final class AdmissionConfigLoader {

    /** Classpath resource holding the packaged defaults. */
    public static final String DEFAULT_RESOURCE = "admission.yaml";

    static final String ROOT = "<root>";

    private AdmissionConfigLoader() {}

    /**
     * @param path location of the YAML configuration
     * @return flat key/value map, or empty when the file does not exist
     * @throws IOException when the file cannot be read
     * @throws IllegalArgumentException when the YAML cannot be parsed
     * @throws ConfigException when the YAML structure is invalid
     */
    public static Optional<Map<String, String>> load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return Optional.of(parse(reader, path.toString()));
        }
    }

    /**
     * @param resource classpath resource name
     * @return flat key/value map, or empty when the resource is missing
     * @throws IOException when the resource cannot be read
     */
    public static Optional<Map<String, String>> loadResource(String resource) throws IOException {
        Objects.requireNonNull(resource, "resource");
        InputStream in = AdmissionConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            return Optional.empty();
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return Optional.of(parse(reader, "classpath:" + resource));
        }
    }

    static Map<String, String> parse(Reader reader, String source) {
        Object document;
        try {
            document = new Yaml().load(reader);
        } catch (YAMLException ex) {
            throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
        }
        if (document == null) {
            return Map.of();
        }
        if (!(document instanceof Map<?, ?>)) {
            throw new ConfigException(ROOT, "document must be a mapping, got " + describe(document));
        }
        Map<String, String> flattened = new LinkedHashMap<>();
        walk(document, "", flattened);
        return Map.copyOf(flattened);
    }

    /**
     * Depth-first walk writing one entry per scalar leaf. Sections are recursed into;
     * sequences are rejected because no admission setting is a list.
     */
    private static void walk(Object node, String path, Map<String, String> target) {
        if (node instanceof Map<?, ?> section) {
            for (Map.Entry<?, ?> entry : section.entrySet()) {
                walk(entry.getValue(), childPath(path, entry.getKey()), target);
            }
        } else if (node instanceof Iterable<?> || node instanceof Object[]) {
            throw new ConfigException(path, "lists are not supported");
        } else if (target.putIfAbsent(path, node == null ? "" : node.toString()) != null) {
            // "a.b: 1" next to "a: {b: 2}"
            throw new ConfigException(path, "defined more than once");
        }
    }

    private static String childPath(String parent, Object rawKey) {
        String where = parent.isEmpty() ? ROOT : parent;
        if (!(rawKey instanceof String key)) {
            throw new ConfigException(where, "section contains non-string key " + describe(rawKey));
        }
        if (key.isBlank()) {
            throw new ConfigException(where, "section contains a blank key");
        }
        return parent.isEmpty() ? key : parent + '.' + key;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    }
}
