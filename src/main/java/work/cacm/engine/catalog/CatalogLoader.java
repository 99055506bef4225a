package work.cacm.engine.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads capability catalog documents ({@code .json}, {@code .yaml}/{@code .yml} or {@code .toml}).
 *
 * <p>Expected shape: a top-level {@code computeCapabilities} list whose entries carry an {@code id} and a worker type
 * hint ({@code workerType} or {@code agentType}); an optional {@code hints} object is handed to the worker factory.
 * Loading never aborts the process: any problem is logged and yields an empty catalog, and individual entries that are
 * not objects or have no id are skipped.
 */
public final class CatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String ROOT_KEY = "computeCapabilities";
    static final String HINTS_KEY = "hints";

    private CatalogLoader() {}

    public static CapabilityCatalog load(Path path) {
        try {
            var catalog = loadOrThrow(path);
            log.info("Loaded {} compute capabilities from {}", catalog.size(), path);
            return catalog;
        } catch (CatalogLoadException ex) {
            log.error("Capability catalog unavailable, continuing with an empty catalog: {}", ex.getMessage());
            return CapabilityCatalog.empty();
        }
    }

    /**
     * Strict variant of {@link #load(Path)} for callers that want to surface the failure themselves.
     */
    public static CapabilityCatalog loadOrThrow(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new CatalogLoadException("Catalog file not found: " + path);
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".toml")) {
            return parseToml(path);
        }
        var mapper = fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
        try (var in = Files.newInputStream(path)) {
            return fromTree(mapper.readTree(in));
        } catch (IOException ex) {
            throw new CatalogLoadException("Failed to parse catalog " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static CapabilityCatalog fromTree(JsonNode root) {
        if (root == null || !root.isObject() || !root.has(ROOT_KEY)) {
            throw new CatalogLoadException("Catalog document has no '" + ROOT_KEY + "' list");
        }
        var entries = root.get(ROOT_KEY);
        if (!entries.isArray()) {
            throw new CatalogLoadException("'" + ROOT_KEY + "' must be a list");
        }
        var descriptors = new ArrayList<CapabilityDescriptor>();
        int index = 0;
        for (var entry : entries) {
            var id = text(entry, "id");
            if (id == null || id.isBlank()) {
                log.error("Skipping catalog entry #{}: missing id", index);
            } else {
                descriptors.add(new CapabilityDescriptor(
                    id,
                    firstText(entry, "workerType", "agentType"),
                    Optional.ofNullable(firstText(entry, "skill", "defaultSkill")),
                    text(entry, "name"),
                    text(entry, "description"),
                    names(entry.get("inputs")),
                    names(entry.get("outputs")),
                    hints(entry.get(HINTS_KEY))
                ));
            }
            index++;
        }
        return CapabilityCatalog.of(descriptors);
    }

    private static CapabilityCatalog parseToml(Path path) {
        TomlParseResult result;
        try {
            result = Toml.parse(path);
        } catch (IOException ex) {
            throw new CatalogLoadException("Failed to read catalog " + path + ": " + ex.getMessage(), ex);
        }
        if (result.hasErrors()) {
            throw new CatalogLoadException("Invalid TOML catalog " + path + ": " + result.errors().get(0).toString());
        }
        if (!result.isArray(ROOT_KEY)) {
            throw new CatalogLoadException("Catalog document has no '" + ROOT_KEY + "' list");
        }
        TomlArray entries = result.getArray(ROOT_KEY);
        var descriptors = new ArrayList<CapabilityDescriptor>();
        for (int i = 0; i < entries.size(); i++) {
            if (!(entries.get(i) instanceof TomlTable entry)) {
                log.error("Skipping catalog entry #{}: not a table", i);
                continue;
            }
            var id = tomlText(entry, "id");
            if (id == null || id.isBlank()) {
                log.error("Skipping catalog entry #{}: missing id", i);
                continue;
            }
            descriptors.add(new CapabilityDescriptor(
                id,
                firstTomlText(entry, "workerType", "agentType"),
                Optional.ofNullable(firstTomlText(entry, "skill", "defaultSkill")),
                tomlText(entry, "name"),
                tomlText(entry, "description"),
                tomlNames(entry, "inputs"),
                tomlNames(entry, "outputs"),
                entry.isTable(HINTS_KEY) ? entry.getTable(HINTS_KEY).toMap() : Map.of()
            ));
        }
        return CapabilityCatalog.of(descriptors);
    }

    private static String firstTomlText(TomlTable entry, String primary, String fallback) {
        var value = tomlText(entry, primary);
        return value != null ? value : tomlText(entry, fallback);
    }

    private static String tomlText(TomlTable entry, String key) {
        return entry.isString(key) ? entry.getString(key) : null;
    }

    private static List<String> tomlNames(TomlTable entry, String key) {
        if (entry.isArray(key)) {
            var array = entry.getArray(key);
            var names = new ArrayList<String>();
            for (int i = 0; i < array.size(); i++) {
                names.add(String.valueOf(array.get(i)));
            }
            return names;
        }
        if (entry.isTable(key)) {
            return new ArrayList<>(entry.getTable(key).keySet());
        }
        return List.of();
    }

    private static Map<String, Object> hints(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return JSON_MAPPER.convertValue(node, new TypeReference<Map<String, Object>>() {});
    }

    private static List<String> names(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        var names = new ArrayList<String>();
        if (node.isArray()) {
            for (var item : node) {
                names.add(item.isTextual() ? item.asText() : text(item, "name"));
            }
        } else if (node.isObject()) {
            Iterator<String> fields = node.fieldNames();
            fields.forEachRemaining(names::add);
        }
        names.removeIf(name -> name == null || name.isBlank());
        return names;
    }

    private static String firstText(JsonNode node, String primary, String fallback) {
        var value = text(node, primary);
        return value != null ? value : text(node, fallback);
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        var value = node.get(field);
        return value.isValueNode() ? value.asText() : null;
    }
}
