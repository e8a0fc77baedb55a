package com.rulebook.schema;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulebook.exception.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads rulebook documents from YAML or JSON.
 * <p>
 * Every top-level entry whose value is a map with a {@code schema} list is an entity.
 */
public class RulebookLoader {

    private static final Logger log = LoggerFactory.getLogger(RulebookLoader.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final Set<String> SKIP_KEYS = Set.of("$schema", "model_name", "Description", "_meta", "Name");

    /**
     * Load a rulebook from a path.
     * Supports classpath: prefix for classpath resources; {@code .json} files are read
     * as JSON, everything else as YAML.
     *
     * @param path Path to the rulebook document
     * @return Loaded rulebook
     */
    public static Rulebook load(String path) {
        log.info("Loading rulebook from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                Map<String, Object> document = path.toLowerCase(Locale.ROOT).endsWith(".json")
                        ? readJson(inputStream)
                        : readYaml(inputStream);
                return fromDocument(document, resource.getFilename());
            }
        } catch (IOException e) {
            throw new SchemaException("Failed to load rulebook from: " + path, e);
        }
    }

    /**
     * Parse a JSON rulebook held in memory.
     */
    public static Rulebook fromJson(String json) {
        try {
            return fromDocument(objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {}),
                    null);
        } catch (IOException e) {
            throw new SchemaException("Invalid rulebook JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Build a rulebook from an already-parsed document.
     *
     * @param document    Rulebook document
     * @param defaultName Name used when the document carries none
     */
    @SuppressWarnings("unchecked")
    public static Rulebook fromDocument(Map<String, Object> document, String defaultName) {
        if (document == null) {
            throw new SchemaException("Rulebook document is empty");
        }

        String name = getString(document, "Name", defaultName != null ? defaultName : "Unknown");
        List<EntitySchema> entities = new ArrayList<>();

        for (Map.Entry<String, Object> entry : document.entrySet()) {
            if (SKIP_KEYS.contains(entry.getKey())) {
                continue;
            }
            if (entry.getValue() instanceof Map<?, ?> entityMap && entityMap.containsKey("schema")) {
                entities.add(parseEntity(entry.getKey(), (Map<String, Object>) entityMap));
            }
        }

        log.info("Loaded rulebook '{}' with {} entities", name, entities.size());
        return new Rulebook(name, entities, document);
    }

    @SuppressWarnings("unchecked")
    private static EntitySchema parseEntity(String entityName, Map<String, Object> entityMap) {
        Object schemaObj = entityMap.get("schema");
        if (!(schemaObj instanceof List<?> schemaList)) {
            throw new SchemaException("Entity '" + entityName + "' schema must be a list of fields");
        }

        List<Field> fields = new ArrayList<>();
        for (int i = 0; i < schemaList.size(); i++) {
            if (!(schemaList.get(i) instanceof Map<?, ?> fieldMap)) {
                throw new SchemaException("Entity '" + entityName + "' field " + i + " must be a map");
            }
            fields.add(parseField((Map<String, Object>) fieldMap));
        }

        String description = getString(entityMap, "Description", null);
        log.debug("Parsed entity {}: {} fields", entityName, fields.size());
        return new EntitySchema(entityName, fields, description);
    }

    private static Field parseField(Map<String, Object> map) {
        String description = getString(map, "Description", null);
        if (description == null) {
            description = getString(map, "description", null);
        }
        return new Field(
                getString(map, "name", null),
                DataType.fromName(getString(map, "datatype", null)),
                FieldKind.fromName(getString(map, "type", null)),
                getString(map, "formula", null),
                getBoolean(map, "nullable", true),
                description
        );
    }

    private static Map<String, Object> readJson(InputStream inputStream) throws IOException {
        return objectMapper.readValue(inputStream, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    private static Map<String, Object> readYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);
        if (root == null) {
            throw new SchemaException("Rulebook file is empty");
        }
        return root;
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
