package com.rulebook.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A rulebook: named collection of entity schemas.
 *
 * @param name     Rulebook name
 * @param entities Entities in document order
 * @param document The raw document the rulebook was read from, used for content hashing
 */
public record Rulebook(String name, List<EntitySchema> entities, Map<String, Object> document) {

    public Rulebook {
        entities = List.copyOf(entities);
        document = document == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(document));
    }

    public Rulebook(String name, List<EntitySchema> entities) {
        this(name, entities, null);
    }

    public Optional<EntitySchema> entity(String entityName) {
        return entities.stream().filter(e -> e.name().equals(entityName)).findFirst();
    }

    public List<String> entityNames() {
        List<String> names = new ArrayList<>();
        for (EntitySchema entity : entities) {
            names.add(entity.name());
        }
        return names;
    }
}
