package org.carball.srql.model.schema;

import lombok.extern.slf4j.Slf4j;
import org.carball.srql.error.UnknownEntityException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable entity-to-table mapping with per-entity field allow-lists. Passed explicitly into
 * the compiler and the builder so tests can inject synthetic schemas.
 */
@Slf4j
public final class SchemaCatalog {

    private final Map<String, EntitySchema> entities;
    private final Map<String, String> aliases;

    private SchemaCatalog(Map<String, EntitySchema> entities, Map<String, String> aliases) {
        this.entities = Collections.unmodifiableMap(entities);
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    public static SchemaCatalog of(List<EntitySchema> schemas) {
        Map<String, EntitySchema> entities = new LinkedHashMap<>();
        Map<String, String> aliases = new LinkedHashMap<>();
        for (EntitySchema schema : schemas) {
            schema.validate();
            String name = schema.getName().toLowerCase(Locale.ROOT);
            if (entities.putIfAbsent(name, schema) != null) {
                throw new IllegalArgumentException("Entity '" + name + "' is defined twice");
            }
            for (String alias : schema.getAliases()) {
                String previous = aliases.putIfAbsent(alias.toLowerCase(Locale.ROOT), name);
                if (previous != null && !previous.equals(name)) {
                    throw new IllegalArgumentException(
                            "Alias '" + alias + "' maps to both '" + previous + "' and '" + name + "'");
                }
            }
        }
        log.debug("Schema catalog built with {} entities and {} aliases", entities.size(), aliases.size());
        return new SchemaCatalog(entities, aliases);
    }

    public Optional<EntitySchema> find(String entity) {
        if (entity == null) {
            return Optional.empty();
        }
        String normalized = entity.trim().toLowerCase(Locale.ROOT);
        EntitySchema schema = entities.get(normalized);
        if (schema == null && aliases.containsKey(normalized)) {
            schema = entities.get(aliases.get(normalized));
        }
        return Optional.ofNullable(schema);
    }

    public EntitySchema resolve(String entity) throws UnknownEntityException {
        return find(entity).orElseThrow(() -> new UnknownEntityException(entity));
    }

    public Collection<EntitySchema> getEntities() {
        return entities.values();
    }

    public SchemaCatalog merge(SchemaCatalog other) {
        List<EntitySchema> combined = new ArrayList<>(entities.values());
        combined.addAll(other.entities.values());
        return of(combined);
    }
}
