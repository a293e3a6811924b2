package com.hellblazer.hexcrawl.simulation.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Monster definitions by id.
 * <p>
 * Registering an id twice replaces the earlier definition.
 *
 * @author hal.hildebrand
 */
public class MonsterRegistry {
    private static final Logger log = LoggerFactory.getLogger(MonsterRegistry.class);

    private final Map<String, MonsterDefinition> definitions = new LinkedHashMap<>();

    public MonsterRegistry() {
    }

    public MonsterRegistry(Collection<MonsterDefinition> definitions) {
        load(definitions);
    }

    /**
     * Registry preloaded with the bundled definitions.
     */
    public static MonsterRegistry withDefaults() {
        return new MonsterRegistry(new MonsterDefinitionLoader().loadDefaults());
    }

    public void register(MonsterDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        if (definitions.put(definition.id(), definition) != null) {
            log.debug("Replaced monster definition {}", definition.id());
        }
    }

    public void load(Collection<MonsterDefinition> toLoad) {
        toLoad.forEach(this::register);
        log.info("Loaded {} monster definitions, {} registered", toLoad.size(), definitions.size());
    }

    public Optional<MonsterDefinition> get(String id) {
        return Optional.ofNullable(definitions.get(id));
    }

    public boolean contains(String id) {
        return definitions.containsKey(id);
    }

    /**
     * @return registered ids in registration order
     */
    public Set<String> ids() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(definitions.keySet()));
    }

    public int size() {
        return definitions.size();
    }

    public void clear() {
        definitions.clear();
    }
}
