package com.github.salilvnair.commandconsole.registry;

import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class EntityRegistry {

    private final Map<String, EntityDescriptor> entities;
    private final Map<String, String> aliasIndex;

    public EntityRegistry(Collection<EntityDescriptor> descriptors) {
        Map<String, EntityDescriptor> byName = new LinkedHashMap<>();
        Map<String, String> aliases = new LinkedHashMap<>();
        for (EntityDescriptor descriptor : descriptors) {
            String key = descriptor.name().toLowerCase(Locale.ROOT);
            if (byName.putIfAbsent(key, descriptor) != null) {
                throw new CommandConsoleException(
                        CommandConsoleErrorCode.REGISTRY_LOAD_FAILED,
                        "Duplicate entity '" + descriptor.name() + "'"
                );
            }
            aliases.put(key, key);
            descriptor.aliases().forEach(alias -> aliases.putIfAbsent(alias.toLowerCase(Locale.ROOT), key));
        }
        this.entities = Collections.unmodifiableMap(byName);
        this.aliasIndex = Collections.unmodifiableMap(aliases);
    }

    public EntityDescriptor require(String name) {
        return resolve(name).orElseThrow(() -> new CommandConsoleException(
                CommandConsoleErrorCode.UNKNOWN_ENTITY,
                "Entity '" + name + "' is not registered"
        ));
    }

    /** Resolves a canonical entity name or one of its aliases. */
    public Optional<EntityDescriptor> resolve(String nameOrAlias) {
        if (nameOrAlias == null || nameOrAlias.isBlank()) {
            return Optional.empty();
        }
        String key = aliasIndex.get(nameOrAlias.trim().toLowerCase(Locale.ROOT));
        return key == null ? Optional.empty() : Optional.ofNullable(entities.get(key));
    }

    public boolean contains(String nameOrAlias) {
        return resolve(nameOrAlias).isPresent();
    }

    public List<String> entityNames() {
        return List.copyOf(entities.keySet());
    }

    public Collection<EntityDescriptor> descriptors() {
        return entities.values();
    }

    /** Every name and alias with the entity it points to, longest phrase first. */
    public List<Map.Entry<String, String>> phrases() {
        List<Map.Entry<String, String>> phrases = new ArrayList<>(aliasIndex.entrySet());
        phrases.sort((a, b) -> Integer.compare(b.getKey().length(), a.getKey().length()));
        return phrases;
    }
}
