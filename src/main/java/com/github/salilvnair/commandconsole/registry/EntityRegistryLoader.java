package com.github.salilvnair.commandconsole.registry;

import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
public final class EntityRegistryLoader {

    private EntityRegistryLoader() {
    }

    public static EntityRegistry load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            RegistryDocument document = JsonUtil.mapper().readValue(in, RegistryDocument.class);
            List<EntityDescriptor> descriptors = new ArrayList<>();
            for (EntityDocument entity : document.getEntities()) {
                descriptors.add(toDescriptor(entity));
            }
            EntityRegistry registry = new EntityRegistry(linkOwners(document.getEntities(), descriptors));
            log.info("Loaded entity registry from {} entities={}", resource.getDescription(), registry.entityNames());
            return registry;
        }
        catch (IOException e) {
            throw new CommandConsoleException(
                    CommandConsoleErrorCode.REGISTRY_LOAD_FAILED,
                    "Unable to read entity registry " + resource.getDescription(),
                    e
            );
        }
    }

    private static EntityDescriptor toDescriptor(EntityDocument doc) {
        if (doc.getName() == null || doc.getTable() == null || doc.getFields().isEmpty()) {
            throw invalid(doc.getName(), "name, table and fields are required");
        }
        Map<String, FieldType> fields = new LinkedHashMap<>();
        doc.getFields().forEach((field, type) -> fields.put(field, FieldType.valueOf(type.toUpperCase(Locale.ROOT))));
        String idField = doc.getIdField() == null ? "id" : doc.getIdField();
        if (!fields.containsKey(idField)) {
            throw invalid(doc.getName(), "id field '" + idField + "' is not declared");
        }
        for (String field : doc.getFilterable()) {
            if (!fields.containsKey(field)) {
                throw invalid(doc.getName(), "filterable field '" + field + "' is not declared");
            }
        }
        for (String field : doc.getWritable()) {
            if (!fields.containsKey(field)) {
                throw invalid(doc.getName(), "writable field '" + field + "' is not declared");
            }
        }
        checkOptionalField(doc.getName(), fields, doc.getOwnerField());
        checkOptionalField(doc.getName(), fields, doc.getDepartmentField());

        Map<String, Map<String, Object>> vocabularies = new LinkedHashMap<>();
        doc.getVocabularies().forEach((field, phrases) -> {
            Map<String, Object> lowered = new LinkedHashMap<>();
            phrases.forEach((phrase, value) -> lowered.put(phrase.toLowerCase(Locale.ROOT), value));
            vocabularies.put(field, lowered);
        });
        Map<String, Map<String, Object>> keywordFilters = new LinkedHashMap<>();
        doc.getKeywordFilters().forEach((keyword, filters) -> keywordFilters.put(keyword.toLowerCase(Locale.ROOT), filters));

        return new EntityDescriptor(
                doc.getName().toLowerCase(Locale.ROOT),
                doc.getTable(),
                idField,
                doc.getAliases(),
                fields,
                new LinkedHashSet<>(doc.getFilterable()),
                new LinkedHashSet<>(doc.getWritable()),
                doc.isSensitive(),
                doc.getOwnerField(),
                doc.getDepartmentField(),
                null,
                vocabularies,
                keywordFilters
        );
    }

    private static List<EntityDescriptor> linkOwners(List<EntityDocument> docs, List<EntityDescriptor> descriptors) {
        Map<String, EntityDescriptor> byName = new LinkedHashMap<>();
        descriptors.forEach(descriptor -> byName.put(descriptor.name(), descriptor));
        List<EntityDescriptor> linked = new ArrayList<>();
        for (int i = 0; i < docs.size(); i++) {
            EntityDocument doc = docs.get(i);
            EntityDescriptor descriptor = descriptors.get(i);
            OwnerLinkDocument link = doc.getOwnerLink();
            if (link == null) {
                linked.add(descriptor);
                continue;
            }
            if (descriptor.owner().isPresent()) {
                throw invalid(doc.getName(), "ownerField and ownerLink are mutually exclusive");
            }
            if (link.getField() == null || !descriptor.hasField(link.getField())) {
                throw invalid(doc.getName(), "owner link field '" + link.getField() + "' is not declared");
            }
            EntityDescriptor target = link.getEntity() == null ? null : byName.get(link.getEntity().toLowerCase(Locale.ROOT));
            if (target == null || target.owner().isEmpty()) {
                throw invalid(doc.getName(), "owner link target '" + link.getEntity() + "' is unknown or has no owner field");
            }
            String ownerField = target.owner().get();
            linked.add(descriptor.withOwnerLink(new OwnerLink(
                    link.getField(),
                    target.name(),
                    target.table(),
                    target.idField(),
                    ownerField,
                    target.fieldType(ownerField)
            )));
        }
        return linked;
    }

    private static void checkOptionalField(String entity, Map<String, FieldType> fields, String field) {
        if (field != null && !fields.containsKey(field)) {
            throw invalid(entity, "scope field '" + field + "' is not declared");
        }
    }

    private static CommandConsoleException invalid(String entity, String reason) {
        return new CommandConsoleException(
                CommandConsoleErrorCode.REGISTRY_LOAD_FAILED,
                "Invalid registry entry '" + entity + "': " + reason
        );
    }

    @Getter
    @Setter
    static class RegistryDocument {
        private List<EntityDocument> entities = new ArrayList<>();
    }

    @Getter
    @Setter
    static class EntityDocument {
        private String name;
        private String table;
        private String idField;
        private List<String> aliases = new ArrayList<>();
        private boolean sensitive;
        private String ownerField;
        private String departmentField;
        private OwnerLinkDocument ownerLink;
        private Map<String, String> fields = new LinkedHashMap<>();
        private List<String> filterable = new ArrayList<>();
        private List<String> writable = new ArrayList<>();
        private Map<String, Map<String, Object>> vocabularies = new LinkedHashMap<>();
        private Map<String, Map<String, Object>> keywordFilters = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    static class OwnerLinkDocument {
        private String field;
        private String entity;
    }
}
