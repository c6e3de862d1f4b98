package com.github.salilvnair.commandconsole.intent;

import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects the details an intent cannot go without, whichever strategy produced it.
 */
@UtilityClass
public final class IntentGaps {

    public static Optional<String> question(IntentType type,
                                            EntityDescriptor entity,
                                            List<FieldFilter> filters,
                                            Map<String, Object> values,
                                            Aggregation aggregation,
                                            List<String> knownEntities) {
        if (type == null) {
            return Optional.of("What would you like to do: read, create, update, delete or analyze records?");
        }
        if (entity == null) {
            return Optional.of("Which records do you mean? Known record types: " + String.join(", ", knownEntities) + ".");
        }
        if ((type == IntentType.CREATE || type == IntentType.UPDATE) && (values == null || values.isEmpty())) {
            return Optional.of("Which " + entity.name() + " fields should be set, and to what values? Writable fields: "
                    + String.join(", ", entity.writable()) + ".");
        }
        if ((type == IntentType.UPDATE || type == IntentType.DELETE) && (filters == null || filters.isEmpty())) {
            return Optional.of("Which " + entity.name() + " records should this apply to? Filterable fields: "
                    + String.join(", ", entity.filterable()) + ".");
        }
        if (aggregation != null && aggregation.function().needsField() && aggregation.field() == null) {
            return Optional.of("Which numeric " + entity.name() + " field should be aggregated?");
        }
        return Optional.empty();
    }
}
