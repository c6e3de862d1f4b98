package com.github.salilvnair.commandconsole.data;

import com.github.salilvnair.commandconsole.intent.FieldFilter;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Generic row store for registered entities. Calls join the caller's transaction when one is active.
 * Rows are maps keyed by lower-case field name.
 */
public interface EntityRepository {

    long count(EntityDescriptor entity, List<FieldFilter> filters);

    /**
     * @param limit maximum rows, or {@code 0} for all matching rows
     */
    List<Map<String, Object>> select(EntityDescriptor entity, List<FieldFilter> filters, int limit);

    default List<Map<String, Object>> select(EntityDescriptor entity, List<FieldFilter> filters) {
        return select(entity, filters, 0);
    }

    /**
     * Inserts one row. An id in {@code values} is written as given, otherwise the store generates one.
     */
    Map<String, Object> insert(EntityDescriptor entity, Map<String, Object> values);

    /** @return the matching rows after the update */
    List<Map<String, Object>> update(EntityDescriptor entity, List<FieldFilter> filters, Map<String, Object> values);

    /** @return the rows as they were before deletion */
    List<Map<String, Object>> delete(EntityDescriptor entity, List<FieldFilter> filters);
}
