package com.github.salilvnair.commandconsole.registry;

/**
 * Ownership reached through a foreign key: rows of the entity belong to whoever owns the
 * {@code targetEntity} row that {@code field} points at.
 *
 * @param keyField   column of {@code targetTable} referenced by {@code field}
 * @param ownerField owner column of {@code targetTable}
 */
public record OwnerLink(String field,
                        String targetEntity,
                        String targetTable,
                        String keyField,
                        String ownerField,
                        FieldType ownerType) {
}
