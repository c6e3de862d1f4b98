package com.github.salilvnair.commandconsole.preview;

/**
 * One field change. {@code rowId} is null for a row that does not exist yet.
 */
public record ProposedChange(Object rowId, String field, Object oldValue, Object newValue) {
}
