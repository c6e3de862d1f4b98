package com.github.salilvnair.commandconsole.execution;

import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.intent.FieldFilter;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rows of a plan an approver signed off on. No approved ids means every previewed row;
 * rejected ids are always left out.
 */
public record RowScope(List<Long> approvedIds, List<Long> rejectedIds) {

    private static final RowScope WHOLE_PLAN = new RowScope(List.of(), List.of());

    public RowScope {
        approvedIds = distinct(approvedIds);
        rejectedIds = distinct(rejectedIds);
        for (Long id : approvedIds) {
            if (rejectedIds.contains(id)) {
                throw new CommandConsoleException(
                        CommandConsoleErrorCode.APPROVAL_SCOPE_INVALID,
                        "Row " + id + " is both approved and rejected"
                );
            }
        }
    }

    public static RowScope wholePlan() {
        return WHOLE_PLAN;
    }

    public static RowScope of(Collection<Long> approvedIds, Collection<Long> rejectedIds) {
        return new RowScope(
                approvedIds == null ? List.of() : new ArrayList<>(approvedIds),
                rejectedIds == null ? List.of() : new ArrayList<>(rejectedIds)
        );
    }

    public boolean isPartial() {
        return !approvedIds.isEmpty() || !rejectedIds.isEmpty();
    }

    /** Plan filters, narrowed to the approved ids when there are any. */
    List<FieldFilter> restrict(EntityDescriptor entity, List<FieldFilter> filters) {
        if (approvedIds.isEmpty()) {
            return filters;
        }
        List<FieldFilter> narrowed = new ArrayList<>(filters);
        narrowed.add(FieldFilter.in(entity.idField(), approvedIds));
        return narrowed;
    }

    /** Rows {@link #restrict} must match for the plan to still be what was approved. */
    long expectedRows(long previewed) {
        return approvedIds.isEmpty() ? previewed : approvedIds.size();
    }

    List<Map<String, Object>> withoutRejected(EntityDescriptor entity, List<Map<String, Object>> rows) {
        if (rejectedIds.isEmpty()) {
            return rows;
        }
        Set<String> rejected = new LinkedHashSet<>();
        rejectedIds.forEach(id -> rejected.add(String.valueOf(id)));
        return rows.stream()
                .filter(row -> !rejected.contains(String.valueOf(row.get(entity.idField()))))
                .toList();
    }

    private static List<Long> distinct(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Set<Long> unique = new LinkedHashSet<>();
        for (Long id : ids) {
            if (id == null) {
                throw new CommandConsoleException(CommandConsoleErrorCode.APPROVAL_SCOPE_INVALID, "Row ids cannot be empty");
            }
            unique.add(id);
        }
        return List.copyOf(unique);
    }
}
