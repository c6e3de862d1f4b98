package com.github.salilvnair.commandconsole.data;

import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.intent.FieldFilter;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import com.github.salilvnair.commandconsole.registry.FieldType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcEntityRepository implements EntityRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public long count(EntityDescriptor entity, List<FieldFilter> filters) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = "SELECT COUNT(*) FROM " + table(entity) + SqlFilterTranslator.where(entity, filters, params);
        Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public List<Map<String, Object>> select(EntityDescriptor entity, List<FieldFilter> filters, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(", ", columns(entity)))
                .append(" FROM ")
                .append(table(entity))
                .append(SqlFilterTranslator.where(entity, filters, params))
                .append(" ORDER BY ")
                .append(SqlFilterTranslator.column(entity, entity.idField()));
        if (limit > 0) {
            sql.append(" FETCH FIRST ").append(limit).append(" ROWS ONLY");
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : jdbcTemplate.queryForList(sql.toString(), params)) {
            rows.add(normalizeRow(entity, row));
        }
        return rows;
    }

    @Override
    public Map<String, Object> insert(EntityDescriptor entity, Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            throw new CommandConsoleException(CommandConsoleErrorCode.INVALID_FILTER, "No values to insert into " + entity.name());
        }
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> columns = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        values.forEach((field, value) -> {
            columns.add(SqlFilterTranslator.column(entity, field));
            placeholders.add(":" + field);
            params.addValue(field, entity.fieldType(field).coerce(field, value));
        });
        String sql = "INSERT INTO " + table(entity) + " (" + String.join(", ", columns) + ") VALUES (" + String.join(", ", placeholders) + ")";

        String idField = entity.idField();
        Object id = values.get(idField);
        if (id != null) {
            jdbcTemplate.update(sql, params);
        }
        else {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(sql, params, keyHolder, new String[]{SqlFilterTranslator.column(entity, idField)});
            id = generatedId(keyHolder, idField);
        }
        List<Map<String, Object>> inserted = select(entity, List.of(FieldFilter.eq(idField, id)), 1);
        if (inserted.isEmpty()) {
            throw new CommandConsoleException(CommandConsoleErrorCode.EXECUTION_FAILED, "Inserted " + entity.name() + " row could not be read back");
        }
        log.debug("Inserted {} id={}", entity.name(), id);
        return inserted.get(0);
    }

    @Override
    public List<Map<String, Object>> update(EntityDescriptor entity, List<FieldFilter> filters, Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            throw new CommandConsoleException(CommandConsoleErrorCode.INVALID_FILTER, "No values to update on " + entity.name());
        }
        List<Map<String, Object>> targets = select(entity, filters);
        if (targets.isEmpty()) {
            return targets;
        }
        List<Object> ids = ids(entity, targets);
        List<FieldFilter> byId = List.of(FieldFilter.in(entity.idField(), ids));

        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> assignments = new ArrayList<>();
        values.forEach((field, value) -> {
            String param = "v_" + field;
            assignments.add(SqlFilterTranslator.column(entity, field) + " = :" + param);
            params.addValue(param, entity.fieldType(field).coerce(field, value));
        });
        String sql = "UPDATE " + table(entity) + " SET " + String.join(", ", assignments)
                + SqlFilterTranslator.where(entity, byId, params);
        int updated = jdbcTemplate.update(sql, params);
        log.debug("Updated {} rows={}", entity.name(), updated);
        return select(entity, byId);
    }

    @Override
    public List<Map<String, Object>> delete(EntityDescriptor entity, List<FieldFilter> filters) {
        List<Map<String, Object>> targets = select(entity, filters);
        if (targets.isEmpty()) {
            return targets;
        }
        MapSqlParameterSource params = new MapSqlParameterSource();
        String sql = "DELETE FROM " + table(entity)
                + SqlFilterTranslator.where(entity, List.of(FieldFilter.in(entity.idField(), ids(entity, targets))), params);
        int deleted = jdbcTemplate.update(sql, params);
        log.debug("Deleted {} rows={}", entity.name(), deleted);
        return targets;
    }

    private static String table(EntityDescriptor entity) {
        return SqlFilterTranslator.identifier(entity.table());
    }

    private static List<String> columns(EntityDescriptor entity) {
        List<String> columns = new ArrayList<>();
        for (String field : entity.fields().keySet()) {
            columns.add(SqlFilterTranslator.identifier(field));
        }
        return columns;
    }

    private static List<Object> ids(EntityDescriptor entity, List<Map<String, Object>> rows) {
        List<Object> ids = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            ids.add(row.get(entity.idField()));
        }
        return ids;
    }

    private static Map<String, Object> normalizeRow(EntityDescriptor entity, Map<String, Object> row) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        row.forEach((column, value) -> {
            String field = column.toLowerCase(Locale.ROOT);
            FieldType type = entity.fields().get(field);
            normalized.put(field, type == null ? value : type.normalize(value));
        });
        return normalized;
    }

    private static Object generatedId(KeyHolder keyHolder, String idField) {
        for (Map<String, Object> keys : keyHolder.getKeyList()) {
            for (Map.Entry<String, Object> entry : keys.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(idField)) {
                    return entry.getValue();
                }
            }
        }
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new CommandConsoleException(CommandConsoleErrorCode.EXECUTION_FAILED, "Data store did not return a generated id");
        }
        return key;
    }
}
