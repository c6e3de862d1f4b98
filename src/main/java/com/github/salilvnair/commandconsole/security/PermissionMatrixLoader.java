package com.github.salilvnair.commandconsole.security;

import com.github.salilvnair.commandconsole.exception.CommandConsoleErrorCode;
import com.github.salilvnair.commandconsole.exception.CommandConsoleException;
import com.github.salilvnair.commandconsole.intent.IntentType;
import com.github.salilvnair.commandconsole.registry.EntityRegistry;
import com.github.salilvnair.commandconsole.util.JsonUtil;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Slf4j
public final class PermissionMatrixLoader {

    private PermissionMatrixLoader() {
    }

    public static PermissionMatrix load(Resource resource, EntityRegistry registry) {
        try (InputStream in = resource.getInputStream()) {
            MatrixDocument document = JsonUtil.mapper().readValue(in, MatrixDocument.class);
            Map<String, PermissionMatrix.RolePolicy> roles = new LinkedHashMap<>();
            document.getRoles().forEach((role, policy) ->
                    roles.put(role.toLowerCase(Locale.ROOT), toPolicy(role, policy, registry)));
            log.info("Loaded permission matrix from {} roles={}", resource.getDescription(), roles.keySet());
            return new PermissionMatrix(roles);
        }
        catch (IOException e) {
            throw new CommandConsoleException(
                    CommandConsoleErrorCode.REGISTRY_LOAD_FAILED,
                    "Unable to read permission matrix " + resource.getDescription(),
                    e
            );
        }
    }

    private static PermissionMatrix.RolePolicy toPolicy(String role, RoleDocument doc, EntityRegistry registry) {
        Map<IntentType, Set<String>> permissions = new EnumMap<>(IntentType.class);
        doc.getPermissions().forEach((typeName, entities) -> {
            IntentType type = IntentType.parse(typeName).orElseThrow(() -> new CommandConsoleException(
                    CommandConsoleErrorCode.REGISTRY_LOAD_FAILED,
                    "Unknown intent type '" + typeName + "' for role '" + role + "'"
            ));
            Set<String> resolved = new LinkedHashSet<>();
            for (String entity : entities) {
                resolved.add(PermissionMatrix.ANY_ENTITY.equals(entity) ? entity : registry.require(entity).name());
            }
            permissions.put(type, resolved);
        });
        ScopeRule scope = doc.getScope() == null ? ScopeRule.NONE : ScopeRule.valueOf(doc.getScope().toUpperCase(Locale.ROOT));
        return new PermissionMatrix.RolePolicy(scope, permissions);
    }

    @Getter
    @Setter
    static class MatrixDocument {
        private Map<String, RoleDocument> roles = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    static class RoleDocument {
        private String scope;
        private Map<String, List<String>> permissions = new LinkedHashMap<>();
    }
}
