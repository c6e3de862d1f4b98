package com.github.salilvnair.commandconsole.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "commandconsole.pipeline")
@Getter
@Setter
public class CommandConsolePipelineConfig {

    /** Intents below this confidence are sent back for clarification. */
    private double confidenceThreshold = 0.75;

    /** Impact counts strictly greater than this are HIGH risk. */
    private long highImpactThreshold = 50;

    private int maxPreviewRows = 50;
    private Set<String> seniorRoles = new LinkedHashSet<>(Set.of("admin"));
    private boolean requireSecondFactorForHighRisk = false;
    private String registryLocation = "classpath:commandconsole/entity-registry.json";
    private String permissionMatrixLocation = "classpath:commandconsole/permission-matrix.json";

    public boolean isSenior(String role) {
        return role != null && seniorRoles.stream().anyMatch(r -> r.toLowerCase(Locale.ROOT).equals(role));
    }
}
