package com.github.salilvnair.commandconsole.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "commandconsole.audit")
@Getter
@Setter
public class CommandConsoleAuditConfig {

    private int defaultQueryLimit = 100;
    private int maxQueryLimit = 500;

    public int effectiveLimit(Integer requested) {
        int limit = requested == null || requested <= 0 ? defaultQueryLimit : requested;
        return Math.min(limit, maxQueryLimit);
    }
}
