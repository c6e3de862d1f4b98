package com.github.salilvnair.commandconsole.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "commandconsole.inference")
@Getter
@Setter
public class CommandConsoleInferenceConfig {

    private boolean enabled = true;
    private long timeoutMs = 8000;
    private int workerThreads = 2;
    private int queueCapacity = 64;
    private String promptLocation = "classpath:commandconsole/prompts/intent-prompt.txt";
}
