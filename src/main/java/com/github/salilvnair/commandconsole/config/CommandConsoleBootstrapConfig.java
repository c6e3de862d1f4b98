package com.github.salilvnair.commandconsole.config;

import com.github.salilvnair.commandconsole.approval.DigitCodeSecondFactorVerifier;
import com.github.salilvnair.commandconsole.approval.SecondFactorVerifier;
import com.github.salilvnair.commandconsole.intent.FallbackIntentNormalizer;
import com.github.salilvnair.commandconsole.intent.InferenceIntentNormalizer;
import com.github.salilvnair.commandconsole.intent.IntentNormalizer;
import com.github.salilvnair.commandconsole.intent.KeywordIntentNormalizer;
import com.github.salilvnair.commandconsole.registry.EntityRegistry;
import com.github.salilvnair.commandconsole.registry.EntityRegistryLoader;
import com.github.salilvnair.commandconsole.security.PermissionMatrix;
import com.github.salilvnair.commandconsole.security.PermissionMatrixLoader;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class CommandConsoleBootstrapConfig {

    @Bean
    @ConditionalOnMissingBean
    public EntityRegistry entityRegistry(CommandConsolePipelineConfig pipelineConfig, ResourceLoader resourceLoader) {
        return EntityRegistryLoader.load(resourceLoader.getResource(pipelineConfig.getRegistryLocation()));
    }

    @Bean
    @ConditionalOnMissingBean
    public PermissionMatrix permissionMatrix(CommandConsolePipelineConfig pipelineConfig,
                                             ResourceLoader resourceLoader,
                                             EntityRegistry entityRegistry) {
        return PermissionMatrixLoader.load(resourceLoader.getResource(pipelineConfig.getPermissionMatrixLocation()), entityRegistry);
    }

    @Bean
    @Primary
    public IntentNormalizer intentNormalizer(InferenceIntentNormalizer inferenceIntentNormalizer,
                                             KeywordIntentNormalizer keywordIntentNormalizer) {
        return new FallbackIntentNormalizer(inferenceIntentNormalizer, keywordIntentNormalizer);
    }

    @Bean
    @ConditionalOnMissingBean
    public SecondFactorVerifier secondFactorVerifier() {
        return new DigitCodeSecondFactorVerifier();
    }
}
