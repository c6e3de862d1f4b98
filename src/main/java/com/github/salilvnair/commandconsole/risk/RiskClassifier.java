package com.github.salilvnair.commandconsole.risk;

import com.github.salilvnair.commandconsole.config.CommandConsolePipelineConfig;
import com.github.salilvnair.commandconsole.intent.IntentType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * First matching rule wins:
 * <ol>
 *     <li>DELETE is HIGH</li>
 *     <li>any write on a sensitive entity is HIGH</li>
 *     <li>impact above the high-impact threshold is HIGH</li>
 *     <li>CREATE and UPDATE are MEDIUM</li>
 *     <li>READ and ANALYZE are LOW</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class RiskClassifier {

    private final CommandConsolePipelineConfig pipelineConfig;

    public RiskLevel classify(IntentType type, boolean sensitiveEntity, long impactCount) {
        if (type == IntentType.DELETE) {
            return RiskLevel.HIGH;
        }
        if (sensitiveEntity && type.isWrite()) {
            return RiskLevel.HIGH;
        }
        if (impactCount > pipelineConfig.getHighImpactThreshold()) {
            return RiskLevel.HIGH;
        }
        if (type == IntentType.CREATE || type == IntentType.UPDATE) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
