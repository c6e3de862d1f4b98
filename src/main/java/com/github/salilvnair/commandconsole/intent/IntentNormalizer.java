package com.github.salilvnair.commandconsole.intent;

public interface IntentNormalizer {

    Intent normalize(NormalizationRequest request);
}
