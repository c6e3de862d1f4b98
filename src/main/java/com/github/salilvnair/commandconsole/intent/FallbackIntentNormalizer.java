package com.github.salilvnair.commandconsole.intent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs {@code primary} and switches to {@code fallback} when it fails or yields nothing.
 */
@Slf4j
@RequiredArgsConstructor
public class FallbackIntentNormalizer implements IntentNormalizer {

    private final IntentNormalizer primary;
    private final IntentNormalizer fallback;

    @Override
    public Intent normalize(NormalizationRequest request) {
        Intent intent;
        try {
            intent = primary.normalize(request);
        }
        catch (RuntimeException e) {
            log.info("Primary intent normalizer failed, using fallback. primary={} reason={}",
                    primary.getClass().getSimpleName(), e.getMessage());
            return fallback.normalize(request);
        }
        if (intent == null) {
            log.info("Primary intent normalizer returned no intent, using fallback. primary={}", primary.getClass().getSimpleName());
            return fallback.normalize(request);
        }
        return intent;
    }
}
