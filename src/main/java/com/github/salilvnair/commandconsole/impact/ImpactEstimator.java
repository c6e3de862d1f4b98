package com.github.salilvnair.commandconsole.impact;

import com.github.salilvnair.commandconsole.data.EntityRepository;
import com.github.salilvnair.commandconsole.intent.Intent;
import com.github.salilvnair.commandconsole.intent.IntentType;
import com.github.salilvnair.commandconsole.registry.EntityDescriptor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Read-only blast radius of an intent. CREATE always touches exactly the row it inserts.
 */
@Component
@RequiredArgsConstructor
public class ImpactEstimator {

    public static final long CREATE_IMPACT = 1L;

    private final EntityRepository entityRepository;

    public long estimate(EntityDescriptor entity, Intent intent) {
        if (intent.type() == IntentType.CREATE) {
            return CREATE_IMPACT;
        }
        return entityRepository.count(entity, intent.filters());
    }
}
