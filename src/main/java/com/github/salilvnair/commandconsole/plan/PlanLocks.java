package com.github.salilvnair.commandconsole.plan;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed lock stripes keyed by plan id. Execution and rollback of the same plan never overlap.
 */
@Component
public class PlanLocks {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public PlanLocks() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    public Lock forPlan(String planId) {
        return locks[Math.floorMod(Objects.hashCode(planId), STRIPES)];
    }
}
