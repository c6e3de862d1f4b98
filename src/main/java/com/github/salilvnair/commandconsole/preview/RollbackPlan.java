package com.github.salilvnair.commandconsole.preview;

public record RollbackPlan(boolean supportsRollback, String strategy, String note) {

    public static final String BEFORE_STATE_SNAPSHOT = "before_state_snapshot";

    public static RollbackPlan snapshot(String note) {
        return new RollbackPlan(true, BEFORE_STATE_SNAPSHOT, note);
    }

    public static RollbackPlan none() {
        return new RollbackPlan(false, null, "Read-only operation, nothing to roll back");
    }
}
