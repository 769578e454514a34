package com.agentkernel.scheduler.guard;

/**
 * Verdict of one guard for one scheduling slot.
 */
public record GuardResult(boolean proceed, String guard, String reason) {

    private static final GuardResult PASS = new GuardResult(true, null, null);

    public static GuardResult pass() {
        return PASS;
    }

    public static GuardResult block(String guard, String reason) {
        return new GuardResult(false, guard, reason);
    }

    public boolean blocked() {
        return !proceed;
    }
}
