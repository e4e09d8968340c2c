package com.hivemind.core.scheduler;

/**
 * Answer to "may this agent start this task now?".
 *
 * @param reason human-readable block reason, or {@code "ready"} when allowed
 */
public record StartCheck(boolean allowed, String reason) {

    public static StartCheck allow() {
        return new StartCheck(true, "ready");
    }

    public static StartCheck deny(String reason) {
        return new StartCheck(false, reason);
    }
}
