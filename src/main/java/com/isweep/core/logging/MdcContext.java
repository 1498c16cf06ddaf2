package com.isweep.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing ISweep-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setUser(long userId) {
        MDC.put("userId", String.valueOf(userId));
    }

    public static void setRequest(long userId, String mode) {
        MDC.put("userId", String.valueOf(userId));
        MDC.put("decisionMode", mode);
    }

    public static void clear() {
        MDC.remove("userId");
        MDC.remove("decisionMode");
    }
}
