package com.boarddb.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing boarddb-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setCommand(String command) {
        MDC.put("command", command);
    }

    public static void setWorker(int workerIndex) {
        MDC.put("worker", String.valueOf(workerIndex));
    }

    public static void setFragment(String fragment) {
        MDC.put("fragment", fragment);
    }

    public static void clearFragment() {
        MDC.remove("fragment");
    }

    public static void clear() {
        MDC.remove("command");
        MDC.remove("worker");
        MDC.remove("fragment");
    }
}
