package com.trading.retention.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around the SLF4J MDC for retention work.
 * Keys added through this context are removed again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCleanupOperation(operationId, "trades")) {
 *     log.info("cleanup.completed deleted={}", deleted);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one scheduler or manual cleanup cycle.
     *
     * @param cycleId identifier of the cycle
     * @param trigger what started the cycle, e.g. {@code "schedule"} or {@code "manual"}
     */
    public static LogContext forCleanupCycle(String cycleId, String trigger) {
        LogContext ctx = new LogContext();
        ctx.put("cycleId", cycleId);
        ctx.put("trigger", trigger);
        ctx.put("operation", "cleanup-cycle");
        return ctx;
    }

    /**
     * Context for the cleanup of a single data type.
     */
    public static LogContext forCleanupOperation(String operationId, String dataType) {
        LogContext ctx = new LogContext();
        ctx.put("operationId", operationId);
        ctx.put("dataType", dataType);
        ctx.put("operation", "cleanup");
        return ctx;
    }

    /**
     * Context for a storage snapshot.
     */
    public static LogContext forSnapshot(String snapshotId) {
        LogContext ctx = new LogContext();
        ctx.put("snapshotId", snapshotId);
        ctx.put("operation", "snapshot");
        return ctx;
    }

    public static String generateId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds a further key to this context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
