package com.salary.equity.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forAnalysis(runId)) {
 *     log.info("analysis.started runId={} employees={}", runId, size);
 * }
 * </pre>
 *
 * <p>MDC is thread-local; work handed to an executor opens its own context.</p>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String OPERATION = "operation";
    public static final String MANAGER_ID = "managerId";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a full analysis run.
     */
    public static LogContext forAnalysis(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(OPERATION, "analyze");
        return ctx;
    }

    /**
     * Creates a log context for one manager's allocation pass.
     * A null runId is left out.
     */
    public static LogContext forManager(String runId, String managerId) {
        LogContext ctx = new LogContext();
        if (runId != null) {
            ctx.put(RUN_ID, runId);
        }
        ctx.put(MANAGER_ID, managerId);
        ctx.put(OPERATION, "allocate");
        return ctx;
    }

    /**
     * Creates a log context for reading a population.
     */
    public static LogContext forPopulationLoad(String sourceName) {
        LogContext ctx = new LogContext();
        ctx.put("source", sourceName);
        ctx.put(OPERATION, "load");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Run id of the context active on the calling thread, or null.
     */
    public static String currentRunId() {
        return MDC.get(RUN_ID);
    }

    /**
     * Adds an additional key-value pair to this log context.
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
