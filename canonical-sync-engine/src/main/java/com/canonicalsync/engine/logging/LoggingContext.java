package com.canonicalsync.engine.logging;

import com.canonicalsync.core.model.SyncJob;
import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Ensures sync logs carry tenant, environment and job identifiers.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forJob(job)) {
 *     log.info("Processing batch"); // includes tenantId, environmentId, jobId, jobKind
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String TENANT_ID = "tenantId";
    public static final String ENVIRONMENT_ID = "environmentId";
    public static final String JOB_ID = "jobId";
    public static final String JOB_KIND = "jobKind";
    public static final String PAIR = "environmentPair";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for one sync job.
     */
    public static LoggingContext forJob(SyncJob job) {
        LoggingContext ctx = forEnvironment(job.tenantId(), job.environmentId());
        MDC.put(JOB_ID, job.jobId().toString());
        MDC.put(JOB_KIND, job.jobKind().name());
        return ctx;
    }

    /**
     * Create a logging context for environment-level operations.
     */
    public static LoggingContext forEnvironment(String tenantId, String environmentId) {
        LoggingContext ctx = new LoggingContext();
        if (tenantId != null) {
            MDC.put(TENANT_ID, tenantId);
        }
        if (environmentId != null) {
            MDC.put(ENVIRONMENT_ID, environmentId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for reconciling an ordered environment pair.
     */
    public static LoggingContext forPair(String tenantId, String sourceEnvironmentId, String targetEnvironmentId) {
        LoggingContext ctx = new LoggingContext();
        if (tenantId != null) {
            MDC.put(TENANT_ID, tenantId);
        }
        MDC.put(PAIR, sourceEnvironmentId + "->" + targetEnvironmentId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(TENANT_ID);
        MDC.remove(ENVIRONMENT_ID);
        MDC.remove(JOB_ID);
        MDC.remove(JOB_KIND);
        MDC.remove(PAIR);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a scheduler tick or worker task.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
