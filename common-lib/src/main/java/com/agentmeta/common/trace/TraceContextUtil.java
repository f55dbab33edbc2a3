package com.agentmeta.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Per-iteration tracing for the evaluation cycles.
 *
 * <p>The Reactor Context is the single source of truth for the trace id and the
 * cycle name inside a reactive pipeline. MDC is written only for the duration of
 * a log statement, never kept as a ThreadLocal between operators.
 *
 * <pre>
 *     TraceContextUtil.withTrace(iteration, "ranking", TraceContextUtil.newTraceId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String CYCLE_KEY    = "cycle";

    private static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores the trace id and cycle name in the Reactor Context of {@code mono}.
     * {@code contextWrite} propagates upstream, so call this last when assembling.
     */
    public static <T> Mono<T> withTrace(Mono<T> mono, String cycle, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId).put(CYCLE_KEY, cycle));
    }

    /** @return the trace id, or {@code "unknown"}; never {@code null} */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /** @return the cycle name, or {@code "unknown"}; never {@code null} */
    public static String getCycle(ContextView ctx) {
        return ctx.getOrDefault(CYCLE_KEY, UNKNOWN);
    }

    /**
     * Bridges the trace id and cycle into MDC for the duration of {@code logAction},
     * then removes both entries.
     */
    public static void withMdc(String traceId, String cycle, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        MDC.put(CYCLE_KEY, cycle);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
            MDC.remove(CYCLE_KEY);
        }
    }

    /** Same as {@link #withMdc(String, String, Runnable)} reading both values from the context. */
    public static void withMdc(ContextView ctx, Runnable logAction) {
        withMdc(getTraceId(ctx), getCycle(ctx), logAction);
    }
}
