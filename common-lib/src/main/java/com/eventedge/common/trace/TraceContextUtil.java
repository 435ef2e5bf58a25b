package com.eventedge.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Per-attempt trace ids for gateway dispatches.
 *
 * <p>Every {@code /cap} call gets its own trace id, distinct from the caller's
 * {@code request_id}. The id travels in the Reactor Context of the dispatch pipeline,
 * is echoed to the caller in {@code meta.trace_id} and is stored on the audit row, so
 * one attempt can be followed across logs, response and audit table.
 *
 * <p>MDC is written only while a single log statement runs. Reactor operators hop
 * threads, so a ThreadLocal left populated would leak into unrelated requests.
 *
 * <p>Typical wiring:
 * <pre>
 *     String traceId = TraceContextUtil.newTraceId();
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 * and, from a {@code doOnEach} consumer:
 * <pre>
 *     signal -> TraceContextUtil.getTraceId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    static final String UNKNOWN_TRACE_ID = "unknown";

    private TraceContextUtil() {}

    /**
     * Generates a trace id for one dispatch attempt.
     *
     * @return a random UUID rendered as 32 lowercase hex characters, without dashes
     */
    public static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Attaches {@code traceId} to the Reactor Context of {@code mono}.
     *
     * <p>The context is visible to every operator assembled before this call, so wrap
     * the fully assembled dispatch pipeline rather than an inner stage.
     *
     * @param mono    the dispatch pipeline
     * @param traceId the id returned by {@link #newTraceId()}
     * @param <T>     pipeline element type
     * @return {@code mono} with the trace id in its context
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * Reads the trace id attached by {@link #withTraceId(Mono, String)}.
     *
     * @param ctx context of the current signal, e.g. {@code signal.getContextView()}
     * @return the trace id, or {@code "unknown"} outside a traced pipeline; never {@code null}
     */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN_TRACE_ID);
    }

    /**
     * Runs {@code logAction} with {@code traceId} in the MDC and clears the entry afterwards,
     * even when the action throws.
     *
     * @param traceId   value for the {@value #TRACE_ID_KEY} MDC key
     * @param logAction the logging call; must not block or subscribe to anything
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
