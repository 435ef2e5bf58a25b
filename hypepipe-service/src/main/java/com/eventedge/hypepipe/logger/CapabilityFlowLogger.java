package com.eventedge.hypepipe.logger;

import com.eventedge.common.trace.TraceContextUtil;
import com.eventedge.hypepipe.audit.AuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Observability component for the lifecycle of one capability request.
 *
 * <p>Pure side effects: nothing here changes gateway behaviour.
 *
 * <p>Stages (in order):
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: body shape validated</li>
 *   <li>{@link #AUTHENTICATED}: bearer token verified against the agent header</li>
 *   <li>{@link #AUTHORIZED}: required scope present</li>
 *   <li>{@link #CACHE_HIT}: fresh result served without invoking the handler</li>
 *   <li>{@link #HANDLER_INVOKED}: handler returned a result</li>
 *   <li>{@link #DECISION_RECORDED}: audit record appended</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(CapabilityFlowLogger.AUTHENTICATED))
 * </pre>
 */
@Component
public class CapabilityFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(CapabilityFlowLogger.class);

    public static final String REQUEST_RECEIVED  = "REQUEST_RECEIVED";
    public static final String AUTHENTICATED     = "AUTHENTICATED";
    public static final String AUTHORIZED        = "AUTHORIZED";
    public static final String CACHE_HIT         = "CACHE_HIT";
    public static final String HANDLER_INVOKED   = "HANDLER_INVOKED";
    public static final String DECISION_RECORDED = "DECISION_RECORDED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * The traceId is read from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[CapabilityFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[CapabilityFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /**
     * One compact line per request, emitted after the audit append settles.
     */
    public void logDecision(AuditRecord record) {
        TraceContextUtil.withMdc(record.traceId(), () ->
            log.info("[CapabilityFlow] stage={} cap={} agent={} decision={} denyReason={} "
                     + "latencyMs={} cacheHit={} traceId={}",
                     DECISION_RECORDED,
                     record.cap(), record.agentId(), record.decision().wire(),
                     record.denyReason() != null ? record.denyReason() : "-",
                     record.latencyMs(), record.cacheHit(), record.traceId())
        );
    }
}
