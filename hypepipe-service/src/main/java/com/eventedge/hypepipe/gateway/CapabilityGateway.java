package com.eventedge.hypepipe.gateway;

import com.eventedge.common.trace.TraceContextUtil;
import com.eventedge.hypepipe.audit.AuditDecision;
import com.eventedge.hypepipe.audit.AuditRecord;
import com.eventedge.hypepipe.audit.AuditSink;
import com.eventedge.hypepipe.auth.AuthClaims;
import com.eventedge.hypepipe.auth.AuthConfigurationException;
import com.eventedge.hypepipe.auth.AuthDeniedException;
import com.eventedge.hypepipe.auth.DenyReason;
import com.eventedge.hypepipe.auth.TokenVerifier;
import com.eventedge.hypepipe.cache.CacheEntry;
import com.eventedge.hypepipe.cache.CacheKeys;
import com.eventedge.hypepipe.cache.FreshnessPolicy;
import com.eventedge.hypepipe.cache.ResultCache;
import com.eventedge.hypepipe.capability.CapabilityHandler;
import com.eventedge.hypepipe.capability.CapabilityRegistry;
import com.eventedge.hypepipe.capability.CapabilityResult;
import com.eventedge.hypepipe.dto.CapContext;
import com.eventedge.hypepipe.dto.CapEnvelope;
import com.eventedge.hypepipe.dto.CapMeta;
import com.eventedge.hypepipe.dto.CapRequest;
import com.eventedge.hypepipe.logger.CapabilityFlowLogger;
import com.eventedge.hypepipe.policy.ScopePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Dispatch orchestrator for {@code POST /api/v1/hypepipe/cap}.
 *
 * <p>Steps run strictly in order and stop at the first failure:
 * <ol>
 *   <li>validate shape: blank {@code request_id} or {@code cap} → 400, not audited</li>
 *   <li>authenticate → 401 (or 500 when the signing secret is unusable)</li>
 *   <li>authorize scope → 403</li>
 *   <li>resolve capability → 400 listing the known capabilities</li>
 *   <li>cache lookup, when the capability is cacheable and the cache is enabled</li>
 *   <li>invoke the handler on a miss → 500 on fault; store the result when cacheable</li>
 *   <li>respond 200</li>
 * </ol>
 *
 * <p>Every path past step 1 appends exactly one audit record before the response is
 * emitted. Audit failures never change the response.
 */
@Service
public class CapabilityGateway {

    private static final Logger log = LoggerFactory.getLogger(CapabilityGateway.class);

    static final String UNKNOWN_AGENT = "unknown";
    static final String INTERNAL_ERROR = "internal_error";
    static final String INTERNAL_ERROR_DETAIL = "internal capability error";
    static final String SERVER_MISCONFIGURED = "server_misconfigured";
    static final String SERVER_MISCONFIGURED_DETAIL = "Server auth configuration error";
    static final String BAD_REQUEST_ERROR = "bad_request";
    static final String UNREADABLE_BODY_DETAIL = "request body is not a valid capability request";

    private final TokenVerifier tokenVerifier;
    private final ScopePolicy scopePolicy;
    private final CapabilityRegistry registry;
    private final ResultCache resultCache;
    private final AuditSink auditSink;
    private final CapabilityFlowLogger flowLogger;
    private final Clock clock;
    private final LongSupplier nanoClock;
    private final boolean cacheDisabled;

    @Autowired
    public CapabilityGateway(TokenVerifier tokenVerifier,
                             ScopePolicy scopePolicy,
                             CapabilityRegistry registry,
                             ResultCache resultCache,
                             AuditSink auditSink,
                             CapabilityFlowLogger flowLogger,
                             Clock clock,
                             @Value("${hypepipe.cache.disabled:false}") boolean cacheDisabled) {
        this(tokenVerifier, scopePolicy, registry, resultCache, auditSink, flowLogger,
             clock, System::nanoTime, cacheDisabled);
    }

    CapabilityGateway(TokenVerifier tokenVerifier,
                      ScopePolicy scopePolicy,
                      CapabilityRegistry registry,
                      ResultCache resultCache,
                      AuditSink auditSink,
                      CapabilityFlowLogger flowLogger,
                      Clock clock,
                      LongSupplier nanoClock,
                      boolean cacheDisabled) {
        this.tokenVerifier = tokenVerifier;
        this.scopePolicy   = scopePolicy;
        this.registry      = registry;
        this.resultCache   = resultCache;
        this.auditSink     = auditSink;
        this.flowLogger    = flowLogger;
        this.clock         = clock;
        this.nanoClock     = nanoClock;
        this.cacheDisabled = cacheDisabled;
        if (cacheDisabled) {
            log.warn("Result cache disabled by configuration; every call invokes its handler");
        }
    }

    public Mono<GatewayResponse> dispatch(CapRequest request, String agentIdHeader, String authorization) {
        long startedNanos = nanoClock.getAsLong();
        String traceId = TraceContextUtil.newTraceId();
        String cap = request != null ? request.cap() : null;

        if (request == null || isBlank(request.requestId())) {
            log.info("Capability call rejected: request_id required. cap={} traceId={}", cap, traceId);
            return Mono.just(badRequest(cap, traceId, "request_id required"));
        }
        if (isBlank(cap)) {
            log.info("Capability call rejected: cap required. requestId={} traceId={}", request.requestId(), traceId);
            return Mono.just(badRequest(cap, traceId, "cap required"));
        }

        Call call = new Call(request, traceId, startedNanos, isBlank(agentIdHeader) ? UNKNOWN_AGENT : agentIdHeader);
        flowLogger.logWithTraceId(CapabilityFlowLogger.REQUEST_RECEIVED, traceId);

        Mono<GatewayResponse> pipeline = authenticate(call, agentIdHeader, authorization)
            .flatMap(auth -> auth.claims() != null ? authorize(call, auth.claims()) : Mono.just(auth.denial()))
            .onErrorResume(e -> {
                log.error("Dispatch failed unexpectedly. cap={} traceId={}", cap, traceId, e);
                return Mono.just(internalError(call, call.headerAgent(), null));
            })
            .flatMap(terminal -> recordAndRespond(call, terminal));

        return TraceContextUtil.withTraceId(pipeline, traceId);
    }

    /**
     * Response for a {@code /cap} body that could not be decoded at all. Like the other
     * shape failures it is not audited: there is no capability or request id to record.
     *
     * @param reason decoder message, logged only
     */
    public GatewayResponse rejectUnreadable(String reason) {
        String traceId = TraceContextUtil.newTraceId();
        log.info("Capability call rejected: unreadable body. reason={} traceId={}", reason, traceId);
        return badRequest(null, traceId, UNREADABLE_BODY_DETAIL);
    }

    // ── Authentication ──────────────────────────────────────────────────────

    private Mono<AuthOutcome> authenticate(Call call, String agentIdHeader, String authorization) {
        return Mono.fromCallable(() -> {
                AuthClaims claims = tokenVerifier.verify(agentIdHeader, authorization);
                reconcileContextAgent(call.request().ctx(), claims);
                return claims;
            })
            // secret resolution may read the fallback file
            .subscribeOn(Schedulers.boundedElastic())
            .doOnEach(flowLogger.stage(CapabilityFlowLogger.AUTHENTICATED))
            .map(AuthOutcome::granted)
            .onErrorResume(AuthDeniedException.class, e -> {
                log.info("Authentication denied. reason={} agent={} cap={} traceId={}",
                         e.getReason().code(), call.headerAgent(), call.cap(), call.traceId());
                return Mono.just(AuthOutcome.denied(unauthorized(call, e)));
            })
            .onErrorResume(AuthConfigurationException.class, e -> {
                log.error("Signing secret unusable; no caller can authenticate. cap={} traceId={}",
                          call.cap(), call.traceId(), e);
                return Mono.just(AuthOutcome.denied(misconfigured(call)));
            });
    }

    private static void reconcileContextAgent(CapContext ctx, AuthClaims claims) {
        if (ctx == null || isBlank(ctx.agentId())) {
            return;
        }
        if (!ctx.agentId().equals(claims.agentId())) {
            throw new AuthDeniedException(DenyReason.AGENT_MISMATCH,
                "ctx.agent_id does not match token agent_id");
        }
    }

    // ── Authorization, resolution, cache, handler ───────────────────────────

    private Mono<Terminal> authorize(Call call, AuthClaims claims) {
        Optional<String> missingScope = scopePolicy.missingScope(claims, call.cap());
        if (missingScope.isPresent()) {
            log.info("Scope denied. agent={} cap={} requiredScope={} traceId={}",
                     claims.agentId(), call.cap(), missingScope.get(), call.traceId());
            return Mono.just(scopeDenied(call, claims, missingScope.get()));
        }
        flowLogger.logWithTraceId(CapabilityFlowLogger.AUTHORIZED, call.traceId());

        Optional<CapabilityHandler> handler = registry.resolve(call.cap());
        if (handler.isEmpty()) {
            log.info("Unknown capability requested. agent={} cap={} traceId={}",
                     claims.agentId(), call.cap(), call.traceId());
            return Mono.just(unknownCapability(call, claims));
        }
        return execute(call, claims, handler.get());
    }

    private Mono<Terminal> execute(Call call, AuthClaims claims, CapabilityHandler handler) {
        int ttlSeconds = handler.defaultTtlSeconds();
        if (cacheDisabled || ttlSeconds <= 0) {
            return invoke(call, claims, handler, null);
        }

        long maxAgeSeconds = FreshnessPolicy.effectiveMaxAgeSeconds(freshnessOverride(call.request()), ttlSeconds);
        String cacheKey = CacheKeys.of(call.cap(), call.request().input());
        Optional<CacheEntry> cached = resultCache.get(cacheKey, Duration.ofSeconds(maxAgeSeconds));
        if (cached.isPresent()) {
            flowLogger.logWithTraceId(CapabilityFlowLogger.CACHE_HIT, call.traceId());
            CacheEntry entry = cached.get();
            return Mono.just(success(call, claims, entry.result(), entry.asof(), Boolean.TRUE));
        }
        return invoke(call, claims, handler, cacheKey);
    }

    /**
     * @param cacheKey where to store the result, {@code null} when the call is uncacheable
     */
    private Mono<Terminal> invoke(Call call, AuthClaims claims, CapabilityHandler handler, String cacheKey) {
        return Mono.defer(() -> handler.handle(call.request().input()))
            .switchIfEmpty(Mono.fromSupplier(() -> CapabilityResult.fault("handler completed without a result")))
            .onErrorResume(e -> {
                log.error("Capability handler threw. cap={} traceId={}", call.cap(), call.traceId(), e);
                return Mono.just(CapabilityResult.fault(e.getClass().getSimpleName()));
            })
            .doOnEach(flowLogger.stage(CapabilityFlowLogger.HANDLER_INVOKED))
            .map(result -> {
                if (result.isFault()) {
                    log.error("Capability fault. cap={} reason={} traceId={}",
                              call.cap(), result.note(), call.traceId());
                    return internalError(call, claims.agentId(), claims.policyVersion());
                }
                if (cacheKey != null) {
                    resultCache.put(cacheKey, result, result.asof());
                }
                return success(call, claims, result, result.asof(), cacheKey != null ? Boolean.FALSE : null);
            });
    }

    // ── Audit + response ────────────────────────────────────────────────────

    private Mono<GatewayResponse> recordAndRespond(Call call, Terminal terminal) {
        int latencyMs = (int) TimeUnit.NANOSECONDS.toMillis(nanoClock.getAsLong() - call.startedNanos());
        CapContext ctx = call.request().ctx();
        AuditRecord record = new AuditRecord(
            OffsetDateTime.now(clock),
            terminal.agentId(),
            ctx != null ? ctx.userId() : null,
            call.cap(),
            call.request().requestId(),
            call.traceId(),
            terminal.decision(),
            latencyMs,
            terminal.policyVersion(),
            terminal.denyReason(),
            terminal.asof(),
            terminal.cacheHit());

        return Mono.defer(() -> auditSink.append(record))
            .onErrorResume(e -> {
                log.warn("Audit append failed (non-fatal). cap={} traceId={}", call.cap(), call.traceId(), e);
                return Mono.empty();
            })
            .then(Mono.fromSupplier(() -> {
                flowLogger.logDecision(record);
                return terminal.response();
            }));
    }

    // ── Terminal states ─────────────────────────────────────────────────────

    private Terminal success(Call call, AuthClaims claims, CapabilityResult result, String asof, Boolean cacheHit) {
        CapEnvelope body = CapEnvelope.success(result.data(), new CapMeta(call.cap(), call.traceId(), asof, cacheHit));
        return new Terminal(new GatewayResponse(HttpStatus.OK, body, null),
            AuditDecision.ALLOW, claims.agentId(), claims.policyVersion(), null, asof, cacheHit);
    }

    private Terminal unauthorized(Call call, AuthDeniedException e) {
        String code = e.getReason().code();
        CapEnvelope body = CapEnvelope.failure(code, e.getMessage(), meta(call));
        return new Terminal(new GatewayResponse(HttpStatus.UNAUTHORIZED, body, "Bearer error=\"" + code + "\""),
            AuditDecision.DENY, call.headerAgent(), null, code, null, null);
    }

    private Terminal misconfigured(Call call) {
        CapEnvelope body = CapEnvelope.failure(SERVER_MISCONFIGURED, SERVER_MISCONFIGURED_DETAIL, meta(call));
        return new Terminal(new GatewayResponse(HttpStatus.INTERNAL_SERVER_ERROR, body, null),
            AuditDecision.ERROR, call.headerAgent(), null, null, null, null);
    }

    private Terminal scopeDenied(Call call, AuthClaims claims, String scope) {
        String code = DenyReason.SCOPE_DENIED.code();
        CapEnvelope body = CapEnvelope.failure(code, "Missing required scope '" + scope + "'", meta(call));
        return new Terminal(new GatewayResponse(HttpStatus.FORBIDDEN, body, null),
            AuditDecision.SCOPE_DENIED, claims.agentId(), claims.policyVersion(), code, null, null);
    }

    private Terminal unknownCapability(Call call, AuthClaims claims) {
        CapEnvelope body = CapEnvelope.unknownCapability(
            "Unknown capability '" + call.cap() + "'", registry.knownCapabilities(), meta(call));
        return new Terminal(new GatewayResponse(HttpStatus.BAD_REQUEST, body, null),
            AuditDecision.UNKNOWN_CAP, claims.agentId(), claims.policyVersion(),
            DenyReason.UNKNOWN_CAP.code(), null, null);
    }

    private Terminal internalError(Call call, String agentId, String policyVersion) {
        CapEnvelope body = CapEnvelope.failure(INTERNAL_ERROR, INTERNAL_ERROR_DETAIL, meta(call));
        return new Terminal(new GatewayResponse(HttpStatus.INTERNAL_SERVER_ERROR, body, null),
            AuditDecision.ERROR, agentId, policyVersion, null, null, null);
    }

    private static GatewayResponse badRequest(String cap, String traceId, String detail) {
        CapEnvelope body = CapEnvelope.failure(BAD_REQUEST_ERROR, detail, new CapMeta(cap, traceId, null, null));
        return new GatewayResponse(HttpStatus.BAD_REQUEST, body, null);
    }

    private static CapMeta meta(Call call) {
        return new CapMeta(call.cap(), call.traceId(), null, null);
    }

    private static Integer freshnessOverride(CapRequest request) {
        return request.opts() != null ? request.opts().freshnessSeconds() : null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ── Per-call state ──────────────────────────────────────────────────────

    private record Call(CapRequest request, String traceId, long startedNanos, String headerAgent) {
        String cap() {
            return request.cap();
        }
    }

    /** A finished dispatch: the response plus what the audit row needs. */
    private record Terminal(
        GatewayResponse response,
        AuditDecision decision,
        String agentId,
        String policyVersion,
        String denyReason,
        String asof,
        Boolean cacheHit
    ) {}

    private record AuthOutcome(AuthClaims claims, Terminal denial) {
        static AuthOutcome granted(AuthClaims claims) {
            return new AuthOutcome(claims, null);
        }

        static AuthOutcome denied(Terminal denial) {
            return new AuthOutcome(null, denial);
        }
    }
}
