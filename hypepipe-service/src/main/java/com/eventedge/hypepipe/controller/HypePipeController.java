package com.eventedge.hypepipe.controller;

import com.eventedge.hypepipe.capability.CapabilityRegistry;
import com.eventedge.hypepipe.dto.CapEnvelope;
import com.eventedge.hypepipe.dto.CapRequest;
import com.eventedge.hypepipe.dto.CapabilityDescriptor;
import com.eventedge.hypepipe.gateway.CapabilityGateway;
import com.eventedge.hypepipe.gateway.GatewayResponse;
import com.eventedge.hypepipe.policy.ScopePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/hypepipe")
public class HypePipeController {

    private static final Logger log = LoggerFactory.getLogger(HypePipeController.class);

    static final String AGENT_ID_HEADER = "X-Agent-Id";

    private final CapabilityGateway gateway;
    private final CapabilityRegistry registry;
    private final ScopePolicy scopePolicy;
    private final Clock clock;

    public HypePipeController(CapabilityGateway gateway,
                              CapabilityRegistry registry,
                              ScopePolicy scopePolicy,
                              Clock clock) {
        this.gateway     = gateway;
        this.registry    = registry;
        this.scopePolicy = scopePolicy;
        this.clock       = clock;
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("service", "hypepipe");
        body.put("ts", OffsetDateTime.now(clock).toString());
        return Mono.just(ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(body));
    }

    @PostMapping("/cap")
    public Mono<ResponseEntity<CapEnvelope>> cap(
            @RequestBody(required = false) CapRequest request,
            @RequestHeader(value = AGENT_ID_HEADER, required = false) String agentId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        String cap = request != null ? request.cap() : null;
        String requestId = request != null ? request.requestId() : null;
        log.info("Capability call received. cap={} agent={} requestId={}", cap, agentId, requestId);
        return gateway.dispatch(request, agentId, authorization)
            .map(HypePipeController::toResponseEntity)
            .doOnError(e -> log.error("Capability endpoint error. cap={} requestId={}", cap, requestId, e));
    }

    /** Body that cannot be decoded into a {@link CapRequest}: same envelope as any other 400. */
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<CapEnvelope>> unreadableRequest(ServerWebInputException e) {
        return Mono.just(toResponseEntity(gateway.rejectUnreadable(e.getReason())));
    }

    @GetMapping("/caps")
    public Mono<ResponseEntity<List<CapabilityDescriptor>>> caps() {
        List<CapabilityDescriptor> descriptors = registry.knownCapabilities().stream()
            .map(name -> new CapabilityDescriptor(
                name,
                scopePolicy.requiredScope(name).orElse(null),
                registry.defaultTtlSeconds(name)))
            .toList();
        return Mono.just(ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(descriptors));
    }

    private static ResponseEntity<CapEnvelope> toResponseEntity(GatewayResponse response) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(response.status())
            .cacheControl(CacheControl.noStore());
        if (response.wwwAuthenticate() != null) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, response.wwwAuthenticate());
        }
        return builder.body(response.body());
    }
}
