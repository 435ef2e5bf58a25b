package com.eventedge.common.trace;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextUtilTest {

    @Test
    void traceIdIsDashlessLowercaseHex() {
        String traceId = TraceContextUtil.newTraceId();
        assertTrue(traceId.matches("[0-9a-f]{32}"), traceId);
        assertNotEquals(traceId, TraceContextUtil.newTraceId());
    }

    @Test
    void traceIdTravelsInReactorContext() {
        String seen = TraceContextUtil.withTraceId(
                Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getTraceId(ctx))), "abc123")
            .block();
        assertEquals("abc123", seen);
    }

    @Test
    void missingTraceIdFallsBackToUnknown() {
        assertEquals("unknown", TraceContextUtil.getTraceId(Context.empty()));
    }
}
