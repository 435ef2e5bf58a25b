package com.eventedge.hypepipe.capability.handler;

import com.eventedge.common.exception.CapabilityException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/** Converts derived view records into the JSON-shaped map a capability returns. */
final class Views {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private Views() {}

    static Map<String, Object> toMap(ObjectMapper objectMapper, String capability, Object view) {
        try {
            return objectMapper.convertValue(view, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            throw new CapabilityException(capability, "view not serializable: " + view.getClass().getSimpleName(), e);
        }
    }
}
