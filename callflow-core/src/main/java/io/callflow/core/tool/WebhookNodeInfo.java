package io.callflow.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Webhook called by a compiled tool node, reported for tool registration.
///
/// @param toolId tool id referenced by the node, not null
/// @param url endpoint, not null
/// @param method HTTP method (`GET`, `POST`, `PUT`, `PATCH`), not null
/// @param headers request headers, never null
/// @param payload request body template, never null
public record WebhookNodeInfo(
        String toolId,
        String url,
        String method,
        Map<String, Object> headers,
        Map<String, Object> payload) {

    public WebhookNodeInfo {
        Objects.requireNonNull(toolId, "toolId must not be null");
        Objects.requireNonNull(url, "url must not be null");
        method = method != null && !method.isBlank() ? method : "POST";
        headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }
}
