package io.callflow.core.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Server-side webhook tool as registered with the voice platform.
///
/// @param name tool name, also the id referenced from workflow nodes, not null
/// @param description usage instructions read by the agent's model, not null
/// @param apiSchema endpoint and request shape, not null
public record WebhookToolDefinition(String name, String description, ApiSchema apiSchema) {

    public static final String TYPE = "webhook";

    public WebhookToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(apiSchema, "apiSchema must not be null");
    }

    /// Returns the platform tool type.
    ///
    /// @return always `webhook`
    public String type() {
        return TYPE;
    }

    /// HTTP call made by the platform when the tool fires.
    ///
    /// @param url endpoint, not null
    /// @param method HTTP method, not null
    /// @param headers request headers, never null
    /// @param requestBodySchema JSON schema of the request body, never null
    public record ApiSchema(
            String url,
            String method,
            Map<String, String> headers,
            Map<String, Object> requestBodySchema) {

        public ApiSchema {
            Objects.requireNonNull(url, "url must not be null");
            Objects.requireNonNull(method, "method must not be null");
            headers = headers != null ? Collections.unmodifiableMap(new LinkedHashMap<>(headers)) : Map.of();
            requestBodySchema =
                    requestBodySchema != null
                            ? Collections.unmodifiableMap(new LinkedHashMap<>(requestBodySchema))
                            : Map.of();
        }
    }
}
