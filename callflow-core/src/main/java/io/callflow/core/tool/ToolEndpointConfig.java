package io.callflow.core.tool;

import java.util.Objects;

/// Where the platform should deliver tool calls back to this system.
///
/// @param baseUrl public base URL, without trailing slash, not null
/// @param formSecret shared secret embedded in form webhook URLs, not null
/// @param agentId voice agent the tools are registered for, not null
public record ToolEndpointConfig(String baseUrl, String formSecret, String agentId) {

    public ToolEndpointConfig {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(formSecret, "formSecret must not be null");
        Objects.requireNonNull(agentId, "agentId must not be null");
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }
}
