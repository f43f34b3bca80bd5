package io.callflow.cli.producers;

import io.callflow.core.compiler.CompilerOptions;
import io.callflow.core.compiler.FlowCompiler;
import io.callflow.core.tool.SubmitFormToolFactory;
import io.callflow.core.tool.ToolEndpointConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// CDI producer for the compiler and the tool definition factory.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `callflow.compiler.strict` | Boolean | `false` | Fail on edges to missing nodes |
/// | `callflow.tools.base-url` | String | - | Public base URL of the form webhook endpoint |
/// | `callflow.tools.form-secret` | String | - | Secret path segment of the webhook URL |
/// | `callflow.tools.agent-id` | String | - | Voice agent the tools are registered for |
///
/// @implNote Both products are `@Singleton`: the core types are final and cannot be proxied.
@ApplicationScoped
public class CompilerProducer {

    private static final Logger logger = Logger.getLogger(CompilerProducer.class.getName());

    @ConfigProperty(name = "callflow.compiler.strict", defaultValue = "false")
    boolean strict;

    @ConfigProperty(name = "callflow.tools.base-url")
    String baseUrl;

    @ConfigProperty(name = "callflow.tools.form-secret")
    String formSecret;

    @ConfigProperty(name = "callflow.tools.agent-id")
    String agentId;

    /// Produces the flow compiler configured from `callflow.compiler.strict`.
    ///
    /// @return stateless compiler, never null
    @Produces
    @Singleton
    public FlowCompiler flowCompiler() {
        if (strict) {
            logger.info("Compiler running in strict mode");
        }
        return new FlowCompiler(strict ? CompilerOptions.strictMode() : CompilerOptions.defaults());
    }

    /// Produces the submit-form tool factory for the configured endpoint.
    ///
    /// @return tool factory, never null
    @Produces
    @Singleton
    public SubmitFormToolFactory submitFormToolFactory() {
        return new SubmitFormToolFactory(new ToolEndpointConfig(baseUrl, formSecret, agentId));
    }
}
