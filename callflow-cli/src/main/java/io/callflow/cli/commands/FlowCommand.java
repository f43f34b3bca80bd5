package io.callflow.cli.commands;

import io.callflow.cli.exception.FlowNotFoundException;
import io.callflow.cli.forms.JsonFileFormRepository;
import io.callflow.core.compiler.CompileResult;
import io.callflow.core.compiler.FlowCompiler;
import io.callflow.core.flow.FlowGraph;
import io.callflow.core.form.FormNodeEnricher;
import io.callflow.serialization.WorkflowSerializer;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Option;

/// Base class for all flow CLI commands.
///
/// Loads an editor flow from the working directory, fills form nodes from `forms/`, and
/// compiles it. Subclasses implement specific command behavior in {@link #execute()}.
///
/// ### Working Directory Resolution
/// Priority order for determining the working directory:
/// 1. CLI option `-d` / `--working-dir`
/// 2. Config property `callflow.working.dir`
/// 3. Current directory (`.`)
///
/// ### Flow Resolution
/// The flow name comes from the CLI positional parameter, else from `callflow.flow.file`.
/// An existing file path is used as-is; otherwise the name is looked up under
/// `<working-dir>/flows/`, with `.json` appended when missing.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
public abstract class FlowCommand implements Runnable {

    private static final String[] BANNER = {
        "",
        "            _ _  __ _",
        "   ___ __ _| | |/ _| | _____      __",
        "  / __/ _` | | | |_| |/ _ \\ \\ /\\ / /",
        " | (_| (_| | | |  _| | (_) \\ V  V /",
        "  \\___\\__,_|_|_|_| |_|\\___/ \\_/\\_/",
        "",
        " Visual call flows for voice agents",
        ""
    };

    @Option(
            names = {"-d", "--working-dir"},
            description = "Working directory containing flows/ and forms/")
    protected Path workingDirPath;

    @Option(
            names = {"-q", "--quiet"},
            description = "Suppress the banner, for piping JSON output")
    protected boolean quiet;

    @Override
    public final void run() {
        if (!quiet) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        execute();
    }

    protected abstract void execute();

    @Inject
    @ConfigProperty(name = "callflow.flow.file")
    private String defaultFlowName;

    @Inject
    @ConfigProperty(name = "callflow.working.dir")
    private String defaultWorkingDir;

    @Inject private FlowCompiler compiler;

    /// Reads the flow, fills form nodes from the working directory's `forms/` folder and
    /// compiles it.
    ///
    /// @param flowName flow name or path, may be null to use the configured default
    /// @return compile result, never null
    /// @throws FlowNotFoundException if no flow is named or the file does not exist
    /// @throws IOException if the flow file cannot be read
    protected CompileResult compileFlow(String flowName)
            throws FlowNotFoundException, IOException {
        FlowGraph graph = loadFlow(flowName);
        Path formsDir = getWorkingDirectory().resolve("forms");
        FormNodeEnricher enricher = new FormNodeEnricher(new JsonFileFormRepository(formsDir));
        return compiler.compile(enricher.enrich(graph));
    }

    /// Reads and parses the editor flow document.
    ///
    /// @param flowName flow name or path, may be null to use the configured default
    /// @return parsed flow graph, never null
    /// @throws FlowNotFoundException if no flow is named or the file does not exist
    /// @throws IOException if the flow file cannot be read
    protected FlowGraph loadFlow(String flowName) throws FlowNotFoundException, IOException {
        String effectiveName = resolveFlowName(flowName);
        if (effectiveName == null) {
            System.err.println(
                    """
              No flow name specified and no default configured.
              Usage: callflow compile <flow-name> [-d <working-dir>]
              Or set callflow.flow.file in application.properties
              """);
            throw new FlowNotFoundException("Flow not specified");
        }

        Path file = resolveFlowFile(effectiveName);
        if (!Files.isRegularFile(file)) {
            throw new FlowNotFoundException("Flow file not found: " + file);
        }
        return WorkflowSerializer.readFlowGraph(Files.readString(file));
    }

    /// Returns the effective working directory.
    ///
    /// Resolution priority: CLI option `-d` > config property `callflow.working.dir` >
    /// current directory.
    ///
    /// @return absolute working directory, never null
    protected Path getWorkingDirectory() {
        Path effectivePath;
        if (workingDirPath != null) {
            effectivePath = workingDirPath;
        } else if (defaultWorkingDir != null && !defaultWorkingDir.isBlank()) {
            effectivePath = Path.of(defaultWorkingDir);
        } else {
            effectivePath = Path.of(".");
        }
        return effectivePath.toAbsolutePath();
    }

    /// Resolves the effective flow name from CLI argument or config default.
    ///
    /// @param flowName flow name from CLI, may be null or blank
    /// @return resolved flow name, or null if neither CLI nor config specifies one
    protected String resolveFlowName(String flowName) {
        if (flowName != null && !flowName.isBlank()) {
            return flowName;
        }
        return defaultFlowName != null && !defaultFlowName.isBlank() ? defaultFlowName : null;
    }

    private Path resolveFlowFile(String flowName) {
        Path direct = Path.of(flowName);
        if (Files.isRegularFile(direct)) {
            return direct;
        }
        String fileName = flowName.endsWith(".json") ? flowName : flowName + ".json";
        return getWorkingDirectory().resolve("flows").resolve(fileName);
    }
}
