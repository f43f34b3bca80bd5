package io.callflow.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the callflow CLI application.
///
/// Registers all available subcommands:
/// - `compile` - Compile an editor flow to the voice platform's workflow JSON
/// - `validate` - Compile and report structural errors and warnings
/// - `visualize` - Render the compiled workflow as ASCII text or Mermaid diagram
/// - `tools` - Print the tool definitions the compiled workflow needs registered
///
/// @see FlowCompileCommand
/// @see FlowValidateCommand
/// @see FlowVisualizeCommand
/// @see FlowToolsCommand
@TopCommand
@Command(
        name = "callflow",
        description = "Visual call flow to voice agent workflow compiler",
        subcommands = {
            FlowCompileCommand.class,
            FlowValidateCommand.class,
            FlowVisualizeCommand.class,
            FlowToolsCommand.class
        })
public class CallflowCLI {}
