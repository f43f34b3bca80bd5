package io.callflow.cli.exception;

import java.io.Serial;

/// Thrown when a flow document cannot be located.
///
/// Common causes:
/// - No flow name given and `callflow.flow.file` not configured
/// - Flow file missing from `<working-dir>/flows/`
///
/// @see io.callflow.cli.commands.FlowCommand
public class FlowNotFoundException extends Exception {

    @Serial private static final long serialVersionUID = 5572919038311402846L;

    /// Creates an exception with the specified detail message.
    ///
    /// @param message description of the missing flow, not null
    public FlowNotFoundException(String message) {
        super(message);
    }
}
