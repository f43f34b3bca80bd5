package io.callflow.cli.ui;

/// ANSI text styling for CLI output with semantic color methods.
///
/// All methods return styled strings; output handling is the caller's responsibility.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);  // color enabled
/// System.out.println(styles.success("end") + " " + styles.arrow() + " " + styles.bold("done"));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates an AnsiStyles instance with specified color preference.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    /// Returns whether color output is enabled.
    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    // --- Text Formatting ---

    public String bold(String text) {
        return style(text, BOLD);
    }

    public String gray(String text) {
        return style(text, GRAY);
    }

    // --- Semantic Colors ---

    /// Green: terminal and unconditional elements.
    public String success(String text) {
        return style(text, GREEN);
    }

    /// Red: handoffs that leave the agent.
    public String error(String text) {
        return style(text, RED);
    }

    /// Yellow: unreachable nodes and warnings.
    public String warn(String text) {
        return style(text, YELLOW);
    }

    /// Blue: scripted steps and conditions.
    public String accent(String text) {
        return style(text, BLUE);
    }

    // --- Symbols ---

    public String arrow() {
        return style("→", BLUE);
    }

    // --- Box Drawing ---

    /// Box top-left corner: ┌─
    public String boxTop() {
        return style("┌─", DIM);
    }

    /// Box vertical line: │
    public String boxMid() {
        return style("│", DIM);
    }

    /// Box bottom-left corner: └─
    public String boxBottom() {
        return style("└─", DIM);
    }
}
