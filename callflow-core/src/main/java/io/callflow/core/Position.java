package io.callflow.core;

/// Canvas coordinates of a node in the visual editor.
///
/// Positions are cosmetic. The compiler passes them through unchanged from the
/// authoring graph to the compiled workflow so the target platform can lay out
/// the graph the way the author drew it.
///
/// @param x horizontal canvas coordinate
/// @param y vertical canvas coordinate
public record Position(double x, double y) {

    private static final Position ORIGIN = new Position(0, 0);

    /// Returns the canvas origin `(0, 0)`.
    ///
    /// @return origin position, never null
    public static Position origin() {
        return ORIGIN;
    }
}
