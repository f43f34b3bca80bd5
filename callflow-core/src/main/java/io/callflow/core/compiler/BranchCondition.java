package io.callflow.core.compiler;

import java.util.Objects;

/// Outcome of resolving one hop out of a condition node.
///
/// - {@link None}: the hop carries no signal at all
/// - {@link Unconditional}: the hop is explicitly configured to always fire
/// - {@link Named}: the hop fires when the caller matches a natural-language rule
///
/// Both `None` and `Unconditional` contribute no text when hops along a chain of
/// condition nodes are combined.
public sealed interface BranchCondition {

    /// Returns the shared no-signal result.
    ///
    /// @return none, never null
    static BranchCondition none() {
        return None.INSTANCE;
    }

    /// Returns the shared always-fire result.
    ///
    /// @return unconditional, never null
    static BranchCondition unconditional() {
        return Unconditional.INSTANCE;
    }

    /// Creates a named rule.
    ///
    /// @param text rule text, not null or blank
    /// @return named condition, never null
    static BranchCondition named(String text) {
        return new Named(text);
    }

    /// No signal.
    record None() implements BranchCondition {
        static final None INSTANCE = new None();
    }

    /// Always fire.
    record Unconditional() implements BranchCondition {
        static final Unconditional INSTANCE = new Unconditional();
    }

    /// Natural-language rule.
    ///
    /// @param text rule text, not null or blank
    record Named(String text) implements BranchCondition {
        public Named {
            Objects.requireNonNull(text, "text must not be null");
            if (text.isBlank()) {
                throw new IllegalArgumentException("text must not be blank");
            }
        }
    }
}
