package io.callflow.cli.visualizer;

import io.callflow.core.workflow.condition.ExpressionCondition;
import io.callflow.core.workflow.condition.ForwardCondition;
import io.callflow.core.workflow.condition.LlmCondition;
import io.callflow.core.workflow.condition.ResultCondition;

/// Short human-readable labels for forward conditions.
final class ConditionLabels {

    private ConditionLabels() {}

    /// Describes a condition in at most `maxLength` characters.
    ///
    /// @return `null` for unconditional transitions
    static String describe(ForwardCondition condition, int maxLength) {
        if (condition instanceof LlmCondition llm) {
            return truncate(llm.condition(), maxLength);
        }
        if (condition instanceof ResultCondition result) {
            return result.successful() ? "on success" : "on failure";
        }
        if (condition instanceof ExpressionCondition) {
            return "expression";
        }
        return null;
    }

    static String truncate(String text, int maxLength) {
        String singleLine = text.replaceAll("\\s+", " ").trim();
        if (singleLine.length() <= maxLength) {
            return singleLine;
        }
        return singleLine.substring(0, maxLength - 3) + "...";
    }
}
