package io.callflow.core.tool;

import java.util.regex.Pattern;

/// Converts form field ids into property keys the voice platform accepts.
///
/// Allowed characters are letters, digits, `_`, `@` and non-consecutive dots.
public final class FieldIds {

    private static final Pattern INVALID = Pattern.compile("[^a-zA-Z0-9_.@]");
    private static final Pattern DOTS = Pattern.compile("\\.{2,}");
    private static final Pattern UNDERSCORES = Pattern.compile("_{2,}");

    private FieldIds() {}

    /// Sanitizes a field id: hyphens and other invalid characters become `_`, then runs of
    /// dots and runs of underscores collapse to one.
    ///
    /// @param fieldId raw field id, not null
    /// @return sanitized id, never null
    public static String sanitize(String fieldId) {
        String result = fieldId.replace('-', '_');
        result = INVALID.matcher(result).replaceAll("_");
        result = DOTS.matcher(result).replaceAll(".");
        return UNDERSCORES.matcher(result).replaceAll("_");
    }

    /// Returns the request body property key of a field: `field_<sanitized id>`.
    ///
    /// @param fieldId raw field id, not null
    /// @return property key, never null
    public static String propertyKey(String fieldId) {
        return "field_" + sanitize(fieldId);
    }
}
