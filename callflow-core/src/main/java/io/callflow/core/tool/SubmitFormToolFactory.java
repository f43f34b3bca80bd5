package io.callflow.core.tool;

import io.callflow.core.form.FormField;
import io.callflow.core.form.FormNodeInfo;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Builds the `submit_form` webhook tool registered for each form used in a flow.
///
/// The tool name matches the id the compiler attaches to form nodes
/// ({@link ToolIds#submitForm(String)}). The platform posts the collected answers to
/// `<baseUrl>/api/webhooks/elevenlabs/form/<secret>/<formId>/<agentId>` with one
/// `field_<id>` property per question next to the caller's name and phone number.
public final class SubmitFormToolFactory {

    private static final Logger logger = Logger.getLogger(SubmitFormToolFactory.class.getName());

    static final String CONTACT_PHONE_DESCRIPTION =
            "The phone number exactly as spoken by the caller. Accept any format - with or"
                    + " without country code, spaces, dashes, or parentheses. Do NOT ask the"
                    + " caller to repeat or reformat their number.";

    private final ToolEndpointConfig endpoint;

    /// @param endpoint callback location, not null
    public SubmitFormToolFactory(ToolEndpointConfig endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
    }

    /// Builds the submit tool for one form.
    ///
    /// @param form form descriptor from the compile result, not null
    /// @return tool definition, never null
    public WebhookToolDefinition create(FormNodeInfo form) {
        String toolName = ToolIds.submitForm(form.formId());
        String url =
                endpoint.baseUrl()
                        + "/api/webhooks/elevenlabs/form/"
                        + endpoint.formSecret()
                        + "/"
                        + form.formId()
                        + "/"
                        + endpoint.agentId();

        List<FormField> fields = form.orderedFields();
        logger.fine(
                "Creating submit tool "
                        + toolName
                        + " for form "
                        + form.formName()
                        + " ("
                        + fields.size()
                        + " fields)");

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties(fields));
        schema.put("required", required(fields));

        return new WebhookToolDefinition(
                toolName,
                description(form.formName(), fields),
                new WebhookToolDefinition.ApiSchema(
                        url, "POST", Map.of("Content-Type", "application/json"), schema));
    }

    /// Builds the submit tools for a list of forms, one per distinct form id.
    ///
    /// @param forms form descriptors, not null
    /// @return tool definitions in first-seen order, never null
    public List<WebhookToolDefinition> createAll(List<FormNodeInfo> forms) {
        Map<String, WebhookToolDefinition> tools = new LinkedHashMap<>();
        for (FormNodeInfo form : forms) {
            tools.putIfAbsent(form.formId(), create(form));
        }
        return List.copyOf(tools.values());
    }

    private static String description(String formName, List<FormField> fields) {
        StringBuilder list = new StringBuilder();
        for (int i = 0; i < fields.size(); i++) {
            FormField field = fields.get(i);
            if (i > 0) {
                list.append('\n');
            }
            list.append(i + 1)
                    .append(". \"")
                    .append(field.question())
                    .append("\" (")
                    .append(field.fieldType())
                    .append(field.required() ? ", required" : "")
                    .append(')');
        }
        return "Submit the \""
                + formName
                + "\" form. Collect the following information from the caller before using"
                + " this tool:\n"
                + list
                + "\n\nOnce all required fields are collected, call this tool to save the form"
                + " submission.";
    }

    private static Map<String, Object> properties(List<FormField> fields) {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(
                "contactName", property("string", "The name of the person filling the form"));
        properties.put("contactPhone", property("string", CONTACT_PHONE_DESCRIPTION));

        for (FormField field : fields) {
            String question = "\"" + field.question() + "\"";
            Map<String, Object> property =
                    switch (field.fieldType()) {
                        case "number" -> property("number", "Numeric answer to: " + question);
                        case "yes_no" ->
                                property(
                                        "boolean",
                                        "Yes/No answer to: "
                                                + question
                                                + " (true = yes, false = no)");
                        case "multiple_choice" ->
                                property(
                                        "string",
                                        "Choice for: "
                                                + question
                                                + (field.options().isEmpty()
                                                        ? ""
                                                        : ". Options: "
                                                                + String.join(", ", field.options())));
                        case "email" -> property("string", "Email address for: " + question);
                        case "phone" ->
                                property(
                                        "string",
                                        "Phone number for: " + question + ". Accept any format.");
                        case "date" ->
                                property(
                                        "string",
                                        "Date for: "
                                                + question
                                                + ". Can be natural language like 'tomorrow' or"
                                                + " formatted date.");
                        case "rating" ->
                                property("number", "Rating (1-5 or 1-10) for: " + question);
                        default -> property("string", "Answer to: " + question);
                    };
            properties.put(FieldIds.propertyKey(field.id()), property);
        }
        return properties;
    }

    private static List<String> required(List<FormField> fields) {
        List<String> required = new ArrayList<>(List.of("contactName", "contactPhone"));
        for (FormField field : fields) {
            if (field.required()) {
                required.add(FieldIds.propertyKey(field.id()));
            }
        }
        return required;
    }

    private static Map<String, Object> property(String type, String description) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", type);
        property.put("description", description);
        return property;
    }
}
