package io.callflow.core.compiler;

import io.callflow.core.form.FormField;
import java.util.Comparator;
import java.util.List;

/// Locked instruction texts for scripted agent steps.
///
/// Every template starts with `Say exactly: '<text>'` because the runtime does not speak
/// a per-node first message; the agent must be told what to say. Templates end either by
/// continuing immediately (message, delay) or by stopping to wait for the caller
/// (question, appointment, form). The appointment and form templates make the agent say a
/// fixed completion phrase that {@link LlmConditions#APPOINTMENT_COMPLETE} and
/// {@link LlmConditions#FORM_COMPLETE} key on.
public final class PromptTemplates {

    static final String WAIT_FOR_RESPONSE = "Then stop speaking and wait for response.";

    static final String PHONE_NUMBER_PRONUNCIATION =
            """
            PHONE NUMBER PRONUNCIATION: When reading back or confirming any phone number, \
            ALWAYS speak each digit separately with brief pauses. For example:
            - "9990155993" should be spoken as "nine, nine, nine, zero, one, five, five, nine, \
            nine, three"
            - Never read phone numbers as large numbers (do NOT say "nine hundred ninety-nine \
            million...")
            - Group digits in sets of 3 or 4 for natural reading rhythm""";

    private PromptTemplates() {}

    /// Speak a line verbatim, then continue.
    ///
    /// @param text line to speak, not null
    /// @return prompt, never null
    public static String message(String text) {
        return "Say exactly: '"
                + text
                + "' Do not add anything else. After speaking, proceed immediately to the next"
                + " step.";
    }

    /// Speak a filler line while something happens in the background, then continue.
    ///
    /// @param waitMessage filler line, not null
    /// @return prompt, never null
    public static String delay(String waitMessage) {
        return message(waitMessage);
    }

    /// Ask a question verbatim, then wait.
    ///
    /// @param question question to ask, not null
    /// @return prompt, never null
    public static String question(String question) {
        return "Say exactly: '"
                + question
                + "' Then stop speaking and wait for response. Do not add anything else.";
    }

    /// Booking procedure around the `book_appointment` tool.
    ///
    /// @param introMessage opening line, not null
    /// @param serviceName service passed to the booking tool, not null
    /// @param durationMinutes appointment length passed to the booking tool
    /// @return prompt, never null
    public static String appointment(String introMessage, String serviceName, long durationMinutes) {
        return """
                Say exactly: '%s'

                APPOINTMENT BOOKING INSTRUCTIONS:
                1. After the caller responds, collect the following information:
                   - Their name (if not already known)
                   - Preferred date for the appointment
                   - Preferred time for the appointment
                   - Phone number (use the caller's number if available)
                   - Email address (optional)

                2. Once you have collected the date, time, and caller name, IMMEDIATELY use \
                the book_appointment tool to save the appointment.
                   - Pass the caller's name as contactName
                   - Pass the caller's phone number as contactPhone
                   - Pass the date as appointmentDate (format: YYYY-MM-DD)
                   - Pass the time as appointmentTime (format: HH:MM)
                   - Pass %d as duration
                   - Pass "%s" as serviceName
                   - Pass any notes as notes

                3. CRITICAL: After successfully booking, you MUST say exactly: "Your \
                appointment has been booked successfully." This exact phrase signals \
                completion.
                4. If booking fails, apologize and try again or offer to transfer to a human.
                5. Only after saying "Your appointment has been booked successfully" should you \
                proceed to the next step.

                %s

                %s"""
                .formatted(
                        introMessage,
                        durationMinutes,
                        serviceName,
                        PHONE_NUMBER_PRONUNCIATION,
                        WAIT_FOR_RESPONSE);
    }

    /// Field-by-field collection procedure around the form's submit tool.
    ///
    /// Falls back to {@link #formWithoutFields(String, String)} when no fields are known.
    ///
    /// @param introMessage opening line, not null
    /// @param formName form display name, not null
    /// @param fields questions to ask, not null
    /// @return prompt, never null
    public static String form(String introMessage, String formName, List<FormField> fields) {
        if (fields.isEmpty()) {
            return formWithoutFields(introMessage, formName);
        }
        return """
                Say exactly: '%s'

                FORM COLLECTION INSTRUCTIONS for "%s":
                After the caller responds, collect the following information in order:

                %s

                IMPORTANT RULES:
                1. Ask each question one at a time, wait for the response before proceeding.
                2. If the caller's response is unclear, politely ask for clarification.
                3. For required fields, do not skip - gently re-ask if needed.
                4. Once all required fields are collected, use the submit_form tool to save \
                the responses.
                5. CRITICAL: After successful submission, you MUST say exactly: "Your \
                information has been saved successfully." This exact phrase signals completion.
                6. If submission fails, apologize and try again.
                7. Only after saying "Your information has been saved successfully" should you \
                proceed to the next step.

                %s

                %s"""
                .formatted(
                        introMessage,
                        formName,
                        fieldInstructions(fields),
                        PHONE_NUMBER_PRONUNCIATION,
                        WAIT_FOR_RESPONSE);
    }

    /// Generic collection instructions for a form whose fields were not loaded.
    ///
    /// @param introMessage opening line, not null
    /// @param formName form display name, not null
    /// @return prompt, never null
    public static String formWithoutFields(String introMessage, String formName) {
        return """
                Say exactly: '%s'

                FORM COLLECTION INSTRUCTIONS for "%s":
                After speaking the introduction, collect the requested information from the \
                caller.
                Ask questions one at a time and wait for responses.
                Once all information is collected, use the submit_form tool to save the \
                responses.

                %s"""
                .formatted(introMessage, formName, WAIT_FOR_RESPONSE);
    }

    static String fieldInstructions(List<FormField> fields) {
        List<FormField> sorted =
                fields.stream().sorted(Comparator.comparingInt(FormField::order)).toList();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < sorted.size(); i++) {
            FormField field = sorted.get(i);
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(i + 1).append(". Ask: \"").append(field.question()).append('"');
            sb.append(typeHint(field));
            if (field.required()) {
                sb.append(" [REQUIRED]");
            }
        }
        return sb.toString();
    }

    private static String typeHint(FormField field) {
        return switch (field.fieldType()) {
            case "yes_no" -> " (Accept yes/no, yeah/nah, affirmative/negative responses)";
            case "multiple_choice" ->
                    field.options().isEmpty()
                            ? ""
                            : " (Options: " + String.join(", ", field.options()) + ")";
            case "number" -> " (Collect a number)";
            case "email" -> " (Collect email address, confirm spelling)";
            case "phone" -> " (Accept any phone format)";
            case "rating" -> " (Collect a rating, typically 1-5 or 1-10)";
            case "date" -> " (Accept natural language dates like \"tomorrow\", \"next week\")";
            default -> "";
        };
    }
}
