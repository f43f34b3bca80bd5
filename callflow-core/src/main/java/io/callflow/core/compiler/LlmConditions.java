package io.callflow.core.compiler;

/// Natural-language transition rules evaluated by the voice runtime's model.
///
/// Descriptive sentences match more reliably than short phrases. The completion rules
/// quote the literal phrases that {@link PromptTemplates} makes the agent say.
public final class LlmConditions {

    public static final String GENERIC_RESPONSE =
            "The user has verbally responded with any answer. Continue to the next step in the"
                    + " workflow.";

    public static final String QUESTION_ANSWERED =
            "The user has provided an answer or response to the question. They have given"
                    + " information, a number, a name, an address, or any substantive reply."
                    + " Proceed to the next step.";

    public static final String YES_ACCEPTANCE =
            "The user agreed, said yes, confirmed positively, or expressed interest.";

    public static final String NO_REJECTION =
            "The user declined, said no, refused, or expressed disinterest.";

    public static final String CONFUSION =
            "The user sounded confused or asked for clarification. Ask again politely.";

    public static final String SILENCE =
            "The user did not respond or remained silent. Ask again or prompt gently.";

    public static final String FORM_COMPLETE =
            "The agent has said 'Your information has been saved successfully' or a very"
                    + " similar confirmation phrase indicating the form submission is complete."
                    + " Do not transition until this phrase is spoken.";

    public static final String APPOINTMENT_COMPLETE =
            "The agent has said 'Your appointment has been booked successfully' or a very"
                    + " similar confirmation phrase indicating the appointment is confirmed. Do"
                    + " not transition until this phrase is spoken.";

    public static final String TRANSFER_INTENT =
            "The user requested to speak with a human, transfer the call, or be connected to"
                    + " support.";

    private static final int QUESTION_QUOTE_LIMIT = 100;
    private static final int MESSAGE_QUOTE_LIMIT = 80;

    private LlmConditions() {}

    /// Rule that waits for a reply to one specific question.
    ///
    /// @param question question text, not null or empty
    /// @return condition text, never null
    public static String answeredQuestion(String question) {
        return "The agent just asked: \""
                + quote(question, QUESTION_QUOTE_LIMIT)
                + "\" and the user has now responded specifically to THIS question. The user's"
                + " response directly addresses what was just asked. Proceed only after the"
                + " user responds to this specific question.";
    }

    /// Rule that waits for any reply after a spoken line.
    ///
    /// @param message spoken text, not null or empty
    /// @return condition text, never null
    public static String repliedToMessage(String message) {
        return "The agent said: \""
                + quote(message, MESSAGE_QUOTE_LIMIT)
                + "...\" and is waiting for the user to respond before proceeding. Wait for the"
                + " user to speak.";
    }

    // Truncates first, then strips quote characters.
    private static String quote(String text, int limit) {
        String truncated = text.length() > limit ? text.substring(0, limit) : text;
        return truncated.replace("'", "").replace("\"", "");
    }
}
