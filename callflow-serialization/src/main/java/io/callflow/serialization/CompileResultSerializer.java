package io.callflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.callflow.core.compiler.CompileResult;
import io.callflow.core.form.FormField;
import io.callflow.core.form.FormNodeInfo;
import io.callflow.core.tool.PlayAudioNodeInfo;
import io.callflow.core.tool.WebhookNodeInfo;
import java.io.IOException;
import java.io.Serial;

/// Writes the compile summary: the workflow plus the facts that tool registration needs.
///
/// The summary is a local format, so keys are camelCase. The nested `workflow` keeps the
/// platform's wire format. `firstMessage` is omitted when the flow does not open with a
/// message.
class CompileResultSerializer extends StdSerializer<CompileResult> {

    @Serial private static final long serialVersionUID = 1960243358810047725L;

    CompileResultSerializer() {
        super(CompileResult.class);
    }

    @Override
    public void serialize(CompileResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        provider.defaultSerializeField("workflow", result.workflow(), gen);
        if (result.firstMessage() != null) {
            gen.writeStringField("firstMessage", result.firstMessage());
        }
        gen.writeBooleanField("hasTransferNodes", result.hasTransferNodes());
        gen.writeBooleanField("hasAppointmentNodes", result.hasAppointmentNodes());

        gen.writeBooleanField("hasFormNodes", result.hasFormNodes());
        gen.writeArrayFieldStart("formNodes");
        for (FormNodeInfo form : result.formNodes()) {
            gen.writeStartObject();
            gen.writeStringField("formId", form.formId());
            gen.writeStringField("formName", form.formName());
            gen.writeArrayFieldStart("fields");
            for (FormField field : form.fields()) {
                provider.defaultSerializeValue(field.toMap(), gen);
            }
            gen.writeEndArray();
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeBooleanField("hasWebhookNodes", result.hasWebhookNodes());
        gen.writeArrayFieldStart("webhookNodes");
        for (WebhookNodeInfo webhook : result.webhookNodes()) {
            gen.writeStartObject();
            gen.writeStringField("toolId", webhook.toolId());
            gen.writeStringField("url", webhook.url());
            gen.writeStringField("method", webhook.method());
            provider.defaultSerializeField("headers", webhook.headers(), gen);
            provider.defaultSerializeField("payload", webhook.payload(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeBooleanField("hasPlayAudioNodes", result.hasPlayAudioNodes());
        gen.writeArrayFieldStart("playAudioNodes");
        for (PlayAudioNodeInfo audio : result.playAudioNodes()) {
            gen.writeStartObject();
            gen.writeStringField("nodeId", audio.nodeId());
            gen.writeStringField("toolId", audio.toolId());
            gen.writeStringField("audioUrl", audio.audioUrl());
            gen.writeStringField("audioFileName", audio.audioFileName());
            gen.writeBooleanField("interruptible", audio.interruptible());
            gen.writeBooleanField("waitForComplete", audio.waitForComplete());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        provider.defaultSerializeField("toolIds", result.toolIds(), gen);
        gen.writeEndObject();
    }
}
