package io.planbridge.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.planbridge.core.markup.RepairLogEntry;
import io.planbridge.core.response.ParseError;
import io.planbridge.core.response.ParseOutcome;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;

/// Writes a {@link ParseOutcome} as `{"status": ..., "payload": ..., "repairs": [...]}`.
///
/// A recovered outcome also carries `_warning`; a failed outcome carries `error`
/// instead of a payload.
class ParseOutcomeSerializer extends StdSerializer<ParseOutcome> {

    @Serial private static final long serialVersionUID = -1772650884470923611L;

    ParseOutcomeSerializer() {
        super(ParseOutcome.class);
    }

    @Override
    public void serialize(ParseOutcome outcome, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (outcome instanceof ParseOutcome.Ok ok) {
            gen.writeStringField("status", "ok");
            provider.defaultSerializeField("payload", ok.payload(), gen);
        } else if (outcome instanceof ParseOutcome.Recovered recovered) {
            gen.writeStringField("status", "recovered");
            gen.writeStringField("_warning", recovered.warning());
            provider.defaultSerializeField("payload", recovered.payload(), gen);
        } else if (outcome instanceof ParseOutcome.Failed failed) {
            gen.writeStringField("status", "failed");
            writeError(gen, failed.error());
        }

        if (!outcome.repairs().isEmpty()) {
            gen.writeArrayFieldStart("repairs");
            for (RepairLogEntry repair : outcome.repairs()) {
                gen.writeStartObject();
                gen.writeNumberField("line", repair.line());
                gen.writeStringField("found", repair.foundTag());
                gen.writeStringField("expected", repair.expectedTag());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }

        gen.writeEndObject();
    }

    private static void writeError(JsonGenerator gen, ParseError error) throws IOException {
        gen.writeObjectFieldStart("error");
        gen.writeStringField("kind", error.kind().name().toLowerCase(Locale.ROOT));
        gen.writeStringField("message", error.message());
        if (error.hasLocation()) {
            gen.writeNumberField("line", error.line());
            gen.writeNumberField("column", error.column());
        }
        if (!error.preview().isEmpty()) {
            gen.writeStringField("preview", error.preview());
        }
        gen.writeEndObject();
    }
}
