package io.planbridge.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.planbridge.core.plan.Behavior;
import io.planbridge.core.plan.EmptyPayload;
import io.planbridge.core.plan.ParsedWorkflow;
import io.planbridge.core.plan.PlanPayload;
import io.planbridge.core.plan.Reflection;
import io.planbridge.core.plan.Stage;
import io.planbridge.core.plan.Step;
import io.planbridge.core.plan.StepPlan;
import io.planbridge.core.plan.StructuredPayload;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Writes a {@link PlanPayload} with the snake_case field names the engine reads.
///
/// Optional fields (positional edits, focus, effects) are omitted when absent rather than
/// written as null. Structured payloads are written back as the record they came from.
class PlanPayloadSerializer extends StdSerializer<PlanPayload> {

    @Serial private static final long serialVersionUID = 6147020915843371082L;

    PlanPayloadSerializer() {
        super(PlanPayload.class);
    }

    @Override
    public void serialize(PlanPayload payload, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (payload instanceof StructuredPayload structured) {
            provider.defaultSerializeValue(structured.content(), gen);
            return;
        }

        gen.writeStartObject();
        if (payload instanceof ParsedWorkflow workflow) {
            writeOptional(gen, "title", workflow.title());
            writeOptional(gen, "description", workflow.description());
            writeOptional(gen, "focus", workflow.focus());
            gen.writeArrayFieldStart("stages");
            for (Stage stage : workflow.stages()) {
                writeStage(gen, stage);
            }
            gen.writeEndArray();
        } else if (payload instanceof StepPlan plan) {
            writeOptional(gen, "focus", plan.focus());
            writeOptional(gen, "goals", plan.goals());
            gen.writeArrayFieldStart("steps");
            for (Step step : plan.steps()) {
                writeStep(gen, step);
            }
            gen.writeEndArray();
        } else if (payload instanceof Behavior behavior) {
            writeBehavior(gen, behavior);
        } else if (payload instanceof Reflection reflection) {
            writeReflection(gen, reflection);
        } else if (payload instanceof EmptyPayload empty) {
            gen.writeStringField("_warning", empty.warning());
        }
        gen.writeEndObject();
    }

    private static void writeStage(JsonGenerator gen, Stage stage) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("stage_id", stage.id());
        gen.writeStringField("title", stage.title());
        gen.writeStringField("goal", stage.goal());
        writeMap(gen, "verified_artifacts", stage.verifiedArtifacts());
        writeMap(gen, "required_variables", stage.requiredVariables());
        writeOptional(gen, "insert_before", stage.insertBefore());
        writeOptional(gen, "insert_after", stage.insertAfter());
        writeOptional(gen, "replaces", stage.replaces());
        if (stage.optional()) {
            gen.writeBooleanField("optional", true);
        }
        gen.writeEndObject();
    }

    private static void writeStep(JsonGenerator gen, Step step) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("step_id", step.id());
        gen.writeStringField("title", step.title());
        gen.writeStringField("goal", step.goal());
        writeMap(gen, "verified_artifacts", step.verifiedArtifacts());
        writeMap(gen, "required_variables", step.requiredVariables());
        if (step.optional()) {
            gen.writeBooleanField("optional", true);
        }
        if (!step.considerations().isEmpty()) {
            writeMap(gen, "pcs_considerations", step.considerations());
        }
        gen.writeEndObject();
    }

    private static void writeBehavior(JsonGenerator gen, Behavior behavior) throws IOException {
        gen.writeStringField("behavior_id", behavior.id());
        gen.writeStringField("step_id", behavior.stepId());
        gen.writeStringField("agent", behavior.agent());
        gen.writeStringField("task", behavior.task());
        writeMap(gen, "inputs", behavior.inputs());
        writeMap(gen, "outputs", behavior.outputs());
        writeList(gen, "acceptance", behavior.acceptance());
        writeOptional(gen, "effects", behavior.effects());
        if (!behavior.whatHappened().isEmpty()) {
            writeMap(gen, "whathappened", behavior.whatHappened());
        }
    }

    private static void writeReflection(JsonGenerator gen, Reflection reflection)
            throws IOException {
        gen.writeBooleanField("behavior_is_complete", reflection.behaviorComplete());
        gen.writeStringField("next_state", reflection.nextState());
        writeMap(gen, "variables_produced", reflection.variablesProduced());

        gen.writeObjectFieldStart("context_for_next");
        writeMap(gen, "whathappened", reflection.whatHappened());
        writeMap(gen, "recommendations_for_next", reflection.recommendations());
        gen.writeEndObject();

        gen.writeArrayFieldStart("artifacts_produced");
        for (Reflection.ArtifactStatus artifact : reflection.artifactsProduced()) {
            gen.writeStartObject();
            gen.writeStringField("name", artifact.name());
            gen.writeStringField("status", artifact.status());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        Reflection.OutputsTracking tracking = reflection.outputsTracking();
        gen.writeObjectFieldStart("outputs_tracking");
        writeList(gen, "produced", tracking.produced());
        writeList(gen, "in_progress", tracking.inProgress());
        writeList(gen, "remaining", tracking.remaining());
        gen.writeEndObject();
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static void writeOptional(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }

    private static void writeMap(JsonGenerator gen, String field, Map<String, String> values)
            throws IOException {
        gen.writeObjectFieldStart(field);
        for (Map.Entry<String, String> entry : values.entrySet()) {
            gen.writeStringField(entry.getKey(), entry.getValue());
        }
        gen.writeEndObject();
    }

    private static void writeList(JsonGenerator gen, String field, List<String> values)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (String value : values) {
            gen.writeString(value);
        }
        gen.writeEndArray();
    }
}
