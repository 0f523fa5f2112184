package io.planbridge.core.plan;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// A single unit of work inside a step: which agent runs it, what task it performs and how its
/// outputs are accepted.
///
/// @param id behavior identifier, null if the markup had none
/// @param stepId owning step identifier, null if the markup had none
/// @param agent agent name, not null
/// @param task task description, not null
/// @param inputs input variable name to value, not null
/// @param outputs output artifact name to description, not null
/// @param acceptance acceptance criteria in document order, not null
/// @param effects free-form effects text, null when absent or `false`
/// @param whatHappened narrative of what the behavior already did, keyed by element name
public record Behavior(
        String id,
        String stepId,
        String agent,
        String task,
        Map<String, String> inputs,
        Map<String, String> outputs,
        List<String> acceptance,
        String effects,
        Map<String, String> whatHappened)
        implements PlanPayload {

    public Behavior {
        agent = agent != null ? agent : "";
        task = task != null ? task : "";
        inputs = ModelCopies.orderedMap(inputs);
        outputs = ModelCopies.orderedMap(outputs);
        acceptance = ModelCopies.list(acceptance);
        effects = ModelCopies.blankToNull(effects);
        whatHappened = ModelCopies.orderedMap(whatHappened);
    }

    public Optional<String> effectsText() {
        return Optional.ofNullable(effects);
    }

    @Override
    public ResponseKind kind() {
        return ResponseKind.BEHAVIOR;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Mutable builder used while walking a `<behavior>` element.
    public static final class Builder {
        private String id;
        private String stepId;
        private String agent = "";
        private String task = "";
        private Map<String, String> inputs = new LinkedHashMap<>();
        private Map<String, String> outputs = new LinkedHashMap<>();
        private List<String> acceptance = List.of();
        private String effects;
        private Map<String, String> whatHappened = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder stepId(String stepId) {
            this.stepId = stepId;
            return this;
        }

        public Builder agent(String agent) {
            this.agent = agent;
            return this;
        }

        public Builder task(String task) {
            this.task = task;
            return this;
        }

        public Builder inputs(Map<String, String> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(Map<String, String> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder acceptance(List<String> acceptance) {
            this.acceptance = acceptance;
            return this;
        }

        public Builder effects(String effects) {
            this.effects = effects;
            return this;
        }

        public Builder whatHappened(Map<String, String> whatHappened) {
            this.whatHappened = whatHappened;
            return this;
        }

        public Behavior build() {
            return new Behavior(
                    id, stepId, agent, task, inputs, outputs, acceptance, effects, whatHappened);
        }
    }
}
