package io.planbridge.core.plan;

import java.util.LinkedHashMap;
import java.util.Map;

/// One step inside a stage. Mirrors {@link Stage} without the positional-edit attributes.
///
/// @param id step identifier, null if the markup had none
/// @param title display title, not null
/// @param goal goal statement, not null
/// @param verifiedArtifacts artifact name to description, not null
/// @param requiredVariables variable name to description, not null
/// @param optional whether the step may be skipped
/// @param considerations free-form consideration notes keyed by element name, not null
public record Step(
        String id,
        String title,
        String goal,
        Map<String, String> verifiedArtifacts,
        Map<String, String> requiredVariables,
        boolean optional,
        Map<String, String> considerations) {

    public Step {
        title = title != null ? title : "";
        goal = goal != null ? goal : "";
        verifiedArtifacts = ModelCopies.orderedMap(verifiedArtifacts);
        requiredVariables = ModelCopies.orderedMap(requiredVariables);
        considerations = ModelCopies.orderedMap(considerations);
    }

    public static Step of(String id, String title, String goal) {
        return new Step(id, title, goal, Map.of(), Map.of(), false, Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Mutable builder used while walking a `<step>` element.
    public static final class Builder {
        private String id;
        private String title = "";
        private String goal = "";
        private Map<String, String> verifiedArtifacts = new LinkedHashMap<>();
        private Map<String, String> requiredVariables = new LinkedHashMap<>();
        private boolean optional;
        private Map<String, String> considerations = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder goal(String goal) {
            this.goal = goal;
            return this;
        }

        public Builder verifiedArtifacts(Map<String, String> verifiedArtifacts) {
            this.verifiedArtifacts = verifiedArtifacts;
            return this;
        }

        public Builder requiredVariables(Map<String, String> requiredVariables) {
            this.requiredVariables = requiredVariables;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder considerations(Map<String, String> considerations) {
            this.considerations = considerations;
            return this;
        }

        public Step build() {
            return new Step(
                    id, title, goal, verifiedArtifacts, requiredVariables, optional, considerations);
        }
    }
}
