package io.planbridge.core.plan;

import java.util.LinkedHashMap;
import java.util.Map;

/// One stage of a multi-phase workflow, as proposed by the planning backend.
///
/// `insertBefore`, `insertAfter` and `replaces` describe a positional edit
/// against the stage sequence the workflow engine already holds. They are intentions for the
/// engine to apply, not structural children of the stage.
///
/// ### Contracts
///
/// - `id` is taken verbatim from the markup; it is null only when the backend omitted
///   it, which is an upstream error this layer does not repair
/// - all fields are immutable after construction; maps keep document order
///
/// @param id stage identifier, null if the markup had none
/// @param title display title, empty if absent, not null
/// @param goal goal statement, empty if absent, not null
/// @param verifiedArtifacts artifact name to description, not null
/// @param requiredVariables variable name to description, not null
/// @param optional whether the stage may be skipped
/// @param insertBefore id of the stage this one goes before, may be null
/// @param insertAfter id of the stage this one goes after, may be null
/// @param replaces id of the stage this one replaces, may be null
public record Stage(
        String id,
        String title,
        String goal,
        Map<String, String> verifiedArtifacts,
        Map<String, String> requiredVariables,
        boolean optional,
        String insertBefore,
        String insertAfter,
        String replaces) {

    public Stage {
        title = title != null ? title : "";
        goal = goal != null ? goal : "";
        verifiedArtifacts = ModelCopies.orderedMap(verifiedArtifacts);
        requiredVariables = ModelCopies.orderedMap(requiredVariables);
        insertBefore = ModelCopies.blankToNull(insertBefore);
        insertAfter = ModelCopies.blankToNull(insertAfter);
        replaces = ModelCopies.blankToNull(replaces);
    }

    /// Creates a plain stage with no artifacts, variables or positional edit.
    ///
    /// @param id stage identifier
    /// @param title display title
    /// @param goal goal statement
    /// @return new stage, never null
    public static Stage of(String id, String title, String goal) {
        return new Stage(id, title, goal, Map.of(), Map.of(), false, null, null, null);
    }

    /// Returns whether this stage asks the engine to edit its stage sequence.
    ///
    /// @return true if any positional attribute is set
    public boolean hasPositionalEdit() {
        return insertBefore != null || insertAfter != null || replaces != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Mutable builder used while walking a `<stage>` element.
    public static final class Builder {
        private String id;
        private String title = "";
        private String goal = "";
        private Map<String, String> verifiedArtifacts = new LinkedHashMap<>();
        private Map<String, String> requiredVariables = new LinkedHashMap<>();
        private boolean optional;
        private String insertBefore;
        private String insertAfter;
        private String replaces;

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

        public Builder insertBefore(String insertBefore) {
            this.insertBefore = insertBefore;
            return this;
        }

        public Builder insertAfter(String insertAfter) {
            this.insertAfter = insertAfter;
            return this;
        }

        public Builder replaces(String replaces) {
            this.replaces = replaces;
            return this;
        }

        public Stage build() {
            return new Stage(
                    id,
                    title,
                    goal,
                    verifiedArtifacts,
                    requiredVariables,
                    optional,
                    insertBefore,
                    insertAfter,
                    replaces);
        }
    }
}
