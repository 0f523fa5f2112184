package io.planbridge.core.markup;

import io.planbridge.core.plan.Behavior;
import io.planbridge.core.plan.EmptyPayload;
import io.planbridge.core.plan.ParsedWorkflow;
import io.planbridge.core.plan.PlanPayload;
import io.planbridge.core.plan.Reflection;
import io.planbridge.core.plan.Stage;
import io.planbridge.core.plan.Step;
import io.planbridge.core.plan.StepPlan;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Maps parsed markup trees onto the plan model.
///
/// ### Root selection
///
/// A single `<response>` root is unwrapped. Among the remaining top-level elements the
/// first one named `workflow`, `stages`, `steps`, `behavior` or
/// `reflection` is mapped; a sibling `<focus>` supplies the focus when the root has
/// none. Anything else yields an {@link EmptyPayload} and a warning, never an error.
///
/// ### Content rules
///
/// - text is trimmed
/// - `variable`, `artifact` and `criterion` children without a
///   `name` attribute are skipped where a name is required
/// - `optional` is true for `true`, `True` or `1`
/// - stage and step lists accept `remaining`, `current` and `completed`
///   wrappers as well as direct children, in document order
///
/// No semantic validation is done: duplicate ids or dangling positional references pass
/// through for the engine to judge.
public final class PlanDocumentMapper {

    private static final Logger LOG = Logger.getLogger(PlanDocumentMapper.class.getName());

    private static final Set<String> KNOWN_ROOTS =
            Set.of("workflow", "stages", "steps", "behavior", "reflection");
    private static final Set<String> LIST_WRAPPERS = Set.of("remaining", "current", "completed");
    private static final Set<String> TRUE_VALUES = Set.of("true", "True", "1");

    /// Maps the top-level elements of one response.
    ///
    /// @param roots top-level elements in document order, not null or empty
    /// @return mapped payload, never null
    public PlanPayload map(List<MarkupNode> roots) {
        Objects.requireNonNull(roots, "roots must not be null");
        if (roots.isEmpty()) {
            throw new IllegalArgumentException("roots must not be empty");
        }
        List<MarkupNode> forest = roots;
        if (roots.size() == 1 && roots.get(0).name().equals("response")) {
            forest = roots.get(0).children();
        }

        MarkupNode root = null;
        String siblingFocus = null;
        for (MarkupNode node : forest) {
            if (root == null && KNOWN_ROOTS.contains(node.name())) {
                root = node;
            } else if (siblingFocus == null && node.name().equals("focus")) {
                siblingFocus = node.trimmedText();
            }
        }
        if (root == null) {
            String name = forest.isEmpty() ? roots.get(0).name() : forest.get(0).name();
            LOG.warning("Unknown root tag: " + name);
            return new EmptyPayload(name);
        }
        if (forest.size() > 1) {
            LOG.info("Selected <" + root.name() + "> among " + forest.size() + " top-level elements");
        }

        return switch (root.name()) {
            case "workflow" -> workflow(root, siblingFocus);
            case "stages" -> stages(root, siblingFocus);
            case "steps" -> steps(root, siblingFocus);
            case "behavior" -> behavior(root);
            case "reflection" -> reflection(root);
            default -> throw new IllegalStateException("Unhandled root: " + root.name());
        };
    }

    private ParsedWorkflow workflow(MarkupNode root, String siblingFocus) {
        String title = root.childText("title").orElse(null);
        String description = root.childText("description").orElse(null);
        String focus = root.childText("focus").orElse(null);
        List<Stage> stages = new ArrayList<>();
        for (MarkupNode child : root.children()) {
            if (child.name().equals("stages")) {
                ParsedWorkflow nested = stages(child, null);
                stages.addAll(nested.stages());
                title = firstNonBlank(title, nested.title());
                description = firstNonBlank(description, nested.description());
                focus = firstNonBlank(focus, nested.focus());
            } else if (child.name().equals("stage")) {
                stages.add(stage(child));
            }
        }
        return new ParsedWorkflow(title, description, firstNonBlank(focus, siblingFocus), stages);
    }

    private ParsedWorkflow stages(MarkupNode root, String siblingFocus) {
        List<Stage> stages = new ArrayList<>();
        for (MarkupNode child : root.children()) {
            if (child.name().equals("stage")) {
                stages.add(stage(child));
            } else if (LIST_WRAPPERS.contains(child.name())) {
                child.children("stage").forEach(stage -> stages.add(stage(stage)));
            }
        }
        return new ParsedWorkflow(
                root.childText("title").orElse(null),
                root.childText("description").orElse(null),
                firstNonBlank(root.childText("focus").orElse(null), siblingFocus),
                stages);
    }

    private Stage stage(MarkupNode node) {
        return Stage.builder()
                .id(node.attribute("id"))
                .title(trimmedAttribute(node, "title"))
                .goal(node.childText("goal").orElse(""))
                .verifiedArtifacts(namedValues(node.child("verified_artifacts"), "variable"))
                .requiredVariables(namedValues(node.child("required_variables"), "variable"))
                .optional(isTrue(node.attribute("optional")))
                .insertBefore(node.attribute("insert_before"))
                .insertAfter(node.attribute("insert_after"))
                .replaces(node.attribute("replaces"))
                .build();
    }

    private StepPlan steps(MarkupNode root, String siblingFocus) {
        List<Step> steps = new ArrayList<>();
        for (MarkupNode child : root.children()) {
            if (child.name().equals("step")) {
                steps.add(step(child));
            } else if (LIST_WRAPPERS.contains(child.name())) {
                child.children("step").forEach(step -> steps.add(step(step)));
            }
        }
        return new StepPlan(
                firstNonBlank(root.childText("focus").orElse(null), siblingFocus),
                root.childText("goals").orElse(null),
                steps);
    }

    private Step step(MarkupNode node) {
        return Step.builder()
                .id(node.attribute("id"))
                .title(trimmedAttribute(node, "title"))
                .goal(node.childText("goal").orElse(""))
                .verifiedArtifacts(namedValues(node.child("verified_artifacts"), "variable"))
                .requiredVariables(namedValues(node.child("required_variables"), "variable"))
                .optional(isTrue(node.attribute("optional")))
                .considerations(textByTag(node.child("pcs_considerations")))
                .build();
    }

    private Behavior behavior(MarkupNode root) {
        Behavior.Builder builder =
                Behavior.builder()
                        .id(root.attribute("id"))
                        .stepId(root.attribute("step_id"))
                        .agent(root.childText("agent").orElse(""))
                        .task(root.childText("task").orElse(""))
                        .inputs(namedValues(root.child("inputs"), "variable"))
                        .outputs(namedValues(root.child("outputs"), "artifact"))
                        .acceptance(texts(root.child("acceptance"), "criterion"))
                        .whatHappened(textByTag(root.child("whathappened")));
        root.childText("effects")
                .filter(effects -> !effects.equalsIgnoreCase("false"))
                .ifPresent(builder::effects);
        return builder.build();
    }

    private Reflection reflection(MarkupNode root) {
        boolean complete =
                "true".equalsIgnoreCase(
                        firstNonBlank(
                                root.attribute("current_step_is_complete"),
                                root.attribute("behavior_is_complete")));

        String nextState =
                root.child("decision").flatMap(decision -> decision.childText("next_state")).orElse(null);

        Map<String, String> variables = new LinkedHashMap<>();
        Map<String, String> whatHappened = new LinkedHashMap<>();
        Map<String, String> recommendations = new LinkedHashMap<>();
        Optional<MarkupNode> context = root.child("context_for_next");
        if (context.isPresent()) {
            context.get()
                    .child("variables_produced")
                    .ifPresent(
                            produced -> {
                                for (MarkupNode variable : produced.children("variable")) {
                                    String name = variable.attribute("name");
                                    if (name != null) {
                                        String value = variable.attribute("value");
                                        variables.put(name, value != null ? value : variable.trimmedText());
                                    }
                                }
                            });
            whatHappened.putAll(textByTag(context.get().child("whathappened")));
            recommendations.putAll(textByTag(context.get().child("recommendations_for_next")));
        }

        List<Reflection.ArtifactStatus> artifacts = new ArrayList<>();
        root.child("evaluation")
                .flatMap(evaluation -> evaluation.child("artifacts_produced"))
                .ifPresent(
                        produced -> {
                            for (MarkupNode artifact : produced.children("artifact")) {
                                String name = artifact.attribute("name");
                                if (name != null) {
                                    artifacts.add(
                                            new Reflection.ArtifactStatus(
                                                    name, artifact.attribute("status")));
                                }
                            }
                        });

        Optional<MarkupNode> tracking = root.child("outputs_tracking_update");
        Reflection.OutputsTracking outputs =
                tracking.isEmpty()
                        ? Reflection.OutputsTracking.empty()
                        : new Reflection.OutputsTracking(
                                texts(tracking.get().child("produced"), "artifact"),
                                texts(tracking.get().child("in_progress"), "artifact"),
                                texts(tracking.get().child("remaining"), "artifact"));

        return new Reflection(
                complete, nextState, variables, artifacts, outputs, whatHappened, recommendations);
    }

    /// `<x name="k">v</x>` children as an ordered map; unnamed children are skipped.
    private static Map<String, String> namedValues(Optional<MarkupNode> container, String childName) {
        Map<String, String> values = new LinkedHashMap<>();
        container.ifPresent(
                node -> {
                    for (MarkupNode child : node.children(childName)) {
                        String name = child.attribute("name");
                        if (name != null && !name.isEmpty()) {
                            values.put(name, child.trimmedText());
                        }
                    }
                });
        return values;
    }

    private static List<String> texts(Optional<MarkupNode> container, String childName) {
        List<String> texts = new ArrayList<>();
        container.ifPresent(
                node -> {
                    for (MarkupNode child : node.children(childName)) {
                        String text = child.trimmedText();
                        if (!text.isEmpty()) {
                            texts.add(text);
                        }
                    }
                });
        return texts;
    }

    private static Map<String, String> textByTag(Optional<MarkupNode> container) {
        Map<String, String> texts = new LinkedHashMap<>();
        container.ifPresent(
                node -> {
                    for (MarkupNode child : node.children()) {
                        String text = child.trimmedText();
                        if (!text.isEmpty()) {
                            texts.put(child.name(), text);
                        }
                    }
                });
        return texts;
    }

    private static String trimmedAttribute(MarkupNode node, String name) {
        String value = node.attribute(name);
        return value != null ? value.strip() : "";
    }

    private static boolean isTrue(String value) {
        return value != null && TRUE_VALUES.contains(value.strip());
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }
}
