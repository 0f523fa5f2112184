package io.planbridge.core.markup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import io.planbridge.core.markup.MarkupSyntaxException.Reason;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MarkupTreeBuilderTest {

    private final MarkupTreeBuilder builder = new MarkupTreeBuilder();

    @Nested
    class WellFormed {

        @Test
        void shouldBuildElementsAttributesAndText() throws MarkupSyntaxException {
            List<MarkupNode> roots =
                    builder.build("<stage id=\"s1\" title='Intro'>\n  <goal>Begin</goal>\n</stage>");

            assertThat(roots).hasSize(1);
            MarkupNode stage = roots.get(0);
            assertThat(stage.name()).isEqualTo("stage");
            assertThat(stage.attributes()).containsExactly(entry("id", "s1"), entry("title", "Intro"));
            assertThat(stage.childText("goal")).contains("Begin");
            assertThat(stage.line()).isEqualTo(1);
            assertThat(stage.child("goal").orElseThrow().line()).isEqualTo(2);
        }

        @Test
        void shouldDecodePredefinedAndNumericEntities() throws MarkupSyntaxException {
            MarkupNode goal = builder.build("<goal a=\"x &amp; y\">1 &lt; 2 &#65;&#x42;</goal>").get(0);

            assertThat(goal.attribute("a")).isEqualTo("x & y");
            assertThat(goal.text()).isEqualTo("1 < 2 AB");
        }

        @Test
        void shouldSkipPrologCommentsAndDoctype() throws MarkupSyntaxException {
            List<MarkupNode> roots =
                    builder.build(
                            "<?xml version=\"1.0\"?>\n<!DOCTYPE steps [<!ELEMENT steps ANY>]>\n"
                                    + "<!-- generated --><steps/>");

            assertThat(roots).extracting(MarkupNode::name).containsExactly("steps");
            assertThat(roots.get(0).line()).isEqualTo(3);
        }

        @Test
        void shouldKeepCdataVerbatim() throws MarkupSyntaxException {
            MarkupNode task = builder.build("<task><![CDATA[if a < b && c]]></task>").get(0);

            assertThat(task.text()).isEqualTo("if a < b && c");
        }

        @Test
        void shouldIgnoreProcessingInstructionsInsideElements() throws MarkupSyntaxException {
            MarkupNode steps = builder.build("<steps><?render fast?><step id=\"a\"/></steps>").get(0);

            assertThat(steps.children()).extracting(MarkupNode::name).containsExactly("step");
        }

        @Test
        void shouldReturnSeveralTopLevelElements() throws MarkupSyntaxException {
            List<MarkupNode> roots = builder.build("<stages></stages>\n<focus>Next</focus>");

            assertThat(roots).extracting(MarkupNode::name).containsExactly("stages", "focus");
            assertThat(roots.get(1).text()).isEqualTo("Next");
        }

        @Test
        void shouldIgnoreTextBetweenTopLevelElements() throws MarkupSyntaxException {
            List<MarkupNode> roots = builder.build("<stages/> and then <focus>Next</focus> done");

            assertThat(roots).extracting(MarkupNode::name).containsExactly("stages", "focus");
        }
    }

    @Nested
    class EndOfInput {

        @Test
        void shouldReportOpenElementsAtEndOfInput() {
            assertThatThrownBy(() -> builder.build("<stages><stage id=\"s1\"><goal>Begin"))
                    .isInstanceOfSatisfying(
                            MarkupSyntaxException.class,
                            e -> {
                                assertThat(e.reason()).isEqualTo(Reason.END_OF_INPUT);
                                assertThat(e.getMessage())
                                        .isEqualTo("no element found: line 1, column 35");
                            });
        }

        @Test
        void shouldReportInputEndingInsideAttributeValue() {
            assertThatThrownBy(() -> builder.build("<stages><stage id=\"s1"))
                    .isInstanceOfSatisfying(
                            MarkupSyntaxException.class,
                            e -> assertThat(e.isEndOfInput()).isTrue());
        }

        @Test
        void shouldReportInputEndingInsideClosingTag() {
            assertThatThrownBy(() -> builder.build("<steps>\n  <step id=\"a\">\n  </st"))
                    .isInstanceOfSatisfying(
                            MarkupSyntaxException.class,
                            e -> {
                                assertThat(e.isEndOfInput()).isTrue();
                                assertThat(e.line()).isEqualTo(3);
                                assertThat(e.column()).isEqualTo(7);
                            });
        }

        @Test
        void shouldReportInputEndingInsideComment() {
            assertThatThrownBy(() -> builder.build("<stages><!-- still thinking"))
                    .isInstanceOfSatisfying(
                            MarkupSyntaxException.class,
                            e -> assertThat(e.reason()).isEqualTo(Reason.END_OF_INPUT));
        }

        @Test
        void shouldReportMissingRootElement() {
            assertThatThrownBy(() -> builder.build("  \n <!-- nothing -->"))
                    .isInstanceOfSatisfying(
                            MarkupSyntaxException.class,
                            e -> assertThat(e.reason()).isEqualTo(Reason.END_OF_INPUT));
        }
    }

    @Nested
    class Malformed {

        @Test
        void shouldRejectMismatchedClosingTagWithLocation() {
            assertThatThrownBy(() -> builder.build("<a>\n  <b>x</c>\n</a>"))
                    .isInstanceOfSatisfying(
                            MarkupSyntaxException.class,
                            e -> {
                                assertThat(e.reason()).isEqualTo(Reason.MALFORMED);
                                assertThat(e.line()).isEqualTo(2);
                                assertThat(e.getMessage()).contains(": line 2, column ");
                            });
        }

        @Test
        void shouldRejectAttributeWithoutValue() {
            assertThatThrownBy(() -> builder.build("<stage mandatory>x</stage>"))
                    .isInstanceOfSatisfying(
                            MarkupSyntaxException.class,
                            e -> {
                                assertThat(e.reason()).isEqualTo(Reason.MALFORMED);
                                assertThat(e.line()).isEqualTo(1);
                            });
        }

        @Test
        void shouldRejectDuplicateAttribute() {
            assertThatThrownBy(() -> builder.build("<stages>\n<stage id=\"a\" id=\"b\"/>\n</stages>"))
                    .isInstanceOfSatisfying(
                            MarkupSyntaxException.class,
                            e -> {
                                assertThat(e.reason()).isEqualTo(Reason.MALFORMED);
                                assertThat(e.line()).isEqualTo(2);
                            });
        }

        @Test
        void shouldRejectUndeclaredEntity() {
            assertThatThrownBy(() -> builder.build("<goal>a &nbsp; b</goal>"))
                    .isInstanceOfSatisfying(
                            MarkupSyntaxException.class,
                            e -> assertThat(e.reason()).isEqualTo(Reason.MALFORMED));
        }

        @Test
        void shouldRejectDoctypeAfterContent() {
            String markup =
                    "<steps/>\n<!DOCTYPE x [<!ENTITY ext SYSTEM \"file:///etc/passwd\">]>\n<a>&ext;</a>";

            assertThatThrownBy(() -> builder.build(markup))
                    .isInstanceOfSatisfying(
                            MarkupSyntaxException.class,
                            e -> {
                                assertThat(e.reason()).isEqualTo(Reason.MALFORMED);
                                assertThat(e.line()).isEqualTo(2);
                            });
        }

        @Test
        void shouldRejectUnexpectedClosingTagWithoutNamingTheWrapper() {
            assertThatThrownBy(() -> builder.build("<a></a></b>"))
                    .isInstanceOfSatisfying(
                            MarkupSyntaxException.class,
                            e -> {
                                assertThat(e.reason()).isEqualTo(Reason.MALFORMED);
                                assertThat(e.getMessage()).doesNotContain("planbridge-document");
                            });
        }
    }

    @Test
    void shouldBlankPrologWithoutMovingContent() {
        String text = "<?xml version=\"1.0\"?>\n<steps/>";

        String blanked = MarkupTreeBuilder.blankProlog(text);

        assertThat(blanked).hasSameSizeAs(text).endsWith("\n<steps/>");
        assertThat(blanked.substring(0, blanked.indexOf('\n'))).isBlank();
    }
}
