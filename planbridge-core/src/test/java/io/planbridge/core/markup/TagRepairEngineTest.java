package io.planbridge.core.markup;

import static org.assertj.core.api.Assertions.assertThat;

import io.planbridge.core.markup.TagRepairEngine.RepairResult;
import org.junit.jupiter.api.Test;

class TagRepairEngineTest {

    private final TagRepairEngine engine = new TagRepairEngine();

    @Test
    void shouldLeaveWellFormedMarkupUnchanged() {
        String markup = "<stages><stage id=\"s1\"><goal>Begin</goal></stage></stages>";

        RepairResult result = engine.repair(markup);

        assertThat(result.text()).isEqualTo(markup);
        assertThat(result.repairs()).isEmpty();
        assertThat(result.changed()).isFalse();
    }

    @Test
    void shouldRewriteMismatchedClosingTagToInnermostOpenElement() {
        RepairResult result =
                engine.repair("<stages><stage id=\"s1\"><goal>Begin</goal></Section></stages>");

        assertThat(result.text())
                .isEqualTo("<stages><stage id=\"s1\"><goal>Begin</goal></stage></stages>");
        assertThat(result.repairs()).containsExactly(new RepairLogEntry(1, "Section", "stage"));
    }

    @Test
    void shouldReportLineOfEachCorrection() {
        String markup = "<steps>\n  <step id=\"a\">\n    <goal>x</goal>\n  </stpe>\n</stepz>";

        RepairResult result = engine.repair(markup);

        assertThat(result.text())
                .isEqualTo("<steps>\n  <step id=\"a\">\n    <goal>x</goal>\n  </step>\n</steps>");
        assertThat(result.repairs())
                .containsExactly(
                        new RepairLogEntry(4, "stpe", "step"), new RepairLogEntry(5, "stepz", "steps"));
    }

    @Test
    void shouldNotPushSelfClosingTags() {
        String markup = "<inputs><variable name=\"a\"/><variable name=\"b\" /></inputs>";

        RepairResult result = engine.repair(markup);

        assertThat(result.text()).isEqualTo(markup);
        assertThat(result.repairs()).isEmpty();
    }

    @Test
    void shouldPassThroughClosingTagWithEmptyStack() {
        String markup = "<goal>x</goal></extra>";

        RepairResult result = engine.repair(markup);

        assertThat(result.text()).isEqualTo(markup);
        assertThat(result.repairs()).isEmpty();
    }

    @Test
    void shouldTrustOpeningTagsEvenWhenNestingIsSwapped() {
        // <a><b> opened, closed as </a></b>: both closers get forced to the open order
        RepairResult result = engine.repair("<a><b>x</a></b>");

        assertThat(result.text()).isEqualTo("<a><b>x</b></a>");
        assertThat(result.repairs()).hasSize(2);
    }

    @Test
    void shouldIgnoreDeclarationsAndComments() {
        String markup = "<?xml version=\"1.0\"?><!-- note --><stages></stages>";

        assertThat(engine.repair(markup).text()).isEqualTo(markup);
    }

    @Test
    void shouldIgnoreTagLikeTextInsideCdataAndComments() {
        String markup =
                "<stages><!-- <stage> --><stage id=\"s1\"><goal><![CDATA[use <b> for bold]]></goal>"
                        + "<?note </stage>?></stage></stages>";

        RepairResult result = engine.repair(markup);

        assertThat(result.text()).isEqualTo(markup);
        assertThat(result.repairs()).isEmpty();
    }

    @Test
    void shouldStillRepairClosingTagsAfterComment() {
        RepairResult result = engine.repair("<steps><!-- </steps> --><step></stp></steps>");

        assertThat(result.text()).isEqualTo("<steps><!-- </steps> --><step></step></steps>");
        assertThat(result.repairs()).containsExactly(new RepairLogEntry(1, "stp", "step"));
    }
}
