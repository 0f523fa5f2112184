package io.planbridge.core.markup;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TruncationRecoveryTest {

    private final TruncationRecovery recovery = new TruncationRecovery();

    @Test
    void shouldCloseOpenElementsInnermostFirst() {
        assertThat(recovery.complete("<stages><stage id=\"s1\"><goal>Begin"))
                .contains("<stages><stage id=\"s1\"><goal>Begin\n</goal>\n</stage>\n</stages>");
    }

    @Test
    void shouldReturnEmptyWhenNothingIsOpen() {
        assertThat(recovery.complete("<stages><stage id=\"s1\"/></stages>")).isEmpty();
    }

    @Test
    void shouldIgnoreSelfClosingElements() {
        String truncated = "<behavior id=\"b1\">\n  <inputs>\n    <variable name=\"a\"/>";

        assertThat(recovery.complete(truncated))
                .contains(truncated + "\n</inputs>\n</behavior>");
    }

    @Test
    void shouldDropTagCutOffAtTheEnd() {
        assertThat(recovery.complete("<steps>\n  <step id=\"a\">\n    <goal>x</goal>\n  </st"))
                .contains("<steps>\n  <step id=\"a\">\n    <goal>x</goal>\n</step>\n</steps>");
    }

    @Test
    void shouldPopOnlyOnMatchingClosingTag() {
        // </other> does not match the top and leaves the stack alone
        assertThat(recovery.complete("<a><b>x</other>")).contains("<a><b>x</other>\n</b>\n</a>");
    }

    @Test
    void shouldFollowTagsSpanningLines() {
        assertThat(recovery.complete("<stages>\n<stage\n id=\"a\">"))
                .contains("<stages>\n<stage\n id=\"a\">\n</stage>\n</stages>");
    }

    @Test
    void shouldIgnoreTagsInsideCommentsAndCdata() {
        String truncated = "<stages><!-- <draft> --><goal><![CDATA[use <b> here]]>";

        assertThat(recovery.complete(truncated)).contains(truncated + "\n</goal>\n</stages>");
    }

    @Test
    void shouldTerminateCdataCutOffAtTheEnd() {
        assertThat(recovery.complete("<task><![CDATA[if a < b"))
                .contains("<task><![CDATA[if a < b]]>\n</task>");
    }

    @Test
    void shouldDropCommentCutOffAtTheEnd() {
        assertThat(recovery.complete("<steps>\n  <step id=\"a\"/>\n  <!-- <step id=\"b\">"))
                .contains("<steps>\n  <step id=\"a\"/>\n</steps>");
    }

    @Test
    void shouldDropCutOffTagEvenWhenNothingIsOpen() {
        assertThat(recovery.complete("<stages/>\n<foc")).contains("<stages/>");
    }
}
