package io.planbridge.core.diagnostics;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class DiagnosticReportFormatterTest {

    private static final Instant NOW = Instant.parse("2025-03-14T09:26:53.589Z");

    private final DiagnosticReportFormatter formatter = new DiagnosticReportFormatter();

    @Test
    void shouldRenderContextWithMarkerAndColumnPointer() {
        String parsed = "<a>\n  <b>x</c>\n</a>";
        ParseFailureReport report =
                new ParseFailureReport("MALFORMED", "mismatched tag: line 2, column 7", parsed, parsed);

        String text = formatter.format(report, NOW, 4);

        assertThat(text)
                .startsWith("=".repeat(80) + "\nXML PARSING ERROR REPORT\n")
                .contains("Timestamp: 2025-03-14T09:26:53.589Z")
                .contains("Sequence: 4")
                .contains("Error Message: mismatched tag: line 2, column 7")
                .contains("Error Location: Line 2, Column 7")
                .contains("       1 | <a>\n>>>    2 |   <b>x</c>\n" + " ".repeat(17) + "^ ERROR HERE\n")
                .contains("       3 | </a>")
                .contains("FULL XML CONTENT:\n" + "-".repeat(80) + "\n" + parsed)
                .doesNotContain("ORIGINAL RESPONSE:")
                .endsWith("END OF ERROR REPORT\n" + "=".repeat(80));
    }

    @Test
    void shouldAnalyzeMismatchedAndUnclosedTags() {
        String parsed = "<a>\n  <b>x</c>\n</a>";
        ParseFailureReport report =
                new ParseFailureReport("MALFORMED", "mismatched tag: line 2, column 7", parsed, parsed);

        String text = formatter.format(report, NOW, 1);

        assertThat(text)
                .contains("* Mismatched tags detected.")
                .contains("*   - found closing tag: </c>")
                .contains("Potentially unclosed tags:")
                .contains("*   - <b (missing 1 closing tag(s))>");
    }

    @Test
    void shouldRecognizeParserMessageForMissingEndTag() {
        String parsed = "<a>\n  <b>x</c>\n</a>";
        String message =
                "The element type \"b\" must be terminated by the matching end-tag \"</b>\".: line 2, column 11";

        String text = formatter.format(new ParseFailureReport("MALFORMED", message, parsed, parsed), NOW, 1);

        assertThat(text)
                .contains("Error Location: Line 2, Column 11")
                .contains("* Mismatched tags detected.")
                .contains("*   - found closing tag: </c>");
    }

    @Test
    void shouldHintAtAttributeProblems() {
        String parsed = "<stages>\n<stage id=\"a\" id=\"b\"/>\n</stages>";
        String message =
                "Attribute \"id\" was already specified for element \"stage\".: line 2, column 23";

        String text = formatter.format(new ParseFailureReport("MALFORMED", message, parsed, parsed), NOW, 1);

        assertThat(text).contains("* Attribute problem: every attribute needs exactly one quoted value");
    }

    @Test
    void shouldOmitLocationWhenMessageHasNone() {
        ParseFailureReport report = new ParseFailureReport("MALFORMED", "broken", "<a>", "<a>");

        String text = formatter.format(report, NOW, 1);

        assertThat(text).doesNotContain("Error Location").doesNotContain("ERROR HERE");
    }

    @Test
    void shouldIncludeOriginalResponseWhenItDiffersFromParsedText() {
        ParseFailureReport report =
                new ParseFailureReport(
                        "END_OF_INPUT", "no element found: line 1, column 9", "<a>R&amp;D", "<a>R&D");

        String text = formatter.format(report, NOW, 1);

        assertThat(text)
                .contains("ORIGINAL RESPONSE:\n" + "-".repeat(80) + "\n<a>R&D")
                .contains("probably truncated");
    }
}
