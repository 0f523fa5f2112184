package io.planbridge.core.diagnostics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Renders a {@link ParseFailureReport} as a plain-text report.
///
/// The report lists the error, the error location with five lines of context either side, a
/// diagnostic analysis with hints keyed on the error message and tags that look unclosed, the
/// full parsed text and, when it differs, the response as received.
public final class DiagnosticReportFormatter {

    private static final String HEAVY_RULE = "=".repeat(80);
    private static final String RULE = "-".repeat(80);
    private static final int CONTEXT_LINES = 5;

    private static final Pattern LOCATION = Pattern.compile("line (\\d+), column (\\d+)");
    private static final Pattern OPENING_TAG = Pattern.compile("<(\\w+)[\\s>]");
    private static final Pattern CLOSING_TAG = Pattern.compile("</(\\w+)>");
    private static final Pattern UNESCAPED_TEXT = Pattern.compile(">[^<]*[<>&][^<]*<");

    /// Formats a report.
    ///
    /// @param report failure details, not null
    /// @param timestamp when the failure was recorded, not null
    /// @param sequence diagnostic sequence number
    /// @return report text, never null
    public String format(ParseFailureReport report, Instant timestamp, long sequence) {
        String message = report.errorMessage();
        String[] lines = report.parsedText().split("\n", -1);
        int lineNumber = 0;
        int column = 0;
        Matcher location = LOCATION.matcher(message);
        if (location.find()) {
            lineNumber = Integer.parseInt(location.group(1));
            column = Integer.parseInt(location.group(2));
        }

        List<String> out = new ArrayList<>();
        out.add(HEAVY_RULE);
        out.add("XML PARSING ERROR REPORT");
        out.add(HEAVY_RULE);
        out.add("");
        out.add("Timestamp: " + timestamp);
        out.add("Sequence: " + sequence);
        out.add("Error Type: " + report.errorType());
        out.add("Error Message: " + message);
        out.add("");

        if (lineNumber > 0 && column > 0) {
            out.add("Error Location: Line " + lineNumber + ", Column " + column);
            out.add("");
            out.add(RULE);
            out.add("ERROR CONTEXT (with line numbers):");
            out.add(RULE);
            int start = Math.max(0, lineNumber - CONTEXT_LINES - 1);
            int end = Math.min(lines.length, lineNumber + CONTEXT_LINES);
            for (int i = start; i < end; i++) {
                String marker = i == lineNumber - 1 ? ">>> " : "    ";
                out.add(marker + String.format(Locale.ROOT, "%4d", i + 1) + " | " + lines[i]);
                if (i == lineNumber - 1) {
                    out.add(" ".repeat(marker.length() + 7 + column - 1) + "^ ERROR HERE");
                }
            }
            out.add(RULE);
            out.add("");
        }

        out.add("DIAGNOSTIC ANALYSIS:");
        out.add(RULE);
        for (String diagnostic : analyze(report.parsedText(), message, lineNumber, lines)) {
            out.add(diagnostic.isEmpty() ? "" : "* " + diagnostic);
        }
        out.add("");

        out.add(RULE);
        out.add("FULL XML CONTENT:");
        out.add(RULE);
        out.add(report.parsedText());
        out.add("");
        if (!report.originalInput().equals(report.parsedText())) {
            out.add(RULE);
            out.add("ORIGINAL RESPONSE:");
            out.add(RULE);
            out.add(report.originalInput());
            out.add("");
        }
        out.add(HEAVY_RULE);
        out.add("END OF ERROR REPORT");
        out.add(HEAVY_RULE);
        return String.join("\n", out);
    }

    List<String> analyze(String text, String message, int lineNumber, String[] lines) {
        List<String> hints = new ArrayList<>();
        String lower = message.toLowerCase(Locale.ROOT);
        String errorLine =
                lineNumber > 0 && lineNumber <= lines.length ? lines[lineNumber - 1] : null;

        if (lower.contains("well-formed")) {
            hints.add("Markup is not well-formed. Common causes:");
            hints.add("  - special characters (<, >, &) not escaped");
            hints.add("  - missing closing tags");
            hints.add("  - invalid characters in attribute values");
        }
        if (lower.contains("mismatched tag") || lower.contains("matching end-tag")) {
            hints.add("Mismatched tags detected. Check that every opening tag has a matching,");
            hints.add("  correctly spelled and correctly nested closing tag");
            if (errorLine != null) {
                Matcher closing = CLOSING_TAG.matcher(errorLine);
                if (closing.find()) {
                    hints.add("  - found closing tag: </" + closing.group(1) + ">");
                    hints.add("  - search for matching opening tag: <" + closing.group(1) + ">");
                }
            }
        }
        if (lower.contains("no element found")) {
            hints.add("Input ended before the document was complete; the response was probably truncated");
        }
        if (lower.contains("attribute")) {
            hints.add("Attribute problem: every attribute needs exactly one quoted value");
        }

        List<String> unclosed = unclosedTags(text);
        if (!unclosed.isEmpty()) {
            hints.add("");
            hints.add("Potentially unclosed tags:");
            unclosed.forEach(tag -> hints.add("  - <" + tag + ">"));
        }
        if (errorLine != null && UNESCAPED_TEXT.matcher(errorLine).find()) {
            hints.add("");
            hints.add("Possible unescaped special characters in text content on the error line");
        }
        return hints;
    }

    private static List<String> unclosedTags(String text) {
        Map<String, Integer> balance = new LinkedHashMap<>();
        Matcher opening = OPENING_TAG.matcher(text);
        while (opening.find()) {
            balance.merge(opening.group(1), 1, Integer::sum);
        }
        Matcher closing = CLOSING_TAG.matcher(text);
        while (closing.find()) {
            balance.merge(closing.group(1), -1, Integer::sum);
        }
        List<String> unclosed = new ArrayList<>();
        balance.forEach(
                (tag, count) -> {
                    if (count > 0) {
                        unclosed.add(tag + " (missing " + count + " closing tag(s))");
                    }
                });
        return unclosed;
    }
}
