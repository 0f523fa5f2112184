package io.planbridge.core.markup;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.logging.Logger;
import java.util.regex.Matcher;

/// Completes markup that stopped before its elements were closed.
///
/// The open-tag stack is derived again from the repaired text, independently of the repair
/// engine: start tags push, empty-element tags are ignored, and a closing tag pops only when it
/// matches the top. Comments, CDATA sections and processing instructions are skipped. The
/// missing closing tags are appended innermost first, each on its own line.
///
/// Whatever the cut left unfinished at the very end is settled first: a CDATA section is
/// terminated, a comment or processing instruction is dropped, and so is a partial tag.
///
/// Stateless and thread-safe.
public final class TruncationRecovery {

    private static final Logger LOG = Logger.getLogger(TruncationRecovery.class.getName());

    /// Appends closing tags for every element left open.
    ///
    /// @param repairedText markup after sanitizing and tag repair, not null
    /// @return completed markup, or empty if nothing was left unfinished
    public Optional<String> complete(String repairedText) {
        Objects.requireNonNull(repairedText, "repairedText must not be null");
        String stripped = repairedText.strip();

        Deque<String> open = new ArrayDeque<>();
        Matcher matcher = MarkupTokens.matcher(stripped);
        int scanned = 0;
        int cutSection = -1;
        String terminator = "";
        while (matcher.find()) {
            scanned = matcher.end();
            if (MarkupTokens.isOpaque(matcher)) {
                terminator = MarkupTokens.missingTerminator(matcher.group(MarkupTokens.OPAQUE));
                if (!terminator.isEmpty()) {
                    cutSection = matcher.start();
                }
                continue;
            }
            String name = matcher.group(MarkupTokens.NAME);
            if (MarkupTokens.isEndTag(matcher)) {
                if (!open.isEmpty() && open.peek().equals(name)) {
                    open.pop();
                }
            } else if (!MarkupTokens.isSelfClosing(matcher)) {
                open.push(name);
            }
        }

        String text = settleEnd(stripped, scanned, cutSection, terminator);
        if (open.isEmpty() && text.equals(stripped)) {
            return Optional.empty();
        }
        if (open.isEmpty()) {
            LOG.warning("Incomplete response detected. Dropped unfinished trailing markup");
            return Optional.of(text);
        }

        LOG.warning("Incomplete response detected. Unclosed tags: " + open);
        StringJoiner closers = new StringJoiner("\n");
        Iterator<String> innermostFirst = open.iterator();
        while (innermostFirst.hasNext()) {
            closers.add("</" + innermostFirst.next() + ">");
        }
        return Optional.of(text + "\n" + closers);
    }

    private static String settleEnd(String text, int scanned, int cutSection, String terminator) {
        if (cutSection >= 0) {
            if (terminator.equals("]]>")) {
                return text + terminator;
            }
            return text.substring(0, cutSection).strip();
        }
        int dangling = text.indexOf('<', scanned);
        if (dangling >= 0) {
            return text.substring(0, dangling).strip();
        }
        return text;
    }
}
