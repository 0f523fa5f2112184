package io.planbridge.core.markup;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;

/// Rewrites closing tags that do not match the innermost open element.
///
/// The engine keeps a stack of open element names. A closing tag whose name differs from the
/// top of the stack is rewritten to close the top, and the top is popped either way. Closing
/// tags seen with an empty stack are left alone for the structural parser to reject.
///
/// Comments, CDATA sections and processing instructions are skipped, so tag-like text inside
/// them is never rewritten. Opening tags are trusted as written: swapped or otherwise wrong
/// opening nesting is not detected, only the closing side is forced to agree with it.
///
/// Stateless and thread-safe; the stack lives for one {@link #repair(String)} call.
public final class TagRepairEngine {

    private static final Logger LOG = Logger.getLogger(TagRepairEngine.class.getName());

    /// Result of one repair pass.
    ///
    /// @param text repaired markup, not null
    /// @param repairs corrections in document order, not null
    public record RepairResult(String text, List<RepairLogEntry> repairs) {
        public RepairResult {
            Objects.requireNonNull(text, "text must not be null");
            repairs = List.copyOf(repairs);
        }

        public boolean changed() {
            return !repairs.isEmpty();
        }
    }

    /// Repairs mismatched closing tags.
    ///
    /// @param text sanitized markup, not null
    /// @return repaired text with the list of corrections, never null
    public RepairResult repair(String text) {
        Objects.requireNonNull(text, "text must not be null");
        Matcher matcher = MarkupTokens.matcher(text);
        Deque<String> open = new ArrayDeque<>();
        List<RepairLogEntry> repairs = new ArrayList<>();
        StringBuilder out = new StringBuilder(text.length());
        int last = 0;

        while (matcher.find()) {
            if (MarkupTokens.isOpaque(matcher)) {
                continue;
            }
            String name = matcher.group(MarkupTokens.NAME);
            if (!MarkupTokens.isEndTag(matcher)) {
                if (!MarkupTokens.isSelfClosing(matcher)) {
                    open.push(name);
                }
                continue;
            }
            if (open.isEmpty()) {
                continue;
            }
            String expected = open.pop();
            if (!name.equals(expected)) {
                int line = MarkupTokens.lineAt(text, matcher.start());
                LOG.warning(
                        "Fixing mismatched closing tag </"
                                + name
                                + "> at line "
                                + line
                                + ", expected </"
                                + expected
                                + ">");
                repairs.add(new RepairLogEntry(line, name, expected));
                out.append(text, last, matcher.start()).append("</").append(expected).append('>');
                last = matcher.end();
            }
        }
        if (repairs.isEmpty()) {
            return new RepairResult(text, List.of());
        }
        out.append(text, last, text.length());
        return new RepairResult(out.toString(), repairs);
    }
}
