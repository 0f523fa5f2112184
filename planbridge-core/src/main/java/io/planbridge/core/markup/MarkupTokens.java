package io.planbridge.core.markup;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Tag token grammar shared by the sanitizer, the repair engine and truncation recovery.
final class MarkupTokens {

    /// A comment, CDATA section or processing instruction, or else a start, end or empty-element
    /// tag.
    ///
    /// Group 1 holds the whole opaque section when one matched; such a section ends at its
    /// terminator or, if it was cut off, at the end of input. Tag-like text inside it is not a
    /// tag. For tags group 2 is `/` for end tags, group 3 the name, group 4 the attribute
    /// remainder including a trailing `/` for empty elements. Quoted attribute values may
    /// contain `>`.
    static final Pattern TOKEN =
            Pattern.compile(
                    "(<!--.*?(?:-->|\\z)|<!\\[CDATA\\[.*?(?:]]>|\\z)|<\\?.*?(?:\\?>|\\z))"
                            + "|<(/?)([A-Za-z_][\\w:.-]*)((?:\"[^\"]*\"|'[^']*'|[^'\">])*)>",
                    Pattern.DOTALL);

    static final int OPAQUE = 1;
    static final int SLASH = 2;
    static final int NAME = 3;
    static final int REMAINDER = 4;

    private MarkupTokens() {}

    static Matcher matcher(CharSequence text) {
        return TOKEN.matcher(text);
    }

    static boolean isOpaque(Matcher token) {
        return token.group(OPAQUE) != null;
    }

    static boolean isEndTag(Matcher token) {
        return !token.group(SLASH).isEmpty();
    }

    static boolean isSelfClosing(Matcher token) {
        return token.group(REMAINDER).strip().endsWith("/");
    }

    /// Returns the terminator an opaque section lacks, or an empty string if it is complete.
    static String missingTerminator(String section) {
        if (section.startsWith("<!--")) {
            return section.length() >= 7 && section.endsWith("-->") ? "" : "-->";
        }
        if (section.startsWith("<![CDATA[")) {
            return section.length() >= 12 && section.endsWith("]]>") ? "" : "]]>";
        }
        return section.length() >= 4 && section.endsWith("?>") ? "" : "?>";
    }

    /// Returns the 1-based line of `offset` in `text`.
    static int lineAt(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
