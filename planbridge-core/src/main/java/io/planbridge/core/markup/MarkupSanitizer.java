package io.planbridge.core.markup;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Makes backend markup acceptable to a strict parser without changing its structure.
///
/// Two passes run in order:
///
/// 1. bare boolean attributes (`<stage optional>`) are given the value `"true"`
/// 2. text content is escaped: `&` that does not start an entity, `>`, and any
///   `<` that cannot start a tag
///
/// Tags, comments, CDATA sections and processing instructions are copied unchanged, including
/// `>` inside quoted attribute values. Sanitizing already-sanitized text returns it unchanged.
///
/// Stateless and thread-safe.
public final class MarkupSanitizer {

    /// Attribute names that the backend emits without a value.
    public static final Set<String> BOOLEAN_ATTRIBUTES =
            Set.of("optional", "required", "disabled", "enabled", "hidden");

    private static final Pattern ENTITY =
            Pattern.compile("&(?:lt|gt|amp|quot|apos|#\\d+|#x[0-9a-fA-F]+);");

    /// Runs both passes.
    ///
    /// @param text raw markup, not null
    /// @return sanitized markup, never null
    public String sanitize(String text) {
        return escapeTextContent(quoteBooleanAttributes(text));
    }

    /// Rewrites bare boolean attributes inside start tags to `name="true"`. Comments, CDATA
    /// sections and processing instructions are left alone.
    ///
    /// @param text markup, not null
    /// @return markup with boolean attributes quoted
    public String quoteBooleanAttributes(String text) {
        Matcher matcher = MarkupTokens.matcher(text);
        StringBuilder out = new StringBuilder(text.length() + 16);
        int last = 0;
        while (matcher.find()) {
            if (MarkupTokens.isOpaque(matcher)
                    || MarkupTokens.isEndTag(matcher)
                    || matcher.group(MarkupTokens.REMAINDER).isEmpty()) {
                continue;
            }
            String remainder = matcher.group(MarkupTokens.REMAINDER);
            String rewritten = quoteBareAttributes(remainder);
            if (!rewritten.equals(remainder)) {
                out.append(text, last, matcher.start(MarkupTokens.REMAINDER)).append(rewritten);
                last = matcher.end(MarkupTokens.REMAINDER);
            }
        }
        if (last == 0) {
            return text;
        }
        return out.append(text, last, text.length()).toString();
    }

    private static String quoteBareAttributes(String remainder) {
        StringBuilder out = new StringBuilder(remainder.length() + 16);
        int i = 0;
        int n = remainder.length();
        boolean valueExpected = false;
        while (i < n) {
            char c = remainder.charAt(i);
            if (c == '"' || c == '\'') {
                int close = remainder.indexOf(c, i + 1);
                int end = close < 0 ? n : close + 1;
                out.append(remainder, i, end);
                i = end;
                valueExpected = false;
            } else if (isNameChar(c)) {
                int start = i;
                while (i < n && isNameChar(remainder.charAt(i))) {
                    i++;
                }
                String name = remainder.substring(start, i);
                out.append(name);
                if (!valueExpected
                        && !hasValue(remainder, i)
                        && BOOLEAN_ATTRIBUTES.contains(name)
                        && (i == n
                                || Character.isWhitespace(remainder.charAt(i))
                                || remainder.charAt(i) == '/')) {
                    out.append("=\"true\"");
                }
                valueExpected = false;
            } else {
                if (c == '=') {
                    valueExpected = true;
                }
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static boolean hasValue(String remainder, int from) {
        int i = from;
        while (i < remainder.length() && Character.isWhitespace(remainder.charAt(i))) {
            i++;
        }
        return i < remainder.length() && remainder.charAt(i) == '=';
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ':' || c == '.';
    }

    /// Escapes characters in text content that a strict parser would reject.
    ///
    /// @param text markup, not null
    /// @return markup with text content escaped
    public String escapeTextContent(String text) {
        StringBuilder out = new StringBuilder(text.length() + 32);
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '<') {
                int end = passThroughEnd(text, i);
                if (end < 0) {
                    out.append("&lt;");
                    i++;
                } else {
                    out.append(text, i, end);
                    i = end;
                }
            } else if (c == '>') {
                out.append("&gt;");
                i++;
            } else if (c == '&') {
                Matcher entity = ENTITY.matcher(text).region(i, n);
                out.append(entity.lookingAt() ? "&" : "&amp;");
                i++;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /// Returns the end offset (exclusive) of the comment, CDATA section, processing instruction
    /// or tag starting at `start`, the input length if it is cut off, or -1 if `<`
    /// starts no tag.
    private static int passThroughEnd(String text, int start) {
        if (text.startsWith("<!--", start)) {
            return endAfter(text, "-->", start + 4);
        }
        if (text.startsWith("<![CDATA[", start)) {
            return endAfter(text, "]]>", start + 9);
        }
        if (text.startsWith("<?", start)) {
            return endAfter(text, "?>", start + 2);
        }
        if (start + 1 >= text.length() || !isTagStart(text.charAt(start + 1))) {
            return -1;
        }
        char quote = 0;
        boolean afterEquals = false;
        for (int j = start + 1; j < text.length(); j++) {
            char c = text.charAt(j);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '>') {
                return j + 1;
            } else if (c == '=') {
                afterEquals = true;
            } else if ((c == '"' || c == '\'') && afterEquals) {
                quote = c;
                afterEquals = false;
            } else if (!Character.isWhitespace(c)) {
                afterEquals = false;
            }
        }
        return text.length();
    }

    private static int endAfter(String text, String terminator, int from) {
        int end = text.indexOf(terminator, from);
        return end < 0 ? text.length() : end + terminator.length();
    }

    private static boolean isTagStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '/' || c == '?' || c == '!';
    }
}
