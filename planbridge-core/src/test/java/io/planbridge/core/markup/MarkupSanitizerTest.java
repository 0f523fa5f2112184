package io.planbridge.core.markup;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class MarkupSanitizerTest {

    private final MarkupSanitizer sanitizer = new MarkupSanitizer();

    @Nested
    class BooleanAttributes {

        @Test
        void shouldQuoteBareAttributeDirectlyBeforeClosingBracket() {
            assertThat(sanitizer.sanitize("<stage optional>x</stage>"))
                    .isEqualTo("<stage optional=\"true\">x</stage>");
        }

        @Test
        void shouldQuoteBareAttributeFollowedByWhitespaceOrSlash() {
            assertThat(sanitizer.sanitize("<stage optional id=\"s1\"/>"))
                    .isEqualTo("<stage optional=\"true\" id=\"s1\"/>");
            assertThat(sanitizer.sanitize("<stage id=\"s1\" hidden/>"))
                    .isEqualTo("<stage id=\"s1\" hidden=\"true\"/>");
        }

        @ParameterizedTest
        @ValueSource(strings = {"optional", "required", "disabled", "enabled", "hidden"})
        void shouldRecognizeEveryBooleanAttribute(String name) {
            assertThat(sanitizer.sanitize("<step " + name + ">"))
                    .isEqualTo("<step " + name + "=\"true\">");
        }

        @Test
        void shouldLeaveAttributesWithValuesAlone() {
            String markup = "<stage optional=\"false\" id='optional'>x</stage>";

            assertThat(sanitizer.sanitize(markup)).isEqualTo(markup);
        }

        @Test
        void shouldNotRewriteTagNamesOrQuotedValues() {
            String markup = "<optional title=\"required hidden\">x</optional>";

            assertThat(sanitizer.sanitize(markup)).isEqualTo(markup);
        }

        @Test
        void shouldNotQuoteInsideCommentsOrCdata() {
            String markup =
                    "<steps><!-- <step optional> --><goal><![CDATA[<step hidden>]]></goal></steps>";

            assertThat(sanitizer.sanitize(markup)).isEqualTo(markup);
        }

        @Test
        void shouldIgnoreUnknownBareAttributes() {
            assertThat(sanitizer.quoteBooleanAttributes("<stage mandatory>"))
                    .isEqualTo("<stage mandatory>");
        }
    }

    @Nested
    class TextEscaping {

        @Test
        void shouldEscapeBareAmpersand() {
            assertThat(sanitizer.sanitize("<goal>R&D plan</goal>"))
                    .isEqualTo("<goal>R&amp;D plan</goal>");
        }

        @Test
        void shouldKeepExistingEntities() {
            String markup = "<goal>a &lt; b &amp;&amp; c &#38; d &#x26;</goal>";

            assertThat(sanitizer.sanitize(markup)).isEqualTo(markup);
        }

        @Test
        void shouldEscapeComparisonOperatorsInText() {
            assertThat(sanitizer.sanitize("<goal>x < 5 and y > 3</goal>"))
                    .isEqualTo("<goal>x &lt; 5 and y &gt; 3</goal>");
        }

        @Test
        void shouldKeepGreaterThanInsideQuotedAttributeValue() {
            String markup = "<stage title=\"a > b\">x</stage>";

            assertThat(sanitizer.sanitize(markup)).isEqualTo(markup);
        }

        @Test
        void shouldPassCommentsAndCdataThrough() {
            String markup = "<goal><!-- a < b & c --><![CDATA[x < y & z]]></goal>";

            assertThat(sanitizer.sanitize(markup)).isEqualTo(markup);
        }

        @Test
        void shouldLeaveTruncatedTagUntouched() {
            assertThat(sanitizer.sanitize("<stages><stage id=\"s1"))
                    .isEqualTo("<stages><stage id=\"s1");
        }
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "<stages><stage id=\"s1\" optional><goal>R&D > ops < dev</goal></stage></stages>",
                "<goal>&amp; &foo; & &#12;</goal>",
                "plain text with < and > and &",
                "<a title=\"x > y\"><!-- c --><![CDATA[<raw>]]></a>"
            })
    void shouldBeIdempotent(String input) {
        String once = sanitizer.sanitize(input);

        assertThat(sanitizer.sanitize(once)).isEqualTo(once);
    }
}
