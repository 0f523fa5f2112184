package io.planbridge.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.planbridge.core.response.JsonDecodingException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JacksonJsonDecoderTest {

    private final JacksonJsonDecoder decoder = new JacksonJsonDecoder();

    @Nested
    @DisplayName("Decoding objects")
    class ObjectDecoding {

        @Test
        void shouldDecodeObjectPreservingFieldOrder() throws Exception {
            Map<String, Object> fields =
                    decoder.decode("{\"transition\":\"NEXT_STEP\",\"actions\":[],\"a\":1}");

            assertThat(fields).containsOnlyKeys("transition", "actions", "a");
            assertThat(fields.keySet()).containsExactly("transition", "actions", "a");
            assertThat(fields.get("transition")).isEqualTo("NEXT_STEP");
            assertThat(fields.get("actions")).isEqualTo(List.of());
            assertThat(fields.get("a")).isEqualTo(1);
        }

        @Test
        void shouldDecodeNestedRecordsAsMaps() throws Exception {
            Map<String, Object> fields =
                    decoder.decode("{\"actions\":[{\"type\":\"add\",\"content\":null}]}");

            assertThat(fields.get("actions")).isInstanceOf(List.class);
            Object first = ((List<?>) fields.get("actions")).get(0);
            assertThat(first).isInstanceOf(Map.class);
            Map<?, ?> action = (Map<?, ?>) first;
            assertThat(action.get("type")).isEqualTo("add");
            assertThat(action.containsKey("content")).isTrue();
            assertThat(action.get("content")).isNull();
        }

        @Test
        void shouldStripJsonCodeFence() throws Exception {
            String fenced = "Here you go:\n```json\n{\"target_achieved\": true}\n```\n";

            assertThat(decoder.decode(fenced)).containsEntry("target_achieved", true);
        }

        @Test
        void shouldStripPlainCodeFence() throws Exception {
            String fenced = "```\n{\"transition\": \"NEXT_STAGE\"}\n```";

            assertThat(decoder.decode(fenced)).containsEntry("transition", "NEXT_STAGE");
        }
    }

    @Nested
    @DisplayName("Rejecting non-objects")
    class Rejection {

        @Test
        void shouldRejectPlainText() {
            assertThatThrownBy(() -> decoder.decode("hello"))
                    .isInstanceOf(JsonDecodingException.class)
                    .hasMessageStartingWith("Invalid JSON");
        }

        @Test
        void shouldRejectArray() {
            assertThatThrownBy(() -> decoder.decode("[1, 2]"))
                    .isInstanceOf(JsonDecodingException.class)
                    .hasMessage("Expected a JSON object but got array");
        }

        @Test
        void shouldRejectEmptyText() {
            assertThatThrownBy(() -> decoder.decode("   "))
                    .isInstanceOf(JsonDecodingException.class)
                    .hasMessage("Expected a JSON object but got no content");
        }

        @Test
        void shouldRejectTruncatedObject() {
            assertThatThrownBy(() -> decoder.decode("{\"actions\": ["))
                    .isInstanceOf(JsonDecodingException.class);
        }
    }
}
