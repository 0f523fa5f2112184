package io.planbridge.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.planbridge.core.markup.RepairLogEntry;
import io.planbridge.core.plan.ParsedWorkflow;
import io.planbridge.core.plan.Stage;
import io.planbridge.core.response.ParseError;
import io.planbridge.core.response.ParseOutcome;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParseOutcomeSerializerTest {

    private final ObjectMapper mapper = PlanbridgeMapper.createMapper();

    private final ParsedWorkflow workflow =
            ParsedWorkflow.ofStages(List.of(Stage.of("s1", "Load", "Load the data")));

    @Test
    void shouldWriteOkOutcomeWithRepairs() throws Exception {
        ParseOutcome outcome =
                ParseOutcome.ok(workflow, List.of(new RepairLogEntry(4, "stpe", "step")));

        JsonNode json = mapper.readTree(PlanbridgeMapper.toJson(outcome));

        assertThat(json.get("status").asText()).isEqualTo("ok");
        assertThat(json.has("_warning")).isFalse();
        assertThat(json.get("payload").get("stages").get(0).get("stage_id").asText())
                .isEqualTo("s1");
        JsonNode repair = json.get("repairs").get(0);
        assertThat(repair.get("line").asInt()).isEqualTo(4);
        assertThat(repair.get("found").asText()).isEqualTo("stpe");
        assertThat(repair.get("expected").asText()).isEqualTo("step");
    }

    @Test
    void shouldWriteRecoveryWarning() throws Exception {
        JsonNode json =
                mapper.readTree(PlanbridgeMapper.toJson(ParseOutcome.recovered(workflow, List.of())));

        assertThat(json.get("status").asText()).isEqualTo("recovered");
        assertThat(json.get("_warning").asText())
                .isEqualTo("Recovered from incomplete API response");
        assertThat(json.has("payload")).isTrue();
        assertThat(json.has("repairs")).isFalse();
    }

    @Test
    void shouldWriteFailureWithoutPayload() throws Exception {
        ParseError error = ParseError.structural("mismatched tag", 3, 5, "<a>\n<b>\n</c>", 100);

        JsonNode json = mapper.readTree(PlanbridgeMapper.toJson(ParseOutcome.failed(error)));

        assertThat(json.get("status").asText()).isEqualTo("failed");
        assertThat(json.has("payload")).isFalse();
        JsonNode written = json.get("error");
        assertThat(written.get("kind").asText()).isEqualTo("structural");
        assertThat(written.get("line").asInt()).isEqualTo(3);
        assertThat(written.get("column").asInt()).isEqualTo(5);
        assertThat(written.get("preview").asText()).isEqualTo("<a>\n<b>\n</c>");
    }

    @Test
    void shouldOmitLocationForUnclassifiableFailure() throws Exception {
        ParseError error = ParseError.unclassifiable("Cannot parse response", "hello", 100);

        JsonNode json = mapper.readTree(PlanbridgeMapper.toJson(ParseOutcome.failed(error)));

        assertThat(json.get("error").get("kind").asText()).isEqualTo("unclassifiable");
        assertThat(json.get("error").has("line")).isFalse();
    }
}
