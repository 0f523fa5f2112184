package io.planbridge.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.planbridge.core.plan.PlanPayload;
import io.planbridge.core.response.ParseOutcome;

/// Shared {@link ObjectMapper} setup and JSON rendering of parse results.
public final class PlanbridgeMapper {

    private PlanbridgeMapper() {}

    /// Renders an outcome in the engine hand-off format.
    ///
    /// @param outcome outcome to render, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if rendering fails
    public static String toJson(ParseOutcome outcome) {
        try {
            return createMapper().writeValueAsString(outcome);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize parse outcome: " + e.getMessage(), e);
        }
    }

    public static String toJson(PlanPayload payload) {
        try {
            return createMapper().writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize payload: " + e.getMessage(), e);
        }
    }

    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new PlanbridgeJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }
}
