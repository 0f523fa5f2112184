package io.planbridge.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.planbridge.core.plan.PlanPayload;
import io.planbridge.core.response.ParseOutcome;
import java.io.Serial;

/// Registers the wire-format serializers for parse outcomes and payloads.
public class PlanbridgeJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3318764215709358126L;

    public PlanbridgeJacksonModule() {
        super("PlanbridgeJacksonModule");

        addSerializer(PlanPayload.class, new PlanPayloadSerializer());
        addSerializer(ParseOutcome.class, new ParseOutcomeSerializer());
    }
}
