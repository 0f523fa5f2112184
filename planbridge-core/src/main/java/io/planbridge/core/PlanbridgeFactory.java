package io.planbridge.core;

import io.planbridge.core.diagnostics.DiagnosticSink;
import io.planbridge.core.diagnostics.FileDiagnosticSink;
import io.planbridge.core.dispatch.ActionObserver;
import io.planbridge.core.dispatch.BackendTransport;
import io.planbridge.core.dispatch.GeneratingHandler;
import io.planbridge.core.dispatch.PlanningHandler;
import io.planbridge.core.dispatch.ReflectingHandler;
import io.planbridge.core.markup.MarkupParser;
import io.planbridge.core.response.JsonDecoder;
import io.planbridge.core.response.ResponseParser;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// Composition root for {@link PlanbridgeEnvironment}.
///
/// The core has no JSON library and no network stack, so the caller supplies a
/// {@link JsonDecoder} and a {@link BackendTransport}:
///
/// {@snippet :
/// PlanbridgeEnvironment env = PlanbridgeFactory.builder()
///         .config(PlanbridgeConfig.fromProperties(properties))
///         .jsonDecoder(new JacksonJsonDecoder())
///         .transport(new HttpBackendTransport(httpConfig, decoder))
///         .build();
/// }
///
/// The diagnostic sequence counter is created here, once per environment, and handed to the
/// file sink; nothing else in the pipeline holds cross-call state.
public final class PlanbridgeFactory {

    private static final Logger LOG = Logger.getLogger(PlanbridgeFactory.class.getName());

    private PlanbridgeFactory() {}

    /// Creates an environment with default configuration.
    ///
    /// @param jsonDecoder JSON decoder, not null
    /// @param transport backend transport, not null
    /// @return wired environment, never null
    public static PlanbridgeEnvironment createEnvironment(
            JsonDecoder jsonDecoder, BackendTransport transport) {
        return builder().jsonDecoder(jsonDecoder).transport(transport).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PlanbridgeConfig config = new PlanbridgeConfig();
        private JsonDecoder jsonDecoder;
        private BackendTransport transport;
        private DiagnosticSink diagnosticSink;
        private ActionObserver actionObserver = ActionObserver.none();
        private Clock clock = Clock.systemDefaultZone();

        private Builder() {}

        public Builder config(PlanbridgeConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder jsonDecoder(JsonDecoder jsonDecoder) {
            this.jsonDecoder = jsonDecoder;
            return this;
        }

        public Builder transport(BackendTransport transport) {
            this.transport = transport;
            return this;
        }

        /// Replaces the sink chosen from the configuration.
        public Builder diagnosticSink(DiagnosticSink diagnosticSink) {
            this.diagnosticSink = diagnosticSink;
            return this;
        }

        public Builder actionObserver(ActionObserver actionObserver) {
            this.actionObserver = Objects.requireNonNull(actionObserver, "actionObserver must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /// Wires the environment.
        ///
        /// @return environment, never null
        /// @throws IllegalStateException if the JSON decoder or the transport is missing
        public PlanbridgeEnvironment build() {
            if (jsonDecoder == null) {
                throw new IllegalStateException("jsonDecoder is required");
            }
            if (transport == null) {
                throw new IllegalStateException("transport is required");
            }
            DiagnosticSink sink = diagnosticSink != null ? diagnosticSink : defaultSink();

            MarkupParser markupParser = new MarkupParser(sink, config.getPreviewLength());
            ResponseParser parser =
                    new ResponseParser(markupParser, jsonDecoder, config.getPreviewLength());

            LOG.info(
                    "Planbridge environment created (diagnostics="
                            + (config.isDiagnosticsEnabled() ? config.getDiagnosticsDirectory() : "off")
                            + ")");
            return new PlanbridgeEnvironment(
                    config,
                    parser,
                    new PlanningHandler(transport, parser),
                    new GeneratingHandler(transport, parser, actionObserver),
                    new ReflectingHandler(transport, parser, actionObserver),
                    sink);
        }

        private DiagnosticSink defaultSink() {
            if (!config.isDiagnosticsEnabled()) {
                return DiagnosticSink.none();
            }
            return new FileDiagnosticSink(config.getDiagnosticsDirectory(), clock, new AtomicLong());
        }
    }
}
