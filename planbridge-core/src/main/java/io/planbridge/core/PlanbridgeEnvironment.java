package io.planbridge.core;

import io.planbridge.core.diagnostics.DiagnosticSink;
import io.planbridge.core.dispatch.GeneratingHandler;
import io.planbridge.core.dispatch.HandlerRole;
import io.planbridge.core.dispatch.PlanningHandler;
import io.planbridge.core.dispatch.ReflectingHandler;
import io.planbridge.core.dispatch.ResponseHandler;
import io.planbridge.core.response.ResponseParser;
import java.util.Objects;

/// The wired parsing and dispatch components.
///
/// All components are stateless apart from the diagnostic sink's sequence counter, so one
/// environment can serve concurrent callers.
///
/// @see PlanbridgeFactory.Builder
public final class PlanbridgeEnvironment {

    private final PlanbridgeConfig config;
    private final ResponseParser responseParser;
    private final PlanningHandler planningHandler;
    private final GeneratingHandler generatingHandler;
    private final ReflectingHandler reflectingHandler;
    private final DiagnosticSink diagnosticSink;

    public PlanbridgeEnvironment(
            PlanbridgeConfig config,
            ResponseParser responseParser,
            PlanningHandler planningHandler,
            GeneratingHandler generatingHandler,
            ReflectingHandler reflectingHandler,
            DiagnosticSink diagnosticSink) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.responseParser = Objects.requireNonNull(responseParser, "responseParser must not be null");
        this.planningHandler = Objects.requireNonNull(planningHandler, "planningHandler must not be null");
        this.generatingHandler =
                Objects.requireNonNull(generatingHandler, "generatingHandler must not be null");
        this.reflectingHandler =
                Objects.requireNonNull(reflectingHandler, "reflectingHandler must not be null");
        this.diagnosticSink = Objects.requireNonNull(diagnosticSink, "diagnosticSink must not be null");
    }

    public PlanbridgeConfig getConfig() {
        return config;
    }

    public ResponseParser getResponseParser() {
        return responseParser;
    }

    public PlanningHandler getPlanningHandler() {
        return planningHandler;
    }

    public GeneratingHandler getGeneratingHandler() {
        return generatingHandler;
    }

    public ReflectingHandler getReflectingHandler() {
        return reflectingHandler;
    }

    /// Returns the handler for a role.
    ///
    /// @param role handler role, not null
    /// @return the handler, never null
    public ResponseHandler getHandler(HandlerRole role) {
        return switch (role) {
            case PLANNING -> planningHandler;
            case GENERATING -> generatingHandler;
            case REFLECTING -> reflectingHandler;
        };
    }

    public DiagnosticSink getDiagnosticSink() {
        return diagnosticSink;
    }
}
