package io.planbridge.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import io.planbridge.core.diagnostics.DiagnosticSink;
import io.planbridge.core.diagnostics.FileDiagnosticSink;
import io.planbridge.core.dispatch.BackendTransport;
import io.planbridge.core.dispatch.HandlerRole;
import io.planbridge.core.response.JsonDecoder;
import io.planbridge.core.response.ParseOutcome;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PlanbridgeFactoryTest {

    private final JsonDecoder decoder = text -> Map.of();
    private final BackendTransport transport = mock(BackendTransport.class);

    @Test
    void shouldWireHandlersToSharedParser() {
        PlanbridgeEnvironment env = PlanbridgeFactory.createEnvironment(decoder, transport);

        assertThat(env.getPlanningHandler().parser()).isSameAs(env.getResponseParser());
        assertThat(env.getGeneratingHandler().parser()).isSameAs(env.getResponseParser());
        assertThat(env.getReflectingHandler().transport()).isSameAs(transport);
        assertThat(env.getHandler(HandlerRole.REFLECTING)).isSameAs(env.getReflectingHandler());
        assertThat(env.getDiagnosticSink()).isInstanceOf(FileDiagnosticSink.class);
    }

    @Test
    void shouldDisableDiagnosticsFromConfig() {
        PlanbridgeEnvironment env =
                PlanbridgeFactory.builder()
                        .config(PlanbridgeConfig.builder().diagnosticsEnabled(false).build())
                        .jsonDecoder(decoder)
                        .transport(transport)
                        .build();

        assertThat(env.getDiagnosticSink()).isNotInstanceOf(FileDiagnosticSink.class);
    }

    @Test
    void shouldWriteDiagnosticsForUnrecoverableMarkup(@TempDir Path tempDir) throws IOException {
        PlanbridgeEnvironment env =
                PlanbridgeFactory.builder()
                        .config(PlanbridgeConfig.builder().diagnosticsDirectory(tempDir).build())
                        .clock(Clock.fixed(Instant.parse("2025-01-02T03:04:05.006Z"), ZoneOffset.UTC))
                        .jsonDecoder(decoder)
                        .transport(transport)
                        .build();

        ParseOutcome outcome = env.getResponseParser().parse("<stages><stage id=\"a\" id=\"b\"/></stages>");

        assertThat(outcome.isFailure()).isTrue();
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(path -> path.getFileName().toString()))
                    .containsExactly("xml_error_20250102_030405_006.log");
        }
    }

    @Test
    void shouldUseExplicitSink() {
        DiagnosticSink sink = DiagnosticSink.none();

        PlanbridgeEnvironment env =
                PlanbridgeFactory.builder().jsonDecoder(decoder).transport(transport).diagnosticSink(sink).build();

        assertThat(env.getDiagnosticSink()).isSameAs(sink);
    }

    @Test
    void shouldRequireDecoderAndTransport() {
        assertThatThrownBy(() -> PlanbridgeFactory.builder().transport(transport).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jsonDecoder");
        assertThatThrownBy(() -> PlanbridgeFactory.builder().jsonDecoder(decoder).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("transport");
    }
}
