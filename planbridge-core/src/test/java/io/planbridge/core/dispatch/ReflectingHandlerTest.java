package io.planbridge.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.planbridge.core.diagnostics.DiagnosticSink;
import io.planbridge.core.markup.MarkupParser;
import io.planbridge.core.plan.ActionRecord;
import io.planbridge.core.plan.Reflection;
import io.planbridge.core.response.JsonDecodingException;
import io.planbridge.core.response.ParseOutcome;
import io.planbridge.core.response.RawResponse;
import io.planbridge.core.response.ResponseParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReflectingHandlerTest {

    @Mock private BackendTransport transport;
    @Mock private ActionObserver observer;

    private ReflectingHandler handler;

    @BeforeEach
    void setUp() {
        ResponseParser parser =
                new ResponseParser(
                        new MarkupParser(DiagnosticSink.none(), 100),
                        text -> {
                            throw new JsonDecodingException("not JSON");
                        });
        handler = new ReflectingHandler(transport, parser, observer);
    }

    @Test
    void shouldStreamUnderReflectingRole() {
        ActionRecord comment = ActionRecord.of(Map.of("type", "comment_result", "content", "Looks right"));
        when(transport.openStream(any())).thenReturn(ActionStream.of(List.of(comment)));

        List<ActionRecord> received = new ArrayList<>();
        try (ActionStream stream = handler.stream(HandlerCall.of(Map.of()).atLocation("s1", "st2"))) {
            stream.forEachRemaining(received::add);
        }

        assertThat(received).containsExactly(comment);
        verify(observer).onAction(HandlerRole.REFLECTING, 1, comment);
        ArgumentCaptor<BackendRequest> request = ArgumentCaptor.forClass(BackendRequest.class);
        verify(transport).openStream(request.capture());
        assertThat(request.getValue().role()).isEqualTo(HandlerRole.REFLECTING);
        assertThat(request.getValue().location()).isEqualTo(new ExecutionLocation("s1", "st2"));
    }

    @Test
    void shouldParseReflectionDocumentForNonStreamingCall() throws Exception {
        when(transport.query(any()))
                .thenReturn(
                        RawResponse.text(
                                "<reflection current_step_is_complete=\"true\">"
                                        + "<decision><next_state>STEP_COMPLETED</next_state></decision>"
                                        + "</reflection>"));

        ParseOutcome outcome = handler.call(HandlerCall.of(Map.of()));

        Reflection reflection = (Reflection) outcome.payloadOrThrow();
        assertThat(reflection.behaviorComplete()).isTrue();
        assertThat(reflection.nextState()).isEqualTo("STEP_COMPLETED");
    }
}
