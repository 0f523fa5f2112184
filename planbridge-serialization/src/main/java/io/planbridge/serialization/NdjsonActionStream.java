package io.planbridge.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.planbridge.core.dispatch.ActionStream;
import io.planbridge.core.dispatch.BackendException;
import io.planbridge.core.plan.ActionRecord;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link ActionStream} over newline-delimited JSON.
///
/// Each line is expected to look like `{"action": {...}}`. Lines are read and decoded
/// only when the consumer asks for the next action. Blank lines and objects without an
/// `action` object are skipped; lines that are not JSON are logged and skipped. A read
/// failure surfaces as {@link BackendException}.
///
/// Closing the stream closes the underlying input, which for an HTTP response body aborts
/// the connection.
public class NdjsonActionStream implements ActionStream {

    private static final Logger LOG = Logger.getLogger(NdjsonActionStream.class.getName());

    private final BufferedReader reader;
    private final ObjectMapper mapper;
    private ActionRecord lookahead;
    private boolean closed;
    private int lineNumber;

    public NdjsonActionStream(InputStream input, ObjectMapper mapper) {
        this(
                new BufferedReader(
                        new InputStreamReader(
                                Objects.requireNonNull(input, "input must not be null"),
                                StandardCharsets.UTF_8)),
                mapper);
    }

    public NdjsonActionStream(BufferedReader reader, ObjectMapper mapper) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        if (lookahead == null) {
            lookahead = readNext();
        }
        return lookahead != null;
    }

    @Override
    public ActionRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ActionRecord action = lookahead;
        lookahead = null;
        return action;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        lookahead = null;
        try {
            reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close action stream", e);
        }
    }

    private ActionRecord readNext() {
        String line;
        while ((line = readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            ActionRecord action = decode(line);
            if (action != null) {
                return action;
            }
        }
        return null;
    }

    private String readLine() {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new BackendException("Failed to read action stream: " + e.getMessage(), e);
        }
    }

    private ActionRecord decode(String line) {
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            LOG.warning(
                    "Skipping undecodable stream line "
                            + lineNumber
                            + ": "
                            + e.getOriginalMessage());
            return null;
        }
        JsonNode action = node.get("action");
        if (action == null || !action.isObject()) {
            return null;
        }
        Map<String, Object> fields =
                mapper.convertValue(action, new TypeReference<LinkedHashMap<String, Object>>() {});
        return ActionRecord.of(fields);
    }
}
