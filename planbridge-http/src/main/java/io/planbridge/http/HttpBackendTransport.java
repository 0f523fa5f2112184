package io.planbridge.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.planbridge.core.dispatch.ActionStream;
import io.planbridge.core.dispatch.BackendException;
import io.planbridge.core.dispatch.BackendRequest;
import io.planbridge.core.dispatch.BackendTransport;
import io.planbridge.core.plan.StructuredPayload;
import io.planbridge.core.response.JsonDecodingException;
import io.planbridge.core.response.RawResponse;
import io.planbridge.serialization.JacksonJsonDecoder;
import io.planbridge.serialization.NdjsonActionStream;
import io.planbridge.serialization.PlanbridgeMapper;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link BackendTransport} that POSTs JSON to the planning, generating and reflecting endpoints.
///
/// Complete responses are returned as text when the backend labels them `xml` or
/// `text`, and as a decoded record otherwise. A body that claims to be JSON but does not
/// decode is handed over as text so the response parser can classify it.
///
/// Streamed actions are read as NDJSON from the open response body. Closing the returned
/// {@link ActionStream} closes the body, which releases the connection.
///
/// Every failure, including HTTP status 400 and above, is reported as
/// {@link BackendException}. Nothing is retried.
public class HttpBackendTransport implements BackendTransport {

    private static final Logger LOG = Logger.getLogger(HttpBackendTransport.class.getName());

    private final HttpClient client;
    private final HttpTransportConfig config;
    private final ObjectMapper mapper;
    private final JacksonJsonDecoder decoder;

    public HttpBackendTransport(HttpTransportConfig config) {
        this(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                config,
                PlanbridgeMapper.createMapper());
    }

    public HttpBackendTransport(HttpClient client, HttpTransportConfig config, ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.decoder = new JacksonJsonDecoder(mapper);
    }

    @Override
    public RawResponse query(BackendRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString());
        String endpoint = config.endpointFor(request.role());
        String body = response.body() != null ? response.body() : "";
        failOnErrorStatus(endpoint, response.statusCode(), body);

        String contentType = contentType(response);
        if (contentType.contains("xml") || contentType.contains("text")) {
            LOG.info(
                    "Response from "
                            + endpoint
                            + ": "
                            + contentType
                            + " ("
                            + body.length()
                            + " chars)");
            return RawResponse.text(body);
        }
        try {
            Map<String, Object> content = decoder.decode(body);
            LOG.info("Response from " + endpoint + ": JSON with fields " + content.keySet());
            return RawResponse.structured(content);
        } catch (JsonDecodingException e) {
            LOG.warning("Response from " + endpoint + " is not a JSON object: " + e.getMessage());
            return RawResponse.text(body);
        }
    }

    @Override
    public ActionStream openStream(BackendRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (!request.stream()) {
            return batch(request);
        }
        String endpoint = config.endpointFor(request.role());
        HttpResponse<InputStream> response =
                send(request, HttpResponse.BodyHandlers.ofInputStream());
        if (response.statusCode() >= 400) {
            failOnErrorStatus(endpoint, response.statusCode(), drain(response.body()));
        }
        LOG.info("Streaming actions from " + endpoint);
        return new NdjsonActionStream(response.body(), mapper);
    }

    private ActionStream batch(BackendRequest request) {
        RawResponse response = query(request);
        if (response instanceof RawResponse.Structured structured) {
            return ActionStream.of(new StructuredPayload(structured.content()).actions());
        }
        throw new BackendException(
                "Expected a JSON action batch from "
                        + config.endpointFor(request.role())
                        + " but got a text response");
    }

    private <T> HttpResponse<T> send(BackendRequest request, HttpResponse.BodyHandler<T> handler) {
        String endpoint = config.endpointFor(request.role());
        String body;
        try {
            body = mapper.writeValueAsString(RequestPayloadBuilder.build(request));
        } catch (JsonProcessingException e) {
            throw new BackendException(
                    "Failed to encode request for " + endpoint + ": " + e.getMessage(), e);
        }

        HttpRequest.Builder builder =
                HttpRequest.newBuilder()
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .uri(URI.create(endpoint))
                        .timeout(config.getRequestTimeout())
                        .header("Content-Type", "application/json")
                        .header(
                                "Accept",
                                request.stream()
                                        ? "application/x-ndjson"
                                        : "application/json, application/xml, text/plain");
        config.getToken().ifPresent(t -> builder.header("Authorization", "Bearer " + t));

        LOG.fine("POST " + endpoint + " (" + body.length() + " chars)");
        try {
            return client.send(builder.build(), handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Request to " + endpoint + " interrupted", e);
        } catch (IOException e) {
            throw new BackendException(
                    "Failed to reach " + endpoint + ": " + e.getMessage(), e);
        }
    }

    private static void failOnErrorStatus(String endpoint, int status, String body) {
        if (status >= 400) {
            throw new BackendException(
                    "Backend " + endpoint + " returned HTTP " + status + ": " + body, status, null);
        }
    }

    private static String contentType(HttpResponse<?> response) {
        return response.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
    }

    private static String drain(InputStream body) {
        if (body == null) {
            return "";
        }
        try (InputStream in = body) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "<unreadable body: " + e.getMessage() + ">";
        }
    }
}
