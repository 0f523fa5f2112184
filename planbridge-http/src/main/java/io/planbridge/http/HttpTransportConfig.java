package io.planbridge.http;

import io.planbridge.core.dispatch.HandlerRole;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Endpoint settings for {@link HttpBackendTransport}.
///
/// Property keys read by {@link #fromProperties(Map)}:
///
/// - `planbridge.http.base-url` - default `http://localhost:28600`
/// - `planbridge.http.planning-path` - default `/planning`
/// - `planbridge.http.generating-path` - default `/generating`
/// - `planbridge.http.reflecting-path` - default `/reflecting`
/// - `planbridge.http.timeout-seconds` - request timeout, default `120`
/// - `planbridge.http.token` - bearer token, unset by default
public class HttpTransportConfig {

    public static final String BASE_URL = "planbridge.http.base-url";
    public static final String PLANNING_PATH = "planbridge.http.planning-path";
    public static final String GENERATING_PATH = "planbridge.http.generating-path";
    public static final String REFLECTING_PATH = "planbridge.http.reflecting-path";
    public static final String TIMEOUT_SECONDS = "planbridge.http.timeout-seconds";
    public static final String TOKEN = "planbridge.http.token";

    private String baseUrl = "http://localhost:28600";
    private String planningPath = "/planning";
    private String generatingPath = "/generating";
    private String reflectingPath = "/reflecting";
    private Duration requestTimeout = Duration.ofSeconds(120);
    private String token;

    public HttpTransportConfig() {}

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getPlanningPath() {
        return planningPath;
    }

    public void setPlanningPath(String planningPath) {
        this.planningPath = planningPath;
    }

    public String getGeneratingPath() {
        return generatingPath;
    }

    public void setGeneratingPath(String generatingPath) {
        this.generatingPath = generatingPath;
    }

    public String getReflectingPath() {
        return reflectingPath;
    }

    public void setReflectingPath(String reflectingPath) {
        this.reflectingPath = reflectingPath;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Optional<String> getToken() {
        return Optional.ofNullable(token).filter(t -> !t.isBlank());
    }

    public void setToken(String token) {
        this.token = token;
    }

    /// Returns the full endpoint URL for a role.
    ///
    /// @param role backend role, not null
    /// @return base URL joined with the role's path, never null
    public String endpointFor(HandlerRole role) {
        Objects.requireNonNull(role, "role must not be null");
        String path =
                switch (role) {
                    case PLANNING -> planningPath;
                    case GENERATING -> generatingPath;
                    case REFLECTING -> reflectingPath;
                };
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + (path.startsWith("/") ? path : "/" + path);
    }

    /// Reads settings from string properties; absent or blank keys keep their defaults.
    ///
    /// @param properties property map, not null
    /// @return new config, never null
    /// @throws IllegalArgumentException if the timeout is not a positive integer
    public static HttpTransportConfig fromProperties(Map<String, String> properties) {
        Builder builder = builder();
        value(properties, BASE_URL).ifPresent(builder::baseUrl);
        value(properties, PLANNING_PATH).ifPresent(builder::planningPath);
        value(properties, GENERATING_PATH).ifPresent(builder::generatingPath);
        value(properties, REFLECTING_PATH).ifPresent(builder::reflectingPath);
        value(properties, TOKEN).ifPresent(builder::token);
        Optional<String> timeout = value(properties, TIMEOUT_SECONDS);
        if (timeout.isPresent()) {
            try {
                builder.requestTimeout(Duration.ofSeconds(Long.parseLong(timeout.get())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        TIMEOUT_SECONDS + " must be an integer: " + timeout.get(), e);
            }
        }
        return builder.build();
    }

    private static Optional<String> value(Map<String, String> properties, String key) {
        return Optional.ofNullable(properties.get(key)).map(String::strip).filter(v -> !v.isEmpty());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final HttpTransportConfig config = new HttpTransportConfig();

        public Builder baseUrl(String baseUrl) {
            config.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
            return this;
        }

        public Builder planningPath(String planningPath) {
            config.planningPath = Objects.requireNonNull(planningPath, "planningPath must not be null");
            return this;
        }

        public Builder generatingPath(String generatingPath) {
            config.generatingPath =
                    Objects.requireNonNull(generatingPath, "generatingPath must not be null");
            return this;
        }

        public Builder reflectingPath(String reflectingPath) {
            config.reflectingPath =
                    Objects.requireNonNull(reflectingPath, "reflectingPath must not be null");
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
            if (requestTimeout.isNegative() || requestTimeout.isZero()) {
                throw new IllegalArgumentException(
                        "requestTimeout must be positive: " + requestTimeout);
            }
            config.requestTimeout = requestTimeout;
            return this;
        }

        public Builder token(String token) {
            config.token = token;
            return this;
        }

        public HttpTransportConfig build() {
            return config;
        }
    }
}
