package io.planbridge.core;

import java.nio.file.Path;
import java.util.Map;

/// Settings for the parsing pipeline.
///
/// Property keys read by {@link #fromProperties(Map)}:
///
/// - `planbridge.diagnostics.enabled` - write diagnostic reports, default `true`
/// - `planbridge.diagnostics.dir` - report directory, default `xml_errors`
/// - `planbridge.preview.length` - characters of input kept in error previews,
///   default `100`
public class PlanbridgeConfig {

    public static final String DIAGNOSTICS_ENABLED = "planbridge.diagnostics.enabled";
    public static final String DIAGNOSTICS_DIR = "planbridge.diagnostics.dir";
    public static final String PREVIEW_LENGTH = "planbridge.preview.length";

    private boolean diagnosticsEnabled = true;
    private Path diagnosticsDirectory = Path.of("xml_errors");
    private int previewLength = 100;

    public PlanbridgeConfig() {}

    public boolean isDiagnosticsEnabled() {
        return diagnosticsEnabled;
    }

    public void setDiagnosticsEnabled(boolean diagnosticsEnabled) {
        this.diagnosticsEnabled = diagnosticsEnabled;
    }

    public Path getDiagnosticsDirectory() {
        return diagnosticsDirectory;
    }

    public void setDiagnosticsDirectory(Path diagnosticsDirectory) {
        this.diagnosticsDirectory = diagnosticsDirectory;
    }

    public int getPreviewLength() {
        return previewLength;
    }

    public void setPreviewLength(int previewLength) {
        this.previewLength = previewLength;
    }

    /// Reads settings from string properties; absent keys keep their defaults.
    ///
    /// @param properties property map, not null
    /// @return new config, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static PlanbridgeConfig fromProperties(Map<String, String> properties) {
        Builder builder = builder();
        String enabled = properties.get(DIAGNOSTICS_ENABLED);
        if (enabled != null) {
            builder.diagnosticsEnabled(parseBoolean(DIAGNOSTICS_ENABLED, enabled));
        }
        String dir = properties.get(DIAGNOSTICS_DIR);
        if (dir != null && !dir.isBlank()) {
            builder.diagnosticsDirectory(Path.of(dir.strip()));
        }
        String preview = properties.get(PREVIEW_LENGTH);
        if (preview != null) {
            try {
                builder.previewLength(Integer.parseInt(preview.strip()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        PREVIEW_LENGTH + " must be an integer: " + preview, e);
            }
        }
        return builder.build();
    }

    private static boolean parseBoolean(String key, String value) {
        String normalized = value.strip();
        if (normalized.equalsIgnoreCase("true")) {
            return true;
        }
        if (normalized.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false: " + value);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final PlanbridgeConfig config = new PlanbridgeConfig();

        public Builder diagnosticsEnabled(boolean diagnosticsEnabled) {
            config.diagnosticsEnabled = diagnosticsEnabled;
            return this;
        }

        public Builder diagnosticsDirectory(Path diagnosticsDirectory) {
            config.diagnosticsDirectory = diagnosticsDirectory;
            return this;
        }

        public Builder previewLength(int previewLength) {
            if (previewLength <= 0) {
                throw new IllegalArgumentException("previewLength must be positive: " + previewLength);
            }
            config.previewLength = previewLength;
            return this;
        }

        public PlanbridgeConfig build() {
            return config;
        }
    }
}
