package io.planbridge.core.diagnostics;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// Writes one report file per unrecoverable markup failure.
///
/// Files are named `xml_error_<yyyyMMdd_HHmmss_SSS>.log` after the local time of the
/// failure; a second failure in the same millisecond gets a `_<sequence>` suffix instead
/// of overwriting the first. The sequence counter is shared with the composition root.
///
/// Thread-safe. Never throws: I/O failures are logged and the report is dropped.
public final class FileDiagnosticSink implements DiagnosticSink {

    private static final Logger LOG = Logger.getLogger(FileDiagnosticSink.class.getName());

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path directory;
    private final Clock clock;
    private final AtomicLong sequence;
    private final DiagnosticReportFormatter formatter = new DiagnosticReportFormatter();

    public FileDiagnosticSink(Path directory, Clock clock, AtomicLong sequence) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sequence = Objects.requireNonNull(sequence, "sequence must not be null");
    }

    public FileDiagnosticSink(Path directory) {
        this(directory, Clock.systemDefaultZone(), new AtomicLong());
    }

    @Override
    public void report(ParseFailureReport report) {
        Objects.requireNonNull(report, "report must not be null");
        Instant now = clock.instant();
        long number = sequence.incrementAndGet();
        String content = formatter.format(report, now, number);
        String stamp = FILE_TIMESTAMP.format(now.atZone(clock.getZone()));
        try {
            Files.createDirectories(directory);
            Path written = write(directory.resolve("xml_error_" + stamp + ".log"), content);
            if (written == null) {
                written = write(directory.resolve("xml_error_" + stamp + "_" + number + ".log"), content);
            }
            if (written == null) {
                LOG.warning("Could not write diagnostic report " + number + ": file name already taken");
            } else {
                LOG.warning("Parse error details saved to: " + written);
            }
        } catch (IOException e) {
            LOG.warning("Could not write diagnostic report to " + directory + ": " + e.getMessage());
        }
    }

    public Path directory() {
        return directory;
    }

    /// Creates the file, or returns null if a file with that name already exists.
    private static Path write(Path file, String content) throws IOException {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
            return file;
        } catch (FileAlreadyExistsException e) {
            LOG.fine("Diagnostic file exists, trying next name: " + file);
            return null;
        }
    }
}
