package io.planbridge.core.markup;

import io.planbridge.core.diagnostics.DiagnosticSink;
import io.planbridge.core.diagnostics.ParseFailureReport;
import io.planbridge.core.plan.PlanPayload;
import io.planbridge.core.response.ParseError;
import io.planbridge.core.response.ParseOutcome;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// The markup pipeline: sanitize, repair closing tags, parse, map.
///
/// When the structural parse stops at end of input, {@link TruncationRecovery} closes the
/// open elements and the completed text is parsed once more. A successful second parse is
/// returned as {@link ParseOutcome.Recovered}. Every other failure, and a failed second parse,
/// is reported to the {@link DiagnosticSink} and returned as {@link ParseOutcome.Failed}
/// carrying the first error.
///
/// Thread-safe: all collaborators are stateless and the sink is required to be thread-safe.
public final class MarkupParser {

    private static final Logger LOG = Logger.getLogger(MarkupParser.class.getName());

    private final MarkupSanitizer sanitizer;
    private final TagRepairEngine repairEngine;
    private final MarkupTreeBuilder treeBuilder;
    private final PlanDocumentMapper mapper;
    private final TruncationRecovery recovery;
    private final DiagnosticSink diagnostics;
    private final int previewLength;

    public MarkupParser(DiagnosticSink diagnostics, int previewLength) {
        this(
                new MarkupSanitizer(),
                new TagRepairEngine(),
                new MarkupTreeBuilder(),
                new PlanDocumentMapper(),
                new TruncationRecovery(),
                diagnostics,
                previewLength);
    }

    public MarkupParser(
            MarkupSanitizer sanitizer,
            TagRepairEngine repairEngine,
            MarkupTreeBuilder treeBuilder,
            PlanDocumentMapper mapper,
            TruncationRecovery recovery,
            DiagnosticSink diagnostics,
            int previewLength) {
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
        this.repairEngine = Objects.requireNonNull(repairEngine, "repairEngine must not be null");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.recovery = Objects.requireNonNull(recovery, "recovery must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        if (previewLength <= 0) {
            throw new IllegalArgumentException("previewLength must be positive");
        }
        this.previewLength = previewLength;
    }

    /// Parses one markup response.
    ///
    /// @param text markup, not null
    /// @return ok, recovered or failed outcome, never null
    public ParseOutcome parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        TagRepairEngine.RepairResult repaired = repairEngine.repair(sanitizer.sanitize(text));
        try {
            PlanPayload payload = mapper.map(treeBuilder.build(repaired.text()));
            return ParseOutcome.ok(payload, repaired.repairs());
        } catch (MarkupSyntaxException e) {
            LOG.severe("Markup parse error: " + e.getMessage());
            if (e.isEndOfInput()) {
                Optional<ParseOutcome> recovered = recover(repaired);
                if (recovered.isPresent()) {
                    return recovered.get();
                }
            }
            diagnostics.report(
                    new ParseFailureReport(
                            e.reason().name(), e.getMessage(), repaired.text(), text));
            return ParseOutcome.failed(
                    ParseError.structural(
                            e.getMessage(), e.line(), e.column(), text, previewLength));
        }
    }

    private Optional<ParseOutcome> recover(TagRepairEngine.RepairResult repaired) {
        Optional<String> completed = recovery.complete(repaired.text());
        if (completed.isEmpty()) {
            return Optional.empty();
        }
        try {
            PlanPayload payload = mapper.map(treeBuilder.build(sanitizer.sanitize(completed.get())));
            LOG.info("Recovered " + payload.kind() + " response by closing unclosed tags");
            return Optional.of(ParseOutcome.recovered(payload, repaired.repairs()));
        } catch (MarkupSyntaxException recoveryError) {
            LOG.severe("Recovery attempt failed: " + recoveryError.getMessage());
            return Optional.empty();
        }
    }
}
