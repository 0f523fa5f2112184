package io.planbridge.core.response;

import io.planbridge.core.markup.RepairLogEntry;
import io.planbridge.core.plan.PlanPayload;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Result of parsing one backend response.
///
/// Three variants keep a recovered payload distinguishable from a clean one:
///
/// - {@link Ok} - the response parsed, possibly after closing-tag repairs
/// - {@link Recovered} - the response was truncated and completed by closing its open
///   tags; the payload holds what the backend sent before the cut and is lower-confidence
/// - {@link Failed} - nothing usable was produced
///
/// ### Contracts
/// - **Invariant**: a failed outcome never carries a partial payload
/// - **Invariant**: a recovered payload is only handed out by
///   {@link #payloadAcceptingRecovery()}; {@link #payloadOrThrow()} refuses it
public sealed interface ParseOutcome permits ParseOutcome.Ok, ParseOutcome.Recovered, ParseOutcome.Failed {

    /// Warning attached to every {@link Recovered} outcome.
    String RECOVERY_WARNING = "Recovered from incomplete API response";

    static ParseOutcome ok(PlanPayload payload) {
        return new Ok(payload, List.of());
    }

    static ParseOutcome ok(PlanPayload payload, List<RepairLogEntry> repairs) {
        return new Ok(payload, repairs);
    }

    static ParseOutcome recovered(PlanPayload payload, List<RepairLogEntry> repairs) {
        return new Recovered(payload, RECOVERY_WARNING, repairs);
    }

    static ParseOutcome failed(ParseError error) {
        return new Failed(error);
    }

    default boolean isRecovered() {
        return this instanceof Recovered;
    }

    default boolean isFailure() {
        return this instanceof Failed;
    }

    /// Returns the recovery warning, if any.
    ///
    /// @return warning for recovered outcomes, empty otherwise
    default Optional<String> recoveryWarning() {
        if (this instanceof Recovered recovered) {
            return Optional.of(recovered.warning());
        }
        return Optional.empty();
    }

    /// Returns the closing-tag repairs applied before the structural parse.
    ///
    /// @return repair entries in document order, empty for failures
    default List<RepairLogEntry> repairs() {
        if (this instanceof Ok ok) {
            return ok.repairLog();
        }
        if (this instanceof Recovered recovered) {
            return recovered.repairLog();
        }
        return List.of();
    }

    /// Returns the payload of a clean {@link Ok} outcome.
    ///
    /// A {@link Recovered} outcome is refused: its payload was completed from a truncated
    /// response and has to be taken through {@link #payloadAcceptingRecovery()}.
    ///
    /// @return parsed payload, never null
    /// @throws ResponseParseException if this outcome is {@link Failed}
    /// @throws IllegalStateException if this outcome is {@link Recovered}
    default PlanPayload payloadOrThrow() throws ResponseParseException {
        if (this instanceof Ok ok) {
            return ok.payload();
        }
        if (this instanceof Recovered recovered) {
            throw new IllegalStateException(
                    recovered.warning() + "; use payloadAcceptingRecovery() to accept it");
        }
        throw new ResponseParseException(((Failed) this).error());
    }

    /// Returns the payload of an {@link Ok} or {@link Recovered} outcome.
    ///
    /// @return parsed payload, possibly completed from a truncated response, never null
    /// @throws ResponseParseException if this outcome is {@link Failed}
    default PlanPayload payloadAcceptingRecovery() throws ResponseParseException {
        if (this instanceof Recovered recovered) {
            return recovered.payload();
        }
        return payloadOrThrow();
    }

    /// Clean parse.
    ///
    /// @param payload parsed payload, not null
    /// @param repairLog closing-tag repairs applied, not null
    record Ok(PlanPayload payload, List<RepairLogEntry> repairLog) implements ParseOutcome {
        public Ok {
            Objects.requireNonNull(payload, "payload must not be null");
            repairLog = repairLog != null ? List.copyOf(repairLog) : List.of();
        }
    }

    /// Parse of a truncated response completed by closing its open tags.
    ///
    /// @param payload payload parsed from the completed text, not null
    /// @param warning recovery warning, not null
    /// @param repairLog closing-tag repairs applied, not null
    record Recovered(PlanPayload payload, String warning, List<RepairLogEntry> repairLog)
            implements ParseOutcome {
        public Recovered {
            Objects.requireNonNull(payload, "payload must not be null");
            Objects.requireNonNull(warning, "warning must not be null");
            repairLog = repairLog != null ? List.copyOf(repairLog) : List.of();
        }
    }

    /// Failed parse.
    ///
    /// @param error failure details, not null
    record Failed(ParseError error) implements ParseOutcome {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}
