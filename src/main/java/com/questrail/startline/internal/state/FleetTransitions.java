package com.questrail.startline.internal.state;

import com.questrail.startline.error.InvalidTransitionException;
import com.questrail.startline.model.FleetStartStatus;
import com.questrail.startline.model.SequenceProfile;
import com.questrail.startline.model.SignalStage;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * FleetTransitions
 * -----------------------------------------------------------------------------
 * The one place that decides whether a fleet may move from one status to
 * another.
 *
 * <pre>
 *   PENDING ──warning──▶ WARNING ──prep──▶ PREPARATORY ──1min──▶ ONE_MINUTE ──start──▶ STARTED
 *      ▲                    │                  │                     │               │
 *      │                    └──────── general recall ────────────────┘      individual recall
 *      │                                                                       (stays STARTED)
 *      └── resume ── POSTPONED ◀── postpone ── PENDING / WARNING / PREPARATORY
 *
 *   any status except STARTED and ABANDONED ── abandon ──▶ ABANDONED
 * </pre>
 *
 * Signal steps follow the sequence profile: a sequence without a preparatory
 * signal goes WARNING to ONE_MINUTE, and one without a one-minute signal goes
 * from its last stage straight to STARTED.
 */
public final class FleetTransitions
{
    /**
     * Entry-level operations subject to the transition table.
     */
    public enum Operation {
        SIGNAL_WARNING("signalWarning"),
        SIGNAL_PREPARATORY("signalPreparatory"),
        SIGNAL_ONE_MINUTE("signalOneMinute"),
        SIGNAL_START("signalStart"),
        GENERAL_RECALL("generalRecall"),
        INDIVIDUAL_RECALL("individualRecall"),
        POSTPONE("postpone"),
        RESUME("resume"),
        ABANDON("abandon");

        private final String commandName;

        Operation(String commandName) {
            this.commandName = commandName;
        }

        public String commandName() {
            return commandName;
        }

        public static Operation forStage(SignalStage stage) {
            return switch (stage) {
                case WARNING -> SIGNAL_WARNING;
                case PREPARATORY -> SIGNAL_PREPARATORY;
                case ONE_MINUTE -> SIGNAL_ONE_MINUTE;
                case START -> SIGNAL_START;
            };
        }
    }

    private static final Set<FleetStartStatus> POSTPONABLE =
            EnumSet.of(FleetStartStatus.PENDING, FleetStartStatus.WARNING, FleetStartStatus.PREPARATORY);

    private FleetTransitions() {}

    /**
     * Returns the status the entry ends up in after {@code op}, or empty if the
     * operation is not legal from {@code from}.
     *
     * <p>General recall reports {@link FleetStartStatus#PENDING}: the entry
     * passes through {@link FleetStartStatus#GENERAL_RECALL} inside the command
     * and is requeued before the command completes.</p>
     */
    public static Optional<FleetStartStatus> target(FleetStartStatus from, Operation op, SequenceProfile profile) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(profile, "profile");

        return switch (op) {
            case SIGNAL_WARNING -> signal(from, SignalStage.WARNING, profile);
            case SIGNAL_PREPARATORY -> signal(from, SignalStage.PREPARATORY, profile);
            case SIGNAL_ONE_MINUTE -> signal(from, SignalStage.ONE_MINUTE, profile);
            case SIGNAL_START -> signal(from, SignalStage.START, profile);
            case GENERAL_RECALL -> from.isSignaling()
                    ? Optional.of(FleetStartStatus.PENDING)
                    : Optional.empty();
            case INDIVIDUAL_RECALL -> from == FleetStartStatus.STARTED
                    ? Optional.of(FleetStartStatus.STARTED)
                    : Optional.empty();
            case POSTPONE -> POSTPONABLE.contains(from)
                    ? Optional.of(FleetStartStatus.POSTPONED)
                    : Optional.empty();
            case RESUME -> from == FleetStartStatus.POSTPONED
                    ? Optional.of(FleetStartStatus.PENDING)
                    : Optional.empty();
            case ABANDON -> from.isTerminal()
                    ? Optional.empty()
                    : Optional.of(FleetStartStatus.ABANDONED);
        };
    }

    public static boolean permits(FleetStartStatus from, Operation op, SequenceProfile profile) {
        return target(from, op, profile).isPresent();
    }

    /**
     * Like {@link #target} but fails with a typed error.
     *
     * @throws InvalidTransitionException if the operation is not legal
     */
    public static FleetStartStatus require(String entryId,
                                           FleetStartStatus from,
                                           Operation op,
                                           SequenceProfile profile) {
        Optional<FleetStartStatus> to = target(from, op, profile);
        if (to.isPresent()) {
            return to.get();
        }
        if (isSignal(op)) {
            SignalStage stage = stageOf(op);
            if (!profile.hasStage(stage)) {
                throw new InvalidTransitionException(entryId, from, op.commandName(),
                        "Sequence " + profile.sequenceType() + " has no " + stage.name().toLowerCase()
                                + " signal");
            }
        }
        throw new InvalidTransitionException(entryId, from, op.commandName());
    }

    private static Optional<FleetStartStatus> signal(FleetStartStatus from, SignalStage stage, SequenceProfile profile) {
        if (!profile.hasStage(stage)) {
            return Optional.empty();
        }
        FleetStartStatus required = profile.previousStage(stage)
                .map(SignalStage::resultingStatus)
                .orElse(FleetStartStatus.PENDING);
        return from == required ? Optional.of(stage.resultingStatus()) : Optional.empty();
    }

    private static boolean isSignal(Operation op) {
        return op == Operation.SIGNAL_WARNING
                || op == Operation.SIGNAL_PREPARATORY
                || op == Operation.SIGNAL_ONE_MINUTE
                || op == Operation.SIGNAL_START;
    }

    private static SignalStage stageOf(Operation op) {
        return switch (op) {
            case SIGNAL_WARNING -> SignalStage.WARNING;
            case SIGNAL_PREPARATORY -> SignalStage.PREPARATORY;
            case SIGNAL_ONE_MINUTE -> SignalStage.ONE_MINUTE;
            case SIGNAL_START -> SignalStage.START;
            default -> throw new IllegalArgumentException(op + " is not a signal");
        };
    }
}
