package com.questrail.startline.internal.state;

import com.questrail.startline.api.FleetEntryRequest;
import com.questrail.startline.api.FleetUpdate;
import com.questrail.startline.api.ScheduleUpdate;
import com.questrail.startline.model.SignalStage;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ScheduleCommand
 * -----------------------------------------------------------------------------
 * Closed set of changes that can be applied to one {@code StartSchedule}.
 *
 * <p>Commands carry everything the reducer needs, including ids for new
 * entries, so that applying the same command to the same snapshot always
 * produces the same result. That is what allows a conflicting save to be
 * retried by simply re-applying the command to a fresh snapshot.</p>
 */
public sealed interface ScheduleCommand
        permits ScheduleCommand.AddFleets,
                ScheduleCommand.RemoveFleet,
                ScheduleCommand.UpdateFleet,
                ScheduleCommand.ReorderFleets,
                ScheduleCommand.UpdateSchedule,
                ScheduleCommand.MarkReady,
                ScheduleCommand.StartSequence,
                ScheduleCommand.Signal,
                ScheduleCommand.GeneralRecall,
                ScheduleCommand.IndividualRecall,
                ScheduleCommand.Postpone,
                ScheduleCommand.Resume,
                ScheduleCommand.Abandon
{
    /**
     * Short name used in rejection reports, e.g. {@code signalStart}.
     */
    String name();

    /**
     * The entry this command addresses, if it is an entry command.
     */
    default Optional<String> targetEntryId() {
        return Optional.empty();
    }

    /**
     * A fleet to append, with the entry id it will be stored under.
     */
    record NewFleet(String entryId, FleetEntryRequest request) {
        public NewFleet {
            Objects.requireNonNull(entryId, "entryId");
            Objects.requireNonNull(request, "request");
        }
    }

    record AddFleets(List<NewFleet> fleets) implements ScheduleCommand {
        public AddFleets {
            fleets = List.copyOf(fleets);
        }

        @Override
        public String name() {
            return "addFleets";
        }
    }

    record RemoveFleet(String entryId) implements ScheduleCommand {
        @Override
        public String name() {
            return "removeFleet";
        }

        @Override
        public Optional<String> targetEntryId() {
            return Optional.of(entryId);
        }
    }

    record UpdateFleet(String entryId, FleetUpdate update) implements ScheduleCommand {
        public UpdateFleet {
            Objects.requireNonNull(update, "update");
        }

        @Override
        public String name() {
            return "updateFleet";
        }

        @Override
        public Optional<String> targetEntryId() {
            return Optional.of(entryId);
        }
    }

    record ReorderFleets(List<String> orderedEntryIds) implements ScheduleCommand {
        public ReorderFleets {
            orderedEntryIds = List.copyOf(orderedEntryIds);
        }

        @Override
        public String name() {
            return "reorderFleets";
        }
    }

    record UpdateSchedule(ScheduleUpdate update) implements ScheduleCommand {
        public UpdateSchedule {
            Objects.requireNonNull(update, "update");
        }

        @Override
        public String name() {
            return "updateSchedule";
        }
    }

    record MarkReady() implements ScheduleCommand {
        @Override
        public String name() {
            return "markReady";
        }
    }

    record StartSequence() implements ScheduleCommand {
        @Override
        public String name() {
            return "startSequence";
        }
    }

    record Signal(String entryId, SignalStage stage) implements ScheduleCommand {
        public Signal {
            Objects.requireNonNull(entryId, "entryId");
            Objects.requireNonNull(stage, "stage");
        }

        @Override
        public String name() {
            return switch (stage) {
                case WARNING -> "signalWarning";
                case PREPARATORY -> "signalPreparatory";
                case ONE_MINUTE -> "signalOneMinute";
                case START -> "signalStart";
            };
        }

        @Override
        public Optional<String> targetEntryId() {
            return Optional.of(entryId);
        }
    }

    record GeneralRecall(String entryId, String reason) implements ScheduleCommand {
        @Override
        public String name() {
            return "generalRecall";
        }

        @Override
        public Optional<String> targetEntryId() {
            return Optional.of(entryId);
        }
    }

    record IndividualRecall(String entryId, List<String> boatIds) implements ScheduleCommand {
        public IndividualRecall {
            boatIds = List.copyOf(boatIds);
            if (boatIds.isEmpty()) {
                throw new IllegalArgumentException("individual recall needs at least one boat");
            }
        }

        @Override
        public String name() {
            return "individualRecall";
        }

        @Override
        public Optional<String> targetEntryId() {
            return Optional.of(entryId);
        }
    }

    record Postpone(String entryId, String reason) implements ScheduleCommand {
        @Override
        public String name() {
            return "postpone";
        }

        @Override
        public Optional<String> targetEntryId() {
            return Optional.of(entryId);
        }
    }

    record Resume(String entryId, Instant newWarningTime) implements ScheduleCommand {
        public Resume {
            Objects.requireNonNull(newWarningTime, "newWarningTime");
        }

        @Override
        public String name() {
            return "resume";
        }

        @Override
        public Optional<String> targetEntryId() {
            return Optional.of(entryId);
        }
    }

    record Abandon(String entryId, String reason) implements ScheduleCommand {
        @Override
        public String name() {
            return "abandon";
        }

        @Override
        public Optional<String> targetEntryId() {
            return Optional.of(entryId);
        }
    }
}
