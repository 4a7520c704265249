package com.questrail.startline.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FleetStartEntry
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one fleet's place in a start schedule.
 *
 * <h2>Planned vs actual times</h2>
 * Planned times are derived by the timeline calculator and may be rewritten
 * whenever the schedule changes shape, but only while the entry is
 * {@link FleetStartStatus#PENDING}. Actual times are stamped by the matching
 * signal command and are cleared only by a general recall or a postponement,
 * both of which restart the fleet's sequence.
 *
 * <h2>Mutation</h2>
 * Every change produces a new instance through {@link #toBuilder()}. Entries
 * belong to exactly one {@link StartSchedule} and are only ever replaced as
 * part of a new schedule snapshot.
 */
public final class FleetStartEntry
{
    private final String id;
    private final String scheduleId;
    private final String fleetId;
    private final String fleetName;
    private final String classFlag;
    private final int startOrder;
    private final int raceNumber;

    private final Instant plannedWarningTime;
    private final Instant plannedPrepTime;
    private final Instant plannedStartTime;

    private final Instant actualWarningTime;
    private final Instant actualPrepTime;
    private final Instant actualOneMinuteTime;
    private final Instant actualStartTime;

    private final FleetStartStatus status;
    private final int recallCount;
    private final Instant lastRecallAt;
    private final String recallNotes;
    private final List<String> ocsBoatIds;

    private final Integer customIntervalMinutes;
    private final Instant anchoredWarningTime;

    private FleetStartEntry(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.scheduleId = Objects.requireNonNull(b.scheduleId, "scheduleId");
        this.fleetId = b.fleetId;
        this.fleetName = Objects.requireNonNull(b.fleetName, "fleetName");
        this.classFlag = b.classFlag;
        this.startOrder = b.startOrder;
        this.raceNumber = b.raceNumber;
        this.plannedWarningTime = b.plannedWarningTime;
        this.plannedPrepTime = b.plannedPrepTime;
        this.plannedStartTime = b.plannedStartTime;
        this.actualWarningTime = b.actualWarningTime;
        this.actualPrepTime = b.actualPrepTime;
        this.actualOneMinuteTime = b.actualOneMinuteTime;
        this.actualStartTime = b.actualStartTime;
        this.status = Objects.requireNonNull(b.status, "status");
        this.recallCount = b.recallCount;
        this.lastRecallAt = b.lastRecallAt;
        this.recallNotes = b.recallNotes;
        this.ocsBoatIds = List.copyOf(b.ocsBoatIds);
        this.customIntervalMinutes = b.customIntervalMinutes;
        this.anchoredWarningTime = b.anchoredWarningTime;

        if (startOrder < 1) {
            throw new IllegalArgumentException("startOrder must be >= 1, was " + startOrder);
        }
        if (recallCount < 0) {
            throw new IllegalArgumentException("recallCount must be >= 0");
        }
        if (customIntervalMinutes != null && customIntervalMinutes < 0) {
            throw new IllegalArgumentException("customIntervalMinutes must be >= 0");
        }
    }

    public String id() {
        return id;
    }

    public String scheduleId() {
        return scheduleId;
    }

    /**
     * External fleet reference, if the fleet is managed elsewhere.
     */
    public Optional<String> fleetId() {
        return Optional.ofNullable(fleetId);
    }

    public String fleetName() {
        return fleetName;
    }

    public Optional<String> classFlag() {
        return Optional.ofNullable(classFlag);
    }

    public int startOrder() {
        return startOrder;
    }

    public int raceNumber() {
        return raceNumber;
    }

    public Optional<Instant> plannedWarningTime() {
        return Optional.ofNullable(plannedWarningTime);
    }

    public Optional<Instant> plannedPrepTime() {
        return Optional.ofNullable(plannedPrepTime);
    }

    public Optional<Instant> plannedStartTime() {
        return Optional.ofNullable(plannedStartTime);
    }

    public Optional<Instant> actualWarningTime() {
        return Optional.ofNullable(actualWarningTime);
    }

    public Optional<Instant> actualPrepTime() {
        return Optional.ofNullable(actualPrepTime);
    }

    public Optional<Instant> actualOneMinuteTime() {
        return Optional.ofNullable(actualOneMinuteTime);
    }

    public Optional<Instant> actualStartTime() {
        return Optional.ofNullable(actualStartTime);
    }

    public FleetStartStatus status() {
        return status;
    }

    public int recallCount() {
        return recallCount;
    }

    public Optional<Instant> lastRecallAt() {
        return Optional.ofNullable(lastRecallAt);
    }

    public Optional<String> recallNotes() {
        return Optional.ofNullable(recallNotes);
    }

    /**
     * Boats recorded as on course side by individual recalls, first recorded first.
     */
    public List<String> ocsBoatIds() {
        return ocsBoatIds;
    }

    /**
     * Override of the start-to-start gap to the next fleet, in minutes.
     */
    public Optional<Integer> customIntervalMinutes() {
        return Optional.ofNullable(customIntervalMinutes);
    }

    /**
     * Warning time pinned by a resume after postponement.
     */
    public Optional<Instant> anchoredWarningTime() {
        return Optional.ofNullable(anchoredWarningTime);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FleetStartEntry e)) {
            return false;
        }
        return startOrder == e.startOrder
                && raceNumber == e.raceNumber
                && recallCount == e.recallCount
                && id.equals(e.id)
                && scheduleId.equals(e.scheduleId)
                && Objects.equals(fleetId, e.fleetId)
                && fleetName.equals(e.fleetName)
                && Objects.equals(classFlag, e.classFlag)
                && Objects.equals(plannedWarningTime, e.plannedWarningTime)
                && Objects.equals(plannedPrepTime, e.plannedPrepTime)
                && Objects.equals(plannedStartTime, e.plannedStartTime)
                && Objects.equals(actualWarningTime, e.actualWarningTime)
                && Objects.equals(actualPrepTime, e.actualPrepTime)
                && Objects.equals(actualOneMinuteTime, e.actualOneMinuteTime)
                && Objects.equals(actualStartTime, e.actualStartTime)
                && status == e.status
                && Objects.equals(lastRecallAt, e.lastRecallAt)
                && Objects.equals(recallNotes, e.recallNotes)
                && ocsBoatIds.equals(e.ocsBoatIds)
                && Objects.equals(customIntervalMinutes, e.customIntervalMinutes)
                && Objects.equals(anchoredWarningTime, e.anchoredWarningTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, scheduleId, startOrder, status, plannedWarningTime, actualWarningTime, recallCount);
    }

    @Override
    public String toString() {
        return "FleetStartEntry{" + fleetName + " #" + startOrder + " " + status.wireName()
                + ", plannedWarning=" + plannedWarningTime
                + ", plannedStart=" + plannedStartTime
                + ", actualStart=" + actualStartTime + "}";
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder
    {
        private String id;
        private String scheduleId;
        private String fleetId;
        private String fleetName;
        private String classFlag;
        private int startOrder = 1;
        private int raceNumber = 1;
        private Instant plannedWarningTime;
        private Instant plannedPrepTime;
        private Instant plannedStartTime;
        private Instant actualWarningTime;
        private Instant actualPrepTime;
        private Instant actualOneMinuteTime;
        private Instant actualStartTime;
        private FleetStartStatus status = FleetStartStatus.PENDING;
        private int recallCount;
        private Instant lastRecallAt;
        private String recallNotes;
        private List<String> ocsBoatIds = new ArrayList<>();
        private Integer customIntervalMinutes;
        private Instant anchoredWarningTime;

        private Builder() {}

        private Builder(FleetStartEntry e) {
            this.id = e.id;
            this.scheduleId = e.scheduleId;
            this.fleetId = e.fleetId;
            this.fleetName = e.fleetName;
            this.classFlag = e.classFlag;
            this.startOrder = e.startOrder;
            this.raceNumber = e.raceNumber;
            this.plannedWarningTime = e.plannedWarningTime;
            this.plannedPrepTime = e.plannedPrepTime;
            this.plannedStartTime = e.plannedStartTime;
            this.actualWarningTime = e.actualWarningTime;
            this.actualPrepTime = e.actualPrepTime;
            this.actualOneMinuteTime = e.actualOneMinuteTime;
            this.actualStartTime = e.actualStartTime;
            this.status = e.status;
            this.recallCount = e.recallCount;
            this.lastRecallAt = e.lastRecallAt;
            this.recallNotes = e.recallNotes;
            this.ocsBoatIds = new ArrayList<>(e.ocsBoatIds);
            this.customIntervalMinutes = e.customIntervalMinutes;
            this.anchoredWarningTime = e.anchoredWarningTime;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder scheduleId(String scheduleId) {
            this.scheduleId = scheduleId;
            return this;
        }

        public Builder fleetId(String fleetId) {
            this.fleetId = fleetId;
            return this;
        }

        public Builder fleetName(String fleetName) {
            this.fleetName = fleetName;
            return this;
        }

        public Builder classFlag(String classFlag) {
            this.classFlag = classFlag;
            return this;
        }

        public Builder startOrder(int startOrder) {
            this.startOrder = startOrder;
            return this;
        }

        public Builder raceNumber(int raceNumber) {
            this.raceNumber = raceNumber;
            return this;
        }

        public Builder plannedWarningTime(Instant t) {
            this.plannedWarningTime = t;
            return this;
        }

        public Builder plannedPrepTime(Instant t) {
            this.plannedPrepTime = t;
            return this;
        }

        public Builder plannedStartTime(Instant t) {
            this.plannedStartTime = t;
            return this;
        }

        public Builder actualWarningTime(Instant t) {
            this.actualWarningTime = t;
            return this;
        }

        public Builder actualPrepTime(Instant t) {
            this.actualPrepTime = t;
            return this;
        }

        public Builder actualOneMinuteTime(Instant t) {
            this.actualOneMinuteTime = t;
            return this;
        }

        public Builder actualStartTime(Instant t) {
            this.actualStartTime = t;
            return this;
        }

        /**
         * Clears every actual signal time; used when a fleet's sequence restarts.
         */
        public Builder clearActualTimes() {
            this.actualWarningTime = null;
            this.actualPrepTime = null;
            this.actualOneMinuteTime = null;
            this.actualStartTime = null;
            return this;
        }

        public Builder status(FleetStartStatus status) {
            this.status = status;
            return this;
        }

        public Builder recallCount(int recallCount) {
            this.recallCount = recallCount;
            return this;
        }

        public Builder lastRecallAt(Instant t) {
            this.lastRecallAt = t;
            return this;
        }

        public Builder recallNotes(String recallNotes) {
            this.recallNotes = recallNotes;
            return this;
        }

        public Builder ocsBoatIds(List<String> ids) {
            this.ocsBoatIds = new ArrayList<>(ids);
            return this;
        }

        public Builder customIntervalMinutes(Integer minutes) {
            this.customIntervalMinutes = minutes;
            return this;
        }

        public Builder anchoredWarningTime(Instant t) {
            this.anchoredWarningTime = t;
            return this;
        }

        public FleetStartEntry build() {
            return new FleetStartEntry(this);
        }
    }
}
