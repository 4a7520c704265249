package com.questrail.startline.model;

import com.questrail.startline.error.DuplicateStartOrderException;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * StartSchedule
 * -----------------------------------------------------------------------------
 * Immutable aggregate root: one regatta day's chain of fleet starts.
 *
 * <h2>Aggregate boundary</h2>
 * A schedule owns its {@link FleetStartEntry} list outright. Entries are never
 * edited on their own; every command produces a whole new schedule snapshot,
 * which the repository saves in one step.
 *
 * <h2>Ordering invariant</h2>
 * Entries are kept sorted by {@code startOrder}, and {@code startOrder} values
 * are exactly {@code 1..n}. The constructor rejects any snapshot that breaks
 * this, so a duplicate or gapped order can never be persisted.
 *
 * <h2>Versioning</h2>
 * {@link #version()} is the optimistic concurrency token. It is assigned by
 * the repository on save; the reducer carries it through unchanged.
 */
public final class StartSchedule
{
    private final String id;
    private final String regattaId;
    private final String name;
    private final LocalDate scheduledDate;
    private final String notes;
    private final SequenceProfile sequence;
    private final int startIntervalMinutes;
    private final Instant firstWarningTime;
    private final Instant actualFirstWarningTime;
    private final ScheduleStatus status;
    private final long version;
    private final List<FleetStartEntry> entries;
    private final Instant createdAt;
    private final Instant updatedAt;

    private StartSchedule(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.regattaId = Objects.requireNonNull(b.regattaId, "regattaId");
        this.name = Objects.requireNonNull(b.name, "name");
        this.scheduledDate = Objects.requireNonNull(b.scheduledDate, "scheduledDate");
        this.notes = b.notes;
        this.sequence = Objects.requireNonNull(b.sequence, "sequence");
        this.startIntervalMinutes = b.startIntervalMinutes;
        this.firstWarningTime = b.firstWarningTime;
        this.actualFirstWarningTime = b.actualFirstWarningTime;
        this.status = Objects.requireNonNull(b.status, "status");
        this.version = b.version;
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(b.updatedAt, "updatedAt");

        if (startIntervalMinutes <= 0) {
            throw new IllegalArgumentException("startIntervalMinutes must be positive, was " + startIntervalMinutes);
        }

        List<FleetStartEntry> sorted = new ArrayList<>(b.entries);
        sorted.sort(Comparator.comparingInt(FleetStartEntry::startOrder));
        assertDenseOrder(id, sorted);
        this.entries = List.copyOf(sorted);
    }

    private static void assertDenseOrder(String scheduleId, List<FleetStartEntry> sorted) {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < sorted.size(); i++) {
            FleetStartEntry e = sorted.get(i);
            if (!scheduleId.equals(e.scheduleId())) {
                throw new IllegalArgumentException("Entry " + e.id() + " belongs to schedule " + e.scheduleId());
            }
            if (!ids.add(e.id())) {
                throw new DuplicateStartOrderException("Entry " + e.id() + " appears more than once");
            }
            if (e.startOrder() != i + 1) {
                throw new DuplicateStartOrderException(
                        "Start order must be dense 1.." + sorted.size() + "; entry " + e.id()
                                + " at position " + (i + 1) + " has startOrder " + e.startOrder());
            }
        }
    }

    public String id() {
        return id;
    }

    public String regattaId() {
        return regattaId;
    }

    public String name() {
        return name;
    }

    public LocalDate scheduledDate() {
        return scheduledDate;
    }

    public Optional<String> notes() {
        return Optional.ofNullable(notes);
    }

    public SequenceProfile sequence() {
        return sequence;
    }

    public String sequenceType() {
        return sequence.sequenceType();
    }

    public int startIntervalMinutes() {
        return startIntervalMinutes;
    }

    public Optional<Instant> firstWarningTime() {
        return Optional.ofNullable(firstWarningTime);
    }

    public Optional<Instant> actualFirstWarningTime() {
        return Optional.ofNullable(actualFirstWarningTime);
    }

    public ScheduleStatus status() {
        return status;
    }

    public long version() {
        return version;
    }

    /**
     * Entries in start order.
     */
    public List<FleetStartEntry> entries() {
        return entries;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Optional<FleetStartEntry> entry(String entryId) {
        for (FleetStartEntry e : entries) {
            if (e.id().equals(entryId)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /**
     * The entry currently mid-sequence, if any.
     */
    public Optional<FleetStartEntry> signalingEntry() {
        return entries.stream().filter(e -> e.status().isSignaling()).findFirst();
    }

    /**
     * The lowest-ordered entry still waiting for its warning signal.
     */
    public Optional<FleetStartEntry> firstPendingEntry() {
        return entries.stream().filter(e -> e.status() == FleetStartStatus.PENDING).findFirst();
    }

    /**
     * True when no entry is pending or mid-sequence.
     */
    public boolean hasNoOutstandingStarts() {
        return entries.stream().noneMatch(e -> e.status() == FleetStartStatus.PENDING || e.status().isSignaling());
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
        if (!(o instanceof StartSchedule s)) {
            return false;
        }
        return startIntervalMinutes == s.startIntervalMinutes
                && version == s.version
                && id.equals(s.id)
                && regattaId.equals(s.regattaId)
                && name.equals(s.name)
                && scheduledDate.equals(s.scheduledDate)
                && Objects.equals(notes, s.notes)
                && sequence.equals(s.sequence)
                && Objects.equals(firstWarningTime, s.firstWarningTime)
                && Objects.equals(actualFirstWarningTime, s.actualFirstWarningTime)
                && status == s.status
                && entries.equals(s.entries)
                && createdAt.equals(s.createdAt)
                && updatedAt.equals(s.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, status, entries);
    }

    @Override
    public String toString() {
        return "StartSchedule{" + id + " '" + name + "' " + status + " v" + version
                + ", " + sequence + ", fleets=" + entries.size() + "}";
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder
    {
        private String id;
        private String regattaId;
        private String name;
        private LocalDate scheduledDate;
        private String notes;
        private SequenceProfile sequence;
        private int startIntervalMinutes = 5;
        private Instant firstWarningTime;
        private Instant actualFirstWarningTime;
        private ScheduleStatus status = ScheduleStatus.DRAFT;
        private long version;
        private List<FleetStartEntry> entries = new ArrayList<>();
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {}

        private Builder(StartSchedule s) {
            this.id = s.id;
            this.regattaId = s.regattaId;
            this.name = s.name;
            this.scheduledDate = s.scheduledDate;
            this.notes = s.notes;
            this.sequence = s.sequence;
            this.startIntervalMinutes = s.startIntervalMinutes;
            this.firstWarningTime = s.firstWarningTime;
            this.actualFirstWarningTime = s.actualFirstWarningTime;
            this.status = s.status;
            this.version = s.version;
            this.entries = new ArrayList<>(s.entries);
            this.createdAt = s.createdAt;
            this.updatedAt = s.updatedAt;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder regattaId(String regattaId) {
            this.regattaId = regattaId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder scheduledDate(LocalDate scheduledDate) {
            this.scheduledDate = scheduledDate;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder sequence(SequenceProfile sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder startIntervalMinutes(int minutes) {
            this.startIntervalMinutes = minutes;
            return this;
        }

        public Builder firstWarningTime(Instant t) {
            this.firstWarningTime = t;
            return this;
        }

        public Builder actualFirstWarningTime(Instant t) {
            this.actualFirstWarningTime = t;
            return this;
        }

        public Builder status(ScheduleStatus status) {
            this.status = status;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder entries(List<FleetStartEntry> entries) {
            this.entries = new ArrayList<>(entries);
            return this;
        }

        public Builder createdAt(Instant t) {
            this.createdAt = t;
            return this;
        }

        public Builder updatedAt(Instant t) {
            this.updatedAt = t;
            return this;
        }

        public StartSchedule build() {
            return new StartSchedule(this);
        }
    }
}
