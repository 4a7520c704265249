package com.questrail.startline.api;

import com.questrail.startline.model.SequenceProfiles;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Everything needed to create a new draft schedule.
 *
 * <p>{@code sequenceType} and {@code startIntervalMinutes} may be left
 * {@code null}; the scheduler then applies its configured defaults.
 * {@code customOffsets} is only read for the {@value SequenceProfiles#CUSTOM}
 * sequence.</p>
 */
public record ScheduleDefinition(
    String regattaId,
    String name,
    LocalDate scheduledDate,
    String sequenceType,
    SequenceProfiles.CustomOffsets customOffsets,
    Integer startIntervalMinutes,
    Instant firstWarningTime,
    String notes
) {
    public ScheduleDefinition {
        Objects.requireNonNull(regattaId, "regattaId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(scheduledDate, "scheduledDate");
        if (startIntervalMinutes != null && startIntervalMinutes <= 0) {
            throw new IllegalArgumentException("startIntervalMinutes must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String regattaId;
        private String name;
        private LocalDate scheduledDate;
        private String sequenceType;
        private SequenceProfiles.CustomOffsets customOffsets;
        private Integer startIntervalMinutes;
        private Instant firstWarningTime;
        private String notes;

        public Builder withRegattaId(String regattaId) {
            this.regattaId = regattaId;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withScheduledDate(LocalDate date) {
            this.scheduledDate = date;
            return this;
        }

        public Builder withSequenceType(String sequenceType) {
            this.sequenceType = sequenceType;
            return this;
        }

        public Builder withCustomOffsets(int warningMinutes, Integer prepMinutes, Integer oneMinuteMinutes) {
            this.customOffsets = new SequenceProfiles.CustomOffsets(warningMinutes, prepMinutes, oneMinuteMinutes);
            return this;
        }

        public Builder withStartIntervalMinutes(int minutes) {
            this.startIntervalMinutes = minutes;
            return this;
        }

        public Builder withFirstWarningTime(Instant t) {
            this.firstWarningTime = t;
            return this;
        }

        public Builder withNotes(String notes) {
            this.notes = notes;
            return this;
        }

        public ScheduleDefinition build() {
            return new ScheduleDefinition(regattaId, name, scheduledDate, sequenceType, customOffsets,
                    startIntervalMinutes, firstWarningTime, notes);
        }
    }
}
