package com.questrail.startline.api;

import com.questrail.startline.model.SequenceProfiles;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Edits to a draft schedule's settings. {@code null} leaves a field as it is.
 */
public record ScheduleUpdate(
    String name,
    LocalDate scheduledDate,
    String sequenceType,
    SequenceProfiles.CustomOffsets customOffsets,
    Integer startIntervalMinutes,
    Instant firstWarningTime,
    String notes
) {
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private LocalDate scheduledDate;
        private String sequenceType;
        private SequenceProfiles.CustomOffsets customOffsets;
        private Integer startIntervalMinutes;
        private Instant firstWarningTime;
        private String notes;

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

        public Builder withCustomOffsets(SequenceProfiles.CustomOffsets offsets) {
            this.customOffsets = offsets;
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

        public ScheduleUpdate build() {
            return new ScheduleUpdate(name, scheduledDate, sequenceType, customOffsets,
                    startIntervalMinutes, firstWarningTime, notes);
        }
    }
}
