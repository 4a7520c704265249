package com.questrail.startline.config;

import com.questrail.startline.internal.timeline.CustomIntervalPolicy;
import com.questrail.startline.model.SequenceProfiles;

import java.time.Duration;
import java.util.Objects;

/**
 * SchedulerConfig
 * -----------------------------------------------------------------------------
 * Behavioural settings for a {@code RollingStartScheduler}.
 *
 * <ul>
 *   <li><b>customIntervalPolicy</b> - how a fleet's custom interval combines
 *       with the rolling chain. Default {@link CustomIntervalPolicy#REPLACE}.</li>
 *   <li><b>autoAdvance</b> - whether {@code signalStart} warns the next fleet
 *       in the same command when it is due back-to-back. Default on.</li>
 *   <li><b>autoAdvanceTolerance</b> - how far the next fleet's planned warning
 *       may be from the actual start and still be auto-advanced. Default zero.</li>
 *   <li><b>maxConflictRetries</b> - reload-and-reapply attempts after a stale
 *       save before the conflict is surfaced. Default 2.</li>
 *   <li><b>defaultSequenceType</b> and <b>defaultStartIntervalMinutes</b> - used
 *       when a schedule definition leaves them out.</li>
 *   <li><b>countdownTickInterval</b> - cadence of countdown publication.</li>
 * </ul>
 */
public record SchedulerConfig(
    CustomIntervalPolicy customIntervalPolicy,
    boolean autoAdvance,
    Duration autoAdvanceTolerance,
    int maxConflictRetries,
    String defaultSequenceType,
    int defaultStartIntervalMinutes,
    Duration countdownTickInterval
) {
    public SchedulerConfig {
        Objects.requireNonNull(customIntervalPolicy, "customIntervalPolicy");
        Objects.requireNonNull(autoAdvanceTolerance, "autoAdvanceTolerance");
        Objects.requireNonNull(defaultSequenceType, "defaultSequenceType");
        Objects.requireNonNull(countdownTickInterval, "countdownTickInterval");

        if (autoAdvanceTolerance.isNegative()) {
            throw new IllegalArgumentException("autoAdvanceTolerance must be non-negative");
        }
        if (maxConflictRetries < 0) {
            throw new IllegalArgumentException("maxConflictRetries must be non-negative");
        }
        if (defaultStartIntervalMinutes <= 0) {
            throw new IllegalArgumentException("defaultStartIntervalMinutes must be positive");
        }
        if (countdownTickInterval.isZero() || countdownTickInterval.isNegative()) {
            throw new IllegalArgumentException("countdownTickInterval must be positive");
        }
    }

    public static SchedulerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CustomIntervalPolicy customIntervalPolicy = CustomIntervalPolicy.REPLACE;
        private boolean autoAdvance = true;
        private Duration autoAdvanceTolerance = Duration.ZERO;
        private int maxConflictRetries = 2;
        private String defaultSequenceType = SequenceProfiles.FIVE_FOUR_ONE_GO;
        private int defaultStartIntervalMinutes = 5;
        private Duration countdownTickInterval = Duration.ofSeconds(1);

        public Builder withCustomIntervalPolicy(CustomIntervalPolicy policy) {
            this.customIntervalPolicy = policy;
            return this;
        }

        public Builder withAutoAdvance(boolean enabled) {
            this.autoAdvance = enabled;
            return this;
        }

        public Builder withAutoAdvanceTolerance(Duration tolerance) {
            this.autoAdvanceTolerance = tolerance;
            return this;
        }

        public Builder withMaxConflictRetries(int retries) {
            this.maxConflictRetries = retries;
            return this;
        }

        public Builder withDefaultSequenceType(String sequenceType) {
            this.defaultSequenceType = sequenceType;
            return this;
        }

        public Builder withDefaultStartIntervalMinutes(int minutes) {
            this.defaultStartIntervalMinutes = minutes;
            return this;
        }

        public Builder withCountdownTickInterval(Duration interval) {
            this.countdownTickInterval = interval;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(customIntervalPolicy, autoAdvance, autoAdvanceTolerance,
                    maxConflictRetries, defaultSequenceType, defaultStartIntervalMinutes, countdownTickInterval);
        }
    }
}
