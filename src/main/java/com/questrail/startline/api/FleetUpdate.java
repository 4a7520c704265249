package com.questrail.startline.api;

/**
 * Edits to one fleet of a draft schedule. {@code null} leaves a field as it is.
 *
 * @param clearCustomInterval drop the fleet's custom interval; takes precedence
 *                            over {@code customIntervalMinutes}
 */
public record FleetUpdate(
    String fleetName,
    String classFlag,
    Integer raceNumber,
    Integer customIntervalMinutes,
    boolean clearCustomInterval
) {
    public FleetUpdate {
        if (fleetName != null && fleetName.isBlank()) {
            throw new IllegalArgumentException("fleetName must not be blank");
        }
        if (raceNumber != null && raceNumber < 1) {
            throw new IllegalArgumentException("raceNumber must be >= 1");
        }
        if (customIntervalMinutes != null && customIntervalMinutes < 0) {
            throw new IllegalArgumentException("customIntervalMinutes must be >= 0");
        }
    }

    public static FleetUpdate customInterval(int minutes) {
        return new FleetUpdate(null, null, null, minutes, false);
    }

    public static FleetUpdate rename(String fleetName) {
        return new FleetUpdate(fleetName, null, null, null, false);
    }
}
