package com.questrail.startline.api;

import java.util.Objects;

/**
 * A fleet to be appended to a draft schedule.
 *
 * @param fleetId               external fleet reference, may be {@code null}
 * @param fleetName             display name used in the committee log
 * @param classFlag             flag hoisted with the warning signal, may be {@code null}
 * @param raceNumber            race number for this fleet
 * @param customIntervalMinutes gap override to the next fleet, may be {@code null}
 */
public record FleetEntryRequest(
    String fleetId,
    String fleetName,
    String classFlag,
    int raceNumber,
    Integer customIntervalMinutes
) {
    public FleetEntryRequest {
        Objects.requireNonNull(fleetName, "fleetName");
        if (fleetName.isBlank()) {
            throw new IllegalArgumentException("fleetName must not be blank");
        }
        if (raceNumber < 1) {
            throw new IllegalArgumentException("raceNumber must be >= 1");
        }
        if (customIntervalMinutes != null && customIntervalMinutes < 0) {
            throw new IllegalArgumentException("customIntervalMinutes must be >= 0");
        }
    }

    public static FleetEntryRequest of(String fleetName, int raceNumber) {
        return new FleetEntryRequest(null, fleetName, null, raceNumber, null);
    }

    public FleetEntryRequest withClassFlag(String flag) {
        return new FleetEntryRequest(fleetId, fleetName, flag, raceNumber, customIntervalMinutes);
    }

    public FleetEntryRequest withCustomIntervalMinutes(Integer minutes) {
        return new FleetEntryRequest(fleetId, fleetName, classFlag, raceNumber, minutes);
    }
}
