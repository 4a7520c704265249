package com.questrail.startline.model;

/**
 * One audible/visual signal of a start sequence, in the order they are made.
 *
 * <p>Each stage maps to the {@link FleetStartStatus} the fleet holds after the
 * signal has been made.</p>
 */
public enum SignalStage
{
    WARNING(FleetStartStatus.WARNING),
    PREPARATORY(FleetStartStatus.PREPARATORY),
    ONE_MINUTE(FleetStartStatus.ONE_MINUTE),
    START(FleetStartStatus.STARTED);

    private final FleetStartStatus resultingStatus;

    SignalStage(FleetStartStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public FleetStartStatus resultingStatus() {
        return resultingStatus;
    }
}
