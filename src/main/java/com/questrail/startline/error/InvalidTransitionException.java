package com.questrail.startline.error;

import com.questrail.startline.model.FleetStartStatus;

/**
 * A command is not legal for the fleet's current status.
 */
public final class InvalidTransitionException extends StartSchedulerException
{
    private final String entryId;
    private final FleetStartStatus currentStatus;
    private final String command;

    public InvalidTransitionException(String entryId, FleetStartStatus currentStatus, String command) {
        this(entryId, currentStatus, command,
                command + " is not allowed while fleet " + entryId + " is " + currentStatus.wireName());
    }

    public InvalidTransitionException(String entryId, FleetStartStatus currentStatus, String command, String message) {
        super(message);
        this.entryId = entryId;
        this.currentStatus = currentStatus;
        this.command = command;
    }

    public String entryId() {
        return entryId;
    }

    public FleetStartStatus currentStatus() {
        return currentStatus;
    }

    public String command() {
        return command;
    }
}
