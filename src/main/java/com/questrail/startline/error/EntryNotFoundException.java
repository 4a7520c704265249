package com.questrail.startline.error;

/**
 * No fleet entry with the given id exists.
 */
public final class EntryNotFoundException extends StartSchedulerException
{
    private final String entryId;

    public EntryNotFoundException(String entryId) {
        super("Fleet entry not found: " + entryId);
        this.entryId = entryId;
    }

    public String entryId() {
        return entryId;
    }
}
