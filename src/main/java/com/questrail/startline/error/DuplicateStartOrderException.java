package com.questrail.startline.error;

/**
 * A reorder would leave two fleets sharing a start position, or leave a gap.
 */
public final class DuplicateStartOrderException extends StartSchedulerException
{
    public DuplicateStartOrderException(String message) {
        super(message);
    }
}
