package com.questrail.startline.error;

/**
 * Unknown sequence type name, or offsets that do not form a valid sequence.
 */
public final class InvalidSequenceTypeException extends StartSchedulerException
{
    public InvalidSequenceTypeException(String message) {
        super(message);
    }
}
