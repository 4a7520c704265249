package com.questrail.startline.codec;

/**
 * A datagram could not be read as a start event.
 */
public final class StartEventDecodeException extends RuntimeException
{
    public StartEventDecodeException(String message) {
        super(message);
    }

    public StartEventDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
