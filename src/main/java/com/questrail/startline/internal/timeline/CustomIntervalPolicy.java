package com.questrail.startline.internal.timeline;

/**
 * How a fleet's {@code customIntervalMinutes} combines with the rolling chain
 * when planning the next fleet.
 */
public enum CustomIntervalPolicy
{
    /**
     * The custom value is the start-to-start gap to the next fleet. A value
     * equal to the sequence length reproduces the plain rolling chain.
     */
    REPLACE,

    /**
     * The custom value is dead time inserted between this fleet's start and
     * the next fleet's warning.
     */
    ADD
}
