package com.questrail.startline.observability;

/**
 * No-op implementation of StartEventSink.
 */
public final class NullStartEventSink implements StartEventSink {
    public static final NullStartEventSink INSTANCE = new NullStartEventSink();

    private NullStartEventSink() {}

    @Override
    public void onEvent(StartEvent event) {}

    @Override
    public void onCommandRejected(CommandRejectedEvent event) {}

    @Override
    public void onError(SchedulerErrorEvent event) {}
}
