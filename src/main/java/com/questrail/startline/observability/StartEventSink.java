package com.questrail.startline.observability;

/**
 * Receives the start scheduler's event stream.
 * Implementations can provide committee logging, broadcasting or test recording.
 *
 * <p>Callbacks arrive after the change has been committed. An implementation
 * that throws does not undo the change.</p>
 */
public interface StartEventSink {
    /**
     * Called once per committed, externally observable change.
     * @param event the change
     */
    void onEvent(StartEvent event);

    /**
     * Called when a command is refused.
     * @param event the refused command and its reason
     */
    void onCommandRejected(CommandRejectedEvent event);

    /**
     * Called when an error occurs outside the command path.
     * @param event the error event
     */
    void onError(SchedulerErrorEvent event);
}
