package com.contentvalidator.validation.dto;

/**
 * Event delivered to progress subscribers. {@code done} is sent exactly once,
 * carrying the terminal snapshot, and ends the stream.
 */
public record ProgressEvent(String eventType, ProgressSnapshot snapshot) {

    public static final String PROGRESS = "progress";
    public static final String DONE = "done";

    public static ProgressEvent of(ProgressSnapshot snapshot) {
        return new ProgressEvent(snapshot.isTerminal() ? DONE : PROGRESS, snapshot);
    }

    public boolean isDone() {
        return DONE.equals(eventType);
    }
}
