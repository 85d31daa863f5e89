package io.pollwatch;

/** Lifecycle of a {@link PollingObserver}. Transitions only move forward. */
public enum ObserverState {
    CREATED,
    RUNNING,
    STOPPING,
    STOPPED
}
