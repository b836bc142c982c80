package com.image.optimization.api;

/**
 * Lifecycle of a batch. There is no failed state: failures belong to items.
 */
public enum BatchState {
    NOT_STARTED,
    RUNNING,
    COMPLETED
}
