package com.hivemind.core.store;

/**
 * Unrecoverable task store failure (database unavailable, corrupt row).
 * Propagates to the hosting service.
 */
public class TaskStoreException extends RuntimeException {

    public TaskStoreException(String message) {
        super(message);
    }

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
