package com.directory.actions.store;

/**
 * Runtime exception thrown when the job or audit tables cannot be read or written.
 * A request that hits this exception is rejected and no timer is armed.
 */
public class JobPersistenceException extends RuntimeException {

    public JobPersistenceException(String message) {
        super(message);
    }

    public JobPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
