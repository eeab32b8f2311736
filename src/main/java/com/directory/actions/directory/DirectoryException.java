package com.directory.actions.directory;

/**
 * Checked exception raised when the directory backend cannot complete a search or action:
 * the script host failed, timed out, or returned output that could not be read.
 */
public class DirectoryException extends Exception {

    public DirectoryException(String message) {
        super(message);
    }

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
