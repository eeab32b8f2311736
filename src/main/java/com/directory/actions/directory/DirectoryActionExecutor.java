package com.directory.actions.directory;

import com.directory.actions.core.model.JobType;

/**
 * Capability interface for the administrative operations the desk performs on the directory.
 * Calls may be slow and may leave the process (subprocess or remote shell).
 *
 * <p>Implementations receive handles that already passed {@link InputSanitizer#validateHandle(String)}
 * and must still escape every value they interpolate into a script.</p>
 */
public interface DirectoryActionExecutor {

    /**
     * Performs the deferred action behind a job.
     *
     * @param jobType      what to do
     * @param targetHandle account handle
     * @return backend outcome
     * @throws DirectoryException if the backend call could not be completed
     */
    ActionOutcome performAction(JobType jobType, String targetHandle) throws DirectoryException;

    /**
     * Sets a new password and forces a change at next logon.
     *
     * @param targetHandle account handle
     * @param newPassword  generated password
     * @return backend outcome
     * @throws DirectoryException if the backend call could not be completed
     */
    ActionOutcome resetPassword(String targetHandle, String newPassword) throws DirectoryException;
}
