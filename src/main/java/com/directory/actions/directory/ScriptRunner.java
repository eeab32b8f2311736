package com.directory.actions.directory;

/**
 * Runs a PowerShell script and returns its standard output.
 */
public interface ScriptRunner {

    /**
     * @param script complete script text; all interpolated values must already be escaped
     * @return standard output
     * @throws DirectoryException on non-zero exit, timeout or I/O failure
     */
    String run(String script) throws DirectoryException;
}
