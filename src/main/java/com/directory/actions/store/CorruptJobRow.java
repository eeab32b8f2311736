package com.directory.actions.store;

/**
 * A live job row that could not be turned into a {@code Job}, typically because its
 * {@code run_at} does not parse. Reported by the scan and skipped by recovery.
 */
public record CorruptJobRow(long id, String targetHandle, String rawRunAt, String problem) {
}
