package com.directory.actions.store;

import com.directory.actions.core.model.Job;

import java.util.List;

/**
 * Result of reading all {@code SCHEDULED} rows: readable jobs in ascending due order and the
 * rows that could not be read.
 */
public record ScheduledScan(List<Job> jobs, List<CorruptJobRow> corrupt) {

    public ScheduledScan {
        jobs = List.copyOf(jobs);
        corrupt = List.copyOf(corrupt);
    }
}
