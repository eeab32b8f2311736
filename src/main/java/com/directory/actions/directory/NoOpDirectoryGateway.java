package com.directory.actions.directory;

import com.directory.actions.core.model.Identity;
import com.directory.actions.core.model.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Dry-run gateway. Searches find nothing and every action reports success without touching
 * the directory. Selected with {@code desk.directory.mode=noop}.
 */
public class NoOpDirectoryGateway implements DirectorySearch, DirectoryActionExecutor {
    private static final Logger log = LoggerFactory.getLogger(NoOpDirectoryGateway.class);

    @Override
    public List<Identity> search(String queryText) {
        log.info("directory.noop.search query={}", queryText);
        return List.of();
    }

    @Override
    public ActionOutcome performAction(JobType jobType, String targetHandle) {
        log.info("directory.noop.action type={} target={}", jobType, targetHandle);
        return ActionOutcome.ok("dry-run");
    }

    @Override
    public ActionOutcome resetPassword(String targetHandle, String newPassword) {
        log.info("directory.noop.reset target={}", targetHandle);
        return ActionOutcome.ok("dry-run");
    }
}
