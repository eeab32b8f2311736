package com.directory.actions.api;

import com.directory.actions.core.model.Identity;
import com.directory.actions.core.model.Job;
import com.directory.actions.intake.Intent;

import java.util.List;

/**
 * Typed answer to an operator request. Transports decide how to render each variant;
 * {@link #message()} is a plain-text fallback.
 */
public interface Reply {

    String message();

    record NotUnderstood() implements Reply {
        @Override
        public String message() {
            return "Command not recognised. Try \"reset password <name>\" or \"disable <name> <date>\".";
        }
    }

    record QueryMissing(Intent intent) implements Reply {
        @Override
        public String message() {
            return "Whose account? Add a name or login to the command.";
        }
    }

    record IdentityNotFound(String query) implements Reply {
        @Override
        public String message() {
            return "No account matches '" + query + "'.";
        }
    }

    record SelectionRequired(DisambiguationPrompt prompt) implements Reply {
        @Override
        public String message() {
            return "Several accounts match '" + prompt.pendingAction().targetQuery() + "'. Pick one.";
        }
    }

    record SelectionExpired() implements Reply {
        @Override
        public String message() {
            return "This selection has expired or was already used. Send the request again.";
        }
    }

    record AccessDenied(String principal) implements Reply {
        @Override
        public String message() {
            return "Access denied.";
        }
    }

    /**
     * @param temporaryPassword the generated password, to be handed to the user out of band
     */
    record PasswordReset(Identity identity, String temporaryPassword) implements Reply {
        @Override
        public String message() {
            return "Password for " + identity.label() + " was reset. It must be changed at next logon.";
        }
    }

    record DeactivationScheduled(Identity identity, Job job) implements Reply {
        @Override
        public String message() {
            return "Account " + identity.label() + " will be disabled at " + job.runAt() + " (job " + job.id() + ").";
        }
    }

    record ActionFailed(String reason) implements Reply {
        @Override
        public String message() {
            return "Action failed: " + reason;
        }
    }

    record JobList(List<Job> jobs) implements Reply {
        public JobList {
            jobs = jobs != null ? List.copyOf(jobs) : List.of();
        }

        @Override
        public String message() {
            if (jobs.isEmpty()) {
                return "No scheduled jobs.";
            }
            StringBuilder sb = new StringBuilder("Scheduled jobs:");
            for (Job job : jobs) {
                sb.append('\n').append(job.id()).append(": ").append(job.targetHandle())
                        .append(" at ").append(job.runAt());
            }
            return sb.toString();
        }
    }
}
