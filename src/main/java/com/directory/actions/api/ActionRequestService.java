package com.directory.actions.api;

import com.directory.actions.audit.AuditAction;
import com.directory.actions.audit.AuditService;
import com.directory.actions.core.model.ActionKind;
import com.directory.actions.core.model.Identity;
import com.directory.actions.core.model.Job;
import com.directory.actions.core.model.PendingAction;
import com.directory.actions.core.model.RequestSource;
import com.directory.actions.directory.ActionOutcome;
import com.directory.actions.directory.DirectoryActionExecutor;
import com.directory.actions.directory.DirectoryException;
import com.directory.actions.directory.InputSanitizer;
import com.directory.actions.directory.PasswordGenerator;
import com.directory.actions.disambiguation.DisambiguationManager;
import com.directory.actions.disambiguation.DisambiguationToken;
import com.directory.actions.disambiguation.ResolvedSelection;
import com.directory.actions.intake.ClassifiedText;
import com.directory.actions.intake.IntentClassifier;
import com.directory.actions.intake.MailExtractedOffboarding;
import com.directory.actions.intake.SelectionPayload;
import com.directory.actions.logging.LogContext;
import com.directory.actions.operator.OperatorRegistry;
import com.directory.actions.resolver.CandidateSet;
import com.directory.actions.resolver.IdentityResolver;
import com.directory.actions.scheduler.DeactivationScheduler;
import com.directory.actions.store.JobPersistenceException;
import com.directory.actions.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns operator messages, selection callbacks and HR mail notices into directory actions.
 *
 * <p>Every entry point checks the operator roster first. A query that matches one identity is
 * acted on directly; several matches open a disambiguation session and return the choices.
 * Password resets run immediately; deactivations are persisted and armed for later.</p>
 */
public class ActionRequestService {
    private static final Logger log = LoggerFactory.getLogger(ActionRequestService.class);

    private final OperatorRegistry operators;
    private final IntentClassifier classifier;
    private final IdentityResolver resolver;
    private final DisambiguationManager disambiguation;
    private final DirectoryActionExecutor directory;
    private final PasswordGenerator passwordGenerator;
    private final DeactivationScheduler deactivationScheduler;
    private final JobStore jobStore;
    private final AuditService auditService;
    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime deactivationTime;

    public ActionRequestService(OperatorRegistry operators, IntentClassifier classifier, IdentityResolver resolver,
                                DisambiguationManager disambiguation, DirectoryActionExecutor directory,
                                PasswordGenerator passwordGenerator, DeactivationScheduler deactivationScheduler,
                                JobStore jobStore, AuditService auditService, Clock clock, ZoneId zone,
                                int deactivationHour) {
        this.operators = operators;
        this.classifier = classifier;
        this.resolver = resolver;
        this.disambiguation = disambiguation;
        this.directory = directory;
        this.passwordGenerator = passwordGenerator;
        this.deactivationScheduler = deactivationScheduler;
        this.jobStore = jobStore;
        this.auditService = auditService;
        this.clock = clock;
        this.zone = zone;
        this.deactivationTime = LocalTime.of(deactivationHour, 0);
    }

    // ========== Entry points ==========

    public Reply handleFreeText(String principal, String text) {
        try (LogContext ignored = LogContext.forRequest(LogContext.generateCorrelationId(), principal)) {
            if (!operators.isOperator(principal)) {
                return deny(principal);
            }
            ClassifiedText classified = classifier.classify(text);
            switch (classified.intent()) {
                case NONE:
                    return new Reply.NotUnderstood();
                case LIST_JOBS:
                    return new Reply.JobList(jobStore.listScheduled());
                default:
                    break;
            }
            Optional<String> query = classified.query();
            if (query.isEmpty()) {
                return new Reply.QueryMissing(classified.intent());
            }
            PendingAction pending = switch (classified.intent()) {
                case RESET_PASSWORD -> PendingAction.reset(query.get(), principal);
                default -> PendingAction.disable(query.get(), principal,
                        deactivationTimeFor(classified.date()), RequestSource.CHAT);
            };
            log.info("request.received principal={} kind={} query='{}'", principal, pending.kind(), query.get());
            return dispatch(pending, resolver.resolve(pending.targetQuery()), principal);
        }
    }

    public Reply handleSelection(String principal, SelectionPayload payload) {
        try (LogContext ignored = LogContext.forRequest(LogContext.generateCorrelationId(), principal)) {
            if (!operators.isOperator(principal)) {
                return deny(principal);
            }
            Optional<ResolvedSelection> selection = disambiguation.resolve(payload.token(), payload.handle());
            if (selection.isEmpty()) {
                auditService.record(principal, AuditAction.SELECTION_EXPIRED, payload.handle(),
                        Map.of("token", payload.token().value()));
                return new Reply.SelectionExpired();
            }
            ResolvedSelection resolved = selection.get();
            if (!resolved.owner().equals(principal) && !operators.isSuperAdmin(principal)) {
                log.warn("selection.foreign principal={} owner={}", principal, resolved.owner());
                return deny(principal);
            }
            return act(resolved.pendingAction(), resolved.identity());
        }
    }

    /**
     * Schedules a deactivation from an HR mail. Runs as {@link MailExtractedOffboarding#SYSTEM_PRINCIPAL};
     * an ambiguous name is forwarded to the super-admin as a selection prompt.
     */
    public Reply handleMailOffboarding(MailExtractedOffboarding event) {
        try (LogContext ignored = LogContext.forRequest(LogContext.generateCorrelationId(), event.principal())
                .with("messageId", event.messageId())) {
            Map<String, String> details = new HashMap<>();
            details.put("message_id", event.messageId());
            event.date().ifPresent(d -> details.put("date", d.toString()));
            auditService.record(event.principal(), AuditAction.MAIL_OFFBOARDING, event.handleOrName(), details);

            PendingAction pending = PendingAction.disable(event.handleOrName(), event.principal(),
                    deactivationTimeFor(event.date()), RequestSource.MAIL);
            CandidateSet candidates = resolver.resolve(event.handleOrName());
            if (InputSanitizer.isValidHandle(event.handleOrName())) {
                Optional<Identity> exact = candidates.findByHandle(event.handleOrName());
                if (exact.isPresent()) {
                    return act(pending, exact.get());
                }
            }
            return dispatch(pending, candidates, operators.superAdminId());
        }
    }

    public Reply listJobs(String principal) {
        if (!operators.isOperator(principal)) {
            return deny(principal);
        }
        return new Reply.JobList(jobStore.listScheduled());
    }

    // ========== Resolution and actions ==========

    private Reply dispatch(PendingAction pending, CandidateSet candidates, String owner) {
        if (candidates.isEmpty()) {
            log.info("request.no_match query='{}'", pending.targetQuery());
            return new Reply.IdentityNotFound(pending.targetQuery());
        }
        if (candidates.isUnambiguous()) {
            return act(pending, candidates.single().orElseThrow());
        }
        DisambiguationToken token = disambiguation.open(pending, candidates, owner);
        List<DisambiguationChoice> choices = new ArrayList<>();
        for (Identity identity : candidates.identities()) {
            SelectionPayload payload = new SelectionPayload(token, identity.handle());
            if (!payload.fitsCallbackLimit()) {
                log.warn("selection.payload_too_long handle={} bytes>{}", identity.handle(),
                        SelectionPayload.MAX_ENCODED_BYTES);
            }
            choices.add(new DisambiguationChoice(identity.label(), payload));
        }
        return new Reply.SelectionRequired(new DisambiguationPrompt(token, pending, choices));
    }

    private Reply act(PendingAction pending, Identity identity) {
        if (pending.kind() == ActionKind.RESET) {
            return resetPassword(pending, identity);
        }
        return scheduleDeactivation(pending, identity);
    }

    private Reply resetPassword(PendingAction pending, Identity identity) {
        String password = passwordGenerator.generate();
        ActionOutcome outcome;
        try {
            outcome = directory.resetPassword(identity.handle(), password);
        } catch (DirectoryException | IllegalArgumentException e) {
            outcome = ActionOutcome.failed(e.getMessage());
        }
        if (!outcome.success()) {
            auditService.record(pending.requestedBy(), AuditAction.RESET_PASSWORD, identity.handle(),
                    Map.of("status", "failed", "reason", outcome.message()));
            log.warn("reset.failed target={} reason='{}'", identity.handle(), outcome.message());
            return new Reply.ActionFailed(outcome.message());
        }
        auditService.record(pending.requestedBy(), AuditAction.RESET_PASSWORD, identity.handle(),
                Map.of("status", "ok"));
        log.info("reset.done target={} by={}", identity.handle(), pending.requestedBy());
        return new Reply.PasswordReset(identity, password);
    }

    private Reply scheduleDeactivation(PendingAction pending, Identity identity) {
        ZonedDateTime when = pending.schedule().orElseGet(() -> deactivationTimeFor(Optional.empty()));
        Map<String, String> metadata = Map.of(
                "source", pending.source().metadataValue(),
                "query", pending.targetQuery());
        Job job;
        try {
            job = deactivationScheduler.schedule(identity.handle(), when, pending.requestedBy(), metadata);
        } catch (JobPersistenceException e) {
            log.error("schedule.failed target={} when={}", identity.handle(), when, e);
            return new Reply.ActionFailed("could not store the scheduled job");
        }
        auditService.record(pending.requestedBy(), AuditAction.SCHEDULE_DISABLE, identity.handle(), Map.of(
                "when", job.runAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                "job_id", Long.toString(job.id()),
                "source", pending.source().metadataValue()));
        return new Reply.DeactivationScheduled(identity, job);
    }

    /**
     * The given day, or today when none was given, at the configured deactivation hour.
     */
    ZonedDateTime deactivationTimeFor(Optional<LocalDate> date) {
        LocalDate day = date.orElseGet(() -> LocalDate.now(clock.withZone(zone)));
        return ZonedDateTime.of(day, deactivationTime, zone);
    }

    private Reply deny(String principal) {
        log.warn("request.denied principal={}", principal);
        return new Reply.AccessDenied(principal);
    }
}
