package com.directory.actions.api;

import com.directory.actions.audit.AuditRepository;
import com.directory.actions.audit.AuditService;
import com.directory.actions.audit.JdbcAuditRepository;
import com.directory.actions.config.DeskSettings;
import com.directory.actions.config.DirectoryMode;
import com.directory.actions.directory.DirectoryActionExecutor;
import com.directory.actions.directory.DirectorySearch;
import com.directory.actions.directory.NoOpDirectoryGateway;
import com.directory.actions.directory.PasswordGenerator;
import com.directory.actions.directory.PowerShellDirectoryGateway;
import com.directory.actions.directory.ProcessScriptRunner;
import com.directory.actions.disambiguation.CaffeineSessionStore;
import com.directory.actions.disambiguation.DisambiguationManager;
import com.directory.actions.disambiguation.InMemorySessionStore;
import com.directory.actions.disambiguation.SessionStore;
import com.directory.actions.intake.DateExtractor;
import com.directory.actions.intake.IntentClassifier;
import com.directory.actions.intake.MailExtractedOffboarding;
import com.directory.actions.intake.MailOffboardingExtractor;
import com.directory.actions.intake.RuleBasedIntentClassifier;
import com.directory.actions.intake.SelectionPayload;
import com.directory.actions.metrics.MicrometerSchedulerMetrics;
import com.directory.actions.metrics.NoOpSchedulerMetrics;
import com.directory.actions.metrics.SchedulerMetrics;
import com.directory.actions.operator.JdbcOperatorRegistry;
import com.directory.actions.operator.OperatorRegistry;
import com.directory.actions.recovery.RecoveryBootstrapper;
import com.directory.actions.recovery.RecoveryReport;
import com.directory.actions.resolver.IdentityResolver;
import com.directory.actions.scheduler.DeactivationScheduler;
import com.directory.actions.scheduler.JobExecutor;
import com.directory.actions.scheduler.JobScheduler;
import com.directory.actions.similarity.WeightedNameScorer;
import com.directory.actions.store.Database;
import com.directory.actions.store.JdbcJobStore;
import com.directory.actions.store.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point: wires the resolver, the disambiguation sessions, the durable job store and
 * the scheduler from {@link DeskSettings}.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (DirectoryActionDesk desk = DirectoryActionDesk.builder()
 *         .settings(DeskSettings.load())
 *         .build()) {
 *     desk.start();   // re-arms persisted jobs
 *     Reply reply = desk.handleFreeText("42", "disable ivanov 15.03.2025");
 * }
 * </pre>
 *
 * <p>Requests are refused until {@link #start()} has restored the persisted jobs.</p>
 */
public class DirectoryActionDesk implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DirectoryActionDesk.class);

    private final DeskSettings settings;
    private final JobStore jobStore;
    private final AuditService auditService;
    private final OperatorRegistry operators;
    private final JobExecutor jobExecutor;
    private final JobScheduler jobScheduler;
    private final RecoveryBootstrapper recovery;
    private final DisambiguationManager disambiguation;
    private final MailOffboardingExtractor mailExtractor;
    private final ActionRequestService requests;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private DirectoryActionDesk(Builder builder) {
        this.settings = builder.settings;
        Clock clock = builder.clock;

        Database database = new Database(settings.dbPath());
        database.init();
        this.jobStore = new JdbcJobStore(database, clock);

        AuditRepository auditRepository = builder.auditRepository != null
                ? builder.auditRepository : new JdbcAuditRepository(database);
        this.auditService = new AuditService(auditRepository, clock);

        SchedulerMetrics metrics;
        if (builder.metrics != null) {
            metrics = builder.metrics;
        } else if (builder.meterRegistry != null) {
            metrics = new MicrometerSchedulerMetrics(builder.meterRegistry);
        } else {
            metrics = NoOpSchedulerMetrics.INSTANCE;
        }

        DirectorySearch search = builder.directorySearch;
        DirectoryActionExecutor actions = builder.actionExecutor;
        if (search == null || actions == null) {
            if (settings.directoryMode() == DirectoryMode.POWERSHELL) {
                PowerShellDirectoryGateway gateway = new PowerShellDirectoryGateway(
                        new ProcessScriptRunner(settings.scriptTimeout()), settings.searchBase());
                search = search != null ? search : gateway;
                actions = actions != null ? actions : gateway;
            } else {
                NoOpDirectoryGateway gateway = new NoOpDirectoryGateway();
                search = search != null ? search : gateway;
                actions = actions != null ? actions : gateway;
            }
        }

        this.jobExecutor = new JobExecutor(jobStore, actions, auditService, metrics, settings.actionTimeout());
        this.jobScheduler = new JobScheduler(jobExecutor::submit, clock);
        DeactivationScheduler deactivationScheduler = new DeactivationScheduler(jobStore, jobScheduler, metrics);
        this.recovery = new RecoveryBootstrapper(jobStore, jobScheduler, auditService, metrics, clock,
                settings.overdueDelay());

        SessionStore sessionStore = settings.sessionConfig().expires()
                ? new CaffeineSessionStore(settings.sessionConfig())
                : new InMemorySessionStore();
        this.disambiguation = new DisambiguationManager(sessionStore, clock);

        this.operators = new JdbcOperatorRegistry(database, settings.superAdminId(), auditService, clock);
        DateExtractor dateExtractor = new DateExtractor(clock, settings.timezone());
        IntentClassifier classifier = builder.intentClassifier != null
                ? builder.intentClassifier : new RuleBasedIntentClassifier(dateExtractor);
        this.mailExtractor = new MailOffboardingExtractor(dateExtractor);
        IdentityResolver resolver = new IdentityResolver(search, new WeightedNameScorer(), settings.resolverLimit());

        this.requests = new ActionRequestService(operators, classifier, resolver, disambiguation, actions,
                new PasswordGenerator(), deactivationScheduler, jobStore, auditService, clock,
                settings.timezone(), settings.deactivationHour());

        log.info("DirectoryActionDesk initialized: db={} directory={} zone={}",
                settings.dbPath(), settings.directoryMode(), settings.timezone());
    }

    /**
     * Restores persisted jobs. Must be called once before requests are accepted; later calls
     * return an empty report.
     */
    public RecoveryReport start() {
        if (closed.get()) {
            throw new IllegalStateException("DirectoryActionDesk is closed");
        }
        if (!started.compareAndSet(false, true)) {
            log.warn("DirectoryActionDesk already started");
            return RecoveryReport.empty();
        }
        return recovery.restoreOnStartup();
    }

    public boolean isStarted() {
        return started.get() && !closed.get();
    }

    // ========== Requests ==========

    public Reply handleFreeText(String principal, String text) {
        requireStarted();
        return requests.handleFreeText(principal, text);
    }

    public Reply handleSelection(String principal, SelectionPayload payload) {
        requireStarted();
        return requests.handleSelection(principal, payload);
    }

    /**
     * Parses callback data and handles the selection. Malformed data is treated as an expired
     * selection.
     */
    public Reply handleSelection(String principal, String callbackData) {
        requireStarted();
        Optional<SelectionPayload> payload = SelectionPayload.parse(callbackData);
        if (payload.isEmpty()) {
            log.warn("selection.malformed principal={}", principal);
            return new Reply.SelectionExpired();
        }
        return requests.handleSelection(principal, payload.get());
    }

    public Reply handleMailOffboarding(MailExtractedOffboarding event) {
        requireStarted();
        return requests.handleMailOffboarding(event);
    }

    /**
     * Extracts an offboarding notice from a mail and handles it.
     *
     * @return empty when the mail is not an offboarding notice
     */
    public Optional<Reply> handleMail(String subject, String body, String messageId) {
        requireStarted();
        return mailExtractor.extract(subject, body, messageId).map(requests::handleMailOffboarding);
    }

    public Reply listJobs(String principal) {
        requireStarted();
        return requests.listJobs(principal);
    }

    // ========== Accessors ==========

    public DeskSettings getSettings() {
        return settings;
    }

    public JobStore getJobStore() {
        return jobStore;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public OperatorRegistry getOperators() {
        return operators;
    }

    public JobScheduler getJobScheduler() {
        return jobScheduler;
    }

    public DisambiguationManager getDisambiguationManager() {
        return disambiguation;
    }

    private void requireStarted() {
        if (closed.get()) {
            throw new IllegalStateException("DirectoryActionDesk is closed");
        }
        if (!started.get()) {
            throw new IllegalStateException("DirectoryActionDesk.start() has not been called");
        }
    }

    /**
     * Stops the timers and the executor. Scheduled jobs stay in the store for the next start;
     * requests arriving afterwards are refused.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        jobScheduler.shutdown();
        jobExecutor.close();
        log.info("DirectoryActionDesk closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DeskSettings settings = DeskSettings.defaults();
        private Clock clock = Clock.systemUTC();
        private DirectorySearch directorySearch;
        private DirectoryActionExecutor actionExecutor;
        private IntentClassifier intentClassifier;
        private AuditRepository auditRepository;
        private SchedulerMetrics metrics;
        private MeterRegistry meterRegistry;

        public Builder settings(DeskSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Uses the given directory backend instead of the one {@code desk.directory.mode} selects.
         */
        public Builder directory(DirectorySearch search, DirectoryActionExecutor executor) {
            this.directorySearch = search;
            this.actionExecutor = executor;
            return this;
        }

        public Builder intentClassifier(IntentClassifier intentClassifier) {
            this.intentClassifier = intentClassifier;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder metrics(SchedulerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Records scheduler metrics into the given registry.
         */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public DirectoryActionDesk build() {
            Objects.requireNonNull(settings, "settings are required");
            Objects.requireNonNull(clock, "clock is required");
            return new DirectoryActionDesk(this);
        }
    }
}
