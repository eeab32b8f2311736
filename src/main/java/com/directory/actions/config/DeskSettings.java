package com.directory.actions.config;

import com.directory.actions.disambiguation.SessionConfig;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Runtime settings of the desk, read from MicroProfile Config.
 *
 * <pre>
 * desk.timezone=Europe/Berlin
 * desk.db-path=data/desk.db
 * desk.superadmin-id=0
 * desk.deactivation-hour=16
 * desk.recovery.overdue-delay-seconds=5
 * desk.action.timeout-seconds=120
 * desk.session.ttl-minutes=30
 * desk.session.max-size=1000
 * desk.resolver.limit=10
 * desk.directory.mode=noop
 * desk.directory.search-base=
 * desk.directory.script-timeout-seconds=60
 * </pre>
 */
public record DeskSettings(
        ZoneId timezone,
        Path dbPath,
        String superAdminId,
        int deactivationHour,
        Duration overdueDelay,
        Duration actionTimeout,
        Duration sessionTtl,
        int sessionMaxSize,
        int resolverLimit,
        DirectoryMode directoryMode,
        String searchBase,
        Duration scriptTimeout
) {
    public static final String PREFIX = "desk.";

    public DeskSettings {
        Objects.requireNonNull(timezone, "timezone is required");
        Objects.requireNonNull(dbPath, "dbPath is required");
        Objects.requireNonNull(directoryMode, "directoryMode is required");
        if (superAdminId == null || superAdminId.isBlank()) {
            throw new IllegalArgumentException("desk.superadmin-id must not be blank");
        }
        if (deactivationHour < 0 || deactivationHour > 23) {
            throw new IllegalArgumentException("desk.deactivation-hour must be in 0..23, got " + deactivationHour);
        }
        requireNonNegative(overdueDelay, "desk.recovery.overdue-delay-seconds");
        requirePositive(actionTimeout, "desk.action.timeout-seconds");
        requireNonNegative(sessionTtl, "desk.session.ttl-minutes");
        requirePositive(scriptTimeout, "desk.directory.script-timeout-seconds");
        if (sessionMaxSize <= 0) {
            throw new IllegalArgumentException("desk.session.max-size must be > 0");
        }
        if (resolverLimit <= 0) {
            throw new IllegalArgumentException("desk.resolver.limit must be > 0");
        }
        searchBase = searchBase != null ? searchBase.trim() : "";
    }

    public static DeskSettings defaults() {
        return new DeskSettings(
                ZoneId.of("Europe/Berlin"),
                Path.of("data", "desk.db"),
                "0",
                16,
                Duration.ofSeconds(5),
                Duration.ofSeconds(120),
                Duration.ofMinutes(30),
                1_000,
                10,
                DirectoryMode.NOOP,
                "",
                Duration.ofSeconds(60));
    }

    /**
     * Reads settings from the default config (system properties, environment,
     * {@code META-INF/microprofile-config.properties}).
     */
    public static DeskSettings load() {
        return from(ConfigProvider.getConfig());
    }

    /**
     * Reads every {@code desk.*} key, falling back to {@link #defaults()} for missing ones.
     *
     * @throws IllegalArgumentException if a value is present but invalid
     */
    public static DeskSettings from(Config config) {
        DeskSettings d = defaults();
        return new DeskSettings(
                config.getOptionalValue(PREFIX + "timezone", String.class).map(DeskSettings::zone).orElse(d.timezone()),
                config.getOptionalValue(PREFIX + "db-path", String.class).map(Path::of).orElse(d.dbPath()),
                config.getOptionalValue(PREFIX + "superadmin-id", String.class).orElse(d.superAdminId()),
                config.getOptionalValue(PREFIX + "deactivation-hour", Integer.class).orElse(d.deactivationHour()),
                config.getOptionalValue(PREFIX + "recovery.overdue-delay-seconds", Long.class)
                        .map(Duration::ofSeconds).orElse(d.overdueDelay()),
                config.getOptionalValue(PREFIX + "action.timeout-seconds", Long.class)
                        .map(Duration::ofSeconds).orElse(d.actionTimeout()),
                config.getOptionalValue(PREFIX + "session.ttl-minutes", Long.class)
                        .map(Duration::ofMinutes).orElse(d.sessionTtl()),
                config.getOptionalValue(PREFIX + "session.max-size", Integer.class).orElse(d.sessionMaxSize()),
                config.getOptionalValue(PREFIX + "resolver.limit", Integer.class).orElse(d.resolverLimit()),
                config.getOptionalValue(PREFIX + "directory.mode", String.class)
                        .map(DirectoryMode::parse).orElse(d.directoryMode()),
                config.getOptionalValue(PREFIX + "directory.search-base", String.class).orElse(d.searchBase()),
                config.getOptionalValue(PREFIX + "directory.script-timeout-seconds", Long.class)
                        .map(Duration::ofSeconds).orElse(d.scriptTimeout()));
    }

    public SessionConfig sessionConfig() {
        return new SessionConfig(sessionMaxSize, sessionTtl);
    }

    private static ZoneId zone(String id) {
        try {
            return ZoneId.of(id.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("desk.timezone is not a valid zone id: '" + id + "'", e);
        }
    }

    private static void requirePositive(Duration value, String key) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(key + " must be > 0");
        }
    }

    private static void requireNonNegative(Duration value, String key) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(key + " must be >= 0");
        }
    }
}
