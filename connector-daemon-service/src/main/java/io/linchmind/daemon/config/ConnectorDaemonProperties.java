package io.linchmind.daemon.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "linch-mind.daemon")
public class ConnectorDaemonProperties {

    private final Types types;
    private final Process process;
    private final Health health;
    private final Events events;
    private final Shutdown shutdown;
    private final RestartPolicy restartPolicy;
    private final boolean autoStartOnBoot;

    public ConnectorDaemonProperties(@Valid Types types,
                                     @Valid Process process,
                                     @Valid @DefaultValue Health health,
                                     @Valid @DefaultValue Events events,
                                     @Valid @DefaultValue Shutdown shutdown,
                                     @Valid @DefaultValue RestartPolicy restartPolicy,
                                     @DefaultValue("true") boolean autoStartOnBoot) {
        this.types = Objects.requireNonNull(types, "types");
        this.process = Objects.requireNonNull(process, "process");
        this.health = Objects.requireNonNull(health, "health");
        this.events = Objects.requireNonNull(events, "events");
        this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
        this.restartPolicy = Objects.requireNonNull(restartPolicy, "restartPolicy");
        this.autoStartOnBoot = autoStartOnBoot;
    }

    public Types getTypes() {
        return types;
    }

    public Process getProcess() {
        return process;
    }

    public Health getHealth() {
        return health;
    }

    public Events getEvents() {
        return events;
    }

    public Shutdown getShutdown() {
        return shutdown;
    }

    public RestartPolicy getRestartPolicy() {
        return restartPolicy;
    }

    public boolean isAutoStartOnBoot() {
        return autoStartOnBoot;
    }

    @Validated
    public static final class Types {

        private final Path rootDir;
        private final String manifestFile;

        public Types(@NotNull Path rootDir, @DefaultValue("connector.json") String manifestFile) {
            this.rootDir = Objects.requireNonNull(rootDir, "rootDir");
            this.manifestFile = requireNonBlank(manifestFile, "manifestFile");
        }

        public Path getRootDir() {
            return rootDir;
        }

        public String getManifestFile() {
            return manifestFile;
        }
    }

    @Validated
    public static final class Process {

        private final Path logDir;
        private final String daemonUrl;
        private final Duration stopTimeout;
        private final Duration killTimeout;

        public Process(@NotNull Path logDir,
                       @NotBlank String daemonUrl,
                       @DefaultValue("10s") Duration stopTimeout,
                       @DefaultValue("5s") Duration killTimeout) {
            this.logDir = Objects.requireNonNull(logDir, "logDir");
            String url = requireNonBlank(daemonUrl, "daemonUrl");
            this.daemonUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
            this.stopTimeout = requireNonNegative(stopTimeout, "stopTimeout");
            this.killTimeout = requirePositive(killTimeout, "killTimeout");
        }

        public Path getLogDir() {
            return logDir;
        }

        public String getDaemonUrl() {
            return daemonUrl;
        }

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public Duration getKillTimeout() {
            return killTimeout;
        }
    }

    public enum HeartbeatMode {
        ACTIVITY,
        PROCESS;

        static HeartbeatMode parse(String value) {
            if (value == null || value.isBlank()) {
                return ACTIVITY;
            }
            try {
                return HeartbeatMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("heartbeatMode must be one of activity, process but was " + value, e);
            }
        }
    }

    @Validated
    public static final class Health {

        private final Duration interval;
        private final Duration initialDelay;
        private final HeartbeatMode heartbeatMode;
        private final Duration heartbeatStaleness;
        private final double cpuWarningPercent;
        private final long memoryWarningBytes;

        public Health(@DefaultValue("10s") Duration interval,
                      @DefaultValue("1s") Duration initialDelay,
                      @DefaultValue("activity") String heartbeatMode,
                      @DefaultValue("120s") Duration heartbeatStaleness,
                      @DefaultValue("80") double cpuWarningPercent,
                      @DefaultValue("1073741824") long memoryWarningBytes) {
            this.interval = requirePositive(interval, "interval");
            this.initialDelay = requireNonNegative(initialDelay, "initialDelay");
            this.heartbeatMode = HeartbeatMode.parse(heartbeatMode);
            this.heartbeatStaleness = requirePositive(heartbeatStaleness, "heartbeatStaleness");
            if (cpuWarningPercent <= 0) {
                throw new IllegalArgumentException("cpuWarningPercent must be positive");
            }
            if (memoryWarningBytes <= 0) {
                throw new IllegalArgumentException("memoryWarningBytes must be positive");
            }
            this.cpuWarningPercent = cpuWarningPercent;
            this.memoryWarningBytes = memoryWarningBytes;
        }

        public Duration getInterval() {
            return interval;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public HeartbeatMode getHeartbeatMode() {
            return heartbeatMode;
        }

        public Duration getHeartbeatStaleness() {
            return heartbeatStaleness;
        }

        public double getCpuWarningPercent() {
            return cpuWarningPercent;
        }

        public long getMemoryWarningBytes() {
            return memoryWarningBytes;
        }
    }

    @Validated
    public static final class Events {

        private final int subscriberCapacity;
        private final Duration streamIdleTimeout;

        public Events(@DefaultValue("256") int subscriberCapacity,
                      @DefaultValue("30s") Duration streamIdleTimeout) {
            if (subscriberCapacity <= 0) {
                throw new IllegalArgumentException("subscriberCapacity must be positive");
            }
            this.subscriberCapacity = subscriberCapacity;
            this.streamIdleTimeout = requirePositive(streamIdleTimeout, "streamIdleTimeout");
        }

        public int getSubscriberCapacity() {
            return subscriberCapacity;
        }

        public Duration getStreamIdleTimeout() {
            return streamIdleTimeout;
        }
    }

    @Validated
    public static final class Shutdown {

        private final Duration deadline;

        public Shutdown(@DefaultValue("30s") Duration deadline) {
            this.deadline = requirePositive(deadline, "deadline");
        }

        public Duration getDeadline() {
            return deadline;
        }
    }

    @Validated
    public static final class RestartPolicy {

        private final boolean enabled;
        private final int maxAttempts;
        private final Duration backoff;
        private final Duration maxBackoff;

        public RestartPolicy(@DefaultValue("false") boolean enabled,
                             @DefaultValue("3") int maxAttempts,
                             @DefaultValue("10s") Duration backoff,
                             @DefaultValue("60s") Duration maxBackoff) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("maxAttempts must be positive");
            }
            this.enabled = enabled;
            this.maxAttempts = maxAttempts;
            this.backoff = requireNonNegative(backoff, "backoff");
            this.maxBackoff = requireNonNegative(maxBackoff, "maxBackoff");
        }

        public boolean isEnabled() {
            return enabled;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value.trim();
    }

    private static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static Duration requireNonNegative(Duration value, String name) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }
}
