package com.proposalpilot.orchestrator.config;

import com.proposalpilot.orchestrator.model.ArtifactKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tuning knobs of the coordinator, the agents and the gateway.
 *
 * Bound from {@code proposal.pipeline.*}. Any value left out of the
 * configuration falls back to the default in the compact constructor, so
 * tests can build instances from {@link #defaults()} and the {@code with*}
 * copies.
 *
 * @param maxParallelism     worker threads shared by all runs for agent tasks
 * @param maxConcurrentRuns  runs driven at the same time; further submissions queue
 * @param maxRunDuration     hard limit on one run, after which it is FAILED
 * @param dependencyTimeout  default wait budget for an upstream artifact, measured from run start
 * @param dependencyTimeouts per-artifact overrides of {@code dependencyTimeout}
 * @param toolCallTimeout    deadline the gateway enforces on every provider call
 * @param maxAttempts        attempts per provider call on retryable failures (including the first)
 * @param retryBackoff       delay before the second attempt; grows linearly
 * @param maxResults         hits requested from each provider
 * @param retention          how long terminal runs stay queryable
 */
@ConfigurationProperties(prefix = "proposal.pipeline")
public record PipelineProperties(
        int      maxParallelism,
        int      maxConcurrentRuns,
        Duration maxRunDuration,
        Duration dependencyTimeout,
        Map<ArtifactKind, Duration> dependencyTimeouts,
        Duration toolCallTimeout,
        int      maxAttempts,
        Duration retryBackoff,
        int      maxResults,
        Duration retention) {

    public PipelineProperties {
        if (maxParallelism    <= 0)   maxParallelism    = 4;
        if (maxConcurrentRuns <= 0)   maxConcurrentRuns = 8;
        if (maxRunDuration    == null) maxRunDuration    = Duration.ofMinutes(5);
        if (dependencyTimeout == null) dependencyTimeout = Duration.ofSeconds(120);
        if (toolCallTimeout   == null) toolCallTimeout   = Duration.ofSeconds(20);
        if (maxAttempts       <= 0)   maxAttempts       = 3;
        if (retryBackoff      == null) retryBackoff      = Duration.ofMillis(500);
        if (maxResults        <= 0)   maxResults        = 5;
        if (retention         == null) retention         = Duration.ofHours(1);
        Map<ArtifactKind, Duration> timeouts = new EnumMap<>(ArtifactKind.class);
        if (dependencyTimeouts != null) timeouts.putAll(dependencyTimeouts);
        dependencyTimeouts = Map.copyOf(timeouts);
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(0, 0, null, null, null, null, 0, null, 0, null);
    }

    /** Wait budget for the given upstream artifact. */
    public Duration dependencyTimeoutFor(ArtifactKind kind) {
        return dependencyTimeouts.getOrDefault(kind, dependencyTimeout);
    }

    public PipelineProperties withMaxRunDuration(Duration d) {
        return new PipelineProperties(maxParallelism, maxConcurrentRuns, d, dependencyTimeout,
                dependencyTimeouts, toolCallTimeout, maxAttempts, retryBackoff, maxResults, retention);
    }

    public PipelineProperties withDependencyTimeout(ArtifactKind kind, Duration d) {
        Map<ArtifactKind, Duration> timeouts = new EnumMap<>(ArtifactKind.class);
        timeouts.putAll(dependencyTimeouts);
        timeouts.put(kind, d);
        return new PipelineProperties(maxParallelism, maxConcurrentRuns, maxRunDuration, dependencyTimeout,
                timeouts, toolCallTimeout, maxAttempts, retryBackoff, maxResults, retention);
    }

    public PipelineProperties withToolCallTimeout(Duration d) {
        return new PipelineProperties(maxParallelism, maxConcurrentRuns, maxRunDuration, dependencyTimeout,
                dependencyTimeouts, d, maxAttempts, retryBackoff, maxResults, retention);
    }

    public PipelineProperties withRetries(int attempts, Duration backoff) {
        return new PipelineProperties(maxParallelism, maxConcurrentRuns, maxRunDuration, dependencyTimeout,
                dependencyTimeouts, toolCallTimeout, attempts, backoff, maxResults, retention);
    }

    public PipelineProperties withRetention(Duration d) {
        return new PipelineProperties(maxParallelism, maxConcurrentRuns, maxRunDuration, dependencyTimeout,
                dependencyTimeouts, toolCallTimeout, maxAttempts, retryBackoff, maxResults, d);
    }
}
