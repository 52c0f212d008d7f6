/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.annalist.projection.runtime;

import java.time.Duration;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Settings of a {@link ProjectionRunner}. Immutable, use the {@code with..} methods to derive a new configuration.
 */
public final class ProjectionRunnerConfig {
    public final int batchSize;
    public final Duration pollInterval;
    public final Duration initialBackoff;
    public final Duration maxBackoff;
    public final double backoffMultiplier;
    public final int escalationThreshold;
    public final Duration shutdownGracePeriod;

    private ProjectionRunnerConfig(int batchSize, Duration pollInterval, Duration initialBackoff, Duration maxBackoff, double backoffMultiplier,
                                   int escalationThreshold, Duration shutdownGracePeriod) {
        requireNonNull(pollInterval, "pollInterval cannot be null");
        requireNonNull(initialBackoff, "initialBackoff cannot be null");
        requireNonNull(maxBackoff, "maxBackoff cannot be null");
        requireNonNull(shutdownGracePeriod, "shutdownGracePeriod cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be greater than 0");
        } else if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        } else if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("Backoff must satisfy 0 <= initialBackoff <= maxBackoff");
        } else if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
        } else if (escalationThreshold < 1) {
            throw new IllegalArgumentException("escalationThreshold must be greater than 0");
        } else if (shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException("shutdownGracePeriod cannot be negative");
        }
        this.batchSize = batchSize;
        this.pollInterval = pollInterval;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.backoffMultiplier = backoffMultiplier;
        this.escalationThreshold = escalationThreshold;
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    /**
     * Batches of 100 events, polling every second, backoff from 100 ms up to 30 seconds, escalation at the third consecutive
     * failure and a shutdown grace period of 10 seconds.
     */
    public static ProjectionRunnerConfig defaults() {
        return new ProjectionRunnerConfig(100, Duration.ofSeconds(1), Duration.ofMillis(100), Duration.ofSeconds(30), 2.0, 3, Duration.ofSeconds(10));
    }

    public ProjectionRunnerConfig withBatchSize(int batchSize) {
        return new ProjectionRunnerConfig(batchSize, pollInterval, initialBackoff, maxBackoff, backoffMultiplier, escalationThreshold, shutdownGracePeriod);
    }

    public ProjectionRunnerConfig withPollInterval(Duration pollInterval) {
        return new ProjectionRunnerConfig(batchSize, pollInterval, initialBackoff, maxBackoff, backoffMultiplier, escalationThreshold, shutdownGracePeriod);
    }

    public ProjectionRunnerConfig withBackoff(Duration initialBackoff, Duration maxBackoff, double backoffMultiplier) {
        return new ProjectionRunnerConfig(batchSize, pollInterval, initialBackoff, maxBackoff, backoffMultiplier, escalationThreshold, shutdownGracePeriod);
    }

    public ProjectionRunnerConfig withEscalationThreshold(int escalationThreshold) {
        return new ProjectionRunnerConfig(batchSize, pollInterval, initialBackoff, maxBackoff, backoffMultiplier, escalationThreshold, shutdownGracePeriod);
    }

    public ProjectionRunnerConfig withShutdownGracePeriod(Duration shutdownGracePeriod) {
        return new ProjectionRunnerConfig(batchSize, pollInterval, initialBackoff, maxBackoff, backoffMultiplier, escalationThreshold, shutdownGracePeriod);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectionRunnerConfig)) return false;
        ProjectionRunnerConfig that = (ProjectionRunnerConfig) o;
        return batchSize == that.batchSize && Double.compare(that.backoffMultiplier, backoffMultiplier) == 0 && escalationThreshold == that.escalationThreshold
                && pollInterval.equals(that.pollInterval) && initialBackoff.equals(that.initialBackoff) && maxBackoff.equals(that.maxBackoff)
                && shutdownGracePeriod.equals(that.shutdownGracePeriod);
    }

    @Override
    public int hashCode() {
        return Objects.hash(batchSize, pollInterval, initialBackoff, maxBackoff, backoffMultiplier, escalationThreshold, shutdownGracePeriod);
    }

    @Override
    public String toString() {
        return "ProjectionRunnerConfig{" +
                "batchSize=" + batchSize +
                ", pollInterval=" + pollInterval +
                ", initialBackoff=" + initialBackoff +
                ", maxBackoff=" + maxBackoff +
                ", backoffMultiplier=" + backoffMultiplier +
                ", escalationThreshold=" + escalationThreshold +
                ", shutdownGracePeriod=" + shutdownGracePeriod +
                '}';
    }
}
