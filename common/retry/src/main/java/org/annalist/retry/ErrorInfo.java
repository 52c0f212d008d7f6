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

package org.annalist.retry;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Optional;

/**
 * Describes a failed attempt, passed to the error listener of a {@link RetryStrategy.Retry}.
 */
public final class ErrorInfo {
    private final int attemptNumber;
    private final int maxAttempts;
    private final @Nullable Duration nextBackoff;

    ErrorInfo(int attemptNumber, int maxAttempts, @Nullable Duration nextBackoff) {
        this.attemptNumber = attemptNumber;
        this.maxAttempts = maxAttempts;
        this.nextBackoff = nextBackoff;
    }

    /**
     * @return The number of the attempt that failed, {@code 1} for the first one
     */
    public int attemptNumber() {
        return attemptNumber;
    }

    /**
     * @return {@link Integer#MAX_VALUE} if the retry never gives up
     */
    public int maxAttempts() {
        return maxAttempts;
    }

    public int retryCount() {
        return attemptNumber - 1;
    }

    /**
     * @return The wait before the next attempt, empty if the error will be rethrown
     */
    public Optional<Duration> nextBackoff() {
        return Optional.ofNullable(nextBackoff);
    }

    public boolean willRetry() {
        return nextBackoff != null;
    }

    @Override
    public String toString() {
        return "ErrorInfo[attempt=" + attemptNumber + (maxAttempts == Integer.MAX_VALUE ? "" : "/" + maxAttempts) + ", nextBackoff=" + nextBackoff + "]";
    }
}
