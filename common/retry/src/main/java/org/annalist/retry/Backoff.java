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

import java.time.Duration;
import java.util.Objects;

/**
 * How long to wait after a failed attempt before trying again.
 */
public sealed interface Backoff {

    /**
     * @param failedAttempt The number of the attempt that just failed, {@code 1} for the first one
     * @return The number of milliseconds to wait before the next attempt
     */
    long delayAfter(int failedAttempt);

    static Backoff none() {
        return new Fixed(0);
    }

    static Backoff fixed(long millis) {
        return new Fixed(millis);
    }

    static Backoff fixed(Duration duration) {
        Objects.requireNonNull(duration, Duration.class.getSimpleName() + " cannot be null");
        return new Fixed(duration.toMillis());
    }

    /**
     * @param initial    The wait after the first failed attempt
     * @param max        The upper bound of the wait
     * @param multiplier Factor applied to the wait after each failed attempt
     */
    static Backoff exponential(Duration initial, Duration max, double multiplier) {
        return new Exponential(initial, max, multiplier);
    }

    record Fixed(long millis) implements Backoff {
        public Fixed {
            if (millis < 0) {
                throw new IllegalArgumentException("millis cannot be negative");
            }
        }

        @Override
        public long delayAfter(int failedAttempt) {
            return millis;
        }
    }

    record Exponential(Duration initial, Duration max, double multiplier) implements Backoff {
        public Exponential {
            Objects.requireNonNull(initial, "initial cannot be null");
            Objects.requireNonNull(max, "max cannot be null");
            if (initial.isNegative() || max.compareTo(initial) < 0) {
                throw new IllegalArgumentException("initial must be positive and less than or equal to max");
            } else if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be greater than or equal to 1.0");
            }
        }

        @Override
        public long delayAfter(int failedAttempt) {
            double delay = initial.toMillis() * Math.pow(multiplier, failedAttempt - 1);
            return Math.min(max.toMillis(), Math.round(delay));
        }
    }
}
