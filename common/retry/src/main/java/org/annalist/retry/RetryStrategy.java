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
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs an action again when it throws. Strategies are immutable, every setting returns a new instance:
 * <pre>
 * RetryStrategy.Retry reconnect = RetryStrategy.fixed(200).maxAttempts(5);
 * reconnect.execute(() -> connect());
 * reconnect.backoff(Backoff.fixed(600)).execute(() -> connectElsewhere());
 * </pre>
 */
public interface RetryStrategy {

    /**
     * Retries every exception forever, without waiting, until configured otherwise.
     */
    static Retry retry() {
        return Retry.DEFAULT;
    }

    static RetryStrategy none() {
        return NoRetry.INSTANCE;
    }

    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    static Retry fixed(Duration duration) {
        return retry().backoff(Backoff.fixed(duration));
    }

    static Retry fixed(long millis) {
        return retry().backoff(Backoff.fixed(millis));
    }

    /**
     * @return The result of {@code supplier} once it succeeds
     * @throws RuntimeException The last exception thrown by {@code supplier} when the strategy gives up
     */
    <T> T execute(Supplier<T> supplier);

    default void execute(Runnable runnable) {
        Objects.requireNonNull(runnable, Runnable.class.getSimpleName() + " cannot be null");
        execute(() -> {
            runnable.run();
            return null;
        });
    }

    final class NoRetry implements RetryStrategy {
        private static final NoRetry INSTANCE = new NoRetry();

        private NoRetry() {
        }

        @Override
        public <T> T execute(Supplier<T> supplier) {
            Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
            return supplier.get();
        }

        @Override
        public String toString() {
            return NoRetry.class.getSimpleName();
        }
    }

    final class Retry implements RetryStrategy {
        // @formatter:off
        private static final Retry DEFAULT = new Retry(Backoff.none(), Integer.MAX_VALUE, __ -> true, (__, ___) -> {});
        // @formatter:on

        private final Backoff backoff;
        private final int maxAttempts;
        private final Predicate<Throwable> retryPredicate;
        private final BiConsumer<ErrorInfo, Throwable> errorListener;

        private Retry(Backoff backoff, int maxAttempts, Predicate<Throwable> retryPredicate, BiConsumer<ErrorInfo, Throwable> errorListener) {
            this.backoff = Objects.requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
            this.maxAttempts = maxAttempts;
            this.retryPredicate = Objects.requireNonNull(retryPredicate, "Retry predicate cannot be null");
            this.errorListener = Objects.requireNonNull(errorListener, "Error listener cannot be null");
        }

        public Retry backoff(Backoff backoff) {
            return new Retry(backoff, maxAttempts, retryPredicate, errorListener);
        }

        public Retry maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("Max attempts must be greater than 0");
            }
            return new Retry(backoff, maxAttempts, retryPredicate, errorListener);
        }

        public Retry infiniteAttempts() {
            return new Retry(backoff, Integer.MAX_VALUE, retryPredicate, errorListener);
        }

        /**
         * Only retry when {@code retryPredicate} matches the thrown exception. It's tested again after the backoff,
         * so a predicate that reads a stop flag ends the loop without another attempt.
         */
        public Retry retryIf(Predicate<Throwable> retryPredicate) {
            return new Retry(backoff, maxAttempts, retryPredicate, errorListener);
        }

        /**
         * @param errorListener Called for every failed attempt, before the backoff
         */
        public Retry onError(BiConsumer<ErrorInfo, Throwable> errorListener) {
            return new Retry(backoff, maxAttempts, retryPredicate, errorListener);
        }

        @Override
        public <T> T execute(Supplier<T> supplier) {
            Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
            for (int attempt = 1; ; attempt++) {
                try {
                    return supplier.get();
                } catch (RuntimeException | Error e) {
                    boolean retry = attempt < maxAttempts && retryPredicate.test(e);
                    long delay = retry ? backoff.delayAfter(attempt) : 0;
                    errorListener.accept(new ErrorInfo(attempt, maxAttempts, retry ? Duration.ofMillis(delay) : null), e);
                    if (!retry) {
                        throw e;
                    }
                    if (!sleep(delay, e) || !retryPredicate.test(e)) {
                        throw e;
                    }
                }
            }
        }

        /**
         * @return {@code false} if interrupted, the interrupt is added to {@code failure} as suppressed
         */
        private static boolean sleep(long millis, Throwable failure) {
            if (millis <= 0) {
                return true;
            }
            try {
                TimeUnit.MILLISECONDS.sleep(millis);
                return true;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                failure.addSuppressed(ie);
                return false;
            }
        }

        @Override
        public String toString() {
            return "Retry[backoff=" + backoff + ", maxAttempts=" + (maxAttempts == Integer.MAX_VALUE ? "infinite" : maxAttempts) + "]";
        }
    }
}
