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

package org.annalist.notification.api;

import java.time.Duration;

/**
 * A wakeup signal for a single reader. Signals coalesce: any number of signals between two calls to
 * {@link #awaitWakeup(Duration)} are delivered as one.
 */
public interface WakeupSubscription extends AutoCloseable {

    /**
     * Block until the subscription is signalled or {@code timeout} has elapsed. Returns immediately if a signal is pending.
     *
     * @return {@code true} if signalled, {@code false} on timeout or if the subscription is closed
     * @throws InterruptedException If the waiting thread is interrupted
     */
    boolean awaitWakeup(Duration timeout) throws InterruptedException;

    /**
     * Signal this subscription.
     */
    void wake();

    boolean isClosed();

    /**
     * Close the subscription. A thread blocked in {@link #awaitWakeup(Duration)} returns {@code false}.
     */
    @Override
    void close();
}
