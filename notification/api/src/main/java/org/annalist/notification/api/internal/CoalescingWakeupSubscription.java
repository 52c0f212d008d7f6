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

package org.annalist.notification.api.internal;

import org.annalist.notification.api.WakeupSubscription;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * A {@link WakeupSubscription} holding at most one pending signal.
 */
public class CoalescingWakeupSubscription implements WakeupSubscription {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition signalledOrClosed = lock.newCondition();
    private final Consumer<CoalescingWakeupSubscription> onClose;

    private boolean signalled;
    private boolean closed;

    public CoalescingWakeupSubscription(Consumer<CoalescingWakeupSubscription> onClose) {
        this.onClose = requireNonNull(onClose, "onClose cannot be null");
    }

    @Override
    public boolean awaitWakeup(Duration timeout) throws InterruptedException {
        requireNonNull(timeout, "timeout cannot be null");
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (!signalled && !closed && remaining > 0) {
                remaining = signalledOrClosed.awaitNanos(remaining);
            }
            if (closed) {
                return false;
            }
            boolean wasSignalled = signalled;
            signalled = false;
            return wasSignalled;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void wake() {
        lock.lock();
        try {
            if (!closed) {
                signalled = true;
                signalledOrClosed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            signalledOrClosed.signalAll();
        } finally {
            lock.unlock();
        }
        onClose.accept(this);
    }
}
