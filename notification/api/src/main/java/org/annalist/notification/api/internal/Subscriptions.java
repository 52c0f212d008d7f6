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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The live subscriptions of a notification feed.
 */
public class Subscriptions {
    private final Set<CoalescingWakeupSubscription> live = ConcurrentHashMap.newKeySet();
    private final Object lock = new Object();
    private boolean closed;

    /**
     * @throws IllegalStateException If {@link #closeAll()} has been called
     */
    public WakeupSubscription subscribe() {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Cannot subscribe to a closed notification feed");
            }
            CoalescingWakeupSubscription subscription = new CoalescingWakeupSubscription(live::remove);
            live.add(subscription);
            return subscription;
        }
    }

    public void wakeAll() {
        live.forEach(CoalescingWakeupSubscription::wake);
    }

    public int size() {
        return live.size();
    }

    public void closeAll() {
        List<CoalescingWakeupSubscription> toClose;
        synchronized (lock) {
            closed = true;
            toClose = new ArrayList<>(live);
        }
        toClose.forEach(CoalescingWakeupSubscription::close);
    }
}
