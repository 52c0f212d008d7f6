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

package org.annalist.notification.inmemory;

import org.annalist.eventstore.api.AppendListener;
import org.annalist.eventstore.api.WriteResult;
import org.annalist.notification.api.NotificationFeed;
import org.annalist.notification.api.WakeupSubscription;
import org.annalist.notification.api.internal.Subscriptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link NotificationFeed} for readers in the same JVM as the writers. Register it as the {@link AppendListener} of the
 * event store and every commit wakes all subscriptions.
 * <p>
 * Writers in other processes are invisible to this feed, readers fall back to polling for those.
 */
public class InProcessNotificationFeed implements NotificationFeed, AppendListener {
    private static final Logger log = LoggerFactory.getLogger(InProcessNotificationFeed.class);

    private final Subscriptions subscriptions = new Subscriptions();
    private final AtomicLong highestObservedPosition;

    public InProcessNotificationFeed() {
        this(0);
    }

    /**
     * @param initialPosition The head position of the log when the feed is created
     */
    public InProcessNotificationFeed(long initialPosition) {
        if (initialPosition < 0) {
            throw new IllegalArgumentException("initialPosition cannot be negative");
        }
        this.highestObservedPosition = new AtomicLong(initialPosition);
    }

    @Override
    public void eventsAppended(WriteResult writeResult) {
        if (writeResult.isEmpty()) {
            return;
        }
        long position = highestObservedPosition.accumulateAndGet(writeResult.lastGlobalPosition(), Math::max);
        log.trace("Events appended to {} up to position {}, waking {} subscription(s)", writeResult.getStreamId(), position, subscriptions.size());
        subscriptions.wakeAll();
    }

    @Override
    public WakeupSubscription subscribe() {
        return subscriptions.subscribe();
    }

    @Override
    public long currentPosition() {
        return highestObservedPosition.get();
    }

    @Override
    public void close() {
        subscriptions.closeAll();
    }
}
