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

/**
 * Tells readers of the event log that new events have been committed. A notification carries no events, only the fact
 * that there might be something new to read, so readers must still query the log from their own position.
 * <p>
 * Notifications are best-effort. A reader that never receives one must still make progress by polling.
 */
public interface NotificationFeed extends AutoCloseable {

    /**
     * @return A new subscription that is signalled for every commit observed from now on
     */
    WakeupSubscription subscribe();

    /**
     * @return The highest global position this feed has observed, 0 if none
     */
    long currentPosition();

    /**
     * Stop the feed and close all its subscriptions.
     */
    @Override
    void close();
}
