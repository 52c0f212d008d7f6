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

import io.cloudevents.CloudEvent;
import org.annalist.eventstore.inmemory.InMemoryEventStore;
import org.annalist.notification.api.WakeupSubscription;
import org.annalist.testsupport.domain.OrderCloudEvents;
import org.annalist.testsupport.domain.OrderEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.stream.Stream;

import static org.annalist.testsupport.domain.OrderCloudEvents.placed;
import static org.annalist.testsupport.domain.OrderCloudEvents.shipped;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InProcessNotificationFeedTest {

    private final OrderCloudEvents orderCloudEvents = new OrderCloudEvents();
    private InProcessNotificationFeed feed;
    private InMemoryEventStore eventStore;

    @BeforeEach
    void create_feed() {
        feed = new InProcessNotificationFeed();
        eventStore = new InMemoryEventStore(feed);
    }

    @Test
    void commit_wakes_every_subscription_and_raises_the_current_position() throws InterruptedException {
        // Given
        WakeupSubscription first = feed.subscribe();
        WakeupSubscription second = feed.subscribe();

        // When
        eventStore.write("ORD-1", 0, events(placed("ORD-1"), shipped("ORD-1")));

        // Then
        assertAll(
                () -> assertThat(first.awaitWakeup(Duration.ofSeconds(1))).isTrue(),
                () -> assertThat(second.awaitWakeup(Duration.ofSeconds(1))).isTrue(),
                () -> assertThat(feed.currentPosition()).isEqualTo(2)
        );
    }

    @Test
    void subscription_only_sees_commits_made_after_it_subscribed() throws InterruptedException {
        // Given
        eventStore.write("ORD-1", 0, events(placed("ORD-1")));

        // When
        WakeupSubscription subscription = feed.subscribe();

        // Then
        assertThat(subscription.awaitWakeup(Duration.ofMillis(20))).isFalse();
    }

    @Test
    void failed_write_does_not_wake_subscriptions() throws InterruptedException {
        // Given
        eventStore.write("ORD-1", 0, events(placed("ORD-1")));
        WakeupSubscription subscription = feed.subscribe();

        // When
        catchThrowable(() -> eventStore.write("ORD-1", 0, events(shipped("ORD-1"))));

        // Then
        assertAll(
                () -> assertThat(subscription.awaitWakeup(Duration.ofMillis(20))).isFalse(),
                () -> assertThat(feed.currentPosition()).isEqualTo(1)
        );
    }

    @Test
    void current_position_starts_at_the_given_initial_position() {
        // When
        InProcessNotificationFeed resumed = new InProcessNotificationFeed(42);

        // Then
        assertThat(resumed.currentPosition()).isEqualTo(42);
    }

    @Test
    void close_closes_all_subscriptions() {
        // Given
        WakeupSubscription subscription = feed.subscribe();

        // When
        feed.close();

        // Then
        assertAll(
                () -> assertThat(subscription.isClosed()).isTrue(),
                () -> assertThat(catchThrowable(feed::subscribe)).isExactlyInstanceOf(IllegalStateException.class)
        );
    }

    private Stream<CloudEvent> events(OrderEvent... events) {
        return Stream.of(events).map(e -> orderCloudEvents.toCloudEvent("acme", e));
    }
}
