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

package org.annalist.notification.postgres;

import org.annalist.eventstore.api.WriteResult;
import org.annalist.eventstore.jdbc.JdbcAppendHook;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

/**
 * Sends a PostgreSQL notification with the last global position of every append. The notification is issued inside the
 * append transaction, and PostgreSQL delivers it to listeners only if that transaction commits.
 */
public class PostgresNotifyAppendHook implements JdbcAppendHook {
    private final String channel;

    public PostgresNotifyAppendHook() {
        this(PostgresNotificationFeed.DEFAULT_CHANNEL);
    }

    public PostgresNotifyAppendHook(String channel) {
        this.channel = NotificationChannel.requireValid(channel);
    }

    @Override
    public void beforeCommit(JdbcTemplate jdbcTemplate, WriteResult writeResult) {
        jdbcTemplate.query("SELECT pg_notify(?, ?)", (ResultSetExtractor<Void>) rs -> null, channel, Long.toString(writeResult.lastGlobalPosition()));
    }

    public String channel() {
        return channel;
    }
}
