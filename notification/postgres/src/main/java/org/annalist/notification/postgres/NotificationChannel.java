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

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Channel names are written into {@code LISTEN} statements as identifiers, so only plain lower case identifiers are accepted.
 */
final class NotificationChannel {
    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

    private NotificationChannel() {
    }

    static String requireValid(String channel) {
        requireNonNull(channel, "channel cannot be null");
        if (!IDENTIFIER.matcher(channel).matches()) {
            throw new IllegalArgumentException("Invalid notification channel name: " + channel);
        }
        return channel;
    }
}
