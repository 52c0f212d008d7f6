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

package org.annalist.engine;

/**
 * How projections learn about new commits.
 */
public enum NotificationMode {
    /**
     * PostgreSQL {@code LISTEN/NOTIFY} on a dedicated connection. Sees commits from every process writing to the database.
     */
    POSTGRES_LISTEN,
    /**
     * Commits of this process only. Projections poll for writes from other processes.
     */
    IN_PROCESS
}
