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

package org.annalist.testsupport.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * Creates isolated in-memory H2 databases running in PostgreSQL compatibility mode.
 */
public class H2Database {

    public static DataSource newDatabase() {
        return newDatabase("db-" + UUID.randomUUID());
    }

    public static DataSource newDatabase(String name) {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL(url(name));
        dataSource.setUser("sa");
        dataSource.setPassword("");
        return dataSource;
    }

    public static String url(String name) {
        return "jdbc:h2:mem:" + name + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
    }
}
