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

package org.annalist.projection.jdbc;

import org.annalist.projection.api.ProjectionUnitOfWork;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

import static java.util.Objects.requireNonNull;

/**
 * Runs each projection batch in a database transaction. When the read model and the {@link JdbcTrackingCursorStorage}
 * live in the same database, the handled events and the cursor commit or roll back together, so a restarted projection
 * never sees an event twice.
 */
public class JdbcProjectionUnitOfWork implements ProjectionUnitOfWork {
    private final TransactionTemplate transactionTemplate;

    public JdbcProjectionUnitOfWork(DataSource dataSource) {
        this(new DataSourceTransactionManager(requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null")));
    }

    public JdbcProjectionUnitOfWork(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(requireNonNull(transactionManager, PlatformTransactionManager.class.getSimpleName() + " cannot be null"));
    }

    @Override
    public void execute(Runnable batch) {
        transactionTemplate.executeWithoutResult(__ -> batch.run());
    }
}
