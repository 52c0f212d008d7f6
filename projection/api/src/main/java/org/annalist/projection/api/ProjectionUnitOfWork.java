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

package org.annalist.projection.api;

/**
 * Runs one batch of a projection: the handler writes followed by the cursor save. A rebuild clears the read model and
 * resets the cursor through it as well.
 */
@FunctionalInterface
public interface ProjectionUnitOfWork {

    void execute(Runnable batch);

    /**
     * Runs the batch as is. If the process dies between the handler writes and the cursor save, the batch is delivered
     * again after restart, so the handlers must be idempotent.
     */
    static ProjectionUnitOfWork direct() {
        return Runnable::run;
    }
}
