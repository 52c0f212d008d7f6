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

package org.annalist.eventstore.api;

/**
 * Thrown when events of one tenant are appended to a stream that belongs to another tenant,
 * or when a single append mixes events of several tenants.
 */
public class TenantMismatchException extends RuntimeException {
    public final String streamId;
    public final TenantId expected;
    public final TenantId actual;

    public TenantMismatchException(String streamId, TenantId expected, TenantId actual) {
        super("Stream " + streamId + " belongs to tenant " + expected + " but the events belong to " + actual);
        this.streamId = streamId;
        this.expected = expected;
        this.actual = actual;
    }
}
