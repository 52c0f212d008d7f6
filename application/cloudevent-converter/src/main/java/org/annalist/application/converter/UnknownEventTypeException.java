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

package org.annalist.application.converter;

/**
 * Thrown when a cloud event type, or a domain event class, hasn't been registered.
 */
public class UnknownEventTypeException extends RuntimeException {
    private final String type;

    public UnknownEventTypeException(String type) {
        super("Event type \"" + type + "\" is not registered");
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
