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

package org.annalist.cloudevents;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;

import java.util.Objects;

/**
 * Removes the attributes that the event log assigns, for example before an event is serialized into a store that keeps them in columns of their own.
 */
public class AnnalistExtensionRemover {

    /**
     * @param cloudEvent The cloud event to remove the log-assigned {@code CloudEvent} extensions from.
     * @return A {@code CloudEvent} without {@value AnnalistCloudEventExtension#STREAM_ID}, {@value AnnalistCloudEventExtension#STREAM_VERSION},
     * {@value AnnalistCloudEventExtension#GLOBAL_POSITION}, {@value AnnalistCloudEventExtension#TENANT_ID} and {@value AnnalistCloudEventExtension#RECORDED_AT}.
     */
    public static CloudEvent removeAnnalistExtensions(CloudEvent cloudEvent) {
        Objects.requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        CloudEventBuilder builder = CloudEventBuilder.v1(cloudEvent);
        AnnalistCloudEventExtension.KEYS.forEach(builder::withoutExtension);
        return builder.build();
    }
}
