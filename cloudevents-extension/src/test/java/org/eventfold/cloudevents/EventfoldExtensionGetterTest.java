/*
 * Copyright 2026 the original author or authors.
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

package org.eventfold.cloudevents;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.v1.CloudEventBuilder;
import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.net.URI;
import java.time.OffsetDateTime;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.eventfold.cloudevents.EventfoldCloudEventExtension.eventfold;

@ExtendWith(SoftAssertionsExtension.class)
class EventfoldExtensionGetterTest {

    @Test
    void reads_stream_id_revision_and_global_position(SoftAssertions softly) {
        // Given
        CloudEvent cloudEvent = new CloudEventBuilder(cloudEvent())
                .withExtension(eventfold("cart-1", 2, 17))
                .build();

        // Then
        softly.assertThat(EventfoldExtensionGetter.getStreamId(cloudEvent)).isEqualTo("cart-1");
        softly.assertThat(EventfoldExtensionGetter.getStreamRevision(cloudEvent)).isEqualTo(2L);
        softly.assertThat(EventfoldExtensionGetter.getGlobalPosition(cloudEvent)).isEqualTo(17L);
    }

    @Test
    void accepts_integer_values_produced_by_serialization() {
        // Given
        CloudEvent cloudEvent = new CloudEventBuilder(cloudEvent())
                .withExtension(EventfoldCloudEventExtension.STREAM_REVISION, Integer.valueOf(3))
                .build();

        // Then
        assertThat(EventfoldExtensionGetter.getStreamRevision(cloudEvent)).isEqualTo(3L);
    }

    @Test
    void throws_iae_when_the_extension_is_missing() {
        assertThatThrownBy(() -> EventfoldExtensionGetter.getStreamId(cloudEvent()))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("streamid");
    }

    @Test
    void negative_revisions_cannot_be_assigned() {
        assertThatThrownBy(() -> eventfold("cart-1", -1, 0)).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    private static CloudEvent cloudEvent() {
        return new CloudEventBuilder()
                .withId("id")
                .withTime(OffsetDateTime.now())
                .withSource(URI.create("urn:test"))
                .withType("type")
                .withData("text/plain", "hello".getBytes(UTF_8))
                .build();
    }
}
