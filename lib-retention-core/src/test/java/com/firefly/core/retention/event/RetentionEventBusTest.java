/*
 * Copyright 2024 Firefly Software Solutions Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.firefly.core.retention.event;

import com.firefly.core.retention.domain.enums.event.RetentionEventType;
import com.firefly.core.retention.domain.model.event.RetentionEvent;
import com.firefly.core.retention.port.notification.RetentionNotificationPort;
import com.firefly.core.retention.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.firefly.core.retention.support.RetentionFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RetentionEventBusTest {

    @Mock
    private RetentionNotificationPort notificationPort;

    private RetentionEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new RetentionEventBus(16, new MutableClock(T0));
        when(notificationPort.getAdapterName()).thenReturn("test-notifications");
    }

    @Test
    void events_ShouldOnlyDeliverEventsOfRequestedType() {
        StepVerifier.create(eventBus.events(RetentionEventType.ENTRY_DELETED).take(1))
            .then(() -> {
                eventBus.publish(eventBus.event(RetentionEventType.ENTRY_TRANSITIONED).dataId("inv-1").build());
                eventBus.publish(eventBus.event(RetentionEventType.ENTRY_DELETED).dataId("inv-2").build());
            })
            .assertNext(event -> {
                assertThat(event.getDataId()).isEqualTo("inv-2");
                assertThat(event.getTimestamp()).isEqualTo(T0);
            })
            .verifyComplete();
    }

    @Test
    void allEvents_ShouldMergeEveryTypeUntilShutdown() {
        StepVerifier.create(eventBus.allEvents().map(RetentionEvent::getType))
            .then(() -> {
                eventBus.publish(eventBus.event(RetentionEventType.POLICY_CREATED).build());
                eventBus.publish(eventBus.event(RetentionEventType.LEGAL_HOLD_APPLIED).build());
                eventBus.shutdown();
            })
            .expectNext(RetentionEventType.POLICY_CREATED, RetentionEventType.LEGAL_HOLD_APPLIED)
            .verifyComplete();
    }

    @Test
    void publish_ShouldBufferEventsUntilFirstSubscriber() {
        eventBus.publish(eventBus.event(RetentionEventType.EXECUTION_COMPLETED).message("early").build());

        StepVerifier.create(eventBus.events(RetentionEventType.EXECUTION_COMPLETED).take(1))
            .assertNext(event -> assertThat(event.getMessage()).isEqualTo("early"))
            .verifyComplete();
    }

    @Test
    void dispatcher_ShouldKeepDeliveringAfterFailedNotification() {
        // Given
        List<RetentionEvent> delivered = new CopyOnWriteArrayList<>();
        when(notificationPort.send(any(RetentionEvent.class))).thenAnswer(invocation -> {
            RetentionEvent event = invocation.getArgument(0);
            if ("boom".equals(event.getMessage())) {
                return Mono.error(new IllegalStateException("mail server down"));
            }
            delivered.add(event);
            return Mono.empty();
        });
        RetentionEventDispatcher dispatcher = new RetentionEventDispatcher(eventBus, notificationPort);

        // When
        dispatcher.start();
        eventBus.publish(eventBus.event(RetentionEventType.ENTRY_FAILED).message("boom").build());
        eventBus.publish(eventBus.event(RetentionEventType.ENTRY_DELETED).message("ok").build());
        dispatcher.stop();

        // Then
        assertThat(dispatcher.isRunning()).isFalse();
        assertThat(delivered).extracting(RetentionEvent::getMessage).containsExactly("ok");
        verify(notificationPort, times(2)).send(any(RetentionEvent.class));
    }
}
