package me.golemcore.reminderbot.adapter.outbound.notification;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reminderbot.domain.exception.ReminderDeliveryException;
import me.golemcore.reminderbot.domain.model.ReminderNotification;
import me.golemcore.reminderbot.port.outbound.NotificationPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Notification adapter used when no chat transport is configured.
 *
 * <p>
 * Writes every notification to the log instead of sending it. A chat
 * transport registers its own {@link NotificationPort} bean marked
 * {@code @Primary} to take over delivery.
 */
@Component
@Slf4j
public class LoggingNotificationAdapter implements NotificationPort {

    @Override
    public CompletableFuture<Void> deliver(ReminderNotification notification) {
        if (notification.roomId() == null || notification.roomId().isBlank()) {
            return CompletableFuture.failedFuture(
                    new ReminderDeliveryException("Notification of reminder " + notification.reminderId()
                            + " has no room"));
        }
        log.info("[Notify] {} -> room {}: {}", notification.kind(), notification.roomId(), notification.text());
        return CompletableFuture.completedFuture(null);
    }
}
