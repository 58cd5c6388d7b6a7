package me.golemcore.reminderbot.port.outbound;

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

import me.golemcore.reminderbot.domain.model.ReminderNotification;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound side of the chat transport: delivers a fired reminder to its room.
 * Implementations complete the future exceptionally (preferably with
 * {@link me.golemcore.reminderbot.domain.exception.ReminderDeliveryException})
 * when the message could not be sent.
 */
public interface NotificationPort {

    CompletableFuture<Void> deliver(ReminderNotification notification);
}
