package me.golemcore.reminderbot.port.inbound;

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

import me.golemcore.reminderbot.domain.model.CreateReminderRequest;
import me.golemcore.reminderbot.domain.model.Reminder;
import me.golemcore.reminderbot.domain.model.SilenceResult;

import java.util.List;

/**
 * Reminder-management operations consumed by the chat transport. Selectors
 * are either a reminder id or the reminder text (case-insensitive), always
 * scoped to the calling room.
 */
public interface ReminderCommandPort {

    /**
     * @throws me.golemcore.reminderbot.domain.exception.InvalidRecurrenceException
     *             if the recurrence is malformed
     * @throws me.golemcore.reminderbot.domain.exception.InvalidScheduleException
     *             if the first fire lies in the past
     * @throws me.golemcore.reminderbot.domain.exception.DuplicateReminderException
     *             if the room already has a reminder with this text
     */
    Reminder create(CreateReminderRequest request);

    List<Reminder> list(String roomId);

    /**
     * @throws me.golemcore.reminderbot.domain.exception.ReminderNotFoundException
     *             if nothing matches
     * @throws me.golemcore.reminderbot.domain.exception.AmbiguousReminderException
     *             if several reminders match the text
     */
    Reminder cancel(String roomId, String selector);

    /**
     * @throws me.golemcore.reminderbot.domain.exception.ReminderNotFoundException
     *             if nothing matches
     * @throws me.golemcore.reminderbot.domain.exception.AmbiguousReminderException
     *             if several reminders match the text
     */
    SilenceResult silence(String roomId, String selector);
}
