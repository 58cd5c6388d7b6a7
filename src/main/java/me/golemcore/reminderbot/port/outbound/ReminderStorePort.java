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

import me.golemcore.reminderbot.domain.exception.ReminderPersistenceException;
import me.golemcore.reminderbot.domain.model.Reminder;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of reminder records keyed by id.
 *
 * <p>
 * Every mutating call is durable when it returns and is atomic for the single
 * row it touches. Returned reminders are copies; mutating them does not change
 * the store. Failed writes throw {@link ReminderPersistenceException} and leave
 * the stored state untouched.
 */
public interface ReminderStorePort {

    /**
     * Insert a new reminder.
     *
     * @throws IllegalArgumentException
     *             if a reminder with the same id already exists
     */
    Reminder create(Reminder reminder);

    Optional<Reminder> get(String id);

    /**
     * Consistent snapshot of all reminders of a room, or of every room when
     * {@code roomId} is null.
     */
    List<Reminder> list(String roomId);

    /**
     * Set the next recurrence instant; {@code null} marks the recurrence
     * exhausted.
     *
     * @return false if the reminder no longer exists
     */
    boolean updateNextFire(String id, Instant nextFireAt);

    /**
     * Set the silenced flag. Silencing also clears the pending alarm repeat in the
     * same write, so a silenced row never carries a repeat instant.
     *
     * @return false if the reminder no longer exists
     */
    boolean setSilenced(String id, boolean silenced);

    /**
     * Replace all fields of an existing reminder in one write.
     *
     * @return false if the reminder no longer exists
     */
    boolean update(Reminder reminder);

    /**
     * @return false if there was nothing to delete
     */
    boolean delete(String id);
}
