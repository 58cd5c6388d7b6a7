package me.golemcore.reminderbot.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A scheduled chat notification with its recurrence policy and alarm state.
 * Reminders are persisted by the reminder store and advanced by the scheduler,
 * which is the only component that writes {@code nextFireAt} and
 * {@code alarmNextFireAt}.
 *
 * <p>
 * {@code nextFireAt == null} means the recurrence is exhausted. An alarm keeps
 * ringing independently through {@code alarmNextFireAt} until silenced.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Reminder {

    private String id;
    private String roomId;
    private String creatorId;
    private NotificationTarget target;
    private String text;

    private RecurrenceKind recurrenceKind;
    private Duration interval;
    private String cronExpression;
    private String timezone;

    private Instant startAt;
    private Instant nextFireAt;

    private boolean alarm;
    private Duration alarmRepeatInterval;
    private Instant alarmNextFireAt;
    private boolean silenced;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastFiredAt;

    @JsonIgnore
    public RecurrenceSpec getRecurrence() {
        return new RecurrenceSpec(recurrenceKind, startAt, interval, cronExpression);
    }

    /**
     * Whether an alarm repeat is currently pending for this reminder.
     */
    @JsonIgnore
    public boolean isRinging() {
        return alarm && alarmNextFireAt != null;
    }

    /**
     * Whether nothing is left to fire: the recurrence is exhausted and no alarm is
     * ringing.
     */
    @JsonIgnore
    public boolean isExhausted() {
        return nextFireAt == null && !isRinging();
    }

    public Reminder copy() {
        return toBuilder().build();
    }
}
