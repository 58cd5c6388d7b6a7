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

import java.time.Duration;
import java.time.Instant;

/**
 * Recurrence payload of a reminder. Which fields are meaningful depends on the
 * kind: {@code startAt} for ONCE (and optionally INTERVAL), {@code interval}
 * for INTERVAL, {@code cronExpression} for CRON.
 */
public record RecurrenceSpec(RecurrenceKind kind, Instant startAt, Duration interval, String cronExpression) {

    public static RecurrenceSpec once(Instant at) {
        return new RecurrenceSpec(RecurrenceKind.ONCE, at, null, null);
    }

    public static RecurrenceSpec every(Duration interval, Instant startAt) {
        return new RecurrenceSpec(RecurrenceKind.INTERVAL, startAt, interval, null);
    }

    public static RecurrenceSpec cron(String cronExpression) {
        return new RecurrenceSpec(RecurrenceKind.CRON, null, null, cronExpression);
    }

    public RecurrenceSpec withCronExpression(String normalized) {
        return new RecurrenceSpec(kind, startAt, interval, normalized);
    }

    public boolean isRecurring() {
        return kind == RecurrenceKind.INTERVAL || kind == RecurrenceKind.CRON;
    }
}
