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

import lombok.Builder;

import java.time.Duration;

/**
 * Input of the create operation. {@code alarmRepeatInterval} and
 * {@code timezone} fall back to the configured defaults when null.
 */
@Builder
public record CreateReminderRequest(
        String roomId,
        String creatorId,
        NotificationTarget target,
        String text,
        RecurrenceSpec recurrence,
        boolean alarm,
        Duration alarmRepeatInterval,
        String timezone) {

    public static CreateReminderRequest from(ReminderCommand command) {
        return CreateReminderRequest.builder()
                .roomId(command.getRoomId())
                .creatorId(command.getSenderId())
                .target(command.getTarget())
                .text(command.getText())
                .recurrence(command.getRecurrence())
                .alarm(command.isAlarm())
                .alarmRepeatInterval(command.getAlarmRepeatInterval())
                .timezone(command.getTimezone())
                .build();
    }
}
