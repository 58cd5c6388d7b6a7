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
import lombok.Data;

import java.time.Duration;

/**
 * A reminder-management intent already parsed by the chat transport, carrying
 * the originating room and user.
 */
@Data
@Builder
public class ReminderCommand {

    private Type type;
    private String roomId;
    private String senderId;

    // CREATE
    private NotificationTarget target;
    private String text;
    private RecurrenceSpec recurrence;
    private boolean alarm;
    private Duration alarmRepeatInterval;
    private String timezone;

    // CANCEL / SILENCE: reminder id or reminder text
    private String selector;

    public enum Type {
        CREATE, LIST, CANCEL, SILENCE, HELP
    }
}
