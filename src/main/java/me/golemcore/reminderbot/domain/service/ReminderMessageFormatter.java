package me.golemcore.reminderbot.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.reminderbot.domain.model.NotificationTarget;
import me.golemcore.reminderbot.domain.model.Reminder;
import me.golemcore.reminderbot.domain.model.ReminderNotification;
import me.golemcore.reminderbot.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Composes notification texts and the human-readable dates and durations used
 * in replies.
 */
@Component
@RequiredArgsConstructor
public class ReminderMessageFormatter {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter
            .ofPattern("MMM dd yyyy, HH:mm z", Locale.ENGLISH);

    private final MessageService messageService;

    public ReminderNotification reminderNotification(Reminder reminder, Duration alarmRepeatInterval) {
        String text = mentionText(reminder);
        if (reminder.isAlarm()) {
            text = messageService.getMessage("notification.alarm-notice", text,
                    formatDuration(alarmRepeatInterval));
        }
        return notification(reminder, text, ReminderNotification.Kind.REMINDER);
    }

    public ReminderNotification alarmNotification(Reminder reminder) {
        String text = messageService.getMessage("notification.alarm-repeat", mentionText(reminder));
        return notification(reminder, text, ReminderNotification.Kind.ALARM);
    }

    public String formatInstant(Instant instant, ZoneId zone) {
        if (instant == null) {
            return "-";
        }
        if (TimeExpressionResolver.NEVER.equals(instant)) {
            return messageService.getMessage("command.list.never");
        }
        return DATE_FORMAT.format(instant.atZone(zone));
    }

    /**
     * Compact duration such as {@code 1d 2h 5m}; seconds only appear when
     * nothing larger does or when they are not zero.
     */
    public static String formatDuration(Duration duration) {
        if (duration == null) {
            return "-";
        }
        long days = duration.toDaysPart();
        int hours = duration.toHoursPart();
        int minutes = duration.toMinutesPart();
        int seconds = duration.toSecondsPart();

        StringBuilder sb = new StringBuilder();
        appendUnit(sb, days, "d");
        appendUnit(sb, hours, "h");
        appendUnit(sb, minutes, "m");
        if (seconds > 0 || sb.length() == 0) {
            appendUnit(sb, seconds, "s");
            if (sb.length() == 0) {
                sb.append("0s");
            }
        }
        return sb.toString();
    }

    private String mentionText(Reminder reminder) {
        if (reminder.getTarget() == NotificationTarget.ROOM) {
            return messageService.getMessage("notification.room", reminder.getText(), reminder.getCreatorId());
        }
        return messageService.getMessage("notification.user", reminder.getCreatorId(), reminder.getText());
    }

    private static ReminderNotification notification(Reminder reminder, String text,
            ReminderNotification.Kind kind) {
        return new ReminderNotification(reminder.getId(), reminder.getRoomId(), reminder.getTarget(),
                reminder.getCreatorId(), text, kind);
    }

    private static void appendUnit(StringBuilder sb, long value, String unit) {
        if (value <= 0) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(value).append(unit);
    }
}
