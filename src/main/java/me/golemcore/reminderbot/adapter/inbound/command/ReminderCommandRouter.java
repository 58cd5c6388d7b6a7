package me.golemcore.reminderbot.adapter.inbound.command;

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
import me.golemcore.reminderbot.domain.exception.AmbiguousReminderException;
import me.golemcore.reminderbot.domain.exception.DuplicateReminderException;
import me.golemcore.reminderbot.domain.exception.InvalidRecurrenceException;
import me.golemcore.reminderbot.domain.exception.InvalidScheduleException;
import me.golemcore.reminderbot.domain.exception.ReminderNotFoundException;
import me.golemcore.reminderbot.domain.exception.ReminderPersistenceException;
import me.golemcore.reminderbot.domain.model.CreateReminderRequest;
import me.golemcore.reminderbot.domain.model.NotificationTarget;
import me.golemcore.reminderbot.domain.model.Reminder;
import me.golemcore.reminderbot.domain.model.ReminderCommand;
import me.golemcore.reminderbot.domain.model.SilenceResult;
import me.golemcore.reminderbot.domain.service.AlarmController;
import me.golemcore.reminderbot.domain.service.ReminderMessageFormatter;
import me.golemcore.reminderbot.infrastructure.i18n.MessageService;
import me.golemcore.reminderbot.port.inbound.CommandPort;
import me.golemcore.reminderbot.port.inbound.ReminderCommandPort;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Routes parsed reminder commands to the reminder lifecycle and composes the
 * reply for the room.
 *
 * <ul>
 * <li>create - Schedule a one-off, interval or cron reminder
 * <li>list - List the reminders of the room
 * <li>cancel - Cancel a reminder by id or text
 * <li>silence - Stop a ringing alarm
 * <li>help - Show available commands
 * </ul>
 *
 * <p>
 * Domain errors never escape to the transport: each one becomes a failed
 * {@link CommandResult} carrying a localized explanation.
 *
 * @see ReminderCommandPort
 */
@Component
@Slf4j
public class ReminderCommandRouter implements CommandPort {

    private static final String NEWLINE = "\n";

    private final ReminderCommandPort reminders;
    private final ReminderMessageFormatter formatter;
    private final AlarmController alarmController;
    private final MessageService messageService;

    public ReminderCommandRouter(ReminderCommandPort reminders, ReminderMessageFormatter formatter,
            AlarmController alarmController, MessageService messageService) {
        this.reminders = reminders;
        this.formatter = formatter;
        this.alarmController = alarmController;
        this.messageService = messageService;
    }

    @Override
    public CompletableFuture<CommandResult> execute(ReminderCommand command) {
        return CompletableFuture.supplyAsync(() -> route(command));
    }

    CommandResult route(ReminderCommand command) {
        if (command == null || command.getType() == null) {
            return CommandResult.failure(msg("command.unknown"));
        }
        log.debug("[Commands] Executing {} in room {}", command.getType(), command.getRoomId());
        try {
            return switch (command.getType()) {
            case CREATE -> handleCreate(command);
            case LIST -> handleList(command.getRoomId());
            case CANCEL -> handleCancel(command.getRoomId(), command.getSelector());
            case SILENCE -> handleSilence(command.getRoomId(), command.getSelector());
            case HELP -> handleHelp();
            };
        } catch (InvalidRecurrenceException e) {
            return CommandResult.failure(msg("command.error.invalid-recurrence", e.getMessage()));
        } catch (InvalidScheduleException e) {
            return CommandResult.failure(msg("command.error.invalid-schedule"));
        } catch (ReminderNotFoundException e) {
            return CommandResult.failure(msg("command.error.not-found", e.getSelector()));
        } catch (AmbiguousReminderException e) {
            String ids = e.getCandidates().stream()
                    .map(Reminder::getId)
                    .collect(Collectors.joining(", "));
            return CommandResult.failure(msg("command.error.ambiguous", e.getSelector(), ids));
        } catch (DuplicateReminderException e) {
            return CommandResult.failure(msg("command.error.duplicate"));
        } catch (ReminderPersistenceException e) {
            log.error("[Commands] {} failed in room {}: {}", command.getType(), command.getRoomId(),
                    e.getMessage());
            return CommandResult.failure(msg("command.error.storage"));
        } catch (IllegalArgumentException e) {
            return CommandResult.failure(msg("command.error.invalid", e.getMessage()));
        }
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition("remind", msg("command.remind.desc"),
                        "remind <time|every <interval>|cron <expr>> [alarm] <text>"),
                new CommandDefinition("reminders", msg("command.reminders.desc"), "reminders"),
                new CommandDefinition("cancel", msg("command.cancel.desc"), "cancel <id|text>"),
                new CommandDefinition("silence", msg("command.silence.desc"), "silence <id|text>"),
                new CommandDefinition("help", msg("command.help.desc"), "help"));
    }

    private CommandResult handleCreate(ReminderCommand command) {
        Reminder reminder = reminders.create(CreateReminderRequest.from(command));
        ZoneId zone = displayZone(reminder);
        String who = reminder.getTarget() == NotificationTarget.ROOM
                ? msg("command.target.room")
                : msg("command.target.you");
        String when = formatter.formatInstant(reminder.getNextFireAt(), zone);

        String reply = switch (reminder.getRecurrenceKind()) {
        case ONCE -> msg("command.create.once", who, when);
        case INTERVAL -> msg("command.create.interval", who, when,
                ReminderMessageFormatter.formatDuration(reminder.getInterval()));
        case CRON -> msg("command.create.cron", who, reminder.getCronExpression(), when);
        };
        if (reminder.isAlarm()) {
            reply = reply + " " + msg("command.create.alarm",
                    ReminderMessageFormatter.formatDuration(alarmController.repeatInterval(reminder)));
        }
        return CommandResult.success(reply, reminder);
    }

    private CommandResult handleList(String roomId) {
        List<Reminder> roomReminders = reminders.list(roomId);
        if (roomReminders.isEmpty()) {
            return CommandResult.success(msg("command.list.empty"));
        }

        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.list.title", roomReminders.size())).append(NEWLINE);
        for (Reminder reminder : roomReminders) {
            ZoneId zone = displayZone(reminder);
            sb.append(NEWLINE).append(msg("command.list.item",
                    reminder.getId(),
                    reminder.getText(),
                    formatter.formatInstant(reminder.getNextFireAt(), zone),
                    describeRecurrence(reminder)));
            if (reminder.isAlarm()) {
                sb.append(' ').append(msg("command.list.alarm"));
            }
            if (reminder.isRinging()) {
                sb.append(' ').append(msg("command.list.ringing"));
            } else if (reminder.isSilenced()) {
                sb.append(' ').append(msg("command.list.silenced"));
            }
        }
        return CommandResult.success(sb.toString(), roomReminders);
    }

    private CommandResult handleCancel(String roomId, String selector) {
        Reminder cancelled = reminders.cancel(roomId, selector);
        return CommandResult.success(msg("command.cancel.done", cancelled.getText()), cancelled);
    }

    private CommandResult handleSilence(String roomId, String selector) {
        SilenceResult result = reminders.silence(roomId, selector);
        String text = result.reminder().getText();
        return switch (result.outcome()) {
        case SILENCED -> CommandResult.success(msg("command.silence.done"), result);
        case NOT_RINGING -> CommandResult.failure(msg("command.silence.not-ringing", text));
        case NOT_AN_ALARM -> CommandResult.failure(msg("command.silence.not-alarm", text));
        };
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.help.header")).append(NEWLINE);
        for (CommandDefinition command : listCommands()) {
            sb.append(command.usage()).append(" - ").append(command.description()).append(NEWLINE);
        }
        return CommandResult.success(sb.toString().trim());
    }

    private String describeRecurrence(Reminder reminder) {
        return switch (reminder.getRecurrenceKind()) {
        case ONCE -> msg("command.list.once");
        case INTERVAL -> msg("command.list.every", ReminderMessageFormatter.formatDuration(reminder.getInterval()));
        case CRON -> msg("command.list.cron", reminder.getCronExpression());
        };
    }

    private static ZoneId displayZone(Reminder reminder) {
        String timezone = reminder.getTimezone();
        if (timezone != null) {
            try {
                return ZoneId.of(timezone);
            } catch (DateTimeException e) {
                log.debug("[Commands] Reminder {} has unusable zone '{}', showing UTC", reminder.getId(), timezone);
            }
        }
        return ZoneOffset.UTC;
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
