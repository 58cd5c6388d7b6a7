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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reminderbot.domain.exception.AmbiguousReminderException;
import me.golemcore.reminderbot.domain.exception.DuplicateReminderException;
import me.golemcore.reminderbot.domain.exception.InvalidRecurrenceException;
import me.golemcore.reminderbot.domain.exception.ReminderNotFoundException;
import me.golemcore.reminderbot.domain.exception.ReminderPersistenceException;
import me.golemcore.reminderbot.domain.model.CreateReminderRequest;
import me.golemcore.reminderbot.domain.model.NotificationTarget;
import me.golemcore.reminderbot.domain.model.RecoveryReport;
import me.golemcore.reminderbot.domain.model.RecurrenceKind;
import me.golemcore.reminderbot.domain.model.RecurrenceSpec;
import me.golemcore.reminderbot.domain.model.Reminder;
import me.golemcore.reminderbot.domain.model.SilenceResult;
import me.golemcore.reminderbot.infrastructure.config.BotProperties;
import me.golemcore.reminderbot.port.inbound.ReminderCommandPort;
import me.golemcore.reminderbot.port.outbound.ReminderStorePort;
import me.golemcore.reminderbot.scheduler.ReminderScheduler;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Reminder lifecycle: creation, listing, cancellation, silencing, and
 * recovery of stored reminders at startup.
 *
 * <p>
 * Commands address a reminder by id or by its text within the room. Text
 * matching ignores case; a text shared by several reminders is ambiguous.
 */
@Service
@Slf4j
public class ReminderService implements ReminderCommandPort {

    private static final String ID_PREFIX = "rem-";
    private static final int ID_LENGTH = 8;

    private final ReminderStorePort store;
    private final ReminderScheduler scheduler;
    private final TimeExpressionResolver resolver;
    private final AlarmController alarmController;
    private final BotProperties.ReminderProperties settings;
    private final Clock clock;

    public ReminderService(ReminderStorePort store, ReminderScheduler scheduler, TimeExpressionResolver resolver,
            AlarmController alarmController, BotProperties properties, Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.resolver = resolver;
        this.alarmController = alarmController;
        this.settings = properties.getReminders();
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recover();
        if (settings.isEnabled()) {
            scheduler.start();
        } else {
            log.info("[Reminders] Scheduler disabled");
        }
    }

    @Override
    public Reminder create(CreateReminderRequest request) {
        requireText(request.roomId(), "Room id is required");
        requireText(request.text(), "Reminder text cannot be empty");

        ZoneId zone = resolveZone(request.timezone() != null ? request.timezone() : settings.getTimezone());
        Instant now = clock.instant();
        RecurrenceSpec recurrence = resolver.normalize(request.recurrence());
        Instant firstFire;
        try {
            firstFire = resolver.resolveFirst(recurrence, now, zone);
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidRecurrenceException("First fire time is out of range", e);
        }

        Duration alarmRepeat = request.alarmRepeatInterval();
        if (alarmRepeat != null && (alarmRepeat.isZero() || alarmRepeat.isNegative())) {
            throw new IllegalArgumentException("Alarm repeat interval must be positive");
        }

        String text = request.text().trim();
        Reminder reminder = Reminder.builder()
                .id(ID_PREFIX + UUID.randomUUID().toString().substring(0, ID_LENGTH))
                .roomId(request.roomId())
                .creatorId(request.creatorId())
                .target(request.target() != null ? request.target() : NotificationTarget.USER)
                .text(text)
                .recurrenceKind(recurrence.kind())
                .interval(recurrence.interval())
                .cronExpression(recurrence.cronExpression())
                .timezone(zone.getId())
                .startAt(firstFire)
                .nextFireAt(firstFire)
                .alarm(request.alarm())
                .alarmRepeatInterval(request.alarm() ? alarmRepeat : null)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Reminder created = scheduler.withLock(() -> {
            if (settings.isUniqueTextPerRoom()) {
                findByText(request.roomId(), text).stream().findFirst().ifPresent(existing -> {
                    throw new DuplicateReminderException(text, existing.getId());
                });
            }
            return scheduler.register(reminder);
        });

        log.info("[Reminders] Created {} reminder {} in room {} (first fire: {})", recurrence.kind(),
                created.getId(), created.getRoomId(), firstFire);
        return created;
    }

    @Override
    public List<Reminder> list(String roomId) {
        return store.list(roomId).stream()
                .sorted(Comparator.comparing(Reminder::getNextFireAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(Reminder::getId))
                .toList();
    }

    @Override
    public Reminder cancel(String roomId, String selector) {
        return scheduler.withLock(() -> {
            Reminder reminder = resolve(roomId, selector);
            scheduler.cancel(reminder.getId());
            log.info("[Reminders] Cancelled reminder {} in room {}", reminder.getId(), roomId);
            return reminder;
        });
    }

    @Override
    public SilenceResult silence(String roomId, String selector) {
        return scheduler.withLock(() -> {
            Reminder reminder = resolve(roomId, selector);
            SilenceResult result = scheduler.silence(reminder);
            log.info("[Reminders] Silence of reminder {} in room {}: {}", reminder.getId(), roomId,
                    result.outcome());
            return result;
        });
    }

    /**
     * Load every stored reminder into the scheduler. Instants already in the past
     * count as one missed wake: unless missed reminders are delivered on
     * recovery, recurring reminders move to their next future occurrence and
     * one-off reminders are dropped. Nothing is written when nothing is overdue,
     * so running recovery twice leaves the store unchanged.
     */
    public RecoveryReport recover() {
        return scheduler.withLock(() -> {
            Instant now = clock.instant();
            List<Reminder> snapshot = store.list(null);
            int scheduled = 0;
            int rescheduled = 0;
            int dropped = 0;
            int failed = 0;

            for (Reminder stored : snapshot) {
                try {
                    ZoneId zone = zoneOf(stored);
                    if (settings.isDeliverMissedOnRecovery() || !isOverdue(stored, now)) {
                        scheduler.track(stored);
                        scheduled++;
                        continue;
                    }
                    Optional<Reminder> advanced = advanceMissed(stored, now, zone);
                    if (advanced.isPresent()) {
                        scheduler.track(advanced.get());
                        rescheduled++;
                    } else {
                        dropped++;
                    }
                } catch (ReminderPersistenceException e) {
                    log.error("[Reminders] Failed to recover reminder {}: {}", stored.getId(), e.getMessage());
                    scheduler.track(stored);
                    scheduled++;
                } catch (DateTimeException | ArithmeticException e) {
                    log.error("[Reminders] Reminder {} left unscheduled, its schedule is unusable: {}",
                            stored.getId(), e.getMessage());
                    failed++;
                }
            }

            RecoveryReport report = new RecoveryReport(snapshot.size(), scheduled, rescheduled, dropped, failed);
            log.info("[Reminders] Recovered {} reminders: {} scheduled, {} rescheduled, {} dropped, {} failed",
                    report.loaded(), report.scheduled(), report.rescheduled(), report.dropped(), report.failed());
            return report;
        });
    }

    private Optional<Reminder> advanceMissed(Reminder stored, Instant now, ZoneId zone) {
        Reminder working = stored.copy();
        boolean recurrenceMissed = isPast(working.getNextFireAt(), now);
        boolean repeatMissed = working.isRinging() && isPast(working.getAlarmNextFireAt(), now);

        if (recurrenceMissed && working.getRecurrenceKind() == RecurrenceKind.ONCE) {
            working.setNextFireAt(null);
        } else if (recurrenceMissed) {
            working.setNextFireAt(resolver.resolveNextAfter(working.getRecurrence(), working.getNextFireAt(),
                    now, zone).orElse(null));
        }
        if (repeatMissed) {
            working.setAlarmNextFireAt(alarmController.nextRepeat(working, working.getAlarmNextFireAt(), now));
        }

        if (working.isExhausted() && !settings.isRetainCompleted()) {
            store.delete(working.getId());
            log.info("[Reminders] Dropped missed reminder {}", working.getId());
            return Optional.empty();
        }

        if (!repeatMissed) {
            store.updateNextFire(working.getId(), working.getNextFireAt());
        } else {
            working.setUpdatedAt(now);
            store.update(working);
        }
        log.info("[Reminders] Rescheduled missed reminder {} to {}", working.getId(), working.getNextFireAt());
        return Optional.of(working);
    }

    private Reminder resolve(String roomId, String selector) {
        requireText(selector, "Reminder id or text is required");
        String trimmed = selector.trim();

        Optional<Reminder> byId = store.get(trimmed)
                .filter(reminder -> roomId.equals(reminder.getRoomId()));
        if (byId.isPresent()) {
            return byId.get();
        }

        List<Reminder> byText = findByText(roomId, trimmed);
        if (byText.isEmpty()) {
            throw new ReminderNotFoundException(roomId, trimmed);
        }
        if (byText.size() > 1) {
            throw new AmbiguousReminderException(trimmed, byText);
        }
        return byText.get(0);
    }

    private List<Reminder> findByText(String roomId, String text) {
        String needle = text.toUpperCase(Locale.ROOT);
        return store.list(roomId).stream()
                .filter(reminder -> reminder.getText() != null
                        && reminder.getText().toUpperCase(Locale.ROOT).equals(needle))
                .toList();
    }

    private boolean isOverdue(Reminder reminder, Instant now) {
        return isPast(reminder.getNextFireAt(), now)
                || (reminder.isRinging() && isPast(reminder.getAlarmNextFireAt(), now));
    }

    private static boolean isPast(Instant instant, Instant now) {
        return instant != null && instant.isBefore(now);
    }

    private ZoneId zoneOf(Reminder reminder) {
        return ZoneId.of(reminder.getTimezone() != null ? reminder.getTimezone() : settings.getTimezone());
    }

    private static ZoneId resolveZone(String timezone) {
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new InvalidRecurrenceException("Unknown time zone '" + timezone + "'", e);
        }
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }
}
