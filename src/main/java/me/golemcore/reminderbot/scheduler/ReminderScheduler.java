package me.golemcore.reminderbot.scheduler;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reminderbot.domain.exception.ReminderNotFoundException;
import me.golemcore.reminderbot.domain.exception.ReminderPersistenceException;
import me.golemcore.reminderbot.domain.model.RecurrenceKind;
import me.golemcore.reminderbot.domain.model.Reminder;
import me.golemcore.reminderbot.domain.model.ReminderNotification;
import me.golemcore.reminderbot.domain.model.ScheduledFire;
import me.golemcore.reminderbot.domain.model.ScheduledFire.FireKind;
import me.golemcore.reminderbot.domain.model.SilenceOutcome;
import me.golemcore.reminderbot.domain.model.SilenceResult;
import me.golemcore.reminderbot.domain.service.AlarmController;
import me.golemcore.reminderbot.domain.service.ReminderMessageFormatter;
import me.golemcore.reminderbot.domain.service.TimeExpressionResolver;
import me.golemcore.reminderbot.infrastructure.config.BotProperties;
import me.golemcore.reminderbot.port.outbound.NotificationPort;
import me.golemcore.reminderbot.port.outbound.ReminderStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Scheduling engine that fires due reminders and alarm repeats.
 *
 * <p>
 * Pending fires live in a priority queue ordered by
 * {@link ScheduledFire#ORDER}, next to an id-indexed arena holding the
 * in-memory copy of every tracked reminder. A single daemon thread wakes at
 * the configured tick interval and:
 * <ul>
 * <li>Collects every fire due at the wake instant</li>
 * <li>Advances the recurrence and alarm state of each fired reminder</li>
 * <li>Persists the new state before anything is delivered</li>
 * <li>Delivers the notifications once the lock is released</li>
 * </ul>
 *
 * <p>
 * One fair lock serializes queue access with the command mutations (create,
 * cancel, silence). A reminder fires at most once per wake however late the
 * wake is: missed occurrences are skipped, never replayed.
 *
 * <p>
 * A failed write is retried on a later tick, no earlier than the configured
 * backoff, with the due entries put back into the queue. Nothing is delivered
 * until the write succeeds. After the configured number of attempts the
 * reminder is halted.
 *
 * @see AlarmController
 * @see TimeExpressionResolver
 */
@Component
@Slf4j
public class ReminderScheduler {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ReminderStorePort store;
    private final TimeExpressionResolver resolver;
    private final AlarmController alarmController;
    private final ReminderMessageFormatter formatter;
    private final NotificationPort notificationPort;
    private final BotProperties.ReminderProperties settings;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final PriorityQueue<ScheduledFire> queue = new PriorityQueue<>(ScheduledFire.ORDER);
    private final Map<String, Reminder> arena = new HashMap<>();
    private final Set<String> haltedIds = ConcurrentHashMap.newKeySet();
    private final Map<String, PersistRetry> retries = new HashMap<>();
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> tickTask;

    public ReminderScheduler(ReminderStorePort store, TimeExpressionResolver resolver,
            AlarmController alarmController, ReminderMessageFormatter formatter,
            NotificationPort notificationPort, BotProperties properties, Clock clock) {
        this.store = store;
        this.resolver = resolver;
        this.alarmController = alarmController;
        this.formatter = formatter;
        this.notificationPort = notificationPort;
        this.settings = properties.getReminders();
        this.clock = clock;
    }

    /**
     * Start the tick loop. Calling it again is a no-op.
     */
    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reminder-scheduler");
            t.setDaemon(true);
            return t;
        });

        long tickMillis = Math.max(1, settings.getTickInterval().toMillis());
        tickTask = executor.scheduleAtFixedRate(this::tick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        log.info("[ReminderScheduler] Started with tick interval: {}ms", tickMillis);
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
        log.info("[ReminderScheduler] Shut down");
    }

    /**
     * Run {@code action} while holding the scheduler lock, so that it sees and
     * mutates the store consistently with the tick loop.
     */
    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Persist a new reminder and start tracking it.
     *
     * @throws ReminderPersistenceException
     *             if the reminder could not be stored; nothing is enqueued then
     */
    public Reminder register(Reminder reminder) {
        return withLock(() -> {
            Reminder created = store.create(reminder);
            track(created);
            log.info("[ReminderScheduler] Registered reminder {} (next fire: {})", created.getId(),
                    created.getNextFireAt());
            return created.copy();
        });
    }

    /**
     * Start tracking a reminder that is already stored, without writing it.
     */
    public void track(Reminder reminder) {
        withLock(() -> {
            Reminder tracked = reminder.copy();
            arena.put(tracked.getId(), tracked);
            haltedIds.remove(tracked.getId());
            retries.remove(tracked.getId());
            reschedule(tracked);
            return null;
        });
    }

    /**
     * Stop tracking and delete a reminder. Cancelling an id that is already gone
     * succeeds without effect.
     *
     * @return true if a stored reminder was deleted
     */
    public boolean cancel(String reminderId) {
        return withLock(() -> {
            queue.removeIf(fire -> fire.reminderId().equals(reminderId));
            arena.remove(reminderId);
            haltedIds.remove(reminderId);
            retries.remove(reminderId);
            boolean deleted = store.delete(reminderId);
            if (deleted) {
                log.info("[ReminderScheduler] Cancelled reminder {}", reminderId);
            } else {
                log.debug("[ReminderScheduler] Reminder {} already gone", reminderId);
            }
            return deleted;
        });
    }

    /**
     * Stop the ringing alarm of a reminder. The recurrence keeps its schedule.
     *
     * @throws ReminderNotFoundException
     *             if the reminder vanished before the lock was taken
     */
    public SilenceResult silence(Reminder target) {
        return withLock(() -> {
            String id = target.getId();
            Reminder tracked = arena.get(id);
            Reminder working = tracked != null ? tracked.copy() : target.copy();

            SilenceOutcome outcome = alarmController.silence(working);
            if (outcome != SilenceOutcome.SILENCED) {
                return new SilenceResult(working, outcome);
            }

            if (!store.setSilenced(id, true)) {
                throw new ReminderNotFoundException(target.getRoomId(), id);
            }
            queue.removeIf(fire -> fire.reminderId().equals(id) && fire.kind() == FireKind.ALARM);
            if (tracked != null) {
                arena.put(id, working);
            }
            log.info("[ReminderScheduler] Silenced alarm of reminder {}", id);
            return new SilenceResult(working.copy(), outcome);
        });
    }

    /**
     * Snapshot of the pending queue in fire order.
     */
    public List<ScheduledFire> pendingFires() {
        return withLock(() -> {
            List<ScheduledFire> fires = new ArrayList<>(queue);
            fires.sort(ScheduledFire.ORDER);
            return fires;
        });
    }

    /**
     * Ids of reminders taken out of the schedule because their state could not
     * be persisted.
     */
    public Set<String> getHaltedReminderIds() {
        return Set.copyOf(haltedIds);
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[ReminderScheduler] Tick skipped: previous execution still in progress");
            return;
        }
        try {
            List<ReminderNotification> outbox = withLock(this::fireDue);
            for (ReminderNotification notification : outbox) {
                deliver(notification);
            }
        } catch (Exception e) {
            log.error("[ReminderScheduler] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    private List<ReminderNotification> fireDue() {
        Instant now = clock.instant();
        Map<String, List<ScheduledFire>> dueById = new LinkedHashMap<>();
        List<ScheduledFire> backingOff = new ArrayList<>();
        while (!queue.isEmpty() && !queue.peek().fireAt().isAfter(now)) {
            ScheduledFire fire = queue.poll();
            PersistRetry retry = retries.get(fire.reminderId());
            if (retry != null && now.isBefore(retry.notBefore())) {
                backingOff.add(fire);
            } else {
                dueById.computeIfAbsent(fire.reminderId(), id -> new ArrayList<>()).add(fire);
            }
        }
        queue.addAll(backingOff);
        if (dueById.isEmpty()) {
            return List.of();
        }

        log.debug("[ReminderScheduler] Tick: {} due reminders", dueById.size());
        List<ReminderNotification> outbox = new ArrayList<>();
        for (Map.Entry<String, List<ScheduledFire>> entry : dueById.entrySet()) {
            try {
                outbox.addAll(fireReminder(entry.getKey(), entry.getValue(), now));
            } catch (RuntimeException e) {
                log.error("[ReminderScheduler] Failed to fire reminder {}: {}", entry.getKey(), e.getMessage(), e);
                halt(entry.getKey());
            }
        }
        return outbox;
    }

    private List<ReminderNotification> fireReminder(String id, List<ScheduledFire> fires, Instant now) {
        Reminder current = arena.get(id);
        if (current == null) {
            return List.of();
        }

        Instant recurrenceFired = null;
        Instant repeatFired = null;
        for (ScheduledFire fire : fires) {
            // Entries superseded by a later state change are ignored
            if (fire.kind() == FireKind.REMINDER && fire.fireAt().equals(current.getNextFireAt())) {
                recurrenceFired = fire.fireAt();
            } else if (fire.kind() == FireKind.ALARM && fire.fireAt().equals(current.getAlarmNextFireAt())) {
                repeatFired = fire.fireAt();
            }
        }
        if (recurrenceFired == null && repeatFired == null) {
            return List.of();
        }

        Reminder working = current.copy();
        List<ReminderNotification> notifications = new ArrayList<>();

        if (repeatFired != null) {
            alarmController.onRepeatFired(working, repeatFired, now);
            if (recurrenceFired == null) {
                notifications.add(formatter.alarmNotification(working));
            }
        }
        if (recurrenceFired != null) {
            Instant next = resolver.resolveNextAfter(working.getRecurrence(), recurrenceFired, now, zoneOf(working))
                    .orElse(null);
            working.setNextFireAt(next);
            alarmController.onRecurrenceFired(working, recurrenceFired, now);
            notifications.add(formatter.reminderNotification(working, alarmController.repeatInterval(working)));
        }
        working.setLastFiredAt(now);
        working.setUpdatedAt(now);

        boolean completed = isCompleted(working);
        boolean written;
        try {
            written = completed ? store.delete(id) : store.update(working);
        } catch (ReminderPersistenceException e) {
            retryLater(id, fires, now, e);
            return List.of();
        }
        retries.remove(id);
        if (!written) {
            log.warn("[ReminderScheduler] Reminder {} vanished from the store", id);
            halt(id);
            return List.of();
        }

        if (completed) {
            arena.remove(id);
            queue.removeIf(fire -> fire.reminderId().equals(id));
            log.info("[ReminderScheduler] Reminder {} completed", id);
        } else {
            arena.put(id, working);
            reschedule(working);
            log.info("[ReminderScheduler] Fired reminder {} (next fire: {}, alarm repeat: {})", id,
                    working.getNextFireAt(), working.getAlarmNextFireAt());
        }
        return notifications;
    }

    private boolean isCompleted(Reminder reminder) {
        return reminder.getRecurrenceKind() == RecurrenceKind.ONCE
                && reminder.getNextFireAt() == null
                && !reminder.isAlarm()
                && !settings.isRetainCompleted();
    }

    private void retryLater(String id, List<ScheduledFire> fires, Instant now, ReminderPersistenceException e) {
        int attempts = Math.max(1, settings.getPersistAttempts());
        PersistRetry previous = retries.get(id);
        int failed = previous != null ? previous.failures() + 1 : 1;
        log.warn("[ReminderScheduler] Persisting reminder {} failed (attempt {}/{}): {}", id, failed, attempts,
                e.getMessage());
        if (failed >= attempts) {
            halt(id);
            return;
        }
        // Arena still holds the persisted state, so the same entries fire again
        retries.put(id, new PersistRetry(failed, now.plus(settings.getPersistRetryBackoff())));
        queue.addAll(fires);
    }

    private void halt(String id) {
        // Arena keeps the last persisted state
        queue.removeIf(fire -> fire.reminderId().equals(id));
        retries.remove(id);
        haltedIds.add(id);
        log.error("[ReminderScheduler] Halted reminder {}: its next state could not be persisted", id);
    }

    private void reschedule(Reminder reminder) {
        String id = reminder.getId();
        queue.removeIf(fire -> fire.reminderId().equals(id));
        if (reminder.getNextFireAt() != null) {
            queue.add(new ScheduledFire(reminder.getNextFireAt(), id, FireKind.REMINDER));
        }
        if (reminder.isRinging()) {
            queue.add(new ScheduledFire(reminder.getAlarmNextFireAt(), id, FireKind.ALARM));
        }
    }

    private void deliver(ReminderNotification notification) {
        long timeoutMillis = settings.getDeliveryTimeout().toMillis();
        try {
            notificationPort.deliver(notification).get(timeoutMillis, TimeUnit.MILLISECONDS);
            log.debug("[ReminderScheduler] Delivered {} of reminder {} to room {}", notification.kind(),
                    notification.reminderId(), notification.roomId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ReminderScheduler] Delivery of reminder {} interrupted", notification.reminderId());
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.warn("[ReminderScheduler] Failed to deliver reminder {} to room {}: {}",
                    notification.reminderId(), notification.roomId(), e.getMessage());
        }
    }

    private ZoneId zoneOf(Reminder reminder) {
        String zone = reminder.getTimezone() != null ? reminder.getTimezone() : settings.getTimezone();
        return ZoneId.of(zone);
    }

    private record PersistRetry(int failures, Instant notBefore) {
    }
}
