package me.golemcore.reminderbot.scheduler;

import me.golemcore.reminderbot.adapter.outbound.storage.JsonReminderStore;
import me.golemcore.reminderbot.domain.model.NotificationTarget;
import me.golemcore.reminderbot.domain.model.RecurrenceKind;
import me.golemcore.reminderbot.domain.model.Reminder;
import me.golemcore.reminderbot.domain.model.ReminderNotification;
import me.golemcore.reminderbot.domain.model.ScheduledFire;
import me.golemcore.reminderbot.domain.model.SilenceOutcome;
import me.golemcore.reminderbot.domain.model.SilenceResult;
import me.golemcore.reminderbot.domain.service.AlarmController;
import me.golemcore.reminderbot.domain.service.ReminderMessageFormatter;
import me.golemcore.reminderbot.domain.service.TimeExpressionResolver;
import me.golemcore.reminderbot.infrastructure.config.AutoConfiguration;
import me.golemcore.reminderbot.infrastructure.config.BotProperties;
import me.golemcore.reminderbot.infrastructure.i18n.MessageService;
import me.golemcore.reminderbot.port.outbound.NotificationPort;
import me.golemcore.reminderbot.testsupport.InMemoryStoragePort;
import me.golemcore.reminderbot.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReminderSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final String ROOM = "!room:example.org";
    private static final String ALICE = "@alice:example.org";
    private static final String TRASH = "take out the trash";

    private BotProperties properties;
    private MutableClock clock;
    private InMemoryStoragePort storagePort;
    private JsonReminderStore store;
    private NotificationPort notificationPort;
    private ReminderScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getReminders().setPersistRetryBackoff(Duration.ZERO);
        clock = new MutableClock(NOW);
        storagePort = new InMemoryStoragePort();
        store = new JsonReminderStore(storagePort, AutoConfiguration.objectMapper());
        notificationPort = mock(NotificationPort.class);
        when(notificationPort.deliver(any())).thenReturn(CompletableFuture.completedFuture(null));

        TimeExpressionResolver resolver = new TimeExpressionResolver(properties);
        scheduler = new ReminderScheduler(store, resolver, new AlarmController(resolver, properties),
                new ReminderMessageFormatter(new MessageService()), notificationPort, properties, clock);
    }

    @Test
    void shouldNotFireBeforeDue() {
        scheduler.register(once("rem-1", NOW.plus(Duration.ofMinutes(5))));
        clock.advance(Duration.ofMinutes(4));

        scheduler.tick();

        verify(notificationPort, never()).deliver(any());
    }

    @Test
    void shouldFireOnceReminderAndDeleteIt() {
        scheduler.register(once("rem-1", NOW.plus(Duration.ofMinutes(5))));
        clock.advance(Duration.ofMinutes(5));

        scheduler.tick();
        scheduler.tick();

        ArgumentCaptor<ReminderNotification> captor = ArgumentCaptor.forClass(ReminderNotification.class);
        verify(notificationPort, times(1)).deliver(captor.capture());
        ReminderNotification notification = captor.getValue();
        assertEquals(ROOM, notification.roomId());
        assertEquals(ALICE + " " + TRASH, notification.text());
        assertEquals(ReminderNotification.Kind.REMINDER, notification.kind());
        assertTrue(store.get("rem-1").isEmpty());
        assertTrue(scheduler.pendingFires().isEmpty());
    }

    @Test
    void shouldMentionCreatorForRoomTarget() {
        Reminder reminder = once("rem-1", NOW.plus(Duration.ofMinutes(1)));
        reminder.setTarget(NotificationTarget.ROOM);
        scheduler.register(reminder);
        clock.advance(Duration.ofMinutes(1));

        scheduler.tick();

        ArgumentCaptor<ReminderNotification> captor = ArgumentCaptor.forClass(ReminderNotification.class);
        verify(notificationPort).deliver(captor.capture());
        assertEquals("@room " + TRASH + " (from " + ALICE + ")", captor.getValue().text());
    }

    @Test
    void shouldAdvanceIntervalReminder() {
        scheduler.register(interval("rem-1", Duration.ofHours(1), NOW.plus(Duration.ofHours(1))));
        clock.advance(Duration.ofHours(1));

        scheduler.tick();

        Instant expected = NOW.plus(Duration.ofHours(2));
        assertEquals(expected, store.get("rem-1").orElseThrow().getNextFireAt());
        assertEquals(List.of(new ScheduledFire(expected, "rem-1", ScheduledFire.FireKind.REMINDER)),
                scheduler.pendingFires());
    }

    @Test
    void shouldFireOnlyOnceOnLateWake() {
        scheduler.register(interval("rem-1", Duration.ofMinutes(10), NOW.plus(Duration.ofMinutes(10))));
        clock.advance(Duration.ofMinutes(55));

        scheduler.tick();
        scheduler.tick();

        verify(notificationPort, times(1)).deliver(any());
        Instant next = store.get("rem-1").orElseThrow().getNextFireAt();
        assertEquals(NOW.plus(Duration.ofMinutes(60)), next);
        assertTrue(next.isAfter(clock.instant()));
    }

    @Test
    void shouldAdvanceEvenWhenDeliveryFails() {
        when(notificationPort.deliver(any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));
        scheduler.register(interval("rem-1", Duration.ofHours(1), NOW.plus(Duration.ofHours(1))));
        clock.advance(Duration.ofHours(1));

        scheduler.tick();

        assertEquals(NOW.plus(Duration.ofHours(2)), store.get("rem-1").orElseThrow().getNextFireAt());
        assertTrue(scheduler.getHaltedReminderIds().isEmpty());
    }

    @Test
    void shouldHaltReminderWhenStateCannotBePersisted() {
        Instant due = NOW.plus(Duration.ofHours(1));
        scheduler.register(interval("rem-1", Duration.ofHours(1), due));
        int writesBefore = storagePort.getWriteAttempts();
        storagePort.setFailWrites(true);
        clock.advance(Duration.ofHours(1));

        scheduler.tick();
        scheduler.tick();

        assertTrue(scheduler.getHaltedReminderIds().isEmpty());
        assertEquals(List.of(new ScheduledFire(due, "rem-1", ScheduledFire.FireKind.REMINDER)),
                scheduler.pendingFires());

        scheduler.tick();
        scheduler.tick();

        verify(notificationPort, never()).deliver(any());
        assertEquals(3, storagePort.getWriteAttempts() - writesBefore);
        assertEquals(Set.of("rem-1"), scheduler.getHaltedReminderIds());
        assertTrue(scheduler.pendingFires().isEmpty());
        assertEquals(due, store.get("rem-1").orElseThrow().getNextFireAt());
    }

    @Test
    void shouldDeliverOnceWhenWriteSucceedsOnRetry() {
        scheduler.register(interval("rem-1", Duration.ofHours(1), NOW.plus(Duration.ofHours(1))));
        storagePort.setFailWrites(true);
        clock.advance(Duration.ofHours(1));

        scheduler.tick();

        verify(notificationPort, never()).deliver(any());
        storagePort.setFailWrites(false);
        clock.advance(Duration.ofSeconds(1));
        scheduler.tick();
        scheduler.tick();

        verify(notificationPort, times(1)).deliver(any());
        assertEquals(NOW.plus(Duration.ofHours(2)), store.get("rem-1").orElseThrow().getNextFireAt());
        assertTrue(scheduler.getHaltedReminderIds().isEmpty());
    }

    @Test
    void shouldWaitForBackoffBeforeRetryingWrite() {
        properties.getReminders().setPersistRetryBackoff(Duration.ofSeconds(30));
        scheduler.register(interval("rem-1", Duration.ofHours(1), NOW.plus(Duration.ofHours(1))));
        storagePort.setFailWrites(true);
        clock.advance(Duration.ofHours(1));

        scheduler.tick();
        int afterFirstAttempt = storagePort.getWriteAttempts();
        clock.advance(Duration.ofSeconds(10));
        scheduler.tick();

        assertEquals(afterFirstAttempt, storagePort.getWriteAttempts());

        storagePort.setFailWrites(false);
        clock.advance(Duration.ofSeconds(20));
        scheduler.tick();

        assertEquals(afterFirstAttempt + 1, storagePort.getWriteAttempts());
        verify(notificationPort, times(1)).deliver(any());
    }

    @Test
    void shouldHaltReminderWithUnusableZoneAndKeepFiringOthers() {
        Reminder broken = interval("rem-1", Duration.ofHours(1), NOW.plus(Duration.ofMinutes(5)));
        broken.setTimezone("Mars/Olympus");
        scheduler.register(broken);
        scheduler.register(interval("rem-2", Duration.ofHours(1), NOW.plus(Duration.ofMinutes(5))));
        clock.advance(Duration.ofMinutes(5));

        scheduler.tick();

        ArgumentCaptor<ReminderNotification> captor = ArgumentCaptor.forClass(ReminderNotification.class);
        verify(notificationPort, times(1)).deliver(captor.capture());
        assertEquals("rem-2", captor.getValue().reminderId());
        assertEquals(Set.of("rem-1"), scheduler.getHaltedReminderIds());
        assertEquals(List.of(new ScheduledFire(NOW.plus(Duration.ofMinutes(65)), "rem-2",
                ScheduledFire.FireKind.REMINDER)), scheduler.pendingFires());
    }

    @Test
    void shouldCancelIdempotently() {
        scheduler.register(once("rem-1", NOW.plus(Duration.ofMinutes(5))));

        assertTrue(scheduler.cancel("rem-1"));
        assertFalse(scheduler.cancel("rem-1"));

        clock.advance(Duration.ofMinutes(5));
        scheduler.tick();
        verify(notificationPort, never()).deliver(any());
    }

    @Test
    void shouldRepeatAlarmUntilSilenced() {
        Reminder alarm = once("rem-1", NOW.plus(Duration.ofMinutes(1)));
        alarm.setAlarm(true);
        scheduler.register(alarm);

        clock.advance(Duration.ofMinutes(1));
        scheduler.tick();
        clock.advance(Duration.ofMinutes(5));
        scheduler.tick();

        ArgumentCaptor<ReminderNotification> captor = ArgumentCaptor.forClass(ReminderNotification.class);
        verify(notificationPort, times(2)).deliver(captor.capture());
        List<ReminderNotification> sent = captor.getAllValues();
        assertEquals(ALICE + " " + TRASH + " (This reminder has an alarm. It will go off again in 5m.)",
                sent.get(0).text());
        assertEquals("Alarm: " + ALICE + " " + TRASH + " (use silence to stop it)", sent.get(1).text());
        assertEquals(ReminderNotification.Kind.ALARM, sent.get(1).kind());

        SilenceResult result = scheduler.silence(store.get("rem-1").orElseThrow());
        assertEquals(SilenceOutcome.SILENCED, result.outcome());

        clock.advance(Duration.ofMinutes(30));
        scheduler.tick();
        verify(notificationPort, times(2)).deliver(any());
        // A fired one-off alarm stays until cancelled
        assertTrue(store.get("rem-1").orElseThrow().isSilenced());
    }

    @Test
    void shouldSendSingleNotificationWhenRecurrenceAndRepeatCoincide() {
        Reminder alarm = interval("rem-1", Duration.ofMinutes(5), NOW.plus(Duration.ofMinutes(5)));
        alarm.setAlarm(true);
        scheduler.register(alarm);

        clock.advance(Duration.ofMinutes(5));
        scheduler.tick();
        clock.advance(Duration.ofMinutes(5));
        scheduler.tick();

        verify(notificationPort, times(2)).deliver(any());
        Reminder stored = store.get("rem-1").orElseThrow();
        assertEquals(NOW.plus(Duration.ofMinutes(15)), stored.getNextFireAt());
        assertEquals(NOW.plus(Duration.ofMinutes(15)), stored.getAlarmNextFireAt());
    }

    @Test
    void shouldTrackStoredReminderWithoutWriting() {
        Reminder reminder = once("rem-1", NOW.plus(Duration.ofMinutes(5)));
        store.create(reminder);
        int writes = storagePort.getWriteAttempts();

        scheduler.track(reminder);

        assertEquals(writes, storagePort.getWriteAttempts());
        assertEquals(1, scheduler.pendingFires().size());
    }

    private static Reminder once(String id, Instant at) {
        return Reminder.builder()
                .id(id)
                .roomId(ROOM)
                .creatorId(ALICE)
                .target(NotificationTarget.USER)
                .text(TRASH)
                .recurrenceKind(RecurrenceKind.ONCE)
                .timezone("Etc/UTC")
                .startAt(at)
                .nextFireAt(at)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static Reminder interval(String id, Duration every, Instant first) {
        Reminder reminder = once(id, first);
        reminder.setRecurrenceKind(RecurrenceKind.INTERVAL);
        reminder.setInterval(every);
        return reminder;
    }
}
