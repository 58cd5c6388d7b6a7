package me.golemcore.reminderbot.domain.service;

import me.golemcore.reminderbot.domain.model.RecurrenceKind;
import me.golemcore.reminderbot.domain.model.Reminder;
import me.golemcore.reminderbot.domain.model.SilenceOutcome;
import me.golemcore.reminderbot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlarmControllerTest {

    private static final Instant FIRED = Instant.parse("2026-02-11T10:00:00Z");
    private static final Duration FIVE_MINUTES = Duration.ofMinutes(5);

    private AlarmController controller;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        controller = new AlarmController(new TimeExpressionResolver(properties), properties);
    }

    @Test
    void shouldStartRepeatWhenAlarmRecurrenceFires() {
        Reminder reminder = alarm();

        boolean changed = controller.onRecurrenceFired(reminder, FIRED, FIRED);

        assertTrue(changed);
        assertEquals(FIRED.plus(FIVE_MINUTES), reminder.getAlarmNextFireAt());
        assertTrue(reminder.isRinging());
    }

    @Test
    void shouldIgnoreRecurrenceOfPlainReminder() {
        Reminder reminder = alarm();
        reminder.setAlarm(false);

        assertFalse(controller.onRecurrenceFired(reminder, FIRED, FIRED));
        assertNull(reminder.getAlarmNextFireAt());
    }

    @Test
    void shouldNotRestartRepeatThatIsAlreadyRinging() {
        Reminder reminder = alarm();
        Instant pending = FIRED.plus(Duration.ofMinutes(2));
        reminder.setAlarmNextFireAt(pending);

        boolean changed = controller.onRecurrenceFired(reminder, FIRED, FIRED);

        assertFalse(changed);
        assertEquals(pending, reminder.getAlarmNextFireAt());
    }

    @Test
    void shouldRearmSilencedAlarmOnNextRecurrence() {
        Reminder reminder = alarm();
        reminder.setSilenced(true);

        controller.onRecurrenceFired(reminder, FIRED, FIRED);

        assertFalse(reminder.isSilenced());
        assertTrue(reminder.isRinging());
    }

    @Test
    void shouldScheduleNextRepeatStrictlyAfterNow() {
        Reminder reminder = alarm();
        Instant lateNow = FIRED.plus(Duration.ofMinutes(12));

        controller.onRepeatFired(reminder, FIRED, lateNow);

        assertEquals(FIRED.plus(Duration.ofMinutes(15)), reminder.getAlarmNextFireAt());
    }

    @Test
    void shouldStopRepeatingOnceSilenced() {
        Reminder reminder = alarm();
        reminder.setAlarmNextFireAt(FIRED);
        reminder.setSilenced(true);

        controller.onRepeatFired(reminder, FIRED, FIRED);

        assertNull(reminder.getAlarmNextFireAt());
    }

    @Test
    void shouldSilenceRingingAlarmWithoutTouchingRecurrence() {
        Reminder reminder = alarm();
        Instant nextRecurrence = FIRED.plus(Duration.ofDays(1));
        reminder.setNextFireAt(nextRecurrence);
        reminder.setAlarmNextFireAt(FIRED.plus(FIVE_MINUTES));

        SilenceOutcome outcome = controller.silence(reminder);

        assertEquals(SilenceOutcome.SILENCED, outcome);
        assertTrue(reminder.isSilenced());
        assertNull(reminder.getAlarmNextFireAt());
        assertEquals(nextRecurrence, reminder.getNextFireAt());
    }

    @Test
    void shouldReportAlarmThatIsNotRinging() {
        assertEquals(SilenceOutcome.NOT_RINGING, controller.silence(alarm()));
    }

    @Test
    void shouldReportReminderWithoutAlarm() {
        Reminder reminder = alarm();
        reminder.setAlarm(false);

        assertEquals(SilenceOutcome.NOT_AN_ALARM, controller.silence(reminder));
    }

    @Test
    void shouldUseReminderRepeatIntervalWhenSet() {
        Reminder reminder = alarm();
        reminder.setAlarmRepeatInterval(Duration.ofMinutes(1));

        controller.onRecurrenceFired(reminder, FIRED, FIRED);

        assertEquals(FIRED.plus(Duration.ofMinutes(1)), reminder.getAlarmNextFireAt());
    }

    private static Reminder alarm() {
        return Reminder.builder()
                .id("rem-1")
                .roomId("!room")
                .creatorId("@alice")
                .text("take out the trash")
                .recurrenceKind(RecurrenceKind.INTERVAL)
                .interval(Duration.ofDays(1))
                .alarm(true)
                .build();
    }
}
