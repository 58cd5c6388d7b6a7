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

import me.golemcore.reminderbot.domain.model.Reminder;
import me.golemcore.reminderbot.domain.model.SilenceOutcome;
import me.golemcore.reminderbot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Alarm repeat policy. Mutates the reminder passed in and never touches the
 * store or the queue; the scheduler persists and enqueues the outcome.
 *
 * <p>
 * The alarm repeat runs independently of the recurrence. A recurrence fire
 * re-arms a silenced alarm, and silencing never changes {@code nextFireAt}.
 */
@Component
public class AlarmController {

    private final TimeExpressionResolver resolver;
    private final Duration defaultRepeatInterval;

    public AlarmController(TimeExpressionResolver resolver, BotProperties properties) {
        this.resolver = resolver;
        this.defaultRepeatInterval = properties.getReminders().getAlarmRepeatInterval();
    }

    /**
     * Called after the recurrence of {@code reminder} fired at {@code fired}.
     *
     * @return true if the alarm state changed
     */
    public boolean onRecurrenceFired(Reminder reminder, Instant fired, Instant now) {
        if (!reminder.isAlarm()) {
            return false;
        }
        boolean changed = reminder.isSilenced();
        reminder.setSilenced(false);
        if (reminder.getAlarmNextFireAt() == null) {
            reminder.setAlarmNextFireAt(nextRepeat(reminder, fired, now));
            changed = true;
        }
        return changed;
    }

    /**
     * Called when a pending alarm repeat fired.
     */
    public void onRepeatFired(Reminder reminder, Instant fired, Instant now) {
        if (!reminder.isAlarm() || reminder.isSilenced()) {
            reminder.setAlarmNextFireAt(null);
            return;
        }
        reminder.setAlarmNextFireAt(nextRepeat(reminder, fired, now));
    }

    public SilenceOutcome silence(Reminder reminder) {
        if (!reminder.isAlarm()) {
            return SilenceOutcome.NOT_AN_ALARM;
        }
        if (!reminder.isRinging()) {
            return SilenceOutcome.NOT_RINGING;
        }
        reminder.setSilenced(true);
        reminder.setAlarmNextFireAt(null);
        return SilenceOutcome.SILENCED;
    }

    /**
     * Next repeat instant: {@code fired} plus the repeat interval, skipping whole
     * intervals so it lands strictly after {@code now}.
     */
    public Instant nextRepeat(Reminder reminder, Instant fired, Instant now) {
        return resolver.skipMissed(fired, repeatInterval(reminder), now);
    }

    public Duration repeatInterval(Reminder reminder) {
        Duration interval = reminder.getAlarmRepeatInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return defaultRepeatInterval;
        }
        return interval;
    }
}
