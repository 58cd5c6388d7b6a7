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

import me.golemcore.reminderbot.domain.exception.InvalidRecurrenceException;
import me.golemcore.reminderbot.domain.exception.InvalidScheduleException;
import me.golemcore.reminderbot.domain.model.RecurrenceKind;
import me.golemcore.reminderbot.domain.model.RecurrenceSpec;
import me.golemcore.reminderbot.infrastructure.config.BotProperties;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Computes fire instants of reminder recurrences.
 *
 * <p>
 * All methods are pure functions of their arguments: the reference instant and
 * the zone are always passed in, never read from a global clock. Cron
 * expressions are evaluated against wall-clock fields in the given zone, so a
 * 9:00 reminder stays at 9:00 local time across daylight-saving changes.
 * Interval recurrences are fixed durations on the UTC time line.
 *
 * <p>
 * Cron field combinations that can never occur (for example the 30th of
 * February) resolve to {@link #NEVER} instead of failing.
 */
@Component
public class TimeExpressionResolver {

    /**
     * Fire instant of a recurrence that never matches.
     */
    public static final Instant NEVER = Instant.parse("9999-12-31T23:59:59Z");

    private static final int CRON_FIVE_FIELDS = 5;
    private static final int CRON_SIX_FIELDS = 6;
    private static final Duration MIN_INTERVAL = Duration.ofSeconds(1);
    static final Duration MAX_INTERVAL = Duration.ofDays(3653);

    private final Duration creationGrace;

    public TimeExpressionResolver(BotProperties properties) {
        this.creationGrace = properties.getReminders().getCreationGrace();
    }

    /**
     * Validate a recurrence and bring it into canonical form (6-field cron).
     *
     * @throws InvalidRecurrenceException
     *             if the recurrence cannot be scheduled
     */
    public RecurrenceSpec normalize(RecurrenceSpec spec) {
        if (spec == null || spec.kind() == null) {
            throw new InvalidRecurrenceException("Recurrence is missing");
        }
        return switch (spec.kind()) {
        case ONCE -> {
            if (spec.startAt() == null) {
                throw new InvalidRecurrenceException("A one-off reminder needs a time");
            }
            yield spec;
        }
        case INTERVAL -> {
            validateInterval(spec.interval());
            yield spec;
        }
        case CRON -> spec.withCronExpression(normalizeCronExpression(spec.cronExpression()));
        };
    }

    /**
     * First fire instant of a new reminder created at {@code reference}.
     *
     * @throws InvalidRecurrenceException
     *             if the recurrence is malformed
     * @throws InvalidScheduleException
     *             if the first fire is earlier than the reference minus the
     *             creation grace window
     */
    public Instant resolveFirst(RecurrenceSpec spec, Instant reference, ZoneId zone) {
        RecurrenceSpec normalized = normalize(spec);
        Instant first = switch (normalized.kind()) {
        case ONCE -> truncate(normalized.startAt());
        case INTERVAL -> normalized.startAt() != null
                ? truncate(normalized.startAt())
                : truncate(reference).plus(normalized.interval());
        case CRON -> nextCronMatch(normalized.cronExpression(), reference, zone);
        };

        if (first.isBefore(reference.minus(creationGrace))) {
            throw new InvalidScheduleException(first);
        }
        return first;
    }

    /**
     * Next fire instant strictly after {@code prior}.
     *
     * @return empty for a one-off recurrence, which has no next occurrence
     */
    public Optional<Instant> resolveNext(RecurrenceSpec spec, Instant prior, ZoneId zone) {
        Instant next = switch (spec.kind()) {
        case ONCE -> null;
        case INTERVAL -> prior.plus(spec.interval());
        case CRON -> nextCronMatch(spec.cronExpression(), prior, zone);
        };
        if (next == null) {
            return Optional.empty();
        }
        ensureAdvances(prior, next);
        return Optional.of(next);
    }

    /**
     * Next fire instant after an occurrence that fired (possibly late) at
     * {@code now}: strictly after both. Missed occurrences between {@code fired}
     * and {@code now} are skipped, never replayed. Intervals keep their phase;
     * cron recurrences resolve from {@code now}.
     */
    public Optional<Instant> resolveNextAfter(RecurrenceSpec spec, Instant fired, Instant now, ZoneId zone) {
        if (spec.kind() == RecurrenceKind.INTERVAL) {
            return Optional.of(skipMissed(fired, spec.interval(), now));
        }
        Instant reference = now.isAfter(fired) ? now : fired;
        return resolveNext(spec, reference, zone);
    }

    /**
     * {@code from + k * step} for the smallest k &gt;= 1 that lands strictly after
     * {@code now}.
     */
    public Instant skipMissed(Instant from, Duration step, Instant now) {
        Instant next = from.plus(step);
        if (next.isAfter(now)) {
            return next;
        }
        long missed = Duration.between(from, now).dividedBy(step);
        return from.plus(step.multipliedBy(missed + 1));
    }

    /**
     * Normalize a cron expression: converts 5-field crontab syntax to Spring's
     * 6-field format with a leading seconds field. Validates the result.
     *
     * @throws InvalidRecurrenceException
     *             if the cron expression is invalid
     */
    static String normalizeCronExpression(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidRecurrenceException("Cron expression cannot be empty");
        }

        String trimmed = input.trim();
        String[] parts = trimmed.split("\\s+");

        String sixFieldCron;
        if (parts.length == CRON_FIVE_FIELDS) {
            sixFieldCron = "0 " + trimmed;
        } else if (parts.length == CRON_SIX_FIELDS) {
            sixFieldCron = trimmed;
        } else {
            throw new InvalidRecurrenceException(
                    "Invalid cron expression: expected 5 or 6 fields, got " + parts.length);
        }

        try {
            CronExpression.parse(sixFieldCron);
        } catch (IllegalArgumentException e) {
            throw new InvalidRecurrenceException("Invalid cron expression '" + trimmed + "': " + e.getMessage());
        }

        return sixFieldCron;
    }

    static void validateInterval(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new InvalidRecurrenceException("Interval must be a positive amount of time");
        }
        if (interval.compareTo(MIN_INTERVAL) < 0) {
            throw new InvalidRecurrenceException("Interval must be at least one second");
        }
        if (interval.compareTo(MAX_INTERVAL) > 0) {
            throw new InvalidRecurrenceException("Interval must not exceed ten years");
        }
    }

    private Instant nextCronMatch(String cronExpression, Instant after, ZoneId zone) {
        CronExpression cron = CronExpression.parse(cronExpression);
        ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(after, zone));
        if (next == null) {
            return NEVER;
        }
        return next.toInstant();
    }

    private static void ensureAdvances(Instant prior, Instant next) {
        if (!next.isAfter(prior) && !NEVER.equals(next)) {
            throw new IllegalStateException("Recurrence did not advance past " + prior + ": " + next);
        }
    }

    private static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS);
    }
}
