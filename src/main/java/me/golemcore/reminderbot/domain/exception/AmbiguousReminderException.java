package me.golemcore.reminderbot.domain.exception;

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
import lombok.Getter;

import java.util.List;

/**
 * A cancel or silence selector matched several reminders of the room. Nothing
 * was changed; the caller should retry with one of the candidate ids.
 */
@Getter
public class AmbiguousReminderException extends ReminderException {

    private final String selector;
    private final transient List<Reminder> candidates;

    public AmbiguousReminderException(String selector, List<Reminder> candidates) {
        super("Selector '" + selector + "' matches " + candidates.size() + " reminders");
        this.selector = selector;
        this.candidates = List.copyOf(candidates);
    }
}
