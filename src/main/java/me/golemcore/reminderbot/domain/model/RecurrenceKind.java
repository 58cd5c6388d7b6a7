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

/**
 * How the next fire instant of a reminder is computed.
 */
public enum RecurrenceKind {
    /** Fires once at its start instant. */
    ONCE,
    /** Fires at its start instant and then every fixed duration. */
    INTERVAL,
    /** Fires at every instant matching a cron expression. */
    CRON
}
