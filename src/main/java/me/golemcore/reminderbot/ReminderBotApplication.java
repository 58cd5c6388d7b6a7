package me.golemcore.reminderbot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the reminder bot.
 *
 * <p>
 * Schedules chat reminders (one-off, fixed interval or cron) and alarms that
 * keep repeating until silenced. Reminders survive restarts through the local
 * JSON store.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ReminderCommandRouter
 * Domain Layer       → ReminderService, AlarmController, TimeExpressionResolver
 * Scheduling         → ReminderScheduler
 * Infrastructure     → JsonReminderStore, LocalStorageAdapter, NotificationPort adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code bot.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReminderBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReminderBotApplication.class, args);
    }

}
