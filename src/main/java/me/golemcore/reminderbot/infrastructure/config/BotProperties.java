package me.golemcore.reminderbot.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private StorageProperties storage = new StorageProperties();
    private ReminderProperties reminders = new ReminderProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/reminders";
    }

    // ==================== REMINDERS ====================

    @Data
    public static class ReminderProperties {
        private boolean enabled = true;
        private String timezone = "Etc/UTC";
        private String language = "en";
        private Duration tickInterval = Duration.ofSeconds(1);
        private Duration alarmRepeatInterval = Duration.ofMinutes(5);
        private Duration creationGrace = Duration.ofSeconds(5);
        private Duration deliveryTimeout = Duration.ofSeconds(10);
        private int persistAttempts = 3;
        private Duration persistRetryBackoff = Duration.ofMillis(200);
        private boolean deliverMissedOnRecovery = false;
        private boolean retainCompleted = false;
        private boolean uniqueTextPerRoom = true;
    }
}
