package me.golemcore.reminderbot.adapter.outbound.storage;

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

import me.golemcore.reminderbot.domain.exception.ReminderPersistenceException;
import me.golemcore.reminderbot.domain.model.Reminder;
import me.golemcore.reminderbot.port.outbound.ReminderStorePort;
import me.golemcore.reminderbot.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Reminder table persisted as a single JSON document in
 * {@code reminders/reminders.json} via {@link StoragePort}.
 *
 * <p>
 * Every mutation builds a new table, writes it atomically (temp file, fsync,
 * rename, previous version kept as {@code .bak}) and only then replaces the
 * cached table, so the cache always mirrors what is on disk.
 */
@Component
@Slf4j
public class JsonReminderStore implements ReminderStorePort {

    static final String REMINDERS_DIR = "reminders";
    static final String REMINDERS_FILE = "reminders.json";
    static final int SCHEMA_VERSION = 1;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private Map<String, Reminder> table;

    public JsonReminderStore(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized Reminder create(Reminder reminder) {
        Map<String, Reminder> current = getTable();
        if (current.containsKey(reminder.getId())) {
            throw new IllegalArgumentException("Reminder already exists: " + reminder.getId());
        }
        Map<String, Reminder> next = new LinkedHashMap<>(current);
        next.put(reminder.getId(), reminder.copy());
        save(next);
        return reminder.copy();
    }

    @Override
    public synchronized Optional<Reminder> get(String id) {
        return Optional.ofNullable(getTable().get(id)).map(Reminder::copy);
    }

    @Override
    public synchronized List<Reminder> list(String roomId) {
        return getTable().values().stream()
                .filter(r -> roomId == null || roomId.equals(r.getRoomId()))
                .sorted(Comparator.comparing(Reminder::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(Reminder::getId))
                .map(Reminder::copy)
                .toList();
    }

    @Override
    public synchronized boolean updateNextFire(String id, Instant nextFireAt) {
        return mutate(id, r -> {
            r.setNextFireAt(nextFireAt);
            return r;
        });
    }

    @Override
    public synchronized boolean setSilenced(String id, boolean silenced) {
        return mutate(id, r -> {
            r.setSilenced(silenced);
            if (silenced) {
                r.setAlarmNextFireAt(null);
            }
            return r;
        });
    }

    @Override
    public synchronized boolean update(Reminder reminder) {
        return mutate(reminder.getId(), r -> reminder.copy());
    }

    @Override
    public synchronized boolean delete(String id) {
        Map<String, Reminder> current = getTable();
        if (!current.containsKey(id)) {
            return false;
        }
        Map<String, Reminder> next = new LinkedHashMap<>(current);
        next.remove(id);
        save(next);
        return true;
    }

    private boolean mutate(String id, UnaryOperator<Reminder> change) {
        Map<String, Reminder> current = getTable();
        Reminder existing = current.get(id);
        if (existing == null) {
            return false;
        }
        Map<String, Reminder> next = new LinkedHashMap<>(current);
        next.put(id, change.apply(existing.copy()));
        save(next);
        return true;
    }

    private Map<String, Reminder> getTable() {
        if (table == null) {
            table = load();
        }
        return table;
    }

    private void save(Map<String, Reminder> next) {
        String json;
        try {
            json = objectMapper.writeValueAsString(new ReminderTable(SCHEMA_VERSION, new ArrayList<>(next.values())));
        } catch (JsonProcessingException e) {
            throw new ReminderPersistenceException("Failed to serialize reminders", e);
        }
        try {
            storagePort.putTextAtomic(REMINDERS_DIR, REMINDERS_FILE, json, true).join();
        } catch (RuntimeException e) { // NOSONAR - CompletionException and adapter failures alike
            throw new ReminderPersistenceException("Failed to write reminders", e);
        }
        table = next;
    }

    private Map<String, Reminder> load() {
        String json;
        try {
            json = storagePort.getText(REMINDERS_DIR, REMINDERS_FILE).join();
        } catch (RuntimeException e) { // NOSONAR
            throw new ReminderPersistenceException("Failed to read reminders", e);
        }

        Map<String, Reminder> loaded = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            log.debug("[ReminderStore] No reminders file yet, starting empty");
            return loaded;
        }

        ReminderTable document;
        try {
            document = objectMapper.readValue(json, ReminderTable.class);
        } catch (JsonProcessingException e) {
            // Refuse to start over an unreadable table: the next save would wipe it
            throw new ReminderPersistenceException("Corrupt reminders file " + REMINDERS_DIR + "/" + REMINDERS_FILE, e);
        }
        if (document.getVersion() > SCHEMA_VERSION) {
            log.warn("[ReminderStore] Reminders file has schema version {}, newer than supported {}",
                    document.getVersion(), SCHEMA_VERSION);
        }
        if (document.getReminders() != null) {
            for (Reminder reminder : document.getReminders()) {
                loaded.put(reminder.getId(), reminder);
            }
        }
        log.info("[ReminderStore] Loaded {} reminders", loaded.size());
        return loaded;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class ReminderTable {
        private int version;
        private List<Reminder> reminders;
    }
}
