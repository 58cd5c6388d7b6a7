package me.golemcore.reminderbot.infrastructure.i18n;

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


import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Texts of the reminder bot: command replies, help entries and the
 * notifications posted into rooms.
 *
 * <p>
 * Texts come from the {@code messages} bundles on the classpath
 * ({@code messages.properties} for English, {@code messages_ru.properties}
 * for Russian). Every text is a {@link MessageFormat} pattern, so a literal
 * apostrophe is written as {@code ''} even when the text has no arguments.
 *
 * <p>
 * The reply language is a bot-wide setting ({@code bot.reminders.language})
 * applied once at startup. An unsupported language is a configuration error.
 */
@Service
@Slf4j
public class MessageService {

    public static final String LANG_EN = "en";
    public static final String LANG_RU = "ru";
    public static final String DEFAULT_LANG = LANG_EN;

    private static final String BUNDLE_NAME = "messages";
    private static final List<String> LANGUAGES = List.of(LANG_EN, LANG_RU);

    private final Map<String, ResourceBundle> bundles;
    private volatile String language = DEFAULT_LANG;

    public MessageService() {
        Map<String, ResourceBundle> loaded = new LinkedHashMap<>();
        ResourceBundle.Control control = ResourceBundle.Control
                .getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);
        for (String lang : LANGUAGES) {
            loaded.put(lang, ResourceBundle.getBundle(BUNDLE_NAME, Locale.forLanguageTag(lang), control));
        }
        this.bundles = Map.copyOf(loaded);
        log.debug("[Messages] Loaded bundles: {}", LANGUAGES);
    }

    /**
     * Text for {@code key} in the configured language. Unknown keys come back
     * as the key itself.
     */
    public String getMessage(String key, Object... args) {
        String lang = language;
        String pattern;
        try {
            pattern = bundles.get(lang).getString(key);
        } catch (MissingResourceException e) {
            log.warn("[Messages] Missing key '{}' for language {}", key, lang);
            return key;
        }
        return new MessageFormat(pattern, Locale.forLanguageTag(lang)).format(args);
    }

    public String getLanguage() {
        return language;
    }

    /**
     * Switches the reply language.
     *
     * @throws IllegalArgumentException
     *             if there is no bundle for {@code lang}
     */
    public void setLanguage(String lang) {
        if (lang == null || !bundles.containsKey(lang)) {
            throw new IllegalArgumentException("Unsupported reply language '" + lang
                    + "', expected one of " + LANGUAGES);
        }
        language = lang;
        log.info("[Messages] Reply language: {}", lang);
    }
}
