package me.golemcore.reminderbot.infrastructure.i18n;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageServiceTest {

    private static final String KEY_LIST_EMPTY = "command.list.empty";

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        messageService = new MessageService();
    }

    @Test
    void shouldReturnEnglishMessageByDefault() {
        assertEquals("There are no reminders for this room.", messageService.getMessage(KEY_LIST_EMPTY));
    }

    @Test
    void shouldReturnRussianMessageWhenLanguageSetToRu() {
        messageService.setLanguage("ru");

        assertEquals("В этой комнате нет напоминаний.", messageService.getMessage(KEY_LIST_EMPTY));
    }

    @Test
    void shouldReturnKeyWhenMessageNotFound() {
        assertEquals("nonexistent.key", messageService.getMessage("nonexistent.key"));
    }

    @Test
    void shouldFormatMessageWithParameters() {
        String result = messageService.getMessage("command.cancel.done", "water plants");

        assertEquals("Reminder 'water plants' cancelled.", result);
    }

    @Test
    void shouldFormatTwoTextArgumentsPositionally() {
        String result = messageService.getMessage("notification.room", "standup", "@bob");

        assertEquals("@room standup (from @bob)", result);
    }

    @Test
    void shouldUnescapeApostropheInTextWithoutArguments() {
        assertEquals("Can't schedule a reminder in the past.",
                messageService.getMessage("command.error.invalid-schedule"));
    }

    @Test
    void shouldRejectUnsupportedLanguageAndKeepCurrentOne() {
        messageService.setLanguage(MessageService.LANG_RU);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> messageService.setLanguage("xx"));

        assertTrue(error.getMessage().contains("xx"));
        assertEquals(MessageService.LANG_RU, messageService.getLanguage());
    }

    @Test
    void shouldRejectMissingLanguage() {
        assertThrows(IllegalArgumentException.class, () -> messageService.setLanguage(null));
        assertEquals(MessageService.DEFAULT_LANG, messageService.getLanguage());
    }
}
