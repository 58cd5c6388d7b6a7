package me.golemcore.reminderbot.adapter.outbound.notification;

import me.golemcore.reminderbot.domain.exception.ReminderDeliveryException;
import me.golemcore.reminderbot.domain.model.NotificationTarget;
import me.golemcore.reminderbot.domain.model.ReminderNotification;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LoggingNotificationAdapterTest {

    private final LoggingNotificationAdapter adapter = new LoggingNotificationAdapter();

    @Test
    void shouldCompleteDelivery() {
        ReminderNotification notification = new ReminderNotification("rem-1", "!room", NotificationTarget.USER,
                "@alice", "@alice trash", ReminderNotification.Kind.REMINDER);

        assertDoesNotThrow(() -> adapter.deliver(notification).get());
    }

    @Test
    void shouldFailDeliveryWithoutRoom() {
        ReminderNotification notification = new ReminderNotification("rem-1", " ", NotificationTarget.USER,
                "@alice", "@alice trash", ReminderNotification.Kind.REMINDER);

        ExecutionException error = assertThrows(ExecutionException.class, () -> adapter.deliver(notification).get());
        assertInstanceOf(ReminderDeliveryException.class, error.getCause());
    }
}
