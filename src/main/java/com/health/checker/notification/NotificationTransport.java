package com.health.checker.notification;

import java.util.List;

/**
 * Outbound message channel used by the {@link NotificationEscalator}.
 *
 * <p>Implementations wrap a mail server and a chat service. A delivery failure is reported
 * by throwing a runtime exception; the escalator logs it and carries on.</p>
 */
public interface NotificationTransport {

    /**
     * Sends one e-mail from {@code sender} to the given recipients.
     */
    void sendEmail(String sender, String subject, String body, List<String> recipients);

    /**
     * Posts a chat message to the given channel.
     */
    void notify(String message, String channel);
}
