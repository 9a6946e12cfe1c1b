package io.crontab4j;

/**
 * Delivers the text of a {@link io.crontab4j.core.CronPayload.Message} payload to a chat.
 */
@FunctionalInterface
public interface MessageSender {
    void send(long chatId, String text, String botId) throws Exception;
}
