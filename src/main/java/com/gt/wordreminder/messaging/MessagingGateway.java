package com.gt.wordreminder.messaging;

import java.util.List;

/**
 * Outbound side of the chat transport. Every method throws
 * {@link com.gt.wordreminder.exception.DeliveryException} when the message could not be handed over.
 */
public interface MessagingGateway {

    void sendMessage(long chatId, String text);

    // Keyboard rows are rendered top to bottom, buttons left to right
    void sendMessage(long chatId, String text, List<List<InlineButton>> keyboard);

    void answerCallbackQuery(String callbackQueryId, String text);

    void sendDocument(long chatId, String fileName, byte[] content, String caption);

    byte[] downloadFile(String fileId);
}
