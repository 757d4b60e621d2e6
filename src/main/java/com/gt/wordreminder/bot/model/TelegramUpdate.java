package com.gt.wordreminder.bot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

// The subset of the Bot API update object the bot reads
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramUpdate(@JsonProperty("update_id") long updateId,
                             Message message,
                             @JsonProperty("callback_query") CallbackQuery callbackQuery) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(@JsonProperty("message_id") long messageId,
                          User from,
                          Chat chat,
                          String text,
                          Document document) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(long id, String username) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chat(long id) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Document(@JsonProperty("file_id") String fileId,
                           @JsonProperty("file_name") String fileName) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CallbackQuery(String id,
                                User from,
                                Message message,
                                String data) { }
}
