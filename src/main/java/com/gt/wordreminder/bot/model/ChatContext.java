package com.gt.wordreminder.bot.model;

import java.time.Instant;

// The sender of an update, the chat to answer in, and the time the update is handled
public record ChatContext(long owner, long chatId, String username, Instant now) { }
