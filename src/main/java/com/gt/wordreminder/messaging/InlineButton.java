package com.gt.wordreminder.messaging;

public record InlineButton(String text, String callbackData) { }
