package com.gt.wordreminder.model;

// sessionVersion identifies this prompt, an answer is only accepted while the session is still at it
public record ReviewPrompt(Card card, int number, int total, long sessionVersion) { }
