package com.gt.wordreminder.model;

import java.time.Instant;

public record QuizQuestion(String token, String prompt, Instant expiresAt) { }
