package com.gt.wordreminder.model;

import java.time.Instant;

public record QuizSession(String token,
                          long owner,
                          long cardId,
                          String prompt,
                          String correctAnswer,
                          Instant createdAt,
                          Instant expiresAt,
                          boolean revealed) {

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
