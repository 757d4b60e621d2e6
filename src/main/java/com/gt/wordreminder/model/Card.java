package com.gt.wordreminder.model;

import java.time.Instant;

public record Card(long id,
                   long owner,
                   String front,
                   String back,
                   double easeFactor,
                   int intervalDays,
                   int repetitions,
                   Instant dueAt,
                   Instant lastReviewedAt) {

    public Card withReviewState(double easeFactor, int intervalDays, int repetitions, Instant dueAt, Instant lastReviewedAt) {
        return new Card(id, owner, front, back, easeFactor, intervalDays, repetitions, dueAt, lastReviewedAt);
    }

    public boolean isDue(Instant now) {
        return !dueAt.isAfter(now);
    }
}
