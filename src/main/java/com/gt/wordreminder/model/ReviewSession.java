package com.gt.wordreminder.model;

import java.time.Instant;
import java.util.List;

public record ReviewSession(long owner,
                            List<Long> queue,
                            int position,
                            ReviewSessionState state,
                            Instant startedAt,
                            Instant lastActivityAt,
                            long version) {

    public boolean isExhausted() {
        return position >= queue.size();
    }

    public long currentCardId() {
        return queue.get(position);
    }

    public ReviewSession advance(int newPosition, ReviewSessionState newState, Instant activityInstant) {
        return new ReviewSession(owner, queue, newPosition, newState, startedAt, activityInstant, version + 1);
    }
}
