package com.gt.wordreminder.review;

import com.gt.wordreminder.model.ReviewSession;

import java.time.Instant;

public interface ReviewSessionDao {

    // Returns false if the owner already has a session
    boolean createReviewSession(ReviewSession reviewSession);

    ReviewSession loadReviewSession(long owner);

    // Compare-and-set on version. Returns false if the stored version no longer matches.
    boolean updateReviewSession(ReviewSession reviewSession, long expectedVersion);

    boolean deleteReviewSession(long owner, long expectedVersion);

    int deleteReviewSession(long owner);

    int deleteIdleReviewSessions(Instant lastActivityCutoff);
}
