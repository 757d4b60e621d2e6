package com.gt.wordreminder.quiz;

import com.gt.wordreminder.model.QuizSession;

import java.time.Instant;

public interface QuizSessionDao {

    void createQuizSession(QuizSession quizSession);

    QuizSession loadQuizSession(String token);

    // Marks the session revealed only if it is unrevealed and unexpired. Returns false otherwise.
    boolean markRevealed(String token, Instant now);

    int deleteExpiredQuizSessions(Instant now);

    int deleteQuizSessions(long owner);
}
