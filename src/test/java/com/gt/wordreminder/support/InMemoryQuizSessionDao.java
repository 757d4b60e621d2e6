package com.gt.wordreminder.support;

import com.gt.wordreminder.model.QuizSession;
import com.gt.wordreminder.quiz.QuizSessionDao;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class InMemoryQuizSessionDao implements QuizSessionDao {

    private final ConcurrentMap<String, QuizSession> sessions = new ConcurrentHashMap<>();

    public int size() {
        return sessions.size();
    }

    @Override
    public void createQuizSession(QuizSession quizSession) {
        sessions.put(quizSession.token(), quizSession);
    }

    @Override
    public QuizSession loadQuizSession(String token) {
        return sessions.get(token);
    }

    @Override
    public boolean markRevealed(String token, Instant now) {
        AtomicBoolean marked = new AtomicBoolean(false);
        sessions.computeIfPresent(token, (key, stored) -> {
            if (stored.revealed() || stored.isExpired(now)) {
                return stored;
            }
            marked.set(true);
            return new QuizSession(stored.token(), stored.owner(), stored.cardId(), stored.prompt(), stored.correctAnswer(),
                    stored.createdAt(), stored.expiresAt(), true);
        });

        return marked.get();
    }

    @Override
    public int deleteExpiredQuizSessions(Instant now) {
        int before = sessions.size();
        sessions.values().removeIf(session -> session.expiresAt().isBefore(now));

        return before - sessions.size();
    }

    @Override
    public int deleteQuizSessions(long owner) {
        int before = sessions.size();
        sessions.values().removeIf(session -> session.owner() == owner);

        return before - sessions.size();
    }
}
