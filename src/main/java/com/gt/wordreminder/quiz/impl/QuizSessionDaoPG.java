package com.gt.wordreminder.quiz.impl;

import com.gt.wordreminder.model.QuizSession;
import com.gt.wordreminder.quiz.QuizSessionDao;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class QuizSessionDaoPG implements QuizSessionDao {

    private static final String CREATE_QUIZ_SESSION_SQL =
            "INSERT INTO quiz_session (token, owner, card_id, prompt, correct_answer, created_at, expires_at, revealed) " +
            "VALUES (:token, :owner, :cardId, :prompt, :correctAnswer, :createdAt, :expiresAt, FALSE)";

    private static final String LOAD_QUIZ_SESSION_SQL =
            "SELECT token, owner, card_id, prompt, correct_answer, created_at, expires_at, revealed " +
            "FROM quiz_session WHERE token = :token";

    private static final String MARK_REVEALED_SQL =
            "UPDATE quiz_session SET revealed = TRUE " +
            "WHERE token = :token AND revealed IS NOT TRUE AND expires_at >= :now";

    private static final String DELETE_EXPIRED_QUIZ_SESSIONS_SQL =
            "DELETE FROM quiz_session WHERE expires_at < :now";

    private static final String DELETE_OWNER_QUIZ_SESSIONS_SQL =
            "DELETE FROM quiz_session WHERE owner = :owner";

    private final NamedParameterJdbcTemplate template;

    public QuizSessionDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void createQuizSession(QuizSession quizSession) {
        template.update(CREATE_QUIZ_SESSION_SQL, Map.of(
                "token", quizSession.token(),
                "owner", quizSession.owner(),
                "cardId", quizSession.cardId(),
                "prompt", quizSession.prompt(),
                "correctAnswer", quizSession.correctAnswer(),
                "createdAt", Timestamp.from(quizSession.createdAt()),
                "expiresAt", Timestamp.from(quizSession.expiresAt())));
    }

    @Override
    public QuizSession loadQuizSession(String token) {
        List<QuizSession> quizSessions = template.query(LOAD_QUIZ_SESSION_SQL, Map.of("token", token), QuizSessionDaoPG::getQuizSessionFromResultSet);

        return quizSessions.isEmpty() ? null : quizSessions.get(0);
    }

    @Override
    public boolean markRevealed(String token, Instant now) {
        return template.update(MARK_REVEALED_SQL, Map.of("token", token, "now", Timestamp.from(now))) > 0;
    }

    @Override
    public int deleteExpiredQuizSessions(Instant now) {
        return template.update(DELETE_EXPIRED_QUIZ_SESSIONS_SQL, Map.of("now", Timestamp.from(now)));
    }

    @Override
    public int deleteQuizSessions(long owner) {
        return template.update(DELETE_OWNER_QUIZ_SESSIONS_SQL, Map.of("owner", owner));
    }

    private static QuizSession getQuizSessionFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new QuizSession(
                rs.getString("token"),
                rs.getLong("owner"),
                rs.getLong("card_id"),
                rs.getString("prompt"),
                rs.getString("correct_answer"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("expires_at").toInstant(),
                rs.getBoolean("revealed"));
    }
}
