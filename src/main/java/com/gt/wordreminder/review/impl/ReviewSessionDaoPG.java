package com.gt.wordreminder.review.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.wordreminder.exception.DaoException;
import com.gt.wordreminder.model.ReviewSession;
import com.gt.wordreminder.model.ReviewSessionState;
import com.gt.wordreminder.review.ReviewSessionDao;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class ReviewSessionDaoPG implements ReviewSessionDao {

    private static final TypeReference<List<Long>> QUEUE_TYPE = new TypeReference<>() { };

    private static final String CREATE_REVIEW_SESSION_SQL =
            "INSERT INTO review_session (owner, queue, position, state, started_at, last_activity_at, version) " +
            "VALUES (:owner, CAST(:queue AS jsonb), :position, :state, :startedAt, :lastActivityAt, :version) " +
            "ON CONFLICT (owner) DO NOTHING";

    private static final String LOAD_REVIEW_SESSION_SQL =
            "SELECT owner, queue, position, state, started_at, last_activity_at, version " +
            "FROM review_session WHERE owner = :owner";

    private static final String UPDATE_REVIEW_SESSION_SQL =
            "UPDATE review_session " +
            "SET position = :position, state = :state, last_activity_at = :lastActivityAt, version = :version " +
            "WHERE owner = :owner AND version = :expectedVersion";

    private static final String DELETE_REVIEW_SESSION_VERSION_SQL =
            "DELETE FROM review_session WHERE owner = :owner AND version = :expectedVersion";

    private static final String DELETE_REVIEW_SESSION_SQL =
            "DELETE FROM review_session WHERE owner = :owner";

    private static final String DELETE_IDLE_REVIEW_SESSIONS_SQL =
            "DELETE FROM review_session WHERE last_activity_at < :cutoff";

    private final NamedParameterJdbcTemplate template;
    private final ObjectMapper objectMapper;

    public ReviewSessionDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        this.template = namedParameterJdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean createReviewSession(ReviewSession reviewSession) {
        return template.update(CREATE_REVIEW_SESSION_SQL, Map.of(
                "owner", reviewSession.owner(),
                "queue", writeQueue(reviewSession.queue()),
                "position", reviewSession.position(),
                "state", reviewSession.state().toString(),
                "startedAt", Timestamp.from(reviewSession.startedAt()),
                "lastActivityAt", Timestamp.from(reviewSession.lastActivityAt()),
                "version", reviewSession.version())) > 0;
    }

    @Override
    public ReviewSession loadReviewSession(long owner) {
        List<ReviewSession> sessions = template.query(LOAD_REVIEW_SESSION_SQL, Map.of("owner", owner), this::getReviewSessionFromResultSet);

        return sessions.isEmpty() ? null : sessions.get(0);
    }

    @Override
    public boolean updateReviewSession(ReviewSession reviewSession, long expectedVersion) {
        return template.update(UPDATE_REVIEW_SESSION_SQL, Map.of(
                "owner", reviewSession.owner(),
                "position", reviewSession.position(),
                "state", reviewSession.state().toString(),
                "lastActivityAt", Timestamp.from(reviewSession.lastActivityAt()),
                "version", reviewSession.version(),
                "expectedVersion", expectedVersion)) > 0;
    }

    @Override
    public boolean deleteReviewSession(long owner, long expectedVersion) {
        return template.update(DELETE_REVIEW_SESSION_VERSION_SQL, Map.of("owner", owner, "expectedVersion", expectedVersion)) > 0;
    }

    @Override
    public int deleteReviewSession(long owner) {
        return template.update(DELETE_REVIEW_SESSION_SQL, Map.of("owner", owner));
    }

    @Override
    public int deleteIdleReviewSessions(Instant lastActivityCutoff) {
        return template.update(DELETE_IDLE_REVIEW_SESSIONS_SQL, Map.of("cutoff", Timestamp.from(lastActivityCutoff)));
    }

    private ReviewSession getReviewSessionFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new ReviewSession(
                rs.getLong("owner"),
                readQueue(rs.getString("queue")),
                rs.getInt("position"),
                ReviewSessionState.valueOf(rs.getString("state")),
                rs.getTimestamp("started_at").toInstant(),
                rs.getTimestamp("last_activity_at").toInstant(),
                rs.getLong("version"));
    }

    private String writeQueue(List<Long> queue) {
        try {
            return objectMapper.writeValueAsString(queue);
        } catch (JsonProcessingException ex) {
            throw new DaoException("Unable to serialize review queue", ex);
        }
    }

    private List<Long> readQueue(String queueJson) {
        try {
            return List.copyOf(objectMapper.readValue(queueJson, QUEUE_TYPE));
        } catch (JsonProcessingException ex) {
            throw new DaoException("Unable to read stored review queue " + queueJson, ex);
        }
    }
}
