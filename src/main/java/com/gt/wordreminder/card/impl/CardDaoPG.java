package com.gt.wordreminder.card.impl;

import com.gt.wordreminder.card.CardDao;
import com.gt.wordreminder.model.Card;
import com.gt.wordreminder.model.CardContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class CardDaoPG implements CardDao {

    private static final Logger log = LoggerFactory.getLogger(CardDaoPG.class);

    private static final double INITIAL_EASE_FACTOR = 2.5;

    private static final String CARD_COLUMNS =
            "id, owner, front, back, ease_factor, interval_days, repetitions, due_at, last_reviewed_at ";

    private static final String CREATE_CARD_SQL =
            "INSERT INTO card (owner, front, back, ease_factor, interval_days, repetitions, due_at, last_reviewed_at) " +
            "VALUES (:owner, :front, :back, :easeFactor, 0, 0, :dueAt, NULL)";

    private static final String UPDATE_CARD_BACK_SQL =
            "UPDATE card SET back = :back WHERE owner = :owner AND front = :front";

    private static final String LOAD_CARD_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM card WHERE owner = :owner AND id = :cardId";

    private static final String LOAD_CARDS_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM card WHERE owner = :owner ORDER BY front, id";

    private static final String LOAD_DUE_CARDS_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM card WHERE owner = :owner AND due_at <= :now " +
            "ORDER BY due_at ASC, id ASC " +
            "LIMIT :limit";

    private static final String LOAD_NOT_DUE_CARDS_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM card WHERE owner = :owner AND due_at > :now " +
            "ORDER BY id ASC";

    private static final String LOAD_RANDOM_CARD_SQL =
            "SELECT " + CARD_COLUMNS +
            "FROM card WHERE owner = :owner ORDER BY random() LIMIT 1";

    private static final String COUNT_CARDS_SQL =
            "SELECT count(*) FROM card WHERE owner = :owner";

    private static final String UPDATE_REVIEW_STATE_SQL =
            "UPDATE card " +
            "SET ease_factor = :easeFactor, interval_days = :intervalDays, repetitions = :repetitions, " +
                "due_at = :dueAt, last_reviewed_at = :lastReviewedAt " +
            "WHERE owner = :owner AND id = :cardId";

    private static final String DELETE_ALL_CARDS_SQL =
            "DELETE FROM card WHERE owner = :owner";

    private final NamedParameterJdbcTemplate template;

    public CardDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public void createCard(long owner, CardContent content, Instant dueAt) {
        template.update(CREATE_CARD_SQL, Map.of(
                "owner", owner,
                "front", content.front(),
                "back", content.back(),
                "easeFactor", INITIAL_EASE_FACTOR,
                "dueAt", Timestamp.from(dueAt)));
    }

    @Override
    public int updateCardBack(long owner, String front, String back) {
        return template.update(UPDATE_CARD_BACK_SQL, Map.of("owner", owner, "front", front, "back", back));
    }

    @Override
    public Card loadCard(long owner, long cardId) {
        List<Card> cards = template.query(LOAD_CARD_SQL, Map.of("owner", owner, "cardId", cardId), CardDaoPG::getCardFromResultSet);

        return cards.isEmpty() ? null : cards.get(0);
    }

    @Override
    public List<Card> loadCards(long owner) {
        return template.query(LOAD_CARDS_SQL, Map.of("owner", owner), CardDaoPG::getCardFromResultSet);
    }

    @Override
    public List<Card> loadDueCards(long owner, Instant now, int limit) {
        return template.query(LOAD_DUE_CARDS_SQL, Map.of(
                        "owner", owner,
                        "now", Timestamp.from(now),
                        "limit", limit),
                CardDaoPG::getCardFromResultSet);
    }

    @Override
    public List<Card> loadNotDueCards(long owner, Instant now) {
        return template.query(LOAD_NOT_DUE_CARDS_SQL, Map.of("owner", owner, "now", Timestamp.from(now)), CardDaoPG::getCardFromResultSet);
    }

    @Override
    public Card loadRandomCard(long owner) {
        List<Card> cards = template.query(LOAD_RANDOM_CARD_SQL, Map.of("owner", owner), CardDaoPG::getCardFromResultSet);

        return cards.isEmpty() ? null : cards.get(0);
    }

    @Override
    public int countCards(long owner) {
        Integer count = template.queryForObject(COUNT_CARDS_SQL, Map.of("owner", owner), Integer.class);

        return count == null ? 0 : count;
    }

    @Override
    public int updateReviewState(Card card) {
        // last_reviewed_at may be null, which Map.of does not allow
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("owner", card.owner())
                .addValue("cardId", card.id())
                .addValue("easeFactor", card.easeFactor())
                .addValue("intervalDays", card.intervalDays())
                .addValue("repetitions", card.repetitions())
                .addValue("dueAt", Timestamp.from(card.dueAt()))
                .addValue("lastReviewedAt", toTimestamp(card.lastReviewedAt()));

        return template.update(UPDATE_REVIEW_STATE_SQL, params);
    }

    @Override
    public int deleteAllCards(long owner) {
        int rowsDeleted = template.update(DELETE_ALL_CARDS_SQL, Map.of("owner", owner));
        log.info("Deleted {} cards for owner {}", rowsDeleted, owner);

        return rowsDeleted;
    }

    private static Card getCardFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new Card(
                rs.getLong("id"),
                rs.getLong("owner"),
                rs.getString("front"),
                rs.getString("back"),
                rs.getDouble("ease_factor"),
                rs.getInt("interval_days"),
                rs.getInt("repetitions"),
                toInstant(rs.getTimestamp("due_at")),
                toInstant(rs.getTimestamp("last_reviewed_at")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
