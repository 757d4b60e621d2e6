package com.gt.wordreminder.preferences.impl;

import com.gt.wordreminder.model.UserPreferences;
import com.gt.wordreminder.preferences.UserPreferencesDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class UserPreferencesDaoPG implements UserPreferencesDao {

    private static final String PREFERENCE_COLUMNS =
            "owner, reminders_per_day, cards_per_session, last_reminder_at, next_reminder_at, " +
            "missed_reminders, paused, last_engaged_at ";

    private static final String LOAD_USER_PREFERENCES_SQL =
            "SELECT " + PREFERENCE_COLUMNS +
            "FROM user_preferences WHERE owner = :owner";

    private static final String PREFERENCE_VALUES =
            "VALUES (:owner, :remindersPerDay, :cardsPerSession, :lastReminderAt, :nextReminderAt, " +
            ":missedReminders, :paused, :lastEngagedAt) ";

    private static final String CREATE_USER_PREFERENCES_SQL =
            "INSERT INTO user_preferences (" + PREFERENCE_COLUMNS + ") " + PREFERENCE_VALUES +
            "ON CONFLICT (owner) DO NOTHING";

    // last_engaged_at is only ever written by RECORD_ACTIVITY_SQL
    private static final String SAVE_USER_PREFERENCES_SQL =
            "INSERT INTO user_preferences (" + PREFERENCE_COLUMNS + ") " + PREFERENCE_VALUES +
            "ON CONFLICT (owner) DO UPDATE " +
                    "SET reminders_per_day = :remindersPerDay, cards_per_session = :cardsPerSession, " +
                    "last_reminder_at = :lastReminderAt, next_reminder_at = :nextReminderAt, " +
                    "missed_reminders = :missedReminders, paused = :paused";

    private static final String LOAD_PREFERENCES_DUE_FOR_REMINDER_SQL =
            "SELECT " + PREFERENCE_COLUMNS +
            "FROM user_preferences WHERE next_reminder_at <= :now AND NOT paused " +
            "ORDER BY next_reminder_at ASC, owner ASC";

    private static final String RECORD_ACTIVITY_SQL =
            "UPDATE user_preferences SET last_engaged_at = :now, missed_reminders = 0, paused = FALSE " +
            "WHERE owner = :owner";

    private final NamedParameterJdbcTemplate template;

    public UserPreferencesDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public UserPreferences loadUserPreferences(long owner) {
        List<UserPreferences> preferences = template.query(LOAD_USER_PREFERENCES_SQL, Map.of("owner", owner), UserPreferencesDaoPG::getUserPreferencesFromResultSet);

        return preferences.isEmpty() ? null : preferences.get(0);
    }

    @Override
    public boolean createUserPreferences(UserPreferences userPreferences) {
        return template.update(CREATE_USER_PREFERENCES_SQL, toParams(userPreferences)) > 0;
    }

    @Override
    public int saveUserPreferences(UserPreferences userPreferences) {
        return template.update(SAVE_USER_PREFERENCES_SQL, toParams(userPreferences));
    }

    @Override
    public List<UserPreferences> loadPreferencesDueForReminder(Instant now) {
        return template.query(LOAD_PREFERENCES_DUE_FOR_REMINDER_SQL, Map.of("now", Timestamp.from(now)), UserPreferencesDaoPG::getUserPreferencesFromResultSet);
    }

    @Override
    public int recordActivity(long owner, Instant now) {
        return template.update(RECORD_ACTIVITY_SQL, Map.of("owner", owner, "now", Timestamp.from(now)));
    }

    private static SqlParameterSource toParams(UserPreferences userPreferences) {
        MapSqlParameterSource source = new MapSqlParameterSource();
        source.addValue("owner", userPreferences.owner());
        source.addValue("remindersPerDay", userPreferences.remindersPerDay());
        source.addValue("cardsPerSession", userPreferences.cardsPerSession());
        source.addValue("lastReminderAt", toTimestamp(userPreferences.lastReminderAt()));
        source.addValue("nextReminderAt", toTimestamp(userPreferences.nextReminderAt()));
        source.addValue("missedReminders", userPreferences.missedReminders());
        source.addValue("paused", userPreferences.paused());
        source.addValue("lastEngagedAt", toTimestamp(userPreferences.lastEngagedAt()));

        return source;
    }

    private static UserPreferences getUserPreferencesFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new UserPreferences(
                rs.getLong("owner"),
                rs.getInt("reminders_per_day"),
                rs.getInt("cards_per_session"),
                toInstant(rs.getTimestamp("last_reminder_at")),
                toInstant(rs.getTimestamp("next_reminder_at")),
                rs.getInt("missed_reminders"),
                rs.getBoolean("paused"),
                toInstant(rs.getTimestamp("last_engaged_at")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
