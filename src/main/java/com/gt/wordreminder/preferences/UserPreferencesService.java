package com.gt.wordreminder.preferences;

import com.gt.wordreminder.exception.ValidationException;
import com.gt.wordreminder.model.UserPreferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
public class UserPreferencesService {

    private static final Logger log = LoggerFactory.getLogger(UserPreferencesService.class);

    private final UserPreferencesDao userPreferencesDao;
    private final int defaultRemindersPerDay;
    private final int defaultCardsPerSession;

    @Autowired
    public UserPreferencesService(UserPreferencesDao userPreferencesDao,
                                  @Value("${wordreminder.defaults.remindersPerDay:1}") int defaultRemindersPerDay,
                                  @Value("${wordreminder.defaults.cardsPerSession:5}") int defaultCardsPerSession) {
        this.userPreferencesDao = userPreferencesDao;

        validate(PreferenceSetting.RemindersPerDay, defaultRemindersPerDay);
        validate(PreferenceSetting.CardsPerSession, defaultCardsPerSession);
        this.defaultRemindersPerDay = defaultRemindersPerDay;
        this.defaultCardsPerSession = defaultCardsPerSession;
    }

    // Creates default preferences on first contact. The first reminder is one interval after registration.
    public UserPreferences initialize(long owner, Instant now) {
        UserPreferences existing = userPreferencesDao.loadUserPreferences(owner);
        if (existing != null) {
            return existing;
        }

        UserPreferences defaults = defaultPreferences(owner);
        UserPreferences created = new UserPreferences(owner, defaults.remindersPerDay(), defaults.cardsPerSession(),
                null, now.plus(defaults.reminderInterval()));

        if (!userPreferencesDao.createUserPreferences(created)) {
            return userPreferencesDao.loadUserPreferences(owner);
        }

        log.info("Registered owner {} with {} reminders per day", owner, created.remindersPerDay());
        return created;
    }

    public UserPreferences getPreferences(long owner) {
        UserPreferences userPreferences = userPreferencesDao.loadUserPreferences(owner);

        return userPreferences != null ? userPreferences : defaultPreferences(owner);
    }

    public UserPreferences adjustSetting(long owner, PreferenceSetting setting, int delta, Instant now) {
        UserPreferences current = getPreferences(owner);
        int currentValue = setting == PreferenceSetting.RemindersPerDay ? current.remindersPerDay() : current.cardsPerSession();

        return updateSetting(owner, setting, currentValue + delta, now);
    }

    public UserPreferences updateSetting(long owner, PreferenceSetting setting, int value, Instant now) {
        validate(setting, value);

        UserPreferences current = getPreferences(owner);
        UserPreferences updated;
        if (setting == PreferenceSetting.RemindersPerDay) {
            // Rescheduled from the last actual send so a higher frequency takes effect on the next tick
            Instant base = current.lastReminderAt() != null ? current.lastReminderAt() : now;
            updated = current.withSettings(value, current.cardsPerSession(), base.plus(Duration.ofDays(1).dividedBy(value)));
        } else {
            updated = current.withSettings(current.remindersPerDay(), value,
                    current.nextReminderAt() != null ? current.nextReminderAt() : now.plus(current.reminderInterval()));
        }

        userPreferencesDao.saveUserPreferences(updated);
        log.info("Owner {} set {} to {}", owner, setting, value);

        return updated;
    }

    public List<UserPreferences> getPreferencesDueForReminder(Instant now) {
        return userPreferencesDao.loadPreferencesDueForReminder(now);
    }

    public UserPreferences recordReminderSent(UserPreferences userPreferences, Instant sentAt, int missedReminders) {
        UserPreferences updated = userPreferences.withReminderSent(sentAt, missedReminders);
        userPreferencesDao.saveUserPreferences(updated);

        return updated;
    }

    // Moves the next reminder one interval ahead without sending anything
    public UserPreferences postponeReminder(UserPreferences userPreferences, Instant now) {
        UserPreferences updated = userPreferences.withReminderPostponed(now);
        userPreferencesDao.saveUserPreferences(updated);

        return updated;
    }

    public UserPreferences pauseReminders(UserPreferences userPreferences, int missedReminders) {
        UserPreferences updated = userPreferences.withPaused(missedReminders);
        userPreferencesDao.saveUserPreferences(updated);

        log.info("Paused reminders for owner {} after {} missed reminders", userPreferences.owner(), missedReminders);
        return updated;
    }

    /**
     * Marks the owner as active: the missed reminder count is reset and paused reminders resume. Owners
     * without stored preferences are left alone.
     */
    public void recordActivity(long owner, Instant now) {
        if (userPreferencesDao.recordActivity(owner, now) > 0) {
            log.debug("Recorded activity of owner {}", owner);
        }
    }

    private UserPreferences defaultPreferences(long owner) {
        return new UserPreferences(owner, defaultRemindersPerDay, defaultCardsPerSession, null, null);
    }

    private static void validate(PreferenceSetting setting, int value) {
        if (!setting.isInRange(value)) {
            throw new ValidationException(setting + " must be between " + setting.getMinValue() + " and " + setting.getMaxValue() + ", got " + value);
        }
    }
}
