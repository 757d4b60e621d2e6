package com.gt.wordreminder.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Reminder settings and reminder bookkeeping of one owner.
 * <p>
 * {@code missedReminders} counts reminders sent in a row without the owner interacting with the bot in
 * between, {@code lastEngagedAt} is the owner's latest interaction. Paused owners get no reminders until
 * they interact again.
 */
public record UserPreferences(long owner,
                              int remindersPerDay,
                              int cardsPerSession,
                              Instant lastReminderAt,
                              Instant nextReminderAt,
                              int missedReminders,
                              boolean paused,
                              Instant lastEngagedAt) {

    public UserPreferences(long owner, int remindersPerDay, int cardsPerSession, Instant lastReminderAt, Instant nextReminderAt) {
        this(owner, remindersPerDay, cardsPerSession, lastReminderAt, nextReminderAt, 0, false, null);
    }

    public Duration reminderInterval() {
        return Duration.ofDays(1).dividedBy(remindersPerDay);
    }

    // Missed count including the last reminder, if the owner has not interacted since it was sent
    public int missedRemindersSinceEngagement() {
        if (lastReminderAt == null) {
            return missedReminders;
        }

        if (lastEngagedAt == null || lastEngagedAt.isBefore(lastReminderAt)) {
            return missedReminders + 1;
        }

        return 0;
    }

    public UserPreferences withSettings(int newRemindersPerDay, int newCardsPerSession, Instant newNextReminderAt) {
        return new UserPreferences(owner, newRemindersPerDay, newCardsPerSession, lastReminderAt, newNextReminderAt,
                missedReminders, paused, lastEngagedAt);
    }

    public UserPreferences withReminderSent(Instant sentAt, int missed) {
        return new UserPreferences(owner, remindersPerDay, cardsPerSession, sentAt, sentAt.plus(reminderInterval()),
                missed, paused, lastEngagedAt);
    }

    public UserPreferences withReminderPostponed(Instant now) {
        return new UserPreferences(owner, remindersPerDay, cardsPerSession, lastReminderAt, now.plus(reminderInterval()),
                missedReminders, paused, lastEngagedAt);
    }

    public UserPreferences withPaused(int missed) {
        return new UserPreferences(owner, remindersPerDay, cardsPerSession, lastReminderAt, nextReminderAt,
                missed, true, lastEngagedAt);
    }
}
