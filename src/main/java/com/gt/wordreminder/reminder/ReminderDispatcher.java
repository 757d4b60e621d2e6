package com.gt.wordreminder.reminder;

import com.gt.wordreminder.exception.DaoException;
import com.gt.wordreminder.exception.DeliveryException;
import com.gt.wordreminder.messaging.MessagingGateway;
import com.gt.wordreminder.model.Card;
import com.gt.wordreminder.model.ReviewSession;
import com.gt.wordreminder.model.UserPreferences;
import com.gt.wordreminder.preferences.UserPreferencesService;
import com.gt.wordreminder.review.ReviewSessionService;
import com.gt.wordreminder.scheduling.SchedulingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Sends each user a batch of cards to look over, {@code remindersPerDay} times a day.
 * <p>
 * The next reminder is always scheduled from the moment the current one was actually sent, so a late or
 * missed tick delays the schedule rather than producing a burst of catch-up messages. A failure for one
 * user is logged and never stops the others.
 * <p>
 * A user who is in the middle of a review is not interrupted: the reminder waits until the review has
 * been idle for the active session grace period. After {@code pauseAfterMissed} reminders in a row go
 * without any reaction, reminders are paused until the user talks to the bot again. Users without cards
 * have their reminder pushed back one interval.
 */
@Component
public class ReminderDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ReminderDispatcher.class);

    private final UserPreferencesService userPreferencesService;
    private final ReviewSessionService reviewSessionService;
    private final SchedulingEngine schedulingEngine;
    private final MessagingGateway messagingGateway;
    private final Clock clock;
    private final Duration activeSessionGrace;
    private final int pauseAfterMissed;

    @Autowired
    public ReminderDispatcher(UserPreferencesService userPreferencesService,
                              ReviewSessionService reviewSessionService,
                              SchedulingEngine schedulingEngine,
                              MessagingGateway messagingGateway,
                              Clock clock,
                              @Value("${wordreminder.reminder.activeSessionGraceMinutes:15}") long activeSessionGraceMinutes,
                              @Value("${wordreminder.reminder.pauseAfterMissed:9}") int pauseAfterMissed) {
        if (pauseAfterMissed < 1) {
            throw new IllegalArgumentException("pauseAfterMissed must be at least 1, got " + pauseAfterMissed);
        }

        this.userPreferencesService = userPreferencesService;
        this.reviewSessionService = reviewSessionService;
        this.schedulingEngine = schedulingEngine;
        this.messagingGateway = messagingGateway;
        this.clock = clock;

        this.activeSessionGrace = Duration.ofMinutes(activeSessionGraceMinutes);
        this.pauseAfterMissed = pauseAfterMissed;
    }

    @Scheduled(fixedDelayString = "${wordreminder.reminder.tickIntervalMillis:60000}",
               initialDelayString = "${wordreminder.reminder.initialDelayMillis:30000}")
    public void tick() {
        int sent = dispatch(clock.instant());
        if (sent > 0) {
            log.info("Sent {} reminders", sent);
        }
    }

    // Returns the number of reminders sent
    public int dispatch(Instant now) {
        List<UserPreferences> duePreferences = userPreferencesService.getPreferencesDueForReminder(now);

        int sent = 0;
        for (UserPreferences userPreferences : duePreferences) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Reminder dispatch interrupted with {} of {} users processed", sent, duePreferences.size());
                break;
            }

            try {
                if (sendReminder(userPreferences, now)) {
                    sent++;
                }
            } catch (DeliveryException ex) {
                log.error("Failed to deliver reminder to owner {}", userPreferences.owner(), ex);
            } catch (DataAccessException | DaoException ex) {
                log.error("Failed to prepare reminder for owner {}", userPreferences.owner(), ex);
            } catch (RuntimeException ex) {
                log.error("Unexpected failure sending reminder to owner {}", userPreferences.owner(), ex);
            }
        }

        return sent;
    }

    private boolean sendReminder(UserPreferences userPreferences, Instant now) {
        long owner = userPreferences.owner();

        ReviewSession reviewSession = reviewSessionService.findReviewSession(owner);
        if (reviewSession != null && !reviewSession.lastActivityAt().isBefore(now.minus(activeSessionGrace))) {
            log.debug("Owner {} is reviewing, reminder held back", owner);
            return false;
        }

        int missedReminders = userPreferences.missedRemindersSinceEngagement();
        if (missedReminders >= pauseAfterMissed) {
            userPreferencesService.pauseReminders(userPreferences, missedReminders);
            messagingGateway.sendMessage(owner, ReminderMessageFormatter.formatPaused(missedReminders));
            return false;
        }

        List<Card> cards = schedulingEngine.dueSet(owner, now, userPreferences.cardsPerSession());
        if (cards.isEmpty()) {
            userPreferencesService.postponeReminder(userPreferences, now);
            return false;
        }

        messagingGateway.sendMessage(owner, ReminderMessageFormatter.formatReminder(cards));
        userPreferencesService.recordReminderSent(userPreferences, now, missedReminders);

        return true;
    }
}
