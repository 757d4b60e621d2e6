package com.gt.wordreminder.reminder;

import com.gt.wordreminder.exception.DeliveryException;
import com.gt.wordreminder.messaging.MessagingGateway;
import com.gt.wordreminder.model.ReviewSession;
import com.gt.wordreminder.model.ReviewSessionState;
import com.gt.wordreminder.model.UserPreferences;
import com.gt.wordreminder.preferences.PreferenceSetting;
import com.gt.wordreminder.preferences.UserPreferencesService;
import com.gt.wordreminder.review.ReviewSessionService;
import com.gt.wordreminder.scheduling.SchedulingEngine;
import com.gt.wordreminder.support.InMemoryCardDao;
import com.gt.wordreminder.support.InMemoryReviewSessionDao;
import com.gt.wordreminder.support.InMemoryUserPreferencesDao;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class ReminderDispatcherTests {

    private static final long TEST_OWNER = 5005L;
    private static final long OTHER_OWNER = 6006L;
    private static final Instant START = Instant.parse("2024-03-01T08:00:00Z");

    private static final long GRACE_MINUTES = 15;
    private static final int PAUSE_AFTER_MISSED = 9;

    @Mock private MessagingGateway messagingGateway;

    private InMemoryCardDao cardDao;
    private InMemoryUserPreferencesDao userPreferencesDao;
    private InMemoryReviewSessionDao reviewSessionDao;
    private UserPreferencesService userPreferencesService;
    private SchedulingEngine schedulingEngine;
    private ReminderDispatcher reminderDispatcher;

    @BeforeEach
    public void setup() {
        cardDao = new InMemoryCardDao();
        userPreferencesDao = new InMemoryUserPreferencesDao();
        reviewSessionDao = new InMemoryReviewSessionDao();
        userPreferencesService = new UserPreferencesService(userPreferencesDao, 1, 5);
        schedulingEngine = new SchedulingEngine(cardDao, new Random(11));
        ReviewSessionService reviewSessionService = new ReviewSessionService(reviewSessionDao, cardDao, schedulingEngine, userPreferencesService, 1440);

        reminderDispatcher = buildDispatcher(reviewSessionService);
    }

    @Test
    public void testDispatch_SpacingFollowsActualSendTimes() {
        cardDao.addCard(TEST_OWNER, "haus", "house", START);
        userPreferencesService.initialize(TEST_OWNER, START);
        userPreferencesService.updateSetting(TEST_OWNER, PreferenceSetting.RemindersPerDay, 3, START);

        assertEquals(START.plus(Duration.ofHours(8)), userPreferencesDao.loadUserPreferences(TEST_OWNER).nextReminderAt());

        assertEquals(0, reminderDispatcher.dispatch(START.plus(Duration.ofHours(7))));
        assertEquals(1, reminderDispatcher.dispatch(START.plus(Duration.ofHours(8))));
        assertEquals(START.plus(Duration.ofHours(16)), userPreferencesDao.loadUserPreferences(TEST_OWNER).nextReminderAt());

        // A late tick sends once and reschedules from the late send, with no catch up
        Instant lateTick = START.plus(Duration.ofHours(30));
        assertEquals(1, reminderDispatcher.dispatch(lateTick));
        assertEquals(0, reminderDispatcher.dispatch(lateTick.plusSeconds(60)));

        UserPreferences userPreferences = userPreferencesDao.loadUserPreferences(TEST_OWNER);
        assertEquals(lateTick, userPreferences.lastReminderAt());
        assertEquals(lateTick.plus(Duration.ofHours(8)), userPreferences.nextReminderAt());

        verify(messagingGateway, times(2)).sendMessage(eq(TEST_OWNER), anyString());
    }

    @Test
    public void testDispatch_MessageListsCards() {
        cardDao.addCard(TEST_OWNER, "haus", "house", START);
        cardDao.addCard(TEST_OWNER, "baum", "tree", START);
        userPreferencesService.initialize(TEST_OWNER, START.minus(Duration.ofDays(1)));

        reminderDispatcher.dispatch(START);

        ArgumentCaptor<String> textCaptor = ArgumentCaptor.forClass(String.class);
        verify(messagingGateway).sendMessage(eq(TEST_OWNER), textCaptor.capture());
        assertTrue(textCaptor.getValue().contains("haus - house"));
        assertTrue(textCaptor.getValue().contains("baum - tree"));
    }

    @Test
    public void testDispatch_NoCardsPostponed() {
        UserPreferences initial = userPreferencesService.initialize(TEST_OWNER, START.minus(Duration.ofDays(1)));

        assertEquals(0, reminderDispatcher.dispatch(START));

        verifyNoInteractions(messagingGateway);
        UserPreferences postponed = userPreferencesDao.loadUserPreferences(TEST_OWNER);
        assertEquals(START.plus(Duration.ofDays(1)), postponed.nextReminderAt());
        assertEquals(initial.lastReminderAt(), postponed.lastReminderAt());
        assertEquals(initial.missedReminders(), postponed.missedReminders());

        // Not picked up again on the following ticks
        assertTrue(userPreferencesService.getPreferencesDueForReminder(START.plusSeconds(60)).isEmpty());
    }

    @Test
    public void testDispatch_HeldBackDuringActiveReview() {
        cardDao.addCard(TEST_OWNER, "haus", "house", START);
        UserPreferences initial = userPreferencesService.initialize(TEST_OWNER, START.minus(Duration.ofDays(1)));
        reviewSessionDao.put(new ReviewSession(TEST_OWNER, List.of(1L), 0, ReviewSessionState.AwaitingAnswer,
                START.minus(Duration.ofMinutes(20)), START.minus(Duration.ofMinutes(5)), 1));

        assertEquals(0, reminderDispatcher.dispatch(START));
        verifyNoInteractions(messagingGateway);
        assertEquals(initial, userPreferencesDao.loadUserPreferences(TEST_OWNER));

        // The review has been idle for longer than the grace period
        Instant afterGrace = START.plus(Duration.ofMinutes(11));
        assertEquals(1, reminderDispatcher.dispatch(afterGrace));
        assertEquals(afterGrace, userPreferencesDao.loadUserPreferences(TEST_OWNER).lastReminderAt());
    }

    @Test
    public void testDispatch_CountsMissedReminders() {
        cardDao.addCard(TEST_OWNER, "haus", "house", START);
        userPreferencesService.initialize(TEST_OWNER, START.minus(Duration.ofDays(1)));

        reminderDispatcher.dispatch(START);
        assertEquals(0, userPreferencesDao.loadUserPreferences(TEST_OWNER).missedReminders());

        Instant secondTick = START.plus(Duration.ofDays(1));
        reminderDispatcher.dispatch(secondTick);
        assertEquals(1, userPreferencesDao.loadUserPreferences(TEST_OWNER).missedReminders());

        userPreferencesService.recordActivity(TEST_OWNER, secondTick.plus(Duration.ofHours(1)));
        reminderDispatcher.dispatch(START.plus(Duration.ofDays(2)));
        assertEquals(0, userPreferencesDao.loadUserPreferences(TEST_OWNER).missedReminders());
    }

    @Test
    public void testDispatch_PausesAfterMissedRemindersUntilActivity() {
        cardDao.addCard(TEST_OWNER, "haus", "house", START);
        Instant lastSent = START.minus(Duration.ofDays(1));
        userPreferencesDao.saveUserPreferences(new UserPreferences(TEST_OWNER, 1, 5, lastSent, START,
                PAUSE_AFTER_MISSED - 1, false, lastSent.minus(Duration.ofDays(9))));

        assertEquals(0, reminderDispatcher.dispatch(START));

        UserPreferences paused = userPreferencesDao.loadUserPreferences(TEST_OWNER);
        assertTrue(paused.paused());
        assertEquals(PAUSE_AFTER_MISSED, paused.missedReminders());
        verify(messagingGateway).sendMessage(TEST_OWNER, ReminderMessageFormatter.formatPaused(PAUSE_AFTER_MISSED));

        assertEquals(0, reminderDispatcher.dispatch(START.plus(Duration.ofDays(3))));
        verify(messagingGateway, times(1)).sendMessage(eq(TEST_OWNER), anyString());

        Instant resumedAt = START.plus(Duration.ofDays(3));
        userPreferencesService.recordActivity(TEST_OWNER, resumedAt);
        assertEquals(1, reminderDispatcher.dispatch(resumedAt.plusSeconds(60)));

        UserPreferences resumed = userPreferencesDao.loadUserPreferences(TEST_OWNER);
        assertFalse(resumed.paused());
        assertEquals(0, resumed.missedReminders());
    }

    @Test
    public void testDispatch_UnexpectedFailureIsolated() {
        ReviewSessionService failingReviewSessionService = mock(ReviewSessionService.class);
        when(failingReviewSessionService.findReviewSession(TEST_OWNER)).thenThrow(new IllegalStateException("corrupt queue"));
        ReminderDispatcher dispatcher = buildDispatcher(failingReviewSessionService);

        cardDao.addCard(TEST_OWNER, "haus", "house", START);
        cardDao.addCard(OTHER_OWNER, "baum", "tree", START);
        userPreferencesService.initialize(TEST_OWNER, START.minus(Duration.ofDays(2)));
        userPreferencesService.initialize(OTHER_OWNER, START.minus(Duration.ofDays(1)));

        assertEquals(1, dispatcher.dispatch(START));

        verify(messagingGateway).sendMessage(eq(OTHER_OWNER), anyString());
        verify(messagingGateway, never()).sendMessage(eq(TEST_OWNER), anyString());
    }

    @Test
    public void testDispatch_DeliveryFailureIsolated() {
        cardDao.addCard(TEST_OWNER, "haus", "house", START);
        cardDao.addCard(OTHER_OWNER, "baum", "tree", START);
        UserPreferences failing = userPreferencesService.initialize(TEST_OWNER, START.minus(Duration.ofDays(2)));
        userPreferencesService.initialize(OTHER_OWNER, START.minus(Duration.ofDays(1)));

        doThrow(new DeliveryException("chat blocked")).when(messagingGateway).sendMessage(eq(TEST_OWNER), anyString());

        assertEquals(1, reminderDispatcher.dispatch(START));

        verify(messagingGateway).sendMessage(eq(OTHER_OWNER), anyString());
        assertEquals(failing, userPreferencesDao.loadUserPreferences(TEST_OWNER));
        assertEquals(START, userPreferencesDao.loadUserPreferences(OTHER_OWNER).lastReminderAt());
    }

    @Test
    public void testDispatch_StopsWhenInterrupted() {
        cardDao.addCard(TEST_OWNER, "haus", "house", START);
        userPreferencesService.initialize(TEST_OWNER, START.minus(Duration.ofDays(1)));

        Thread.currentThread().interrupt();
        try {
            assertEquals(0, reminderDispatcher.dispatch(START));
        } finally {
            Thread.interrupted();
        }

        verifyNoInteractions(messagingGateway);
    }

    @Test
    public void testTick() {
        cardDao.addCard(TEST_OWNER, "haus", "house", START);
        userPreferencesService.initialize(TEST_OWNER, START.minus(Duration.ofDays(1)));

        reminderDispatcher.tick();

        verify(messagingGateway).sendMessage(eq(TEST_OWNER), anyString());
    }

    @Test
    public void testConstructor_RejectsNonPositivePauseThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new ReminderDispatcher(userPreferencesService,
                mock(ReviewSessionService.class), schedulingEngine, messagingGateway, Clock.fixed(START, ZoneOffset.UTC),
                GRACE_MINUTES, 0));
    }

    private ReminderDispatcher buildDispatcher(ReviewSessionService reviewSessionService) {
        return new ReminderDispatcher(userPreferencesService, reviewSessionService, schedulingEngine, messagingGateway,
                Clock.fixed(START, ZoneOffset.UTC), GRACE_MINUTES, PAUSE_AFTER_MISSED);
    }
}
