package com.gt.wordreminder.review;

import com.gt.wordreminder.card.CardDao;
import com.gt.wordreminder.exception.NoCardsException;
import com.gt.wordreminder.exception.NotFoundException;
import com.gt.wordreminder.exception.SessionConflictException;
import com.gt.wordreminder.model.*;
import com.gt.wordreminder.preferences.UserPreferencesService;
import com.gt.wordreminder.scheduling.SchedulingEngine;
import com.gt.wordreminder.util.OwnerLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs an owner's review through its states: a session is created {@code InProgress}, each prompt moves
 * it to {@code AwaitingAnswer}, and each answer moves it back to {@code InProgress} or, after the last
 * card, completes it by deleting the row.
 * <p>
 * Operations for one owner are serialized twice: in process by a non-blocking owner lock, and in the
 * store by a compare-and-set on the session version. Losing either race is a {@link SessionConflictException}.
 */
@Component
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final ReviewSessionDao reviewSessionDao;
    private final CardDao cardDao;
    private final SchedulingEngine schedulingEngine;
    private final UserPreferencesService userPreferencesService;
    private final Duration idleTimeout;
    private final OwnerLockRegistry ownerLocks = new OwnerLockRegistry("review");

    @Autowired
    public ReviewSessionService(ReviewSessionDao reviewSessionDao,
                                CardDao cardDao,
                                SchedulingEngine schedulingEngine,
                                UserPreferencesService userPreferencesService,
                                @Value("${wordreminder.review.idleTimeoutMinutes:1440}") long idleTimeoutMinutes) {
        this.reviewSessionDao = reviewSessionDao;
        this.cardDao = cardDao;
        this.schedulingEngine = schedulingEngine;
        this.userPreferencesService = userPreferencesService;

        this.idleTimeout = Duration.ofMinutes(idleTimeoutMinutes);
    }

    public ReviewSession start(long owner, Instant now) {
        return ownerLocks.withOwnerLock(owner, () -> {
            if (reviewSessionDao.loadReviewSession(owner) != null) {
                throw new SessionConflictException("Owner " + owner + " already has a review in progress");
            }

            int sessionSize = userPreferencesService.getPreferences(owner).cardsPerSession();
            List<Card> cards = schedulingEngine.dueSet(owner, now, sessionSize);
            if (cards.isEmpty()) {
                throw new NoCardsException("Owner " + owner + " has no cards to review");
            }

            List<Long> queue = cards.stream().map(Card::id).toList();
            ReviewSession reviewSession = new ReviewSession(owner, queue, 0, ReviewSessionState.InProgress, now, now, 0);
            if (!reviewSessionDao.createReviewSession(reviewSession)) {
                throw new SessionConflictException("Owner " + owner + " already has a review in progress");
            }

            log.info("Started review of {} cards for owner {}", queue.size(), owner);

            return reviewSession;
        });
    }

    public ReviewPrompt nextPrompt(long owner, Instant now) {
        return ownerLocks.withOwnerLock(owner, () -> {
            ReviewSession reviewSession = loadReviewSession(owner);
            if (reviewSession.state() != ReviewSessionState.InProgress) {
                throw new NotFoundException("Review for owner " + owner + " is waiting for an answer, not a new prompt");
            }

            // Cards deleted since the session started are skipped
            int position = reviewSession.position();
            Card card = null;
            while (position < reviewSession.queue().size()) {
                card = cardDao.loadCard(owner, reviewSession.queue().get(position));
                if (card != null) {
                    break;
                }
                log.warn("Card {} in review of owner {} no longer exists. Skipping.", reviewSession.queue().get(position), owner);
                position++;
            }

            if (card == null) {
                reviewSessionDao.deleteReviewSession(owner, reviewSession.version());
                throw new NotFoundException("No cards left in review for owner " + owner);
            }

            ReviewSession awaitingAnswer = reviewSession.advance(position, ReviewSessionState.AwaitingAnswer, now);
            if (!reviewSessionDao.updateReviewSession(awaitingAnswer, reviewSession.version())) {
                throw new SessionConflictException("Review for owner " + owner + " changed while preparing the next prompt");
            }

            return new ReviewPrompt(card, position + 1, reviewSession.queue().size(), awaitingAnswer.version());
        });
    }

    // Read only. Returns the prompt still waiting for an answer.
    public ReviewPrompt currentPrompt(long owner) {
        ReviewSession reviewSession = loadReviewSession(owner);
        if (reviewSession.state() != ReviewSessionState.AwaitingAnswer) {
            throw new NotFoundException("Review for owner " + owner + " has no prompt waiting for an answer");
        }

        Card card = cardDao.loadCard(owner, reviewSession.currentCardId());
        if (card == null) {
            throw new NotFoundException("Card " + reviewSession.currentCardId() + " no longer exists");
        }

        return new ReviewPrompt(card, reviewSession.position() + 1, reviewSession.queue().size(), reviewSession.version());
    }

    // Picks an existing session back up, whichever step it stopped at
    public ReviewPrompt resume(long owner, Instant now) {
        ReviewSession reviewSession = loadReviewSession(owner);

        return reviewSession.state() == ReviewSessionState.AwaitingAnswer ? currentPrompt(owner) : nextPrompt(owner, now);
    }

    /**
     * Grades the card of the prompt identified by {@code promptVersion}, the {@link ReviewPrompt#sessionVersion()}
     * it was shown with. An answer to any other prompt, including a second answer to the same one, is a
     * {@link NotFoundException} and changes nothing.
     */
    @Transactional
    public ReviewAnswerResult submitAnswer(long owner, long promptVersion, int quality, Instant now) {
        return ownerLocks.withOwnerLock(owner, () -> {
            ReviewSession reviewSession = loadReviewSession(owner);
            if (reviewSession.state() != ReviewSessionState.AwaitingAnswer) {
                throw new NotFoundException("Review for owner " + owner + " has no card waiting for an answer");
            }
            if (reviewSession.version() != promptVersion) {
                throw new NotFoundException("Answer for owner " + owner + " is for prompt " + promptVersion
                        + ", the review is at " + reviewSession.version());
            }

            Card updatedCard = null;
            Card card = cardDao.loadCard(owner, reviewSession.currentCardId());
            if (card != null) {
                updatedCard = schedulingEngine.applyAnswer(card, quality, now);
                cardDao.updateReviewState(updatedCard);
            } else {
                log.warn("Answered card {} of owner {} was deleted during the review", reviewSession.currentCardId(), owner);
            }

            int reviewedCount = reviewSession.position() + 1;
            int totalCount = reviewSession.queue().size();

            if (reviewedCount >= totalCount) {
                if (!reviewSessionDao.deleteReviewSession(owner, reviewSession.version())) {
                    throw new SessionConflictException("Review for owner " + owner + " was changed or cancelled before the answer was saved");
                }

                log.info("Completed review of {} cards for owner {}", totalCount, owner);
                return new ReviewAnswerResult(updatedCard, reviewedCount, totalCount, ReviewSessionState.Complete);
            }

            ReviewSession advanced = reviewSession.advance(reviewedCount, ReviewSessionState.InProgress, now);
            if (!reviewSessionDao.updateReviewSession(advanced, reviewSession.version())) {
                throw new SessionConflictException("Review for owner " + owner + " was changed or cancelled before the answer was saved");
            }

            return new ReviewAnswerResult(updatedCard, reviewedCount, totalCount, ReviewSessionState.InProgress);
        });
    }

    // Null when the owner has no review
    public ReviewSession findReviewSession(long owner) {
        return reviewSessionDao.loadReviewSession(owner);
    }

    public boolean cancel(long owner) {
        boolean cancelled = reviewSessionDao.deleteReviewSession(owner) > 0;
        if (cancelled) {
            log.info("Review for owner {} abandoned", owner);
        }

        return cancelled;
    }

    public int sweepIdle(Instant now) {
        return reviewSessionDao.deleteIdleReviewSessions(now.minus(idleTimeout));
    }

    private ReviewSession loadReviewSession(long owner) {
        ReviewSession reviewSession = reviewSessionDao.loadReviewSession(owner);
        if (reviewSession == null) {
            throw new NotFoundException("Owner " + owner + " has no review in progress");
        }

        return reviewSession;
    }
}
