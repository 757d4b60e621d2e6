package com.gt.wordreminder.quiz;

import com.gt.wordreminder.card.CardDao;
import com.gt.wordreminder.exception.NoCardsException;
import com.gt.wordreminder.exception.NotFoundException;
import com.gt.wordreminder.exception.UserAccessException;
import com.gt.wordreminder.model.Card;
import com.gt.wordreminder.model.QuizQuestion;
import com.gt.wordreminder.model.QuizSession;
import com.gt.wordreminder.model.RevealedAnswer;
import com.gt.wordreminder.scheduling.Quality;
import com.gt.wordreminder.scheduling.SchedulingEngine;
import com.gt.wordreminder.util.OwnerLockRegistry;
import com.gt.wordreminder.util.TokenUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * Single question quizzes. Each issued question is addressed by an unguessable token and can be revealed
 * once, by its owner, before it expires. Expired sessions are removed by {@link #sweep(Instant)}.
 */
@Component
public class QuizSessionService {

    private static final Logger log = LoggerFactory.getLogger(QuizSessionService.class);

    public static final int REVEAL_GRADE_DISABLED = -1;

    private final QuizSessionDao quizSessionDao;
    private final CardDao cardDao;
    private final SchedulingEngine schedulingEngine;
    private final Random random;
    private final Duration ttl;
    private final int revealGrade;
    private final OwnerLockRegistry ownerLocks = new OwnerLockRegistry("quiz");

    @Autowired
    public QuizSessionService(QuizSessionDao quizSessionDao,
                              CardDao cardDao,
                              SchedulingEngine schedulingEngine,
                              Random random,
                              @Value("${wordreminder.quiz.ttlMinutes:60}") long ttlMinutes,
                              @Value("${wordreminder.quiz.revealGrade:-1}") int revealGrade) {
        if (revealGrade != REVEAL_GRADE_DISABLED && !Quality.isValid(revealGrade)) {
            throw new IllegalArgumentException("Reveal grade must be " + REVEAL_GRADE_DISABLED + " or a valid quality, got " + revealGrade);
        }

        this.quizSessionDao = quizSessionDao;
        this.cardDao = cardDao;
        this.schedulingEngine = schedulingEngine;
        this.random = random;

        this.ttl = Duration.ofMinutes(ttlMinutes);
        this.revealGrade = revealGrade;
    }

    public QuizQuestion issue(long owner, Instant now) {
        return ownerLocks.withOwnerLock(owner, () -> {
            // Any card of the deck, due or not
            List<Card> cards = cardDao.loadCards(owner);
            if (cards.isEmpty()) {
                throw new NoCardsException("Owner " + owner + " has no cards for a quiz");
            }

            Card card = cards.get(random.nextInt(cards.size()));
            boolean showFront = random.nextBoolean();
            String prompt = showFront ? card.front() : card.back();
            String correctAnswer = showFront ? card.back() : card.front();

            QuizSession quizSession = new QuizSession(TokenUtil.newToken(), owner, card.id(), prompt, correctAnswer,
                    now, now.plus(ttl), false);
            quizSessionDao.createQuizSession(quizSession);

            log.debug("Issued quiz for card {} of owner {}", card.id(), owner);

            return new QuizQuestion(quizSession.token(), prompt, quizSession.expiresAt());
        });
    }

    @Transactional
    public RevealedAnswer reveal(String token, long requester, Instant now) {
        return ownerLocks.withOwnerLock(requester, () -> {
            QuizSession quizSession = quizSessionDao.loadQuizSession(token);
            if (quizSession == null || quizSession.revealed() || quizSession.isExpired(now)) {
                throw new NotFoundException("Quiz session is unknown, already revealed or expired");
            }

            if (quizSession.owner() != requester) {
                log.warn("Owner {} attempted to reveal a quiz belonging to another owner", requester);
                throw new UserAccessException("Quiz session does not belong to owner " + requester);
            }

            if (!quizSessionDao.markRevealed(token, now)) {
                throw new NotFoundException("Quiz session is unknown, already revealed or expired");
            }

            if (revealGrade != REVEAL_GRADE_DISABLED) {
                applyRevealGrade(quizSession, now);
            }

            return new RevealedAnswer(quizSession.prompt(), quizSession.correctAnswer());
        });
    }

    public int sweep(Instant now) {
        return quizSessionDao.deleteExpiredQuizSessions(now);
    }

    private void applyRevealGrade(QuizSession quizSession, Instant now) {
        Card card = cardDao.loadCard(quizSession.owner(), quizSession.cardId());
        if (card == null) {
            log.warn("Card {} of revealed quiz no longer exists, grade not applied", quizSession.cardId());
            return;
        }

        cardDao.updateReviewState(schedulingEngine.applyAnswer(card, revealGrade, now));
    }
}
