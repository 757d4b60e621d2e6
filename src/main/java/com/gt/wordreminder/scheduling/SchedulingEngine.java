package com.gt.wordreminder.scheduling;

import com.gt.wordreminder.card.CardDao;
import com.gt.wordreminder.model.Card;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Decides which cards an owner should practice and how a graded answer moves a card's review state.
 * <p>
 * The update rule is the SM-2 family: an incorrect answer restarts the repetition count with a one day
 * interval, correct answers grow the interval by the ease factor, and the ease factor never drops below
 * {@link #EASE_FLOOR}.
 */
@Component
public class SchedulingEngine {

    private static final Logger log = LoggerFactory.getLogger(SchedulingEngine.class);

    public static final double EASE_FLOOR = 1.3;

    static final int FIRST_INTERVAL_DAYS = 1;
    static final int SECOND_INTERVAL_DAYS = 6;

    private final CardDao cardDao;
    private final Random random;

    @Autowired
    public SchedulingEngine(CardDao cardDao, Random random) {
        this.cardDao = cardDao;
        this.random = random;
    }

    /**
     * Returns up to {@code limit} cards for the owner. Due cards come first, earliest due and then lowest
     * id. When fewer than {@code limit} are due the rest is filled with randomly chosen cards that are not
     * yet due, so a non-empty deck always yields something to practice.
     */
    public List<Card> dueSet(long owner, Instant now, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        List<Card> dueCards = cardDao.loadDueCards(owner, now, limit);
        if (dueCards.size() >= limit) {
            return dueCards.subList(0, limit);
        }

        List<Card> fallbackPool = new ArrayList<>(cardDao.loadNotDueCards(owner, now));
        Collections.shuffle(fallbackPool, random);

        List<Card> selected = new ArrayList<>(dueCards);
        for (Card candidate : fallbackPool) {
            if (selected.size() >= limit) {
                break;
            }
            if (selected.stream().noneMatch(card -> card.id() == candidate.id())) {
                selected.add(candidate);
            }
        }

        if (selected.size() > dueCards.size()) {
            log.debug("Filled due set for owner {} with {} not yet due cards", owner, selected.size() - dueCards.size());
        }

        return selected;
    }

    public Card applyAnswer(Card card, int quality, Instant now) {
        if (!Quality.isValid(quality)) {
            throw new IllegalArgumentException("Quality must be between " + Quality.MIN + " and " + Quality.MAX + ", got " + quality);
        }

        int repetitions;
        int intervalDays;
        double easeFactor = card.easeFactor();

        if (Quality.isCorrect(quality)) {
            repetitions = card.repetitions() + 1;
            if (repetitions == 1) {
                intervalDays = FIRST_INTERVAL_DAYS;
            } else if (repetitions == 2) {
                intervalDays = SECOND_INTERVAL_DAYS;
            } else {
                intervalDays = (int) Math.round(card.intervalDays() * card.easeFactor());
            }
            easeFactor = nextEaseFactor(card.easeFactor(), quality);
        } else {
            repetitions = 0;
            intervalDays = FIRST_INTERVAL_DAYS;
        }

        return card.withReviewState(easeFactor, intervalDays, repetitions, now.plus(Duration.ofDays(intervalDays)), now);
    }

    static double nextEaseFactor(double easeFactor, int quality) {
        int miss = Quality.MAX - quality;
        double adjusted = easeFactor + (0.1 - miss * (0.08 + miss * 0.02));

        return Math.max(EASE_FLOOR, adjusted);
    }
}
