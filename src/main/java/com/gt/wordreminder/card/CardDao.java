package com.gt.wordreminder.card;

import com.gt.wordreminder.model.Card;
import com.gt.wordreminder.model.CardContent;

import java.time.Instant;
import java.util.List;

public interface CardDao {

    void createCard(long owner, CardContent content, Instant dueAt);

    int updateCardBack(long owner, String front, String back);

    Card loadCard(long owner, long cardId);

    List<Card> loadCards(long owner);

    // Cards with due_at <= now, earliest first, ties broken by id
    List<Card> loadDueCards(long owner, Instant now, int limit);

    List<Card> loadNotDueCards(long owner, Instant now);

    Card loadRandomCard(long owner);

    int countCards(long owner);

    int updateReviewState(Card card);

    int deleteAllCards(long owner);
}
