package com.gt.wordreminder.bot;

import com.gt.wordreminder.exception.NoCardsException;
import com.gt.wordreminder.exception.NotFoundException;
import com.gt.wordreminder.exception.SessionConflictException;
import com.gt.wordreminder.exception.UserAccessException;
import com.gt.wordreminder.exception.ValidationException;

/**
 * User facing texts. Exceptions are turned into replies here and nowhere else, so internal messages never
 * reach the chat.
 */
public class BotReplies {

    public static final String WELCOME =
            "Welcome! I help you memorize word pairs with spaced repetition.\n\n" +
            "Upload a CSV file with two columns (word, translation) to add vocabulary, then use:\n" +
            "/review - practice the words that are due\n" +
            "/game - answer a single quick question\n" +
            "/getpair - show a random pair\n" +
            "/settings - change reminder frequency and session size\n" +
            "/export - download your vocabulary\n" +
            "/clear - delete all your vocabulary\n" +
            "/feedback <text> - send a message to the maintainers";

    public static final String UNKNOWN_COMMAND = "Sorry, I don't know that command. Send /start to see what I can do.";
    public static final String NO_CARDS = "You have no vocabulary yet. Upload a CSV file with word pairs to get started.";
    public static final String CONFLICT = "Another action is still in progress. Please try again in a moment.";
    public static final String NO_REVIEW = "You have no review in progress. Send /review to start one.";
    public static final String QUIZ_UNAVAILABLE = "This question is no longer available. Send /game for a new one.";
    public static final String INVALID_INPUT = "That input could not be used.";
    public static final String TRY_AGAIN = "Something went wrong. Please try again later.";

    public static final String REVIEW_CANCELLED = "Review cancelled.";
    public static final String PROMPT_NOT_ACTIVE = "That card has already been answered. Use the buttons on the latest card.";
    public static final String REVIEW_ALREADY_RUNNING = "You already have a review in progress. Here is where you left off.";
    public static final String FEEDBACK_USAGE = "Please add your message after the command, for example: /feedback the reminders are great";
    public static final String FEEDBACK_THANKS = "Thank you! Your feedback has been forwarded.";
    public static final String FEEDBACK_UNAVAILABLE = "Feedback is not enabled for this bot.";
    public static final String NOT_CSV = "The uploaded file is not a CSV. Please upload a valid CSV file.";

    static final int MAX_REJECTED_ROWS_SHOWN = 10;

    public static String forException(RuntimeException ex) {
        if (ex instanceof NoCardsException) {
            return NO_CARDS;
        } else if (ex instanceof SessionConflictException) {
            return CONFLICT;
        } else if (ex instanceof NotFoundException) {
            return NO_REVIEW;
        } else if (ex instanceof UserAccessException) {
            return QUIZ_UNAVAILABLE;
        } else if (ex instanceof ValidationException) {
            return INVALID_INPUT;
        }

        return TRY_AGAIN;
    }
}
