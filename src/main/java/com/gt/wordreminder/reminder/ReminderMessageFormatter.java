package com.gt.wordreminder.reminder;

import com.gt.wordreminder.model.Card;

import java.util.List;

public class ReminderMessageFormatter {

    private static final String HEADER = "Time to refresh your vocabulary!";
    private static final String FOOTER = "Send /review to practice these words.";

    public static String formatReminder(List<Card> cards) {
        StringBuilder builder = new StringBuilder(HEADER).append("\n\n");
        for (Card card : cards) {
            builder.append("• ").append(card.front()).append(" - ").append(card.back()).append('\n');
        }

        return builder.append('\n').append(FOOTER).toString();
    }

    public static String formatPaused(int missedReminders) {
        return "Reminders are paused because the last " + missedReminders + " went unanswered. " +
                "Send any command, for example /review, to turn them back on.";
    }
}
