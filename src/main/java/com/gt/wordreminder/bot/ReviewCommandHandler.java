package com.gt.wordreminder.bot;

import com.gt.wordreminder.bot.callback.CallbackData;
import com.gt.wordreminder.bot.callback.CallbackPayload;
import com.gt.wordreminder.bot.model.ChatContext;
import com.gt.wordreminder.exception.NotFoundException;
import com.gt.wordreminder.exception.SessionConflictException;
import com.gt.wordreminder.messaging.InlineButton;
import com.gt.wordreminder.messaging.MessagingGateway;
import com.gt.wordreminder.model.Card;
import com.gt.wordreminder.model.ReviewAnswerResult;
import com.gt.wordreminder.model.ReviewPrompt;
import com.gt.wordreminder.review.ReviewSessionService;
import com.gt.wordreminder.scheduling.Quality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ReviewCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(ReviewCommandHandler.class);

    private final ReviewSessionService reviewSessionService;
    private final MessagingGateway messagingGateway;

    @Autowired
    public ReviewCommandHandler(ReviewSessionService reviewSessionService, MessagingGateway messagingGateway) {
        this.reviewSessionService = reviewSessionService;
        this.messagingGateway = messagingGateway;
    }

    public void handleReview(ChatContext context) {
        ReviewPrompt prompt;
        try {
            reviewSessionService.start(context.owner(), context.now());
            prompt = reviewSessionService.nextPrompt(context.owner(), context.now());
        } catch (SessionConflictException ex) {
            resumeReview(context);
            return;
        }

        sendPrompt(context.chatId(), prompt);
    }

    public void handleAnswer(ChatContext context, CallbackPayload.ReviewAnswer answer) {
        ReviewAnswerResult result;
        try {
            result = reviewSessionService.submitAnswer(context.owner(), answer.sessionVersion(), answer.quality(), context.now());
        } catch (NotFoundException ex) {
            log.debug("Ignoring answer from owner {}: {}", context.owner(), ex.getMessage());
            messagingGateway.sendMessage(context.chatId(), BotReplies.PROMPT_NOT_ACTIVE);
            return;
        }

        Card answered = result.updatedCard();
        if (answered != null) {
            messagingGateway.sendMessage(context.chatId(), answered.front() + " - " + answered.back());
        }

        if (result.isComplete()) {
            sendCompleted(context.chatId(), result.totalCount());
            return;
        }

        try {
            sendPrompt(context.chatId(), reviewSessionService.nextPrompt(context.owner(), context.now()));
        } catch (NotFoundException ex) {
            // Every remaining card was deleted while the review was running
            sendCompleted(context.chatId(), result.reviewedCount());
        }
    }

    public void handleCancel(ChatContext context) {
        boolean cancelled = reviewSessionService.cancel(context.owner());

        messagingGateway.sendMessage(context.chatId(), cancelled ? BotReplies.REVIEW_CANCELLED : BotReplies.NO_REVIEW);
    }

    // Start lost to an existing review or to a concurrent request for the same owner
    private void resumeReview(ChatContext context) {
        if (reviewSessionService.findReviewSession(context.owner()) == null) {
            messagingGateway.sendMessage(context.chatId(), BotReplies.CONFLICT);
            return;
        }

        ReviewPrompt prompt;
        try {
            prompt = reviewSessionService.resume(context.owner(), context.now());
        } catch (NotFoundException ex) {
            log.debug("Review of owner {} ended before it could be resumed", context.owner());
            messagingGateway.sendMessage(context.chatId(), BotReplies.CONFLICT);
            return;
        }

        log.debug("Owner {} already has a review, resuming it", context.owner());
        messagingGateway.sendMessage(context.chatId(), BotReplies.REVIEW_ALREADY_RUNNING);
        sendPrompt(context.chatId(), prompt);
    }

    private void sendPrompt(long chatId, ReviewPrompt prompt) {
        String text = "Card " + prompt.number() + "/" + prompt.total() + "\n\n" +
                prompt.card().front() + "\n\n" +
                "Recall the translation, then rate how well you remembered it.";

        messagingGateway.sendMessage(chatId, text, answerKeyboard(prompt.sessionVersion()));
    }

    private void sendCompleted(long chatId, int reviewedCount) {
        messagingGateway.sendMessage(chatId, "Review complete! You went through " + reviewedCount + " cards.");
    }

    // An answer is only accepted while the review is still at the version its buttons were built with
    private static List<List<InlineButton>> answerKeyboard(long sessionVersion) {
        return List.of(List.of(
                answerButton("Forgot", sessionVersion, Quality.INCORRECT),
                answerButton("Hard", sessionVersion, Quality.PASSING),
                answerButton("Good", sessionVersion, 4),
                answerButton("Easy", sessionVersion, Quality.CORRECT)));
    }

    private static InlineButton answerButton(String text, long sessionVersion, int quality) {
        return new InlineButton(text, CallbackData.format(new CallbackPayload.ReviewAnswer(sessionVersion, quality)));
    }
}
