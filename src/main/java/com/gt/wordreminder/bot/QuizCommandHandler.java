package com.gt.wordreminder.bot;

import com.gt.wordreminder.bot.callback.CallbackData;
import com.gt.wordreminder.bot.callback.CallbackPayload;
import com.gt.wordreminder.bot.model.ChatContext;
import com.gt.wordreminder.exception.NotFoundException;
import com.gt.wordreminder.exception.UserAccessException;
import com.gt.wordreminder.messaging.InlineButton;
import com.gt.wordreminder.messaging.MessagingGateway;
import com.gt.wordreminder.model.QuizQuestion;
import com.gt.wordreminder.model.RevealedAnswer;
import com.gt.wordreminder.quiz.QuizSessionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class QuizCommandHandler {

    private final QuizSessionService quizSessionService;
    private final MessagingGateway messagingGateway;

    @Autowired
    public QuizCommandHandler(QuizSessionService quizSessionService, MessagingGateway messagingGateway) {
        this.quizSessionService = quizSessionService;
        this.messagingGateway = messagingGateway;
    }

    public void handleGame(ChatContext context) {
        QuizQuestion question = quizSessionService.issue(context.owner(), context.now());

        InlineButton revealButton = new InlineButton("Show answer",
                CallbackData.format(new CallbackPayload.QuizReveal(question.token())));

        messagingGateway.sendMessage(context.chatId(), "What is the translation of:\n\n" + question.prompt(),
                List.of(List.of(revealButton)));
    }

    // An unknown, expired, answered or foreign token all get the same reply
    public void handleReveal(ChatContext context, CallbackPayload.QuizReveal quizReveal) {
        RevealedAnswer revealedAnswer;
        try {
            revealedAnswer = quizSessionService.reveal(quizReveal.token(), context.owner(), context.now());
        } catch (NotFoundException | UserAccessException ex) {
            messagingGateway.sendMessage(context.chatId(), BotReplies.QUIZ_UNAVAILABLE);
            return;
        }

        messagingGateway.sendMessage(context.chatId(), revealedAnswer.prompt() + " - " + revealedAnswer.answer());
    }
}
