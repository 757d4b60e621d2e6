package com.gt.wordreminder.bot;

import com.gt.wordreminder.bot.callback.CallbackData;
import com.gt.wordreminder.bot.callback.CallbackPayload;
import com.gt.wordreminder.bot.model.ChatContext;
import com.gt.wordreminder.bot.model.TelegramUpdate;
import com.gt.wordreminder.exception.DaoException;
import com.gt.wordreminder.exception.DeliveryException;
import com.gt.wordreminder.exception.NotFoundException;
import com.gt.wordreminder.exception.SessionConflictException;
import com.gt.wordreminder.exception.UserAccessException;
import com.gt.wordreminder.exception.ValidationException;
import com.gt.wordreminder.messaging.MessagingGateway;
import com.gt.wordreminder.preferences.UserPreferencesService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Routes one Telegram update to the handler for its command, document or callback button. Any error a
 * handler raises is answered here with a reply from {@link BotReplies}; nothing propagates back to the
 * webhook.
 */
@Component
public class BotUpdateDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BotUpdateDispatcher.class);

    private final AccountCommandHandler accountCommandHandler;
    private final ReviewCommandHandler reviewCommandHandler;
    private final QuizCommandHandler quizCommandHandler;
    private final VocabularyCommandHandler vocabularyCommandHandler;
    private final SettingsCommandHandler settingsCommandHandler;
    private final UserPreferencesService userPreferencesService;
    private final MessagingGateway messagingGateway;
    private final Clock clock;

    @Autowired
    public BotUpdateDispatcher(AccountCommandHandler accountCommandHandler,
                               ReviewCommandHandler reviewCommandHandler,
                               QuizCommandHandler quizCommandHandler,
                               VocabularyCommandHandler vocabularyCommandHandler,
                               SettingsCommandHandler settingsCommandHandler,
                               UserPreferencesService userPreferencesService,
                               MessagingGateway messagingGateway,
                               Clock clock) {
        this.accountCommandHandler = accountCommandHandler;
        this.reviewCommandHandler = reviewCommandHandler;
        this.quizCommandHandler = quizCommandHandler;
        this.vocabularyCommandHandler = vocabularyCommandHandler;
        this.settingsCommandHandler = settingsCommandHandler;
        this.userPreferencesService = userPreferencesService;
        this.messagingGateway = messagingGateway;
        this.clock = clock;
    }

    public void dispatch(TelegramUpdate update) {
        if (update.callbackQuery() != null) {
            dispatchCallback(update.callbackQuery());
        } else if (update.message() != null) {
            dispatchMessage(update.message());
        } else {
            log.debug("Ignoring update {} with no message or callback", update.updateId());
        }
    }

    private void dispatchMessage(TelegramUpdate.Message message) {
        if (message.from() == null || message.chat() == null) {
            log.warn("Ignoring message {} without sender or chat", message.messageId());
            return;
        }

        ChatContext context = new ChatContext(message.from().id(), message.chat().id(), message.from().username(), clock.instant());
        recordActivity(context);

        if (message.document() != null) {
            runHandler(context, () -> vocabularyCommandHandler.handleDocument(context, message.document()));
            return;
        }

        String text = message.text() == null ? "" : message.text().trim();
        int argumentStart = text.indexOf(' ');
        String command = argumentStart < 0 ? text : text.substring(0, argumentStart);
        String argument = argumentStart < 0 ? "" : text.substring(argumentStart + 1).trim();

        if (command.equals("/feedback")) {
            runHandler(context, () -> accountCommandHandler.handleFeedback(context, argument));
            return;
        }

        if (!argument.isEmpty()) {
            runHandler(context, () -> messagingGateway.sendMessage(context.chatId(), BotReplies.UNKNOWN_COMMAND));
            return;
        }

        switch (command) {
            case "/start" -> runHandler(context, () -> accountCommandHandler.handleStart(context));
            case "/review" -> runHandler(context, () -> reviewCommandHandler.handleReview(context));
            case "/cancel" -> runHandler(context, () -> reviewCommandHandler.handleCancel(context));
            case "/game" -> runHandler(context, () -> quizCommandHandler.handleGame(context));
            case "/getpair" -> runHandler(context, () -> vocabularyCommandHandler.handleGetPair(context));
            case "/export" -> runHandler(context, () -> vocabularyCommandHandler.handleExport(context));
            case "/clear" -> runHandler(context, () -> vocabularyCommandHandler.handleClear(context));
            case "/settings" -> runHandler(context, () -> settingsCommandHandler.handleSettings(context));
            default -> runHandler(context, () -> messagingGateway.sendMessage(context.chatId(), BotReplies.UNKNOWN_COMMAND));
        }
    }

    private void dispatchCallback(TelegramUpdate.CallbackQuery callbackQuery) {
        try {
            if (callbackQuery.from() == null) {
                log.warn("Ignoring callback query {} without sender", callbackQuery.id());
                return;
            }

            CallbackPayload payload;
            try {
                payload = CallbackData.parse(callbackQuery.data());
            } catch (ValidationException ex) {
                log.warn("Rejected callback from owner {}: {}", callbackQuery.from().id(), ex.getMessage());
                return;
            }

            long chatId = callbackQuery.message() != null && callbackQuery.message().chat() != null
                    ? callbackQuery.message().chat().id()
                    : callbackQuery.from().id();
            ChatContext context = new ChatContext(callbackQuery.from().id(), chatId, callbackQuery.from().username(), clock.instant());
            recordActivity(context);

            if (payload instanceof CallbackPayload.ReviewAnswer reviewAnswer) {
                runHandler(context, () -> reviewCommandHandler.handleAnswer(context, reviewAnswer));
            } else if (payload instanceof CallbackPayload.QuizReveal quizReveal) {
                runHandler(context, () -> quizCommandHandler.handleReveal(context, quizReveal));
            } else if (payload instanceof CallbackPayload.SettingsAction settingsAction) {
                runHandler(context, () -> settingsCommandHandler.handleSettingsAction(context, settingsAction));
            }
        } finally {
            acknowledgeCallback(callbackQuery.id());
        }
    }

    // Any message or button press counts as engagement and resumes paused reminders
    private void recordActivity(ChatContext context) {
        try {
            userPreferencesService.recordActivity(context.owner(), context.now());
        } catch (DataAccessException | DaoException ex) {
            log.warn("Failed to record activity of owner {}", context.owner(), ex);
        }
    }

    private void runHandler(ChatContext context, Runnable handler) {
        try {
            handler.run();
        } catch (DeliveryException ex) {
            log.error("Failed to deliver reply to chat {}", context.chatId(), ex);
        } catch (SessionConflictException | NotFoundException | UserAccessException | ValidationException ex) {
            log.debug("Request from owner {} rejected: {}", context.owner(), ex.getMessage());
            reply(context, BotReplies.forException(ex));
        } catch (DataAccessException | DaoException ex) {
            log.error("Store failure while handling request from owner {}", context.owner(), ex);
            reply(context, BotReplies.TRY_AGAIN);
        }
    }

    private void reply(ChatContext context, String text) {
        try {
            messagingGateway.sendMessage(context.chatId(), text);
        } catch (DeliveryException ex) {
            log.error("Failed to deliver error reply to chat {}", context.chatId(), ex);
        }
    }

    private void acknowledgeCallback(String callbackQueryId) {
        if (callbackQueryId == null) {
            return;
        }

        try {
            messagingGateway.answerCallbackQuery(callbackQueryId, null);
        } catch (DeliveryException ex) {
            log.warn("Failed to acknowledge callback query {}", callbackQueryId, ex);
        }
    }
}
