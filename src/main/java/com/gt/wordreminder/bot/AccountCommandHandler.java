package com.gt.wordreminder.bot;

import com.gt.wordreminder.bot.model.ChatContext;
import com.gt.wordreminder.exception.DeliveryException;
import com.gt.wordreminder.messaging.MessagingGateway;
import com.gt.wordreminder.preferences.UserPreferencesService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class AccountCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(AccountCommandHandler.class);

    private final UserPreferencesService userPreferencesService;
    private final MessagingGateway messagingGateway;
    private final List<Long> adminChatIds;

    @Autowired
    public AccountCommandHandler(UserPreferencesService userPreferencesService,
                                 MessagingGateway messagingGateway,
                                 @Value("${wordreminder.telegram.adminChatIds:}") long[] adminChatIds) {
        this.userPreferencesService = userPreferencesService;
        this.messagingGateway = messagingGateway;

        this.adminChatIds = Arrays.stream(adminChatIds).boxed().toList();
    }

    public void handleStart(ChatContext context) {
        userPreferencesService.initialize(context.owner(), context.now());

        messagingGateway.sendMessage(context.chatId(), BotReplies.WELCOME);
    }

    public void handleFeedback(ChatContext context, String feedback) {
        if (feedback == null || feedback.isBlank()) {
            messagingGateway.sendMessage(context.chatId(), BotReplies.FEEDBACK_USAGE);
            return;
        }

        if (adminChatIds.isEmpty()) {
            log.warn("Feedback from owner {} dropped, no admin chats configured", context.owner());
            messagingGateway.sendMessage(context.chatId(), BotReplies.FEEDBACK_UNAVAILABLE);
            return;
        }

        String sender = context.username() != null ? "@" + context.username() + " (" + context.owner() + ")" : String.valueOf(context.owner());
        String forwarded = "Feedback from " + sender + ":\n" + feedback.trim();

        int delivered = 0;
        for (long adminChatId : adminChatIds) {
            try {
                messagingGateway.sendMessage(adminChatId, forwarded);
                delivered++;
            } catch (DeliveryException ex) {
                log.error("Failed to forward feedback to admin chat {}", adminChatId, ex);
            }
        }

        messagingGateway.sendMessage(context.chatId(), delivered > 0 ? BotReplies.FEEDBACK_THANKS : BotReplies.TRY_AGAIN);
    }
}
