package com.gt.wordreminder.bot;

import com.gt.wordreminder.bot.model.TelegramUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/telegram")
public class TelegramWebhookController {

    private static final Logger log = LoggerFactory.getLogger(TelegramWebhookController.class);

    private final BotUpdateDispatcher botUpdateDispatcher;

    public TelegramWebhookController(BotUpdateDispatcher botUpdateDispatcher) {
        this.botUpdateDispatcher = botUpdateDispatcher;
    }

    // Always answers 200, otherwise Telegram keeps redelivering the same update
    @PostMapping("webhook")
    public ResponseEntity<Void> receiveUpdate(@RequestBody TelegramUpdate update) {
        try {
            botUpdateDispatcher.dispatch(update);
        } catch (RuntimeException ex) {
            log.error("Unhandled failure processing update {}", update.updateId(), ex);
        }

        return ResponseEntity.ok().build();
    }
}
