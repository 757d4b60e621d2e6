package com.gt.wordreminder.bot;

import com.gt.wordreminder.bot.model.ChatContext;
import com.gt.wordreminder.bot.model.TelegramUpdate;
import com.gt.wordreminder.card.CardService;
import com.gt.wordreminder.messaging.MessagingGateway;
import com.gt.wordreminder.model.Card;
import com.gt.wordreminder.model.ExportedFile;
import com.gt.wordreminder.model.ImportResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class VocabularyCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(VocabularyCommandHandler.class);

    private final CardService cardService;
    private final MessagingGateway messagingGateway;

    @Autowired
    public VocabularyCommandHandler(CardService cardService, MessagingGateway messagingGateway) {
        this.cardService = cardService;
        this.messagingGateway = messagingGateway;
    }

    public void handleGetPair(ChatContext context) {
        Card card = cardService.randomCard(context.owner());

        messagingGateway.sendMessage(context.chatId(), card.front() + " - " + card.back());
    }

    public void handleExport(ChatContext context) {
        ExportedFile exportedFile = cardService.exportCards(context.owner(), context.now());

        messagingGateway.sendDocument(context.chatId(), exportedFile.fileName(), exportedFile.content(),
                "Your vocabulary export (" + exportedFile.cardCount() + " cards).");
    }

    public void handleClear(ChatContext context) {
        int deleted = cardService.clear(context.owner());

        messagingGateway.sendMessage(context.chatId(), deleted > 0
                ? "Deleted " + deleted + " cards. Upload a CSV file to start over."
                : BotReplies.NO_CARDS);
    }

    public void handleDocument(ChatContext context, TelegramUpdate.Document document) {
        String fileName = document.fileName() == null ? "" : document.fileName();
        log.info("Owner {} uploaded {}", context.owner(), fileName);

        if (!fileName.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            messagingGateway.sendMessage(context.chatId(), BotReplies.NOT_CSV);
            return;
        }

        byte[] data = messagingGateway.downloadFile(document.fileId());
        ImportResult importResult = cardService.importCards(context.owner(), data, context.now());

        messagingGateway.sendMessage(context.chatId(), formatImportResult(importResult));
    }

    static String formatImportResult(ImportResult importResult) {
        StringBuilder builder = new StringBuilder()
                .append("Import finished: ").append(importResult.inserted()).append(" added, ")
                .append(importResult.updated()).append(" updated");

        if (importResult.rejectedRows().isEmpty()) {
            return builder.append('.').toString();
        }

        builder.append(", ").append(importResult.rejectedRows().size()).append(" rejected.\n\nRows that need two columns with a word and its translation:");
        importResult.rejectedRows().stream()
                .limit(BotReplies.MAX_REJECTED_ROWS_SHOWN)
                .forEach(row -> builder.append('\n').append(row));

        int hidden = importResult.rejectedRows().size() - BotReplies.MAX_REJECTED_ROWS_SHOWN;
        if (hidden > 0) {
            builder.append("\n...and ").append(hidden).append(" more");
        }

        return builder.toString();
    }
}
