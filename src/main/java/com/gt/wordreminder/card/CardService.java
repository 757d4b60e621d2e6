package com.gt.wordreminder.card;

import com.gt.wordreminder.exception.NoCardsException;
import com.gt.wordreminder.model.Card;
import com.gt.wordreminder.model.CardContent;
import com.gt.wordreminder.model.ExportedFile;
import com.gt.wordreminder.model.ImportResult;
import com.gt.wordreminder.quiz.QuizSessionDao;
import com.gt.wordreminder.review.ReviewSessionDao;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;

@Component
public class CardService {

    private static final Logger log = LoggerFactory.getLogger(CardService.class);

    private static final DateTimeFormatter EXPORT_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);
    private static final char UTF8_BOM = '\uFEFF';

    private final CardDao cardDao;
    private final ReviewSessionDao reviewSessionDao;
    private final QuizSessionDao quizSessionDao;

    @Autowired
    public CardService(CardDao cardDao, ReviewSessionDao reviewSessionDao, QuizSessionDao quizSessionDao) {
        this.cardDao = cardDao;
        this.reviewSessionDao = reviewSessionDao;
        this.quizSessionDao = quizSessionDao;
    }

    // Upserts by front. An existing front gets the new back and keeps its review state.
    @Transactional
    public ImportResult importCards(long owner, byte[] data, Instant now) {
        CsvParseResult parseResult = CardCsvParser.parse(data);

        int inserted = 0;
        int updated = 0;
        for (CardContent content : parseResult.accepted()) {
            if (cardDao.updateCardBack(owner, content.front(), content.back()) > 0) {
                updated++;
            } else {
                cardDao.createCard(owner, content, now);
                inserted++;
            }
        }

        log.info("Imported cards for owner {}: {} inserted, {} updated, {} rejected",
                owner, inserted, updated, parseResult.rejectedRows().size());

        return new ImportResult(inserted, updated, parseResult.rejectedRows());
    }

    public ExportedFile exportCards(long owner, Instant now) {
        List<Card> cards = cardDao.loadCards(owner).stream()
                .sorted(Comparator.comparing(Card::front).thenComparingLong(Card::id))
                .toList();
        if (cards.isEmpty()) {
            throw new NoCardsException("Owner " + owner + " has no cards to export");
        }

        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(outputStream, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
            writer.write(UTF8_BOM);
            for (Card card : cards) {
                printer.printRecord(card.front(), card.back());
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write export for owner " + owner, ex);
        }

        return new ExportedFile("vocabulary-" + EXPORT_DATE_FORMAT.format(now) + ".csv", outputStream.toByteArray(), cards.size());
    }

    // Removes the owner's cards along with any session that refers to them
    @Transactional
    public int clear(long owner) {
        reviewSessionDao.deleteReviewSession(owner);
        quizSessionDao.deleteQuizSessions(owner);
        int rowsDeleted = cardDao.deleteAllCards(owner);

        log.info("Cleared {} cards for owner {}", rowsDeleted, owner);

        return rowsDeleted;
    }

    public Card randomCard(long owner) {
        Card card = cardDao.loadRandomCard(owner);
        if (card == null) {
            throw new NoCardsException("Owner " + owner + " has no cards");
        }

        return card;
    }
}
