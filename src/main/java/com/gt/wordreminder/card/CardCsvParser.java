package com.gt.wordreminder.card;

import com.gt.wordreminder.exception.ValidationException;
import com.gt.wordreminder.model.CardContent;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads vocabulary uploads. The separator is whichever of comma, tab or semicolon splits the most sampled
 * rows into the same number of columns. A leading byte order mark is dropped and a first row such as
 * {@code front,back} is treated as a header.
 * <p>
 * Rows with two or three columns and a non blank front and back are accepted; the third column is free
 * text and ignored. Every other non empty row is rejected on its own and reported back.
 */
public class CardCsvParser {

    private static final Logger log = LoggerFactory.getLogger(CardCsvParser.class);

    private static final String UTF8_BOM = "\uFEFF";
    private static final char[] CANDIDATE_DELIMITERS = { ',', '\t', ';' };
    private static final int DELIMITER_SAMPLE_RECORDS = 20;

    private static final Set<String> HEADER_NAMES = Set.of("front", "back", "word1", "word2", "source", "target");

    public static CsvParseResult parse(byte[] data) {
        String text = new String(data, StandardCharsets.UTF_8);
        if (text.startsWith(UTF8_BOM)) {
            text = text.substring(UTF8_BOM.length());
        }

        char delimiter = detectDelimiter(text);

        List<CardContent> accepted = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        boolean firstRecord = true;

        try (CSVParser parser = new CSVParser(new StringReader(text), buildFormat(delimiter))) {
            for (CSVRecord record : parser) {
                List<String> values = record.toList();
                if (isEmptyRecord(values)) {
                    continue;
                }

                if (firstRecord) {
                    firstRecord = false;
                    if (isHeaderRecord(values)) {
                        continue;
                    }
                }

                if (values.size() < 2 || values.size() > 3 || values.get(0).isBlank() || values.get(1).isBlank()) {
                    rejected.add(String.join(String.valueOf(delimiter), values));
                    continue;
                }

                accepted.add(new CardContent(values.get(0), values.get(1)));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            throw new ValidationException("File is not valid CSV", ex);
        }

        log.debug("Parsed vocabulary file with delimiter '{}': {} accepted, {} rejected", delimiter, accepted.size(), rejected.size());

        return new CsvParseResult(accepted, rejected);
    }

    static char detectDelimiter(String text) {
        char bestDelimiter = CANDIDATE_DELIMITERS[0];
        int bestScore = 0;

        for (char delimiter : CANDIDATE_DELIMITERS) {
            int score = scoreDelimiter(text, delimiter);
            if (score > bestScore) {
                bestScore = score;
                bestDelimiter = delimiter;
            }
        }

        return bestDelimiter;
    }

    // Size of the largest group of sampled rows that share a column count of at least two
    private static int scoreDelimiter(String text, char delimiter) {
        Map<Integer, Integer> rowsByColumnCount = new HashMap<>();
        int recordsSeen = 0;

        try (CSVParser parser = new CSVParser(new StringReader(text), buildFormat(delimiter))) {
            for (CSVRecord record : parser) {
                if (recordsSeen >= DELIMITER_SAMPLE_RECORDS) {
                    break;
                }

                List<String> values = record.toList();
                if (isEmptyRecord(values)) {
                    continue;
                }
                recordsSeen++;

                if (values.size() >= 2) {
                    rowsByColumnCount.merge(values.size(), 1, Integer::sum);
                }
            }
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            log.debug("Delimiter '{}' does not parse the sample: {}", delimiter, ex.getMessage());
            return 0;
        }

        return rowsByColumnCount.values().stream().max(Integer::compare).orElse(0);
    }

    private static CSVFormat buildFormat(char delimiter) {
        return CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();
    }

    private static boolean isEmptyRecord(List<String> values) {
        return values.stream().allMatch(String::isBlank);
    }

    private static boolean isHeaderRecord(List<String> values) {
        return values.size() >= 2
                && HEADER_NAMES.contains(values.get(0).toLowerCase(Locale.ROOT))
                && HEADER_NAMES.contains(values.get(1).toLowerCase(Locale.ROOT));
    }
}
