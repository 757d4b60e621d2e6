package com.gt.wordreminder.card;

import com.gt.wordreminder.exception.ValidationException;
import com.gt.wordreminder.model.CardContent;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CardCsvParserTests {

    @Test
    public void testParse_Comma() {
        CsvParseResult result = parse("haus,house\nbaum,tree\n");

        assertEquals(List.of(new CardContent("haus", "house"), new CardContent("baum", "tree")), result.accepted());
        assertTrue(result.rejectedRows().isEmpty());
    }

    @Test
    public void testParse_Semicolon() {
        CsvParseResult result = parse("haus;house\r\nbaum;tree\r\n");

        assertEquals(List.of(new CardContent("haus", "house"), new CardContent("baum", "tree")), result.accepted());
    }

    @Test
    public void testParse_TabWithCommasInValues() {
        CsvParseResult result = parse("haus\thouse, home\nbaum\ttree\n");

        assertEquals(List.of(new CardContent("haus", "house, home"), new CardContent("baum", "tree")), result.accepted());
    }

    @Test
    public void testParse_BomAndHeader() {
        byte[] bom = { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF };
        byte[] body = "Front,Back\nhaus,house\n".getBytes(StandardCharsets.UTF_8);
        byte[] data = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, data, 0, bom.length);
        System.arraycopy(body, 0, data, bom.length, body.length);

        CsvParseResult result = CardCsvParser.parse(data);

        assertEquals(List.of(new CardContent("haus", "house")), result.accepted());
        assertTrue(result.rejectedRows().isEmpty());
    }

    @Test
    public void testParse_HeaderOnlyOnFirstRow() {
        CsvParseResult result = parse("haus;house\nsource;target\n");

        assertEquals(List.of(new CardContent("haus", "house"), new CardContent("source", "target")), result.accepted());
    }

    @Test
    public void testParse_RejectsRowsIndividually() {
        CsvParseResult result = parse("haus,house\nlonely\na,b,c,d\n,empty\nbaum,tree,a note\n");

        assertEquals(List.of(new CardContent("haus", "house"), new CardContent("baum", "tree")), result.accepted());
        assertEquals(List.of("lonely", "a,b,c,d", ",empty"), result.rejectedRows());
    }

    @Test
    public void testParse_QuotedValuesAndBlankLines() {
        CsvParseResult result = parse("\"Guten Tag, Herr\",good day\n\n   \nhaus,  house  \n");

        assertEquals(List.of(new CardContent("Guten Tag, Herr", "good day"), new CardContent("haus", "house")), result.accepted());
        assertTrue(result.rejectedRows().isEmpty());
    }

    @Test
    public void testParse_Empty() {
        CsvParseResult result = parse("");

        assertTrue(result.accepted().isEmpty());
        assertTrue(result.rejectedRows().isEmpty());
    }

    @Test
    public void testParse_Malformed() {
        assertThrows(ValidationException.class, () -> parse("\"unterminated,house\nbaum,tree"));
    }

    @Test
    public void testDetectDelimiter() {
        assertEquals(',', CardCsvParser.detectDelimiter("a,b\nc,d"));
        assertEquals(';', CardCsvParser.detectDelimiter("a;b\nc;d"));
        assertEquals('\t', CardCsvParser.detectDelimiter("a\tb\nc\td"));
        assertEquals(',', CardCsvParser.detectDelimiter("single\ncolumn"));
    }

    private static CsvParseResult parse(String text) {
        return CardCsvParser.parse(text.getBytes(StandardCharsets.UTF_8));
    }
}
