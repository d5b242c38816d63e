package com.ttennebkram.stickersplit.io;

import com.ttennebkram.stickersplit.model.OutputFormat;
import com.ttennebkram.stickersplit.model.ParameterException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class NamingTemplateTest {

    @Test
    public void testDefaultTemplate() {
        NamingTemplate template = NamingTemplate.defaults();
        assertEquals("001_sheet.png", template.fileName(0, 0, 0, "sheet", OutputFormat.PNG));
        assertEquals("012_sheet.jpg", template.fileName(11, 2, 3, "sheet", OutputFormat.JPG));
    }

    @Test
    public void testRowColTokensAreOneBased() {
        NamingTemplate template = NamingTemplate.parse("{name}-{row}x{col}");
        assertEquals("cats-01x01.png", template.fileName(0, 0, 0, "cats", OutputFormat.PNG));
        assertEquals("cats-03x02.png", template.fileName(7, 2, 1, "cats", OutputFormat.PNG));
    }

    @Test
    public void testAdjacentRowColTokensStayDistinct() {
        NamingTemplate template = NamingTemplate.parse("{row}{col}");
        String rowOneColEleven = template.fileName(10, 0, 10, "sheet", OutputFormat.PNG);
        String rowElevenColOne = template.fileName(180, 10, 0, "sheet", OutputFormat.PNG);
        assertEquals("0111.png", rowOneColEleven);
        assertEquals("1101.png", rowElevenColOne);
        assertNotEquals(rowOneColEleven, rowElevenColOne);
    }

    @Test
    public void testEveryCellOfLargestGridGetsOwnName() {
        NamingTemplate template = NamingTemplate.parse("{row}{col}");
        Set<String> names = new HashSet<>();
        for (int r = 0; r < 18; r++) {
            for (int c = 0; c < 18; c++) {
                assertTrue(names.add(template.fileName(r * 18 + c, r, c, "sheet", OutputFormat.PNG)));
            }
        }
    }

    @Test
    public void testInvalidTemplatesRejected() {
        assertThrows(ParameterException.class, () -> NamingTemplate.parse(""));
        assertThrows(ParameterException.class, () -> NamingTemplate.parse("{name}"));
        assertThrows(ParameterException.class, () -> NamingTemplate.parse("{row}_{name}"));
        assertThrows(ParameterException.class, () -> NamingTemplate.parse("{seq}_{date}"));
        assertThrows(ParameterException.class, () -> NamingTemplate.parse("tiles/{seq}"));
        assertThrows(ParameterException.class, () -> NamingTemplate.parse("tiles\\{seq}"));
    }

    @Test
    public void testLiteralTextKept() {
        assertEquals("sticker {seq}", NamingTemplate.parse("sticker {seq}").pattern());
        assertEquals("sticker 005.png",
                NamingTemplate.parse("sticker {seq}").fileName(4, 1, 1, "x", OutputFormat.PNG));
    }
}
