package com.labelaudit.compliance.service.validation;

import com.labelaudit.compliance.model.Quantity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class QuantityParserTest {

    @Test
    public void parsesCaptionedWeight() {
        assertEquals(new Quantity(500, "g"), QuantityParser.parse("Net Wt. 500 g").orElseThrow());
    }

    @Test
    public void canonicalizesUnitSpellings() {
        assertEquals(new Quantity(1.5, "l"), QuantityParser.parse("1.5 L").orElseThrow());
        assertEquals(new Quantity(250, "g"), QuantityParser.parse("250gm").orElseThrow());
        assertEquals(new Quantity(10, "pcs"), QuantityParser.parse("10 pcs").orElseThrow());
        assertEquals(new Quantity(2, "kg"), QuantityParser.parse("2 Kgs").orElseThrow());
    }

    @Test
    public void thousandsSeparatorIsNotADecimalPoint() {
        assertEquals(new Quantity(1000, "ml"), QuantityParser.parse("1,000 ml").orElseThrow());
        assertEquals(new Quantity(2.5, "kg"), QuantityParser.parse("2,5 kg").orElseThrow());
    }

    @Test
    public void rejectsMissingUnitZeroAndMarkers() {
        assertTrue(QuantityParser.parse("500").isEmpty());
        assertTrue(QuantityParser.parse("0 g").isEmpty());
        assertTrue(QuantityParser.parse("200 boxes").isEmpty());
        assertTrue(QuantityParser.parse("Not found").isEmpty());
        assertTrue(QuantityParser.parse(null).isEmpty());
    }

    @Test
    public void quantityPrintsWithoutTrailingZeros() {
        assertEquals("500 g", new Quantity(500, "g").toString());
        assertEquals("1.5 l", new Quantity(1.5, "l").toString());
    }
}
