package com.datagate.healing;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HealingPromptsTest {

    @Test
    void promptNamesColumnTableAlternativesAndError() {
        String prompt = HealingPrompts.buildPrompt("tax_id", "customers", List.of("vat_number", "tin"), "Column 'tax_id' not found");

        assertTrue(prompt.contains("column 'tax_id' does not exist in table 'customers'"));
        assertTrue(prompt.contains("Error: Column 'tax_id' not found"));
        assertTrue(prompt.contains("(based on semantic similarity): vat_number, tin"));
        assertTrue(prompt.endsWith("Suggested column:"));
    }

    @Test
    void promptSaysNoneFoundWithoutAlternatives() {
        assertTrue(HealingPrompts.buildPrompt("x", "t", List.of(), "err").contains("similarity): none found"));
    }

    @Test
    void parsesBareAndDecoratedReplies() {
        assertEquals("vat_number", HealingPrompts.parseSuggestion("vat_number"));
        assertEquals("vat_number", HealingPrompts.parseSuggestion("  \"vat_number\"\n"));
        assertEquals("vat_number", HealingPrompts.parseSuggestion("'vat_number'"));
        assertEquals("vat_number", HealingPrompts.parseSuggestion("The correct column name: `vat_number`."));
        assertEquals("vat_number", HealingPrompts.parseSuggestion("Suggested column: vat_number"));
        assertEquals("vat_number", HealingPrompts.parseSuggestion("Column name: vat_number"));
        assertEquals("column_x", HealingPrompts.parseSuggestion("column_x"));
    }

    @Test
    void emptyOrNoneMeansNoSuggestion() {
        assertNull(HealingPrompts.parseSuggestion(null));
        assertNull(HealingPrompts.parseSuggestion("   "));
        assertNull(HealingPrompts.parseSuggestion("NONE"));
        assertNull(HealingPrompts.parseSuggestion("\"none\""));
    }

    @Test
    void matchesAlternativesIgnoringCase() {
        List<String> alternatives = List.of("vat_number", "tin");

        assertEquals("vat_number", HealingPrompts.matchAlternative("VAT_NUMBER", alternatives));
        assertNull(HealingPrompts.matchAlternative("customer_tax_code", alternatives));
        assertNull(HealingPrompts.matchAlternative(null, alternatives));
    }
}
