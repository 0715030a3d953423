package com.example.tactics;

import com.example.tactics.rules.ArmorClassFormula;
import com.example.tactics.rules.ArmorProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parsing and applying armor class text.
 */
public class ArmorClassFormulaTest {

    // === Parsing ===

    @Test
    void testParse_light() {
        ArmorProfile armor = ArmorClassFormula.parse("11 + Dex modifier");
        assertEquals(11, armor.baseAc());
        assertNull(armor.maxDexBonus());
        assertTrue(armor.allowsDexterity());
        assertFalse(armor.shield());
    }

    @Test
    void testParse_medium() {
        ArmorProfile armor = ArmorClassFormula.parse("14 + Dex modifier (max 2)");
        assertEquals(14, armor.baseAc());
        assertEquals(2, armor.maxDexBonus());
    }

    @Test
    void testParse_heavy() {
        ArmorProfile armor = ArmorClassFormula.parse("18");
        assertEquals(18, armor.baseAc());
        assertEquals(0, armor.maxDexBonus());
        assertFalse(armor.allowsDexterity());
    }

    @Test
    void testParse_shield() {
        ArmorProfile shield = ArmorClassFormula.parse("+2");
        assertTrue(shield.shield());
        assertEquals(2, shield.baseAc());
    }

    @Test
    void testParse_caseInsensitive() {
        assertEquals(2, ArmorClassFormula.parse("13 + DEX MODIFIER (MAX 2)").maxDexBonus());
    }

    @Test
    void testParse_fallsBackToFirstNumber() {
        ArmorProfile armor = ArmorClassFormula.parse("13 (natural armor)");
        assertEquals(13, armor.baseAc());
    }

    @ParameterizedTest
    @NullAndEmptySource
    void testParse_blankIsUnarmored(String text) {
        assertEquals(ArmorProfile.UNARMORED, ArmorClassFormula.parse(text));
    }

    @Test
    void testParse_noNumberIsUnarmored() {
        assertEquals(ArmorProfile.UNARMORED, ArmorClassFormula.parse("robes"));
    }

    // === Calculation ===

    @ParameterizedTest
    @CsvSource({
        "'11 + Dex modifier', 0, 3, 0, 14",
        "'14 + Dex modifier (max 2)', 0, 4, 0, 16",
        "'14 + Dex modifier (max 2)', 2, -1, 0, 15",
        "'18', 2, 3, 1, 21",
        "'', 0, 2, 0, 12"
    })
    void testCalculate(String text, int shield, int dex, int other, int expected) {
        assertEquals(expected, ArmorClassFormula.calculate(ArmorClassFormula.parse(text), shield, dex, other));
    }

    @Test
    void testCalculate_nullArmorIsUnarmored() {
        assertEquals(13, ArmorClassFormula.calculate(null, 0, 3, 0));
    }
}
