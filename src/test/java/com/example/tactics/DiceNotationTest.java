package com.example.tactics;

import com.example.tactics.dice.DiceNotation;
import com.example.tactics.dice.DiceNotationException;
import com.example.tactics.dice.DiceTerm;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for dice notation parsing.
 */
public class DiceNotationTest {

    // === Valid notation ===

    @Test
    void testParse_singleTerm() {
        List<DiceTerm> terms = DiceNotation.parse("2d6");
        assertEquals(List.of(new DiceTerm(2, 6, 0)), terms);
    }

    @Test
    void testParse_implicitCount() {
        assertEquals(List.of(new DiceTerm(1, 8, 0)), DiceNotation.parse("d8"));
    }

    @Test
    void testParse_modifierAttachesToLastTerm() {
        List<DiceTerm> terms = DiceNotation.parse("2d6+1d4+3");
        assertEquals(2, terms.size());
        assertEquals(new DiceTerm(2, 6, 0), terms.get(0));
        assertEquals(new DiceTerm(1, 4, 3), terms.get(1));
    }

    @Test
    void testParse_negativeModifier() {
        assertEquals(List.of(new DiceTerm(3, 4, -1)), DiceNotation.parse("3d4-1"));
    }

    @Test
    void testParse_subtractedDice() {
        List<DiceTerm> terms = DiceNotation.parse("1d10-1d4");
        assertEquals(new DiceTerm(-1, 4, 0), terms.get(1));
    }

    @Test
    void testParse_flatOnly() {
        List<DiceTerm> terms = DiceNotation.parse("5");
        assertEquals(1, terms.size());
        assertTrue(terms.get(0).isFlat());
        assertEquals(5, terms.get(0).modifier());
    }

    @Test
    void testParse_ignoresCaseAndWhitespace() {
        assertEquals(DiceNotation.parse("2d6+3"), DiceNotation.parse(" 2D6 + 3 "));
    }

    // === Malformed notation ===

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "abc", "2d", "d", "2x6", "1d0", "2d6+", "++1"})
    void testParse_malformedThrows(String notation) {
        assertThrows(DiceNotationException.class, () -> DiceNotation.parse(notation));
        assertFalse(DiceNotation.isValid(notation));
    }

    @Test
    void testParse_nullThrows() {
        assertThrows(DiceNotationException.class, () -> DiceNotation.parse(null));
    }

    @Test
    void testException_carriesNotation() {
        DiceNotationException e = assertThrows(DiceNotationException.class, () -> DiceNotation.parse("1d0"));
        assertEquals("1d0", e.getNotation());
    }
}
