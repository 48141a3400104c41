package org.abstractica.tabletop.impl.game;

import org.abstractica.tabletop.handlers.ValidationException;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.GameConfig;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DeckValidator}.
 */
class DeckValidatorTest
{
    private static final GameConfig CONFIG = new GameConfig("t", 2, 2, 20, 2, 3, 5, 2, true);

    private static List<String> cards(int count)
    {
        return Collections.nCopies(count, "forest");
    }

    private static void assertInvalid(DeckList deck)
    {
        ValidationException e = assertThrows(ValidationException.class, () -> DeckValidator.validate(CONFIG, deck));
        assertEquals(ErrorCode.INVALID_DECK_LIST, e.getCode());
    }

    @Test
    void validate_deckWithinLimits_accepted()
    {
        assertDoesNotThrow(() -> DeckValidator.validate(CONFIG, DeckList.of(cards(3))));
        assertDoesNotThrow(() -> DeckValidator.validate(CONFIG, new DeckList(cards(5), cards(2))));
    }

    @Test
    void validate_mainDeckSize_outsideBounds()
    {
        assertInvalid(DeckList.of(cards(2)));
        assertInvalid(DeckList.of(cards(6)));
    }

    @Test
    void validate_sideboardTooLarge()
    {
        assertInvalid(new DeckList(cards(3), cards(3)));
    }

    @Test
    void validate_badCardIds()
    {
        assertInvalid(DeckList.of(List.of("forest", " ", "island")));
        assertInvalid(new DeckList(cards(3), List.of("x".repeat(DeckValidator.MAX_CARD_ID_LENGTH + 1))));
        assertDoesNotThrow(() -> DeckValidator.validate(CONFIG,
                DeckList.of(List.of("a", "b", "x".repeat(DeckValidator.MAX_CARD_ID_LENGTH)))));
    }
}
