package org.abstractica.tabletop.impl.game;

import org.abstractica.tabletop.handlers.ValidationException;
import org.abstractica.tabletop.protocol.ErrorCode;
import org.abstractica.tabletop.protocol.model.DeckList;
import org.abstractica.tabletop.protocol.model.GameConfig;

/**
 * Structural deck checks against a game's limits.
 */
public final class DeckValidator
{
    public static final int MAX_CARD_ID_LENGTH = 128;

    private DeckValidator() {}

    /**
     * Checks a deck against a game configuration.
     *
     * @param config the game's limits
     * @param deck   the deck
     * @throws ValidationException with {@link ErrorCode#INVALID_DECK_LIST} if the deck does not fit
     */
    public static void validate(GameConfig config, DeckList deck)
    {
        int main = deck.main().size();
        if (main < config.minDeckSize() || main > config.maxDeckSize())
        {
            throw new ValidationException(ErrorCode.INVALID_DECK_LIST,
                    "Main deck has " + main + " cards, must be between "
                            + config.minDeckSize() + " and " + config.maxDeckSize());
        }
        if (deck.sideboard().size() > config.maxSideboardSize())
        {
            throw new ValidationException(ErrorCode.INVALID_DECK_LIST,
                    "Sideboard has " + deck.sideboard().size() + " cards, at most " + config.maxSideboardSize() + " allowed");
        }
        checkCardIds(deck.main());
        checkCardIds(deck.sideboard());
    }

    private static void checkCardIds(Iterable<String> cardIds)
    {
        for (String cardId : cardIds)
        {
            if (cardId.isBlank())
            {
                throw new ValidationException(ErrorCode.INVALID_DECK_LIST, "Blank card id");
            }
            if (cardId.length() > MAX_CARD_ID_LENGTH)
            {
                throw new ValidationException(ErrorCode.INVALID_DECK_LIST,
                        "Card id longer than " + MAX_CARD_ID_LENGTH + " characters");
            }
        }
    }
}
