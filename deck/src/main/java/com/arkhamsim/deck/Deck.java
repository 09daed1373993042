package com.arkhamsim.deck;

/**
 * A deck of cards that can be drawn from, and added to, at either end.
 * The front is the top of the deck.
 *
 * @param <C> card type
 */
public interface Deck<C> {

    /** Label for logs and error messages, e.g. "monsters". */
    String name();

    /** @throws DeckExhaustedException if the deck is empty */
    C drawFront();

    /** @throws DeckExhaustedException if the deck is empty */
    C drawRear();

    void addCardFront(C card);

    void addCardRear(C card);

    /** Puts the cards in a uniformly random order. The cards themselves are unchanged. */
    void shuffle();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
