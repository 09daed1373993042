package com.arkhamsim.deck;

public final class DeckExhaustedException extends RuntimeException {
    private final String deckName;

    public DeckExhaustedException(String deckName, Throwable cause) {
        super("Deck '" + deckName + "' is exhausted", cause);
        this.deckName = deckName;
    }

    public String deckName() { return deckName; }
}
