package com.arkhamsim.deck;

import com.arkhamsim.deque.DoubleEndedQueue;
import com.arkhamsim.deque.EmptyDequeException;
import com.arkhamsim.deque.RingBufferDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * A {@link Deck} that keeps its cards in a {@link DoubleEndedQueue} it owns outright; the queue is never handed out.
 * An empty queue surfaces as {@link DeckExhaustedException}.
 */
public final class DequeDeck<C> implements Deck<C> {
    private static final Logger LOG = LoggerFactory.getLogger(DequeDeck.class);

    private final String name;
    private final Random random;
    private DoubleEndedQueue<C> cards;

    public DequeDeck(String name, ShuffleConfig config) {
        this(name, config, List.of());
    }

    /** @param cards initial contents, first card on top */
    public DequeDeck(String name, ShuffleConfig config, List<? extends C> cards) {
        this(name, Objects.requireNonNull(config, "config").newRandom(), RingBufferDeque.of(cards));
    }

    DequeDeck(String name, Random random, DoubleEndedQueue<C> cards) {
        this.name = Objects.requireNonNull(name, "name");
        this.random = Objects.requireNonNull(random, "random");
        this.cards = Objects.requireNonNull(cards, "cards");
    }

    @Override
    public String name() { return name; }

    @Override
    public C drawFront() {
        try {
            return cards.dequeueFront();
        } catch (EmptyDequeException e) {
            throw new DeckExhaustedException(name, e);
        }
    }

    @Override
    public C drawRear() {
        try {
            return cards.dequeueRear();
        } catch (EmptyDequeException e) {
            throw new DeckExhaustedException(name, e);
        }
    }

    @Override
    public void addCardFront(C card) {
        cards.enqueueFront(card);
    }

    @Override
    public void addCardRear(C card) {
        cards.enqueueRear(card);
    }

    /** Copies the cards out, permutes the copy and rebuilds the queue from it. */
    @Override
    public void shuffle() {
        List<C> working = cards.toList();
        Collections.shuffle(working, random);
        cards = RingBufferDeque.of(working);
        LOG.debug("Shuffled deck '{}' ({} cards)", name, working.size());
    }

    @Override
    public int size() { return cards.size(); }

    @Override
    public String toString() {
        return "DequeDeck(name=" + name + ", size=" + cards.size() + ")";
    }
}
