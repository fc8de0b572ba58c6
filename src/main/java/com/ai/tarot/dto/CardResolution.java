package com.ai.tarot.dto;

import com.ai.tarot.entity.Card;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of resolving a comma-separated list of card names. Cards that resolved are
 * kept even when some names did not.
 */
public final class CardResolution {

    private final List<Card> cards;
    private final List<String> unrecognized;

    public CardResolution(List<Card> cards, List<String> unrecognized) {
        this.cards = List.copyOf(cards);
        this.unrecognized = List.copyOf(unrecognized);
    }

    public List<Card> getCards() {
        return cards;
    }

    public List<String> getUnrecognized() {
        return unrecognized;
    }

    public boolean hasCards() {
        return !cards.isEmpty();
    }

    public List<Integer> getCardIds() {
        return cards.stream().map(Card::getId).collect(Collectors.toList());
    }
}
