package com.ai.tarot.dto;

import com.ai.tarot.entity.Card;
import lombok.Getter;
import lombok.ToString;

/**
 * A catalog card matched from free text, with its similarity score (100 for exact).
 */
@Getter
@ToString
public final class CardMatch {

    private final Card card;
    private final int score;
    private final boolean exact;

    private CardMatch(Card card, int score, boolean exact) {
        this.card = card;
        this.score = score;
        this.exact = exact;
    }

    public static CardMatch exact(Card card) {
        return new CardMatch(card, 100, true);
    }

    public static CardMatch fuzzy(Card card, int score) {
        return new CardMatch(card, score, false);
    }
}
