package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;
import com.ai.tarot.entity.Card;
import com.ai.tarot.exception.CatalogValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only view of the 78-card deck. Built once at startup; construction fails
 * if the deck is empty or any card is malformed.
 */
public final class CardCatalog {

    public static final int MAX_CARD_ID = 77;
    private static final Set<String> SUITS = Set.of("wands", "cups", "swords", "pentacles");

    private final List<Card> cards;

    public CardCatalog(List<Card> cards) {
        List<String> problems = validate(cards);
        if (cards == null || cards.isEmpty()) {
            throw new CatalogValidationException("Card catalog is empty", problems);
        }
        if (!problems.isEmpty()) {
            throw new CatalogValidationException("Card catalog is invalid", problems);
        }
        this.cards = List.copyOf(cards);
    }

    public List<Card> getCards() {
        return cards;
    }

    public int size() {
        return cards.size();
    }

    static List<String> validate(List<Card> cards) {
        List<String> problems = new ArrayList<>();
        if (cards == null) return problems;
        Set<Integer> seen = new HashSet<>();
        for (Card card : cards) {
            int id = card.getId();
            if (id < 0 || id > MAX_CARD_ID) {
                problems.add("card " + id + ": id out of range 0-" + MAX_CARD_ID);
            }
            if (!seen.add(id)) {
                problems.add("card " + id + ": duplicate id");
            }
            for (Language language : Language.values()) {
                String name = card.getNames().get(language);
                if (name == null || name.isBlank()) {
                    problems.add("card " + id + ": missing " + language.getCode() + " name");
                }
            }
            if (card.isMajor()) {
                if (card.getSuit() != null) {
                    problems.add("card " + id + ": major arcana must not have a suit");
                }
                if (card.getNumber() == null || card.getNumber() < 0 || card.getNumber() > 21) {
                    problems.add("card " + id + ": major arcana number must be 0-21");
                }
            } else if (Card.MINOR.equals(card.getArcana())) {
                if (!SUITS.contains(card.getSuit())) {
                    problems.add("card " + id + ": unknown suit " + card.getSuit());
                }
                if (card.getNumber() == null || card.getNumber() < 1 || card.getNumber() > 14) {
                    problems.add("card " + id + ": minor arcana number must be 1-14");
                }
            } else {
                problems.add("card " + id + ": arcana must be major or minor");
            }
        }
        return problems;
    }
}
