package com.ai.tarot.service;

import com.ai.tarot.entity.Card;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Draws distinct cards from the catalog for automated readings.
 */
@Component
public class CardDrawer {

    private final CardCatalog catalog;
    private final Random random;

    @Autowired
    public CardDrawer(CardCatalog catalog) {
        this(catalog, new SecureRandom());
    }

    CardDrawer(CardCatalog catalog, Random random) {
        this.catalog = catalog;
        this.random = random;
    }

    public List<Card> draw(int count) {
        if (count < 1 || count > catalog.size()) {
            throw new IllegalArgumentException("Cannot draw " + count + " cards from a deck of " + catalog.size());
        }
        List<Card> deck = new ArrayList<>(catalog.getCards());
        Collections.shuffle(deck, random);
        return List.copyOf(deck.subList(0, count));
    }
}
