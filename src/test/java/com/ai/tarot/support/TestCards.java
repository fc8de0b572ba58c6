package com.ai.tarot.support;

import com.ai.tarot.config.CardCatalogLoader;
import com.ai.tarot.entity.Card;
import com.ai.tarot.service.CardCatalog;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * The bundled deck, loaded once per test JVM.
 */
public final class TestCards {

    private static CardCatalog catalog;

    private TestCards() {
    }

    public static synchronized CardCatalog catalog() {
        if (catalog == null) {
            try (InputStream in = TestCards.class.getResourceAsStream("/data/tarot_cards.json")) {
                catalog = CardCatalogLoader.load(in);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return catalog;
    }

    public static Card byId(int id) {
        return catalog().getCards().stream()
                .filter(card -> card.getId() == id)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No card " + id));
    }

    public static List<Card> byIds(Integer... ids) {
        List<Card> cards = new ArrayList<>();
        for (Integer id : ids) {
            cards.add(byId(id));
        }
        return cards;
    }
}
