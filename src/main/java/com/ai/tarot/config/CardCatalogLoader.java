package com.ai.tarot.config;

import com.ai.tarot.entity.Card;
import com.ai.tarot.service.CardCatalog;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads the deck from JSON once at startup. Major arcana first, then the four suits
 * in file order. An empty or malformed deck stops the application.
 */
@Configuration
public class CardCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CardCatalogLoader.class);

    private static final ObjectMapper mapper = new ObjectMapper();

    @Bean
    public CardCatalog cardCatalog(@Value("${app.catalog.location:classpath:data/tarot_cards.json}") Resource location) {
        try (InputStream in = location.getInputStream()) {
            CardCatalog catalog = load(in);
            log.info("Loaded {} cards from {}", catalog.size(), location.getDescription());
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read card catalog " + location.getDescription(), e);
        }
    }

    public static CardCatalog load(InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        List<Card> cards = new ArrayList<>();
        for (JsonNode node : root.path("major_arcana")) {
            cards.add(mapper.treeToValue(node, Card.class));
        }
        Iterator<Map.Entry<String, JsonNode>> suits = root.path("minor_arcana").fields();
        while (suits.hasNext()) {
            for (JsonNode node : suits.next().getValue()) {
                cards.add(mapper.treeToValue(node, Card.class));
            }
        }
        return new CardCatalog(cards);
    }
}
