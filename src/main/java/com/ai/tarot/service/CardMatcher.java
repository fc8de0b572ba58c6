package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;
import com.ai.tarot.dto.CardMatch;
import com.ai.tarot.dto.CardResolution;
import com.ai.tarot.entity.Card;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Resolves free-text card names against the catalog. Exact normalized lookup in the
 * active language first, then in the other languages, then fuzzy scoring against
 * every name in every language.
 */
@Service
public class CardMatcher {

    private static final Logger log = LoggerFactory.getLogger(CardMatcher.class);

    private static final Pattern SEPARATORS = Pattern.compile("[,;\\n]+");

    private final CardNameNormalizer normalizer;
    private final FuzzyScorer scorer;
    private final Map<Language, Map<String, Card>> exactIndex = new EnumMap<>(Language.class);

    @Value("${app.matcher.threshold:75}")
    private int threshold = 75;

    @Value("${app.matcher.top-k:5}")
    private int topK = 5;

    public CardMatcher(CardCatalog catalog, CardNameNormalizer normalizer, FuzzyScorer scorer) {
        this.normalizer = normalizer;
        this.scorer = scorer;
        for (Language language : Language.values()) {
            Map<String, Card> byName = new HashMap<>();
            for (Card card : catalog.getCards()) {
                byName.put(normalizer.normalize(card.getName(language), language), card);
            }
            exactIndex.put(language, byName);
        }
    }

    public Optional<CardMatch> match(String query, Language language) {
        if (query == null || query.isBlank()) return Optional.empty();

        Card exact = exactIndex.get(language).get(normalizer.normalize(query, language));
        if (exact != null) {
            return Optional.of(CardMatch.exact(exact));
        }
        for (Language other : Language.values()) {
            if (other == language) continue;
            exact = exactIndex.get(other).get(normalizer.normalize(query, other));
            if (exact != null) {
                return Optional.of(CardMatch.exact(exact));
            }
        }

        List<CardMatch> candidates = candidates(query, language);
        if (candidates.isEmpty()) {
            log.debug("No card above threshold {} for '{}'", threshold, query);
            return Optional.empty();
        }
        return Optional.of(candidates.get(0));
    }

    /**
     * Fuzzy candidates at or above the threshold, best first, at most top-k. Ties prefer
     * a hit in the active language, then the lower card id.
     */
    public List<CardMatch> candidates(String query, Language language) {
        Map<Integer, Scored> best = new HashMap<>();
        for (Language nameLanguage : Language.values()) {
            String normalizedQuery = normalizer.normalize(query, nameLanguage);
            if (normalizedQuery.isEmpty()) continue;
            for (Map.Entry<String, Card> entry : exactIndex.get(nameLanguage).entrySet()) {
                int score = scorer.score(normalizedQuery, entry.getKey());
                if (score < threshold) continue;
                Scored candidate = new Scored(entry.getValue(), score, nameLanguage == language);
                best.merge(candidate.card.getId(), candidate, (a, b) -> BY_RANK.compare(a, b) <= 0 ? a : b);
            }
        }
        return best.values().stream()
                .sorted(BY_RANK)
                .limit(topK)
                .map(s -> CardMatch.fuzzy(s.card, s.score))
                .collect(Collectors.toList());
    }

    /**
     * Splits on commas (also semicolons and newlines) and resolves each part on its own.
     * A card named twice is returned once.
     */
    public CardResolution resolveAll(String input, Language language) {
        Map<Integer, Card> resolved = new LinkedHashMap<>();
        List<String> unrecognized = new ArrayList<>();
        if (input != null) {
            for (String part : SEPARATORS.split(input)) {
                String name = part.trim();
                if (name.isEmpty()) continue;
                Optional<CardMatch> match = match(name, language);
                if (match.isPresent()) {
                    resolved.putIfAbsent(match.get().getCard().getId(), match.get().getCard());
                } else {
                    unrecognized.add(name);
                }
            }
        }
        return new CardResolution(new ArrayList<>(resolved.values()), unrecognized);
    }

    private static final Comparator<Scored> BY_RANK = Comparator
            .comparingInt((Scored s) -> -s.score)
            .thenComparing(s -> !s.activeLanguage)
            .thenComparingInt(s -> s.card.getId());

    private static final class Scored {
        private final Card card;
        private final int score;
        private final boolean activeLanguage;

        private Scored(Card card, int score, boolean activeLanguage) {
            this.card = card;
            this.score = score;
            this.activeLanguage = activeLanguage;
        }
    }
}
