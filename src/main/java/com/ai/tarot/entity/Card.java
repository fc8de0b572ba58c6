package com.ai.tarot.entity;

import com.ai.tarot.conversation.Language;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A tarot card from the static catalog. Names and keywords are kept per language;
 * lookups fall back to English.
 */
@Getter
public final class Card {

    public static final String MAJOR = "major";
    public static final String MINOR = "minor";

    private final int id;
    private final Map<Language, String> names;
    private final Map<Language, List<String>> keywords;
    private final String arcana;
    private final String suit;
    private final Integer number;

    public Card(int id, Map<Language, String> names, Map<Language, List<String>> keywords,
                String arcana, String suit, Integer number) {
        this.id = id;
        this.names = names == null || names.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(names));
        EnumMap<Language, List<String>> kw = new EnumMap<>(Language.class);
        if (keywords != null) {
            keywords.forEach((lang, terms) -> kw.put(lang, terms == null ? List.of() : List.copyOf(terms)));
        }
        this.keywords = Collections.unmodifiableMap(kw);
        this.arcana = arcana;
        this.suit = suit;
        this.number = number;
    }

    @JsonCreator
    static Card fromJson(@JsonProperty("id") int id,
                         @JsonProperty("names") Map<String, String> names,
                         @JsonProperty("keywords") Map<String, List<String>> keywords,
                         @JsonProperty("arcana") String arcana,
                         @JsonProperty("suit") String suit,
                         @JsonProperty("number") Integer number) {
        Map<Language, String> byLanguage = new EnumMap<>(Language.class);
        if (names != null) {
            names.forEach((code, name) -> Language.fromCode(code).ifPresent(l -> byLanguage.put(l, name)));
        }
        Map<Language, List<String>> keywordsByLanguage = new EnumMap<>(Language.class);
        if (keywords != null) {
            keywords.forEach((code, terms) -> Language.fromCode(code).ifPresent(l -> keywordsByLanguage.put(l, terms)));
        }
        return new Card(id, byLanguage, keywordsByLanguage, arcana, suit, number);
    }

    public String getName(Language language) {
        String name = names.get(language);
        return name != null ? name : names.get(Language.EN);
    }

    public List<String> getKeywords(Language language) {
        List<String> terms = keywords.get(language);
        if (terms == null || terms.isEmpty()) {
            return keywords.getOrDefault(Language.EN, List.of());
        }
        return terms;
    }

    public boolean isMajor() {
        return MAJOR.equals(arcana);
    }

    @Override
    public String toString() {
        return "Card(" + id + ", " + getName(Language.EN) + ")";
    }
}
