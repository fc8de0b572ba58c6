package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Brings user input and catalog names into one comparable form: lowercase, single
 * spaces, no leading filler words, and for Russian/Ukrainian a canonical rank word
 * in place of an informal number word at the start.
 */
@Component
public class CardNameNormalizer {

    private static final Map<Language, List<String>> FILLER_PREFIXES = Map.of(
            Language.EN, List.of("the card ", "card ", "the "),
            Language.RU, List.of("карта ", "аркан "),
            Language.UK, List.of("карта ", "аркан ")
    );

    /** Seed table; extend as new inflected variants show up in logs. */
    private static final Map<String, String> RU_NUMBER_WORDS = Map.ofEntries(
            Map.entry("один", "туз"),
            Map.entry("единица", "туз"),
            Map.entry("два", "двойка"),
            Map.entry("две", "двойка"),
            Map.entry("двушка", "двойка"),
            Map.entry("три", "тройка"),
            Map.entry("трешка", "тройка"),
            Map.entry("четыре", "четверка"),
            Map.entry("пять", "пятерка"),
            Map.entry("шесть", "шестерка"),
            Map.entry("семь", "семерка"),
            Map.entry("восемь", "восьмерка"),
            Map.entry("девять", "девятка"),
            Map.entry("десять", "десятка")
    );

    private static final Map<String, String> UK_NUMBER_WORDS = Map.ofEntries(
            Map.entry("один", "туз"),
            Map.entry("одиниця", "туз"),
            Map.entry("два", "двійка"),
            Map.entry("дві", "двійка"),
            Map.entry("три", "трійка"),
            Map.entry("чотири", "четвірка"),
            Map.entry("п'ять", "п'ятірка"),
            Map.entry("шість", "шістка"),
            Map.entry("сім", "сімка"),
            Map.entry("вісім", "вісімка"),
            Map.entry("дев'ять", "дев'ятка"),
            Map.entry("десять", "десятка")
    );

    public String normalize(String text, Language language) {
        if (text == null) return "";
        String normalized = StringUtils.normalizeSpace(text.toLowerCase(Locale.ROOT))
                .replace('’', '\'')
                .replace('ʼ', '\'');
        if (language == Language.RU) {
            normalized = normalized.replace('ё', 'е');
        }
        for (String prefix : FILLER_PREFIXES.getOrDefault(language, List.of())) {
            if (normalized.startsWith(prefix) && normalized.length() > prefix.length()) {
                normalized = normalized.substring(prefix.length());
                break;
            }
        }
        return canonicalizeLeadingNumber(normalized, language);
    }

    private String canonicalizeLeadingNumber(String text, Language language) {
        Map<String, String> table = switch (language) {
            case RU -> RU_NUMBER_WORDS;
            case UK -> UK_NUMBER_WORDS;
            case EN -> Map.of();
        };
        if (table.isEmpty()) return text;
        int space = text.indexOf(' ');
        String head = space < 0 ? text : text.substring(0, space);
        String canonical = table.get(head);
        if (canonical == null) return text;
        return space < 0 ? canonical : canonical + text.substring(space);
    }
}
