package com.ai.tarot.service;

import com.ai.tarot.component.ResponsePhrases;
import com.ai.tarot.conversation.Language;
import com.ai.tarot.entity.Card;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders a finished reading as a Markdown chat message.
 */
@Component
public class ReadingFormatter {

    private final ResponsePhrases phrases;

    public ReadingFormatter(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    public String formatAutomated(String question, List<Card> cards, List<String> positions,
                                  String interpretation, Language language) {
        StringBuilder sb = new StringBuilder();
        sb.append('*').append(phrases.readingTitle(language)).append("*\n\n");
        sb.append('*').append(phrases.questionLabel(language)).append(":* ").append(question).append("\n\n");
        sb.append('*').append(phrases.cardsDrawnLabel(language)).append(":*\n");
        for (int i = 0; i < cards.size(); i++) {
            String position = i < positions.size() ? positions.get(i) : String.valueOf(i + 1);
            sb.append(i + 1).append(". *").append(position).append("*: ")
                    .append(cards.get(i).getName(language)).append('\n');
        }
        appendInterpretation(sb, interpretation, language);
        return sb.toString();
    }

    public String formatCustom(String question, List<Card> cards, String interpretation, Language language) {
        StringBuilder sb = new StringBuilder();
        sb.append('*').append(phrases.readingTitle(language)).append("*\n\n");
        if (StringUtils.isNotBlank(question)) {
            sb.append('*').append(phrases.questionLabel(language)).append(":* ").append(question).append("\n\n");
        }
        sb.append('*').append(phrases.yourCardsLabel(language)).append(":*\n");
        for (int i = 0; i < cards.size(); i++) {
            sb.append(i + 1).append(". ").append(cards.get(i).getName(language)).append('\n');
        }
        appendInterpretation(sb, interpretation, language);
        return sb.toString();
    }

    private void appendInterpretation(StringBuilder sb, String interpretation, Language language) {
        sb.append('\n');
        sb.append('*').append(phrases.interpretationLabel(language)).append(":*\n");
        sb.append(interpretation.trim()).append('\n');
        sb.append(phrases.disclaimer(language));
    }
}
