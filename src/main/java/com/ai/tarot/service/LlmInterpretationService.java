package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;
import com.ai.tarot.entity.Card;
import com.ai.tarot.exception.UpstreamException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates interpretations with Anthropic Messages when an Anthropic key is configured,
 * otherwise with OpenAI Chat Completions.
 */
@Service
public class LlmInterpretationService implements InterpretationGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmInterpretationService.class);

    static final String ANTHROPIC_URL = "https://api.anthropic.com/v1/messages";
    static final String OPENAI_URL = "https://api.openai.com/v1/chat/completions";
    static final int MAX_TOKENS = 2000;

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper = new ObjectMapper();

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.model:claude-3-5-haiku-latest}")
    private String anthropicModel;

    @Value("${openai.api-key:}")
    private String openAiApiKey;

    @Value("${openai.model:gpt-4o-mini}")
    private String openAiModel;

    public LlmInterpretationService(RestTemplateBuilder builder,
                                    @Value("${app.generation.timeout:30s}") Duration timeout) {
        this.restTemplate = builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(timeout)
                .build();
    }

    @Override
    public String generate(List<Card> cards, String question, Language language, List<String> positionLabels) {
        String systemPrompt = systemPrompt(language);
        String userPrompt = positionLabels.isEmpty()
                ? customPrompt(cards, question, language)
                : readingPrompt(cards, question, language, positionLabels);

        String text;
        if (StringUtils.isNotBlank(anthropicApiKey)) {
            text = callAnthropic(systemPrompt, userPrompt);
        } else if (StringUtils.isNotBlank(openAiApiKey)) {
            text = callOpenAi(systemPrompt, userPrompt);
        } else {
            log.error("Neither ANTHROPIC_API_KEY nor OPENAI_API_KEY is set");
            throw new UpstreamException("No interpretation backend configured");
        }
        if (StringUtils.isBlank(text)) {
            throw new UpstreamException("Interpretation backend returned an empty reply");
        }
        return text.trim();
    }

    private String callAnthropic(String systemPrompt, String userPrompt) {
        HttpHeaders headers = new HttpHeaders();
        headers.set("x-api-key", anthropicApiKey);
        headers.set("anthropic-version", "2023-06-01");
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", anthropicModel);
        body.put("max_tokens", MAX_TOKENS);
        body.put("system", systemPrompt);
        body.put("messages", List.of(message("user", userPrompt)));

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(ANTHROPIC_URL, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            return root.path("content").path(0).path("text").asText("");
        } catch (Exception ex) {
            throw new UpstreamException("Anthropic request failed", ex);
        }
    }

    private String callOpenAi(String systemPrompt, String userPrompt) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(openAiApiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        messages.add(message("system", systemPrompt));
        messages.add(message("user", userPrompt));

        Map<String, Object> body = new HashMap<>();
        body.put("model", openAiModel);
        body.put("max_tokens", MAX_TOKENS);
        body.put("messages", messages);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(OPENAI_URL, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            return root.path("choices").path(0).path("message").path("content").asText("");
        } catch (Exception ex) {
            throw new UpstreamException("OpenAI request failed", ex);
        }
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> m = new HashMap<>();
        m.put("role", role);
        m.put("content", content);
        return m;
    }

    static String systemPrompt(Language language) {
        return switch (language) {
            case EN -> "You are an expert Tarot card reader with deep knowledge of traditional Tarot meanings "
                    + "and symbolism. Give insightful, supportive interpretations and connect the cards to the "
                    + "user's question. Be empowering and avoid definitive predictions. Keep the answer under "
                    + "3500 characters: one short paragraph per card, then an overall interpretation.";
            case RU -> "Вы опытный таролог с глубоким знанием традиционных значений и символики карт Таро. "
                    + "Давайте вдумчивые, поддерживающие толкования и связывайте карты с вопросом пользователя. "
                    + "Вдохновляйте и избегайте категоричных предсказаний. Уложитесь в 3500 символов: "
                    + "по короткому абзацу на карту, затем общее толкование.";
            case UK -> "Ви досвідчений таролог із глибоким знанням традиційних значень і символіки карт Таро. "
                    + "Надавайте вдумливі, підтримуючі тлумачення та пов'язуйте карти з питанням користувача. "
                    + "Надихайте та уникайте категоричних передбачень. Вкладіться в 3500 символів: "
                    + "по короткому абзацу на карту, потім загальне тлумачення.";
        };
    }

    static String readingPrompt(List<Card> cards, String question, Language language, List<String> positions) {
        StringBuilder sb = new StringBuilder();
        sb.append("Question: ").append(question).append("\n\nCards drawn:\n");
        for (int i = 0; i < cards.size(); i++) {
            String position = i < positions.size() ? positions.get(i) : "Card " + (i + 1);
            appendCard(sb, position, cards.get(i), language);
        }
        sb.append("\nWrite the reading in ").append(languageName(language)).append(". Explain each card in the ")
                .append("context of its position and the question, show how the cards relate to each other ")
                .append("and finish with guidance that addresses the question.");
        return sb.toString();
    }

    static String customPrompt(List<Card> cards, String question, Language language) {
        StringBuilder sb = new StringBuilder();
        if (StringUtils.isNotBlank(question)) {
            sb.append("User's question: ").append(question).append("\n\n");
        }
        sb.append("User's card combination:\n");
        for (int i = 0; i < cards.size(); i++) {
            appendCard(sb, "Card " + (i + 1), cards.get(i), language);
        }
        sb.append("\nWrite the interpretation in ").append(languageName(language))
                .append(". Explain what this combination suggests about ")
                .append(StringUtils.isNotBlank(question) ? "the question" : "the user's situation")
                .append(", how the cards influence each other and which themes stand out.");
        return sb.toString();
    }

    private static void appendCard(StringBuilder sb, String position, Card card, Language language) {
        sb.append(position).append(": ").append(card.getName(language));
        List<String> keywords = card.getKeywords(language);
        if (!keywords.isEmpty()) {
            sb.append(" (keywords: ").append(String.join(", ", keywords)).append(')');
        }
        sb.append('\n');
    }

    private static String languageName(Language language) {
        return switch (language) {
            case EN -> "English";
            case RU -> "Russian";
            case UK -> "Ukrainian";
        };
    }
}
