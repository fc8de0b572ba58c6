package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;
import com.ai.tarot.entity.Card;
import com.ai.tarot.exception.UpstreamException;
import com.ai.tarot.support.TestCards;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LlmInterpretationServiceTest {

    private static final List<String> POSITIONS = List.of("Past", "Present", "Future");

    private LlmInterpretationService service;
    private MockRestServiceServer server;
    private List<Card> cards;

    @BeforeEach
    void setUp() {
        service = new LlmInterpretationService(new RestTemplateBuilder(), Duration.ofSeconds(30));
        ReflectionTestUtils.setField(service, "anthropicModel", "claude-test");
        ReflectionTestUtils.setField(service, "openAiModel", "gpt-test");
        RestTemplate restTemplate = (RestTemplate) ReflectionTestUtils.getField(service, "restTemplate");
        server = MockRestServiceServer.bindTo(restTemplate).build();
        cards = TestCards.byIds(0, 1, 13);
    }

    @Test
    void anthropicIsPreferredWhenKeyPresent() {
        ReflectionTestUtils.setField(service, "anthropicApiKey", "a-key");
        ReflectionTestUtils.setField(service, "openAiApiKey", "o-key");
        server.expect(requestTo(LlmInterpretationService.ANTHROPIC_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-api-key", "a-key"))
                .andExpect(header("anthropic-version", "2023-06-01"))
                .andExpect(jsonPath("$.model").value("claude-test"))
                .andExpect(jsonPath("$.max_tokens").value(2000))
                .andRespond(withSuccess("{\"content\":[{\"type\":\"text\",\"text\":\"  A new beginning.  \"}]}",
                        MediaType.APPLICATION_JSON));

        String text = service.generate(cards, "Will I move?", Language.EN, POSITIONS);

        assertEquals("A new beginning.", text);
        server.verify();
    }

    @Test
    void openAiIsUsedWithoutAnthropicKey() {
        ReflectionTestUtils.setField(service, "openAiApiKey", "o-key");
        server.expect(requestTo(LlmInterpretationService.OPENAI_URL))
                .andExpect(header("Authorization", "Bearer o-key"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"Перемены.\"}}]}",
                        MediaType.APPLICATION_JSON));

        assertEquals("Перемены.", service.generate(cards, "Что будет?", Language.RU, POSITIONS));
        server.verify();
    }

    @Test
    void missingKeysFailUpstream() {
        assertThrows(UpstreamException.class, () -> service.generate(cards, "q?", Language.EN, POSITIONS));
    }

    @Test
    void serverErrorFailsUpstream() {
        ReflectionTestUtils.setField(service, "anthropicApiKey", "a-key");
        server.expect(requestTo(LlmInterpretationService.ANTHROPIC_URL)).andRespond(withServerError());

        assertThrows(UpstreamException.class, () -> service.generate(cards, "q?", Language.EN, POSITIONS));
    }

    @Test
    void emptyReplyFailsUpstream() {
        ReflectionTestUtils.setField(service, "anthropicApiKey", "a-key");
        server.expect(requestTo(LlmInterpretationService.ANTHROPIC_URL))
                .andRespond(withSuccess("{\"content\":[]}", MediaType.APPLICATION_JSON));

        assertThrows(UpstreamException.class, () -> service.generate(cards, "q?", Language.EN, POSITIONS));
    }

    @Test
    void readingPromptListsPositionsAndLanguage() {
        String prompt = LlmInterpretationService.readingPrompt(cards, "Will I move?", Language.UK, POSITIONS);

        assertTrue(prompt.startsWith("Question: Will I move?"));
        assertTrue(prompt.contains("Past: "));
        assertTrue(prompt.contains("Future: "));
        assertTrue(prompt.contains("Ukrainian"));
    }

    @Test
    void customPromptOmitsBlankQuestion() {
        String prompt = LlmInterpretationService.customPrompt(cards, "", Language.EN);

        assertTrue(prompt.startsWith("User's card combination:"));
        assertTrue(prompt.contains("Card 3: "));
    }
}
