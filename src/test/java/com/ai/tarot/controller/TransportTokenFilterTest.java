package com.ai.tarot.controller;

import com.ai.tarot.conversation.SessionState;
import com.ai.tarot.dto.TurnReply;
import com.ai.tarot.service.ConversationOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TurnController.class)
@TestPropertySource(properties = "app.transport.token=s3cret")
class TransportTokenFilterTest {

    private static final String BODY = "{\"userId\":\"42\",\"text\":\"hello\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationOrchestrator orchestrator;

    @Test
    void requestWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/turns").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void requestWithWrongTokenIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/turns")
                        .header(TransportTokenFilter.HEADER, "guess")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void requestWithTokenPasses() throws Exception {
        when(orchestrator.process(any())).thenReturn(TurnReply.message("42", "hi", SessionState.IDLE));

        mockMvc.perform(post("/api/turns")
                        .header(TransportTokenFilter.HEADER, "s3cret")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk());
    }
}
