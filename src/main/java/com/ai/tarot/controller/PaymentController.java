package com.ai.tarot.controller;

import com.ai.tarot.dto.PaymentConfirmRequest;
import com.ai.tarot.dto.TurnReply;
import com.ai.tarot.service.ConversationOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/payments")
public class PaymentController {

    private static final Logger log = LoggerFactory.getLogger(PaymentController.class);

    private final ConversationOrchestrator orchestrator;

    public PaymentController(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/confirm")
    public ResponseEntity<?> confirm(@RequestBody PaymentConfirmRequest request) {
        if (!StringUtils.hasText(request.getUserId()) || !StringUtils.hasText(request.getPayload())) {
            return ResponseEntity.badRequest().body(Map.of("error", "userId and payload are required"));
        }
        log.info("Payment confirmation for user {}", request.getUserId());
        TurnReply reply = orchestrator.confirmPayment(request.getUserId().trim(), request.getPayload().trim());
        return ResponseEntity.ok(reply);
    }
}
