package com.ai.tarot.controller;

import com.ai.tarot.conversation.TurnAction;
import com.ai.tarot.dto.InboundTurn;
import com.ai.tarot.dto.TurnReply;
import com.ai.tarot.dto.TurnRequest;
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
import java.util.Optional;

/**
 * Entry point for the chat transport adapter: one request per inbound message or button press.
 */
@RestController
@RequestMapping("/api")
public class TurnController {

    private static final Logger log = LoggerFactory.getLogger(TurnController.class);

    private final ConversationOrchestrator orchestrator;

    public TurnController(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/turns")
    public ResponseEntity<?> turn(@RequestBody TurnRequest request) {
        if (!StringUtils.hasText(request.getUserId())) {
            return ResponseEntity.badRequest().body(Map.of("error", "userId is required"));
        }
        String userId = request.getUserId().trim();

        InboundTurn turn;
        if (StringUtils.hasText(request.getAction())) {
            Optional<TurnAction> action = TurnAction.fromId(request.getAction().trim());
            if (action.isEmpty()) {
                return ResponseEntity.badRequest().body(Map.of("error", "unknown action: " + request.getAction()));
            }
            turn = InboundTurn.action(userId, action.get());
        } else if (StringUtils.hasText(request.getText())) {
            turn = InboundTurn.text(userId, request.getText());
        } else {
            return ResponseEntity.badRequest().body(Map.of("error", "text or action is required"));
        }

        log.info("Turn from user {} ({})", userId, turn.isAction() ? turn.getAction().getId() : "text");
        TurnReply reply = orchestrator.process(turn);
        return ResponseEntity.ok(reply);
    }
}
