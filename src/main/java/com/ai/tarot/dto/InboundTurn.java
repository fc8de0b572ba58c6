package com.ai.tarot.dto;

import com.ai.tarot.conversation.TurnAction;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * One inbound message: either free text or a structured action, never both.
 */
@Getter
@ToString
public final class InboundTurn {

    private final String userId;
    private final String text;
    private final TurnAction action;

    private InboundTurn(String userId, String text, TurnAction action) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.text = text;
        this.action = action;
    }

    public static InboundTurn text(String userId, String text) {
        return new InboundTurn(userId, text == null ? "" : text, null);
    }

    public static InboundTurn action(String userId, TurnAction action) {
        return new InboundTurn(userId, null, Objects.requireNonNull(action, "action"));
    }

    public boolean isAction() {
        return action != null;
    }
}
