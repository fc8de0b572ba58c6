package com.ai.tarot.dto;

import com.ai.tarot.conversation.SessionState;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outbound result of one turn. {@code errorKind} is null for a normal reply; {@code invoice}
 * is set when the transport has to ask the user to pay.
 */
@Getter
@ToString(exclude = "text")
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TurnReply {

    private final String userId;
    private final String text;
    private final List<SuggestedAction> actions;
    private final SessionState state;
    private final TurnErrorKind errorKind;
    private final List<String> unrecognized;
    private final PendingInvoice invoice;

    private TurnReply(String userId, String text, List<SuggestedAction> actions, SessionState state,
                      TurnErrorKind errorKind, List<String> unrecognized, PendingInvoice invoice) {
        this.userId = userId;
        this.text = text;
        this.actions = actions == null ? List.of() : List.copyOf(actions);
        this.state = state;
        this.errorKind = errorKind;
        this.unrecognized = unrecognized == null ? List.of() : List.copyOf(unrecognized);
        this.invoice = invoice;
    }

    public static TurnReply message(String userId, String text, SessionState state) {
        return new TurnReply(userId, text, null, state, null, null, null);
    }

    public static TurnReply withActions(String userId, String text, List<SuggestedAction> actions, SessionState state) {
        return new TurnReply(userId, text, actions, state, null, null, null);
    }

    public static TurnReply error(String userId, TurnErrorKind kind, String text, SessionState state) {
        return new TurnReply(userId, text, null, state, kind, null, null);
    }

    public static TurnReply error(String userId, TurnErrorKind kind, String text, List<SuggestedAction> actions,
                                  SessionState state) {
        return new TurnReply(userId, text, actions, state, kind, null, null);
    }

    public static TurnReply invoice(String userId, String text, PendingInvoice invoice, SessionState state) {
        return new TurnReply(userId, text, null, state, null, null, invoice);
    }

    /** A reading that went through even though some submitted names did not resolve. */
    public static TurnReply reading(String userId, String text, List<String> unrecognized,
                                    List<SuggestedAction> actions, SessionState state) {
        return new TurnReply(userId, text, actions, state, null, unrecognized, null);
    }

    @JsonIgnore
    public boolean isError() {
        return errorKind != null;
    }
}
