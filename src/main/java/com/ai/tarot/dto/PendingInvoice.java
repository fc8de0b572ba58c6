package com.ai.tarot.dto;

import com.ai.tarot.conversation.ReadingKind;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class PendingInvoice {

    private final String userId;
    private final ReadingKind flow;
    private final String payload;
    private final String title;
    private final String description;
    private final String currency;
    private final int amount;
}
