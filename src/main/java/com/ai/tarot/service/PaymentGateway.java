package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;
import com.ai.tarot.conversation.ReadingKind;
import com.ai.tarot.dto.PendingInvoice;

/**
 * Issues invoices for paid readings. The invoice payload is stored on the session and
 * a confirmation must carry it back unchanged.
 */
public interface PaymentGateway {

    PendingInvoice requestPayment(String userId, ReadingKind flow, Language language);
}
