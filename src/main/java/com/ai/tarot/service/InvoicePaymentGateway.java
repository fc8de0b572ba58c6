package com.ai.tarot.service;

import com.ai.tarot.component.ResponsePhrases;
import com.ai.tarot.conversation.Language;
import com.ai.tarot.conversation.ReadingKind;
import com.ai.tarot.dto.PendingInvoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Telegram Stars invoices. The transport sends the invoice to the user; this side only
 * prices it and fixes the payload.
 */
@Service
public class InvoicePaymentGateway implements PaymentGateway {

    private static final Logger log = LoggerFactory.getLogger(InvoicePaymentGateway.class);

    static final String CURRENCY = "XTR";

    private final ResponsePhrases phrases;

    @Value("${app.payment.stars-per-reading:20}")
    private int starsPerReading = 20;

    public InvoicePaymentGateway(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    @Override
    public PendingInvoice requestPayment(String userId, ReadingKind flow, Language language) {
        PendingInvoice invoice = PendingInvoice.builder()
                .userId(userId)
                .flow(flow)
                .payload(payload(flow, userId))
                .title(phrases.invoiceTitle(language))
                .description(phrases.invoiceDescription(language, flow))
                .currency(CURRENCY)
                .amount(starsPerReading)
                .build();
        log.info("Invoice issued to user {} for {} {} ({})", userId, starsPerReading, CURRENCY, flow.getValue());
        return invoice;
    }

    static String payload(ReadingKind flow, String userId) {
        return "reading:" + flow.getValue() + ":" + userId;
    }
}
