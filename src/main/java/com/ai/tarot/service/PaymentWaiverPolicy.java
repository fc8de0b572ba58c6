package com.ai.tarot.service;

import com.ai.tarot.entity.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Decides whether a new reading is free: allow-listed users always, everyone else only
 * for their first reading.
 */
@Component
public class PaymentWaiverPolicy {

    private static final Logger log = LoggerFactory.getLogger(PaymentWaiverPolicy.class);

    private final Set<String> allowList;

    public PaymentWaiverPolicy(@Value("${app.payment.allow-list:}") String allowList) {
        this.allowList = parse(allowList);
        if (!this.allowList.isEmpty()) {
            log.info("Payment allow-list has {} user(s)", this.allowList.size());
        }
    }

    public boolean isWaived(Session session) {
        return isAllowListed(session.getUserId()) || session.getReadingCount() == 0;
    }

    boolean isAllowListed(String userId) {
        return allowList.contains(userId);
    }

    static Set<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Collections.emptySet();
        }
        Set<String> ids = new HashSet<>();
        for (String part : raw.split(",")) {
            String id = part.trim();
            if (!id.isEmpty()) {
                ids.add(id);
            }
        }
        return Collections.unmodifiableSet(ids);
    }
}
