package com.ai.tarot.service;

import com.ai.tarot.component.ResponsePhrases;
import com.ai.tarot.conversation.Language;
import com.ai.tarot.dto.AdmissionDecision;
import com.ai.tarot.dto.InboundTurn;
import com.ai.tarot.dto.TurnErrorKind;
import com.ai.tarot.dto.TurnReply;
import com.ai.tarot.entity.Session;
import com.ai.tarot.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Function;

/**
 * Single entry for conversation turns: admission gate first, then load, dispatch and save
 * of the user's session while holding that user's lock.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final RateLimiter rateLimiter;
    private final SessionService sessionService;
    private final UserLockRegistry locks;
    private final SessionStateMachine stateMachine;
    private final ResponsePhrases phrases;

    @Value("${app.turn.lock-timeout:45s}")
    private Duration lockTimeout = Duration.ofSeconds(45);

    public ConversationOrchestrator(RateLimiter rateLimiter,
                                    SessionService sessionService,
                                    UserLockRegistry locks,
                                    SessionStateMachine stateMachine,
                                    ResponsePhrases phrases) {
        this.rateLimiter = rateLimiter;
        this.sessionService = sessionService;
        this.locks = locks;
        this.stateMachine = stateMachine;
        this.phrases = phrases;
    }

    public TurnReply process(InboundTurn turn) {
        String userId = turn.getUserId();
        AdmissionDecision admission = rateLimiter.tryAcquire(userId);
        if (!admission.isAdmitted()) {
            Language language = languageOf(userId);
            logFlow(userId, "rejected", "rate-limit");
            return TurnReply.error(userId, TurnErrorKind.ADMISSION_REJECTED,
                    phrases.rateLimited(language, admission.getRetryAfterSeconds()), null);
        }
        return withSession(userId, session -> stateMachine.handle(session, turn));
    }

    /**
     * Payment confirmations are not user messages and skip the admission gate.
     */
    public TurnReply confirmPayment(String userId, String payload) {
        return withSession(userId, session -> stateMachine.confirmPayment(session, payload));
    }

    private TurnReply withSession(String userId, Function<Session, TurnReply> step) {
        UserLockRegistry.Handle handle;
        try {
            handle = locks.tryLock(userId, lockTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return busy(userId);
        }
        if (handle == null) {
            log.warn("[{}] previous turn still running after {}", userId, lockTimeout);
            return busy(userId);
        }

        try (handle) {
            Session session = sessionService.getOrCreate(userId);
            TurnReply reply = step.apply(session);
            sessionService.save(session);
            logFlow(userId, reply.isError() ? reply.getErrorKind().name() : "ok", reply.getState().name());
            return reply;
        } catch (StorageUnavailableException e) {
            log.error("[{}] session storage failed", userId, e);
            return TurnReply.error(userId, TurnErrorKind.UPSTREAM_FAILURE,
                    phrases.error(TurnErrorKind.UPSTREAM_FAILURE, Language.DEFAULT), null);
        }
    }

    private TurnReply busy(String userId) {
        return TurnReply.error(userId, TurnErrorKind.SESSION_BUSY,
                phrases.error(TurnErrorKind.SESSION_BUSY, languageOf(userId)), null);
    }

    private Language languageOf(String userId) {
        try {
            return sessionService.currentLanguage(userId);
        } catch (StorageUnavailableException e) {
            log.warn("[{}] cannot read session language: {}", userId, e.getMessage());
            return Language.DEFAULT;
        }
    }

    private void logFlow(String userId, String outcome, String state) {
        log.debug("[{}] turn outcome={} state={}", userId, outcome, state);
    }
}
