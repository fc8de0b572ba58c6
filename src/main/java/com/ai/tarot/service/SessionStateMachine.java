package com.ai.tarot.service;

import com.ai.tarot.component.ResponsePhrases;
import com.ai.tarot.conversation.Language;
import com.ai.tarot.conversation.ReadingKind;
import com.ai.tarot.conversation.SessionState;
import com.ai.tarot.conversation.SessionTransitions;
import com.ai.tarot.conversation.TransitionEvent;
import com.ai.tarot.conversation.TurnAction;
import com.ai.tarot.dto.CardResolution;
import com.ai.tarot.dto.InboundTurn;
import com.ai.tarot.dto.PendingInvoice;
import com.ai.tarot.dto.TurnErrorKind;
import com.ai.tarot.dto.TurnReply;
import com.ai.tarot.entity.Card;
import com.ai.tarot.entity.Reading;
import com.ai.tarot.entity.Session;
import com.ai.tarot.exception.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Applies one turn to a session. Every state change goes through {@link SessionTransitions};
 * the caller holds the user's lock and persists the session afterwards.
 */
@Service
public class SessionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(SessionStateMachine.class);

    private final LanguageResolver languageResolver;
    private final QuestionValidator questionValidator;
    private final CardMatcher cardMatcher;
    private final CardDrawer cardDrawer;
    private final InterpretationGenerator generator;
    private final ReadingFormatter formatter;
    private final PaymentWaiverPolicy waiverPolicy;
    private final PaymentGateway paymentGateway;
    private final ResponsePhrases phrases;
    private final ExecutorService generationExecutor;
    private final Clock clock;

    @Value("${app.generation.timeout:30s}")
    private Duration generationTimeout = Duration.ofSeconds(30);

    private Spread spread = Spread.THREE_CARD;

    public SessionStateMachine(LanguageResolver languageResolver,
                               QuestionValidator questionValidator,
                               CardMatcher cardMatcher,
                               CardDrawer cardDrawer,
                               InterpretationGenerator generator,
                               ReadingFormatter formatter,
                               PaymentWaiverPolicy waiverPolicy,
                               PaymentGateway paymentGateway,
                               ResponsePhrases phrases,
                               @Qualifier("generationExecutor") ExecutorService generationExecutor,
                               Clock clock) {
        this.languageResolver = languageResolver;
        this.questionValidator = questionValidator;
        this.cardMatcher = cardMatcher;
        this.cardDrawer = cardDrawer;
        this.generator = generator;
        this.formatter = formatter;
        this.waiverPolicy = waiverPolicy;
        this.paymentGateway = paymentGateway;
        this.phrases = phrases;
        this.generationExecutor = generationExecutor;
        this.clock = clock;
    }

    /**
     * Unknown spread names fall back to the three-card spread.
     */
    @Value("${app.reading.spread:three_card}")
    void setSpread(String value) {
        this.spread = Spread.fromConfig(value).orElseGet(() -> {
            log.warn("Unknown reading spread '{}', using {}", value, Spread.THREE_CARD);
            return Spread.THREE_CARD;
        });
    }

    public TurnReply handle(Session session, InboundTurn turn) {
        if (turn.isAction()) {
            return handleAction(session, turn.getAction());
        }
        String text = turn.getText().trim();
        if (text.startsWith("/")) {
            Optional<TurnAction> command = TurnAction.fromId(text.split("\\s+", 2)[0]);
            if (command.isPresent()) {
                return handleAction(session, command.get());
            }
        }
        return handleText(session, turn.getText());
    }

    /**
     * Payment confirmation from the payment backend. The payload has to match the invoice
     * issued for the flow the user started.
     */
    public TurnReply confirmPayment(Session session, String payload) {
        String userId = session.getUserId();
        Language language = session.getLanguage();
        Optional<String> expected = session.getContextValue(Session.INVOICE_PAYLOAD);
        if (session.getState() != SessionState.AWAITING_PAYMENT || expected.isEmpty()
                || !expected.get().equals(payload)) {
            log.warn("Unexpected payment confirmation for user {} in state {}", userId, session.getState());
            return TurnReply.error(userId, TurnErrorKind.INVALID_STATE, phrases.paymentNotExpected(language),
                    session.getState());
        }
        ReadingKind flow = ReadingKind.fromValue(session.getContextValue(Session.PENDING_FLOW)
                .orElse(ReadingKind.AUTOMATED.getValue()));
        apply(session, TransitionEvent.paymentConfirmed(flow));
        session.clearTransientContext();
        log.info("Payment confirmed for user {} ({})", userId, flow.getValue());
        return TurnReply.message(userId,
                phrases.paymentConfirmed(language) + "\n\n" + phrases.promptQuestion(language),
                session.getState());
    }

    private TurnReply handleAction(Session session, TurnAction action) {
        String userId = session.getUserId();
        Language language = session.getLanguage();
        switch (action) {
            case START:
                apply(session, TransitionEvent.RESET);
                session.clearTransientContext();
                return TurnReply.withActions(userId, phrases.welcome(language), phrases.mainMenu(language),
                        session.getState());
            case HELP:
                return session.getState() == SessionState.IDLE
                        ? TurnReply.withActions(userId, phrases.help(language), phrases.mainMenu(language), session.getState())
                        : TurnReply.message(userId, phrases.help(language), session.getState());
            case ASK_QUESTION:
                return startFlow(session, ReadingKind.AUTOMATED);
            case EXPLAIN_COMBINATION:
                return startFlow(session, ReadingKind.CUSTOM);
            default:
                throw new IllegalArgumentException("Unhandled action " + action);
        }
    }

    private TurnReply startFlow(Session session, ReadingKind flow) {
        String userId = session.getUserId();
        Language language = session.getLanguage();
        if (session.getState() != SessionState.IDLE) {
            log.debug("User {} tried to start {} while {}", userId, flow.getValue(), session.getState());
            return TurnReply.error(userId, TurnErrorKind.INVALID_STATE,
                    phrases.reprompt(session.getState(), language), session.getState());
        }

        boolean waived = waiverPolicy.isWaived(session);
        if (waived) {
            apply(session, TransitionEvent.startFlow(flow, true));
            return TurnReply.message(userId, phrases.promptQuestion(language), session.getState());
        }

        PendingInvoice invoice;
        try {
            invoice = paymentGateway.requestPayment(userId, flow, language);
        } catch (UpstreamException e) {
            log.error("Could not issue invoice for user {}", userId, e);
            return TurnReply.error(userId, TurnErrorKind.UPSTREAM_FAILURE,
                    phrases.error(TurnErrorKind.UPSTREAM_FAILURE, language), phrases.mainMenu(language), session.getState());
        }
        apply(session, TransitionEvent.startFlow(flow, false));
        session.putContext(Session.PENDING_FLOW, flow.getValue());
        session.putContext(Session.INVOICE_PAYLOAD, invoice.getPayload());
        return TurnReply.invoice(userId, phrases.paymentRequired(language, invoice.getAmount()), invoice,
                session.getState());
    }

    private TurnReply handleText(Session session, String text) {
        String userId = session.getUserId();
        if (session.getState() != SessionState.AWAITING_CARDS) {
            Language resolved = languageResolver.resolve(text, session.getLanguage());
            if (resolved != session.getLanguage()) {
                log.debug("User {} language {} -> {}", userId, session.getLanguage(), resolved);
                session.setLanguage(resolved);
            }
        }
        Language language = session.getLanguage();

        return switch (session.getState()) {
            case IDLE -> TurnReply.error(userId, TurnErrorKind.INVALID_STATE,
                    phrases.error(TurnErrorKind.INVALID_STATE, language), phrases.mainMenu(language), session.getState());
            case AWAITING_PAYMENT -> rejection(session, TurnErrorKind.PAYMENT_PENDING);
            case AWAITING_QUESTION -> acceptQuestion(session, text);
            case AWAITING_CUSTOM_QUESTION -> acceptCustomQuestion(session, text);
            case AWAITING_CARDS -> acceptCards(session, text);
            case PROCESSING -> rejection(session, TurnErrorKind.SESSION_BUSY);
        };
    }

    private TurnReply acceptQuestion(Session session, String text) {
        Optional<TurnErrorKind> invalid = questionValidator.validate(text);
        if (invalid.isPresent()) {
            return rejection(session, invalid.get());
        }
        String question = text.trim();
        apply(session, TransitionEvent.QUESTION_ACCEPTED);

        Language language = session.getLanguage();
        List<Card> cards = cardDrawer.draw(spread.size());
        List<String> positions = spread.positionLabels(language);

        String interpretation;
        try {
            interpretation = generate(cards, question, language, positions);
        } catch (UpstreamException e) {
            return failProcessing(session, e);
        }

        String rendered = formatter.formatAutomated(question, cards, positions, interpretation, language);
        session.recordReading(Reading.automated(ids(cards), question, positions, interpretation, language, clock.instant()));
        return completeProcessing(session, rendered, List.of());
    }

    private TurnReply acceptCustomQuestion(Session session, String text) {
        Optional<TurnErrorKind> invalid = questionValidator.validate(text);
        if (invalid.isPresent()) {
            return rejection(session, invalid.get());
        }
        session.putContext(Session.CUSTOM_QUESTION, text.trim());
        apply(session, TransitionEvent.CUSTOM_QUESTION_ACCEPTED);
        return TurnReply.message(session.getUserId(), phrases.promptCards(session.getLanguage()), session.getState());
    }

    private TurnReply acceptCards(Session session, String text) {
        Language language = session.getLanguage();
        CardResolution resolution = cardMatcher.resolveAll(text, language);
        if (!resolution.hasCards()) {
            log.info("No cards recognized for user {} in '{}'", session.getUserId(), text);
            return rejection(session, TurnErrorKind.NO_CARDS_RECOGNIZED);
        }
        apply(session, TransitionEvent.CARDS_RESOLVED);

        String question = session.getContextValue(Session.CUSTOM_QUESTION).orElse("");
        List<Card> cards = resolution.getCards();
        String interpretation;
        try {
            interpretation = generate(cards, question, language, List.of());
        } catch (UpstreamException e) {
            return failProcessing(session, e);
        }

        String rendered = formatter.formatCustom(question, cards, interpretation, language);
        if (!resolution.getUnrecognized().isEmpty()) {
            rendered = rendered + "\n\n" + phrases.unrecognizedCards(language, resolution.getUnrecognized());
        }
        session.recordReading(Reading.custom(resolution.getCardIds(), question, interpretation, language, clock.instant()));
        return completeProcessing(session, rendered, resolution.getUnrecognized());
    }

    private String generate(List<Card> cards, String question, Language language, List<String> positions) {
        CompletableFuture<String> future = CompletableFuture.supplyAsync(
                () -> generator.generate(cards, question, language, positions), generationExecutor);
        String text;
        try {
            text = future.get(generationTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new UpstreamException("Interpretation timed out after " + generationTimeout, e);
        } catch (ExecutionException e) {
            throw new UpstreamException("Interpretation failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Interrupted while waiting for interpretation", e);
        }
        if (text == null || text.isBlank()) {
            throw new UpstreamException("Interpretation was empty");
        }
        return text;
    }

    private TurnReply completeProcessing(Session session, String rendered, List<String> unrecognized) {
        session.clearTransientContext();
        apply(session, TransitionEvent.PROCESSING_SUCCEEDED);
        log.info("Reading #{} delivered to user {}", session.getReadingCount(), session.getUserId());
        return TurnReply.reading(session.getUserId(), rendered, unrecognized,
                phrases.mainMenu(session.getLanguage()), session.getState());
    }

    private TurnReply failProcessing(Session session, UpstreamException e) {
        log.error("Reading failed for user {}", session.getUserId(), e);
        session.clearTransientContext();
        apply(session, TransitionEvent.PROCESSING_FAILED);
        Language language = session.getLanguage();
        return TurnReply.error(session.getUserId(), TurnErrorKind.UPSTREAM_FAILURE,
                phrases.error(TurnErrorKind.UPSTREAM_FAILURE, language), phrases.mainMenu(language), session.getState());
    }

    private TurnReply rejection(Session session, TurnErrorKind kind) {
        return TurnReply.error(session.getUserId(), kind, phrases.error(kind, session.getLanguage()), session.getState());
    }

    private static void apply(Session session, TransitionEvent event) {
        SessionState from = session.getState();
        SessionState to = SessionTransitions.next(from, event).orElseThrow(() ->
                new IllegalStateException("No transition from " + from + " on " + event));
        session.setState(to);
        log.debug("User {}: {} --{}--> {}", session.getUserId(), from, event, to);
    }

    private static List<Integer> ids(List<Card> cards) {
        return cards.stream().map(Card::getId).collect(Collectors.toList());
    }
}
