package com.ai.tarot.service;

import com.ai.tarot.component.ResponsePhrases;
import com.ai.tarot.conversation.Language;
import com.ai.tarot.conversation.ReadingKind;
import com.ai.tarot.conversation.SessionState;
import com.ai.tarot.conversation.TurnAction;
import com.ai.tarot.dto.InboundTurn;
import com.ai.tarot.dto.TurnErrorKind;
import com.ai.tarot.dto.TurnReply;
import com.ai.tarot.entity.Reading;
import com.ai.tarot.entity.Session;
import com.ai.tarot.exception.UpstreamException;
import com.ai.tarot.support.MutableClock;
import com.ai.tarot.support.TestCards;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionStateMachineTest {

    private static final String USER = "42";

    @Mock
    private LanguageResolver languageResolver;

    @Mock
    private InterpretationGenerator generator;

    private final ResponsePhrases phrases = new ResponsePhrases();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private ExecutorService executor;
    private SessionStateMachine machine;
    private Session session;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        lenient().when(languageResolver.resolve(anyString(), any())).thenAnswer(inv -> inv.getArgument(1));
        machine = new SessionStateMachine(
                languageResolver,
                new QuestionValidator(),
                new CardMatcher(TestCards.catalog(), new CardNameNormalizer(), new FuzzyScorer()),
                new CardDrawer(TestCards.catalog(), new Random(3)),
                generator,
                new ReadingFormatter(phrases),
                new PaymentWaiverPolicy("999"),
                new InvoicePaymentGateway(phrases),
                phrases,
                executor,
                clock);
        session = Session.create(USER, Language.EN, clock.instant());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void firstReadingSkipsPayment() {
        TurnReply reply = action(TurnAction.ASK_QUESTION);

        assertEquals(SessionState.AWAITING_QUESTION, session.getState());
        assertEquals(phrases.promptQuestion(Language.EN), reply.getText());
        assertFalse(reply.isError());
        assertNull(reply.getInvoice());
    }

    @Test
    void automatedReadingIsRecordedAndSessionReturnsToIdle() {
        when(generator.generate(anyList(), anyString(), any(), anyList())).thenReturn("The path opens.");

        action(TurnAction.ASK_QUESTION);
        TurnReply reply = text("Will I find a new job this year?");

        assertFalse(reply.isError());
        assertEquals(SessionState.IDLE, reply.getState());
        assertEquals(SessionState.IDLE, session.getState());
        assertEquals(1, session.getReadingCount());
        Reading reading = session.getLastReading().orElseThrow();
        assertEquals(ReadingKind.AUTOMATED, reading.getKind());
        assertEquals(3, reading.getCardIds().size());
        assertEquals(List.of("Past", "Present", "Future"), reading.getPositionLabels());
        assertEquals("Will I find a new job this year?", reading.getQuestion());
        assertEquals("The path opens.", reading.getResultText());
        assertEquals(clock.instant(), reading.getTimestamp());
        assertTrue(reply.getText().contains("The path opens."));
        assertTrue(session.getContext().isEmpty());
        assertEquals(phrases.mainMenu(Language.EN), reply.getActions());
    }

    @Test
    void singleCardSpreadDrawsOneCard() {
        machine.setSpread("single");
        when(generator.generate(anyList(), anyString(), any(), anyList())).thenReturn("Trust yourself.");

        action(TurnAction.ASK_QUESTION);
        text("What should I focus on?");

        Reading reading = session.getLastReading().orElseThrow();
        assertEquals(1, reading.getCardIds().size());
        assertEquals(List.of("Guidance"), reading.getPositionLabels());
    }

    @Test
    void unknownSpreadFallsBackToThreeCards() {
        machine.setSpread("celtic_cross");
        when(generator.generate(anyList(), anyString(), any(), anyList())).thenReturn("The path opens.");

        action(TurnAction.ASK_QUESTION);
        TurnReply reply = text("Will I find a new job this year?");

        assertFalse(reply.isError());
        assertEquals(SessionState.IDLE, session.getState());
        assertEquals(List.of("Past", "Present", "Future"), session.getLastReading().orElseThrow().getPositionLabels());
    }

    @Test
    void secondReadingRequiresPayment() {
        recordPastReading();

        TurnReply reply = action(TurnAction.ASK_QUESTION);

        assertEquals(SessionState.AWAITING_PAYMENT, session.getState());
        assertNotNull(reply.getInvoice());
        assertEquals("reading:automated:42", reply.getInvoice().getPayload());
        assertEquals(20, reply.getInvoice().getAmount());
        assertEquals("XTR", reply.getInvoice().getCurrency());
        assertEquals("automated", session.getContext().get(Session.PENDING_FLOW));
        assertEquals("reading:automated:42", session.getContext().get(Session.INVOICE_PAYLOAD));
    }

    @Test
    void allowListedUserIsNeverAskedToPay() {
        session = Session.create("999", Language.EN, clock.instant());
        session.recordReading(Reading.custom(List.of(1), "q", "t", Language.EN, clock.instant()));

        action(TurnAction.EXPLAIN_COMBINATION);

        assertEquals(SessionState.AWAITING_CUSTOM_QUESTION, session.getState());
    }

    @Test
    void textWhileAwaitingPaymentIsRejected() {
        recordPastReading();
        action(TurnAction.EXPLAIN_COMBINATION);

        TurnReply reply = text("Is he the one for me?");

        assertEquals(TurnErrorKind.PAYMENT_PENDING, reply.getErrorKind());
        assertEquals(SessionState.AWAITING_PAYMENT, session.getState());
    }

    @Test
    void matchingPaymentResumesTheFlow() {
        recordPastReading();
        action(TurnAction.EXPLAIN_COMBINATION);

        TurnReply reply = machine.confirmPayment(session, "reading:custom:42");

        assertFalse(reply.isError());
        assertEquals(SessionState.AWAITING_CUSTOM_QUESTION, session.getState());
        assertTrue(session.getContext().isEmpty());
    }

    @Test
    void mismatchedPaymentIsIgnored() {
        recordPastReading();
        action(TurnAction.ASK_QUESTION);

        TurnReply reply = machine.confirmPayment(session, "reading:custom:42");

        assertEquals(TurnErrorKind.INVALID_STATE, reply.getErrorKind());
        assertEquals(SessionState.AWAITING_PAYMENT, session.getState());
    }

    @Test
    void paymentWithoutInvoiceIsRejected() {
        TurnReply reply = machine.confirmPayment(session, "reading:automated:42");

        assertEquals(TurnErrorKind.INVALID_STATE, reply.getErrorKind());
        assertEquals(SessionState.IDLE, session.getState());
    }

    @Test
    void customReadingKeepsRecognizedCardsAndReportsTheRest() {
        when(generator.generate(anyList(), anyString(), any(), anyList())).thenReturn("Light after dark.");

        action(TurnAction.EXPLAIN_COMBINATION);
        TurnReply prompt = text("What about my love life?");
        assertEquals(SessionState.AWAITING_CARDS, session.getState());
        assertEquals(phrases.promptCards(Language.EN), prompt.getText());

        TurnReply reply = text("Sun, Moonn, zzz");

        assertFalse(reply.isError());
        assertEquals(List.of("zzz"), reply.getUnrecognized());
        assertTrue(reply.getText().contains("zzz"));
        Reading reading = session.getLastReading().orElseThrow();
        assertEquals(ReadingKind.CUSTOM, reading.getKind());
        assertEquals(List.of(19, 18), reading.getCardIds());
        assertTrue(reading.getPositionLabels().isEmpty());
        assertEquals("What about my love life?", reading.getQuestion());
        verify(generator).generate(argThat(cards -> cards.size() == 2), eq("What about my love life?"),
                eq(Language.EN), eq(List.of()));
        assertEquals(SessionState.IDLE, session.getState());
        assertTrue(session.getContext().isEmpty());
    }

    @Test
    void noRecognizedCardsKeepsWaitingForCards() {
        action(TurnAction.EXPLAIN_COMBINATION);
        text("What about my love life?");

        TurnReply reply = text("qwerty zxcvb");

        assertEquals(TurnErrorKind.NO_CARDS_RECOGNIZED, reply.getErrorKind());
        assertEquals(SessionState.AWAITING_CARDS, session.getState());
        assertEquals("What about my love life?", session.getContext().get(Session.CUSTOM_QUESTION));
        verify(generator, never()).generate(anyList(), anyString(), any(), anyList());
    }

    @Test
    void cardsAreNotUsedForLanguageDetection() {
        when(generator.generate(anyList(), anyString(), any(), anyList())).thenReturn("ok");
        action(TurnAction.EXPLAIN_COMBINATION);
        text("What about my love life?");

        text("Солнце, Луна");

        verify(languageResolver, never()).resolve(eq("Солнце, Луна"), any());
        assertEquals(Language.EN, session.getLastReading().orElseThrow().getLanguage());
    }

    @Test
    void invalidQuestionKeepsState() {
        action(TurnAction.ASK_QUESTION);

        TurnReply tooShort = text("Why");
        TurnReply tooLong = text("x".repeat(501));

        assertEquals(TurnErrorKind.QUESTION_TOO_SHORT, tooShort.getErrorKind());
        assertEquals(TurnErrorKind.QUESTION_TOO_LONG, tooLong.getErrorKind());
        assertEquals(SessionState.AWAITING_QUESTION, session.getState());
        verify(generator, never()).generate(anyList(), anyString(), any(), anyList());
    }

    @Test
    void generatorFailureReturnsToIdleWithoutReading() {
        when(generator.generate(anyList(), anyString(), any(), anyList()))
                .thenThrow(new UpstreamException("backend down"));

        action(TurnAction.ASK_QUESTION);
        TurnReply reply = text("Will I find a new job this year?");

        assertEquals(TurnErrorKind.UPSTREAM_FAILURE, reply.getErrorKind());
        assertEquals(SessionState.IDLE, session.getState());
        assertEquals(0, session.getReadingCount());
        assertTrue(session.getContext().isEmpty());
    }

    @Test
    void blankInterpretationCountsAsFailure() {
        when(generator.generate(anyList(), anyString(), any(), anyList())).thenReturn("  ");

        action(TurnAction.ASK_QUESTION);
        TurnReply reply = text("Will I find a new job this year?");

        assertEquals(TurnErrorKind.UPSTREAM_FAILURE, reply.getErrorKind());
        assertEquals(0, session.getReadingCount());
    }

    @Test
    void slowGeneratorTimesOut() {
        ReflectionTestUtils.setField(machine, "generationTimeout", Duration.ofMillis(100));
        when(generator.generate(anyList(), anyString(), any(), anyList())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return "too late";
        });

        action(TurnAction.ASK_QUESTION);
        TurnReply reply = text("Will I find a new job this year?");

        assertEquals(TurnErrorKind.UPSTREAM_FAILURE, reply.getErrorKind());
        assertEquals(SessionState.IDLE, session.getState());
        assertEquals(0, session.getReadingCount());
    }

    @Test
    void startingAnotherFlowMidwayIsRejectedWithReprompt() {
        action(TurnAction.EXPLAIN_COMBINATION);
        text("What about my love life?");

        TurnReply reply = action(TurnAction.ASK_QUESTION);

        assertEquals(TurnErrorKind.INVALID_STATE, reply.getErrorKind());
        assertEquals(phrases.promptCards(Language.EN), reply.getText());
        assertEquals(SessionState.AWAITING_CARDS, session.getState());
    }

    @Test
    void startCommandResetsButKeepsHistory() {
        recordPastReading();
        action(TurnAction.ASK_QUESTION);
        assertEquals(SessionState.AWAITING_PAYMENT, session.getState());

        TurnReply reply = text("/start");

        assertEquals(SessionState.IDLE, session.getState());
        assertTrue(session.getContext().isEmpty());
        assertEquals(1, session.getReadingCount());
        assertEquals(phrases.welcome(Language.EN), reply.getText());
        assertEquals(phrases.mainMenu(Language.EN), reply.getActions());
    }

    @Test
    void freeTextInIdleShowsMenu() {
        TurnReply reply = text("Hello there");

        assertEquals(TurnErrorKind.INVALID_STATE, reply.getErrorKind());
        assertEquals(phrases.mainMenu(Language.EN), reply.getActions());
    }

    @Test
    void helpKeepsState() {
        action(TurnAction.ASK_QUESTION);

        TurnReply reply = action(TurnAction.HELP);

        assertEquals(phrases.help(Language.EN), reply.getText());
        assertEquals(SessionState.AWAITING_QUESTION, session.getState());
    }

    @Test
    void detectedLanguageIsAppliedToTheReading() {
        when(generator.generate(anyList(), anyString(), any(), anyList())).thenReturn("Путь открыт.");
        when(languageResolver.resolve(eq("Найду ли я новую работу?"), any())).thenReturn(Language.RU);

        action(TurnAction.ASK_QUESTION);
        TurnReply reply = text("Найду ли я новую работу?");

        assertEquals(Language.RU, session.getLanguage());
        Reading reading = session.getLastReading().orElseThrow();
        assertEquals(List.of("Прошлое", "Настоящее", "Будущее"), reading.getPositionLabels());
        assertTrue(reply.getText().contains("Ваше гадание на Таро"));
    }

    private TurnReply action(TurnAction action) {
        return machine.handle(session, InboundTurn.action(USER, action));
    }

    private TurnReply text(String text) {
        return machine.handle(session, InboundTurn.text(USER, text));
    }

    private void recordPastReading() {
        session.recordReading(Reading.custom(List.of(1), "old question", "old text", Language.EN, clock.instant()));
    }
}
