package com.ai.tarot.component;

import com.ai.tarot.conversation.Language;
import com.ai.tarot.conversation.ReadingKind;
import com.ai.tarot.conversation.SessionState;
import com.ai.tarot.conversation.TurnAction;
import com.ai.tarot.dto.SuggestedAction;
import com.ai.tarot.dto.TurnErrorKind;
import com.ai.tarot.service.QuestionValidator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * User-facing text in the three supported languages. Markdown, as the chat transport renders it.
 */
@Component
public class ResponsePhrases {

    public String welcome(Language language) {
        return switch (language) {
            case EN -> "🔮 *Welcome to the Tarot reader!*\n\n"
                    + "Ask a question and I will draw a three-card spread, or send me the cards you drew "
                    + "yourself and I will explain the combination.\n\nYour first reading is free.";
            case RU -> "🔮 *Добро пожаловать к тарологу!*\n\n"
                    + "Задайте вопрос, и я сделаю расклад из трёх карт, или пришлите карты, которые вы вытянули "
                    + "сами, и я объясню их сочетание.\n\nПервое гадание бесплатно.";
            case UK -> "🔮 *Ласкаво просимо до таролога!*\n\n"
                    + "Поставте питання, і я зроблю розклад з трьох карт, або надішліть карти, які ви витягли "
                    + "самі, і я поясню їхнє поєднання.\n\nПерше ворожіння безкоштовне.";
        };
    }

    public String help(Language language) {
        return switch (language) {
            case EN -> "*How it works*\n\n"
                    + "• *Ask a question*: send your question and get a Past / Present / Future spread.\n"
                    + "• *Explain my cards*: send your question, then the card names separated by commas, "
                    + "for example: The Sun, Three of Cups, Death.\n\n"
                    + "Send /start at any time to return to the menu.";
            case RU -> "*Как это работает*\n\n"
                    + "• *Задать вопрос*: отправьте вопрос и получите расклад Прошлое / Настоящее / Будущее.\n"
                    + "• *Объяснить мои карты*: отправьте вопрос, затем названия карт через запятую, "
                    + "например: Солнце, Тройка Кубков, Смерть.\n\n"
                    + "Отправьте /start в любой момент, чтобы вернуться в меню.";
            case UK -> "*Як це працює*\n\n"
                    + "• *Поставити питання*: надішліть питання й отримайте розклад Минуле / Теперішнє / Майбутнє.\n"
                    + "• *Пояснити мої карти*: надішліть питання, потім назви карт через кому, "
                    + "наприклад: Сонце, Трійка Кубків, Смерть.\n\n"
                    + "Надішліть /start будь-коли, щоб повернутися до меню.";
        };
    }

    public List<SuggestedAction> mainMenu(Language language) {
        return List.of(
                new SuggestedAction(TurnAction.ASK_QUESTION.getId(), askQuestionButton(language)),
                new SuggestedAction(TurnAction.EXPLAIN_COMBINATION.getId(), explainCombinationButton(language)));
    }

    private String askQuestionButton(Language language) {
        return switch (language) {
            case EN -> "🔮 Ask a question";
            case RU -> "🔮 Задать вопрос";
            case UK -> "🔮 Поставити питання";
        };
    }

    private String explainCombinationButton(Language language) {
        return switch (language) {
            case EN -> "🃏 Explain my cards";
            case RU -> "🃏 Объяснить мои карты";
            case UK -> "🃏 Пояснити мої карти";
        };
    }

    public String promptQuestion(Language language) {
        return switch (language) {
            case EN -> "What would you like to ask the cards? Send your question as one message.";
            case RU -> "О чём вы хотите спросить карты? Отправьте вопрос одним сообщением.";
            case UK -> "Про що ви хочете запитати карти? Надішліть питання одним повідомленням.";
        };
    }

    public String promptCards(Language language) {
        return switch (language) {
            case EN -> "Now send the cards you drew, separated by commas.\nFor example: The Sun, Three of Cups, Death";
            case RU -> "Теперь пришлите карты, которые вы вытянули, через запятую.\nНапример: Солнце, Тройка Кубков, Смерть";
            case UK -> "Тепер надішліть карти, які ви витягли, через кому.\nНаприклад: Сонце, Трійка Кубків, Смерть";
        };
    }

    public String paymentRequired(Language language, int amount) {
        return switch (language) {
            case EN -> "Your free reading has been used. Each new reading costs " + amount + " ⭐. "
                    + "Please pay the invoice to continue.";
            case RU -> "Бесплатное гадание уже использовано. Каждое новое гадание стоит " + amount + " ⭐. "
                    + "Оплатите счёт, чтобы продолжить.";
            case UK -> "Безкоштовне ворожіння вже використано. Кожне нове ворожіння коштує " + amount + " ⭐. "
                    + "Сплатіть рахунок, щоб продовжити.";
        };
    }

    public String invoiceTitle(Language language) {
        return switch (language) {
            case EN -> "Tarot Reading";
            case RU -> "Гадание на Таро";
            case UK -> "Ворожіння на Таро";
        };
    }

    public String invoiceDescription(Language language, ReadingKind flow) {
        boolean custom = flow == ReadingKind.CUSTOM;
        return switch (language) {
            case EN -> custom ? "Interpretation of your own card combination" : "Three-card reading: Past, Present, Future";
            case RU -> custom ? "Толкование вашего сочетания карт" : "Расклад из трёх карт: Прошлое, Настоящее, Будущее";
            case UK -> custom ? "Тлумачення вашого поєднання карт" : "Розклад з трьох карт: Минуле, Теперішнє, Майбутнє";
        };
    }

    public String paymentConfirmed(Language language) {
        return switch (language) {
            case EN -> "✅ Payment received, thank you!";
            case RU -> "✅ Оплата получена, спасибо!";
            case UK -> "✅ Оплату отримано, дякуємо!";
        };
    }

    public String paymentNotExpected(Language language) {
        return switch (language) {
            case EN -> "There is no unpaid invoice for this payment.";
            case RU -> "Для этого платежа нет неоплаченного счёта.";
            case UK -> "Для цього платежу немає несплаченого рахунку.";
        };
    }

    public String rateLimited(Language language, long seconds) {
        return switch (language) {
            case EN -> "⏳ Too many requests. Please wait " + seconds + " s and try again.";
            case RU -> "⏳ Слишком много запросов. Подождите " + seconds + " с и попробуйте снова.";
            case UK -> "⏳ Забагато запитів. Зачекайте " + seconds + " с і спробуйте знову.";
        };
    }

    public String error(TurnErrorKind kind, Language language) {
        return switch (kind) {
            case QUESTION_TOO_SHORT -> switch (language) {
                case EN -> "Your question is too short. Please use at least " + QuestionValidator.MIN_LENGTH + " characters.";
                case RU -> "Вопрос слишком короткий. Используйте не меньше " + QuestionValidator.MIN_LENGTH + " символов.";
                case UK -> "Питання надто коротке. Використайте щонайменше " + QuestionValidator.MIN_LENGTH + " символів.";
            };
            case QUESTION_TOO_LONG -> switch (language) {
                case EN -> "Your question is too long. Please keep it under " + QuestionValidator.MAX_LENGTH + " characters.";
                case RU -> "Вопрос слишком длинный. Уложитесь в " + QuestionValidator.MAX_LENGTH + " символов.";
                case UK -> "Питання надто довге. Вкладіться в " + QuestionValidator.MAX_LENGTH + " символів.";
            };
            case NO_CARDS_RECOGNIZED -> switch (language) {
                case EN -> "I could not recognize any cards. Please check the names and send them again, separated by commas.";
                case RU -> "Не удалось распознать ни одной карты. Проверьте названия и пришлите их снова через запятую.";
                case UK -> "Не вдалося розпізнати жодної карти. Перевірте назви й надішліть їх знову через кому.";
            };
            case UPSTREAM_FAILURE -> switch (language) {
                case EN -> "😔 Something went wrong while preparing your reading. Please try again later.";
                case RU -> "😔 Что-то пошло не так при подготовке гадания. Попробуйте позже.";
                case UK -> "😔 Щось пішло не так під час підготовки ворожіння. Спробуйте пізніше.";
            };
            case ADMISSION_REJECTED -> rateLimited(language, 60);
            case INVALID_STATE -> switch (language) {
                case EN -> "Please choose an option from the menu first.";
                case RU -> "Сначала выберите вариант в меню.";
                case UK -> "Спершу оберіть варіант у меню.";
            };
            case PAYMENT_PENDING -> switch (language) {
                case EN -> "Please pay the invoice above to continue, or send /start to cancel.";
                case RU -> "Оплатите счёт выше, чтобы продолжить, или отправьте /start для отмены.";
                case UK -> "Сплатіть рахунок вище, щоб продовжити, або надішліть /start для скасування.";
            };
            case SESSION_BUSY -> switch (language) {
                case EN -> "🔮 Your reading is still being prepared. Please wait a moment.";
                case RU -> "🔮 Ваше гадание ещё готовится. Подождите немного.";
                case UK -> "🔮 Ваше ворожіння ще готується. Зачекайте трохи.";
            };
        };
    }

    /**
     * Reminder of what the current step expects, used when the user tries to start another flow.
     */
    public String reprompt(SessionState state, Language language) {
        return switch (state) {
            case IDLE -> error(TurnErrorKind.INVALID_STATE, language);
            case AWAITING_PAYMENT -> error(TurnErrorKind.PAYMENT_PENDING, language);
            case AWAITING_QUESTION, AWAITING_CUSTOM_QUESTION -> promptQuestion(language);
            case AWAITING_CARDS -> promptCards(language);
            case PROCESSING -> error(TurnErrorKind.SESSION_BUSY, language);
        };
    }

    public String unrecognizedCards(Language language, List<String> names) {
        String joined = String.join(", ", names);
        return switch (language) {
            case EN -> "_Not recognized and skipped: " + joined + "_";
            case RU -> "_Не распознаны и пропущены: " + joined + "_";
            case UK -> "_Не розпізнано й пропущено: " + joined + "_";
        };
    }

    public String readingTitle(Language language) {
        return switch (language) {
            case EN -> "🔮 Your Tarot Reading";
            case RU -> "🔮 Ваше гадание на Таро";
            case UK -> "🔮 Ваше ворожіння на Таро";
        };
    }

    public String questionLabel(Language language) {
        return switch (language) {
            case EN -> "Question";
            case RU -> "Вопрос";
            case UK -> "Питання";
        };
    }

    public String cardsDrawnLabel(Language language) {
        return switch (language) {
            case EN -> "Cards Drawn";
            case RU -> "Выпавшие карты";
            case UK -> "Витягнуті карти";
        };
    }

    public String yourCardsLabel(Language language) {
        return switch (language) {
            case EN -> "Your Cards";
            case RU -> "Ваши карты";
            case UK -> "Ваші карти";
        };
    }

    public String interpretationLabel(Language language) {
        return switch (language) {
            case EN -> "Interpretation";
            case RU -> "Толкование";
            case UK -> "Тлумачення";
        };
    }

    public String disclaimer(Language language) {
        return switch (language) {
            case EN -> "\n_Tarot offers reflection, not certainty. Trust your own judgment._";
            case RU -> "\n_Таро помогает задуматься, но не даёт гарантий. Доверяйте своему суждению._";
            case UK -> "\n_Таро допомагає замислитися, але не дає гарантій. Довіряйте власному судженню._";
        };
    }
}
