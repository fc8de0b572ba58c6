package com.ai.tarot.entity;

import com.ai.tarot.conversation.Language;
import com.ai.tarot.conversation.ReadingKind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One completed interpretation. Immutable; appended to the session history once.
 */
@Getter
@ToString(exclude = "resultText")
@EqualsAndHashCode
public final class Reading {

    private final ReadingKind kind;

    @JsonProperty("entityIds")
    private final List<Integer> cardIds;

    private final String question;

    private final List<String> positionLabels;

    private final String resultText;

    private final Language language;

    private final Instant timestamp;

    @JsonCreator
    public Reading(@JsonProperty("kind") ReadingKind kind,
                   @JsonProperty("entityIds") List<Integer> cardIds,
                   @JsonProperty("question") String question,
                   @JsonProperty("positionLabels") List<String> positionLabels,
                   @JsonProperty("resultText") String resultText,
                   @JsonProperty("language") Language language,
                   @JsonProperty("timestamp") Instant timestamp) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.cardIds = cardIds == null ? List.of() : List.copyOf(cardIds);
        this.question = question == null ? "" : question;
        this.positionLabels = positionLabels == null ? List.of() : List.copyOf(positionLabels);
        this.resultText = resultText == null ? "" : resultText;
        this.language = language == null ? Language.DEFAULT : language;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public static Reading automated(List<Integer> cardIds, String question, List<String> positionLabels,
                                    String resultText, Language language, Instant timestamp) {
        return new Reading(ReadingKind.AUTOMATED, cardIds, question, positionLabels, resultText, language, timestamp);
    }

    public static Reading custom(List<Integer> cardIds, String question, String resultText,
                                 Language language, Instant timestamp) {
        return new Reading(ReadingKind.CUSTOM, cardIds, question, List.of(), resultText, language, timestamp);
    }
}
