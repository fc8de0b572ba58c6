package com.ai.tarot.service;

import com.ai.tarot.conversation.Language;
import com.ai.tarot.entity.Card;

import java.util.List;

/**
 * Produces the interpretation text of a reading. {@code positionLabels} is empty for a
 * custom combination. Failures surface as {@code UpstreamException}.
 */
public interface InterpretationGenerator {

    String generate(List<Card> cards, String question, Language language, List<String> positionLabels);
}
