package com.ai.tarot.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A button the transport may render under a reply; {@code id} is sent back as the turn action.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SuggestedAction {

    private final String id;
    private final String label;

    @JsonCreator
    public SuggestedAction(@JsonProperty("id") String id, @JsonProperty("label") String label) {
        this.id = id;
        this.label = label;
    }
}
