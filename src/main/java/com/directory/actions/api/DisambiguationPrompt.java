package com.directory.actions.api;

import com.directory.actions.core.model.PendingAction;
import com.directory.actions.disambiguation.DisambiguationToken;

import java.util.List;

/**
 * Candidate list sent back when a query matched more than one identity.
 * Choices are in ranking order, best first.
 */
public record DisambiguationPrompt(
        DisambiguationToken token,
        PendingAction pendingAction,
        List<DisambiguationChoice> choices
) {
    public DisambiguationPrompt {
        choices = choices != null ? List.copyOf(choices) : List.of();
    }
}
