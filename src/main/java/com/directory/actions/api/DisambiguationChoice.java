package com.directory.actions.api;

import com.directory.actions.intake.SelectionPayload;

/**
 * One selectable candidate: the button label and the callback payload behind it.
 */
public record DisambiguationChoice(String label, SelectionPayload payload) {
}
