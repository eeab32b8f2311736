package com.directory.actions.disambiguation;

import com.directory.actions.core.model.Identity;
import com.directory.actions.core.model.PendingAction;

/**
 * Outcome of a successful selection: the pending action and the identity it now targets.
 */
public record ResolvedSelection(PendingAction pendingAction, Identity identity, String owner) {
}
