package com.directory.actions.intake;

/**
 * A request entering the desk, before any identity is resolved.
 * Implemented by {@link FreeTextQuery} and {@link MailExtractedOffboarding}.
 */
public interface AdminRequest {

    /**
     * Principal the request is attributed to.
     */
    String principal();
}
