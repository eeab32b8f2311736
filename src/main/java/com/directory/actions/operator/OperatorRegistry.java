package com.directory.actions.operator;

import java.util.List;

/**
 * Who may use the desk: one configured super-admin plus the operators the super-admin added.
 */
public interface OperatorRegistry {

    boolean isSuperAdmin(String principal);

    /**
     * Whether the principal may submit requests. The super-admin always may.
     */
    boolean isOperator(String principal);

    RosterChange add(String actor, String operatorId);

    RosterChange remove(String actor, String operatorId);

    /**
     * Operators added through {@link #add}, sorted; the super-admin is not listed.
     */
    List<String> list();

    String superAdminId();
}
