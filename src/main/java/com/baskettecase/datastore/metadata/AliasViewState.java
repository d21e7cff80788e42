package com.baskettecase.datastore.metadata;

/**
 * What {@link AliasViewBuilder#ensureAliasView()} found or did.
 */
public enum AliasViewState {
    /** The view already existed; no DDL was run */
    ALREADY_PRESENT,
    /** This process created the view */
    CREATED,
    /** Another process created the view between our existence check and CREATE VIEW */
    CREATED_CONCURRENTLY
}
