package com.baskettecase.datastore.metadata;

/**
 * One row of {@code _table_metadata}.
 *
 * @param dependentRelation the base table the view reads from ({@code alias_of} column)
 * @param dependeeRelation the view acting as an alias ({@code name} column)
 */
public record CatalogDependency(String dependentRelation, String dependeeRelation) {
}
