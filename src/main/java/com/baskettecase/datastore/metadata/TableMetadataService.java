package com.baskettecase.datastore.metadata;

import com.baskettecase.datastore.error.UnexpectedDatabaseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reads alias relationships from {@code _table_metadata}.
 *
 * Nothing is cached; every call reflects the catalog at the time of the query.
 */
@Slf4j
@Service
public class TableMetadataService {

    private static final RowMapper<CatalogDependency> ROW_MAPPER = (rs, rowNum) ->
        new CatalogDependency(rs.getString("alias_of"), rs.getString("name"));

    private final JdbcTemplate jdbcTemplate;
    private final TableMetadataView view;

    public TableMetadataService(@Qualifier("writeJdbcTemplate") JdbcTemplate jdbcTemplate,
                                TableMetadataView view) {
        this.jdbcTemplate = jdbcTemplate;
        this.view = view;
    }

    /**
     * All view to table pairs
     */
    public List<CatalogDependency> findAll() {
        String sql = "SELECT name, alias_of FROM " + view.qualifiedName() + " ORDER BY alias_of, name";
        return read(() -> jdbcTemplate.query(sql, ROW_MAPPER));
    }

    /**
     * Views built on the given table
     */
    public List<CatalogDependency> findAliasesOf(String table) {
        String sql = "SELECT name, alias_of FROM " + view.qualifiedName() + " WHERE alias_of = ? ORDER BY name";
        return read(() -> jdbcTemplate.query(sql, ROW_MAPPER, table));
    }

    /**
     * The table an alias reads from, if the name is an alias of exactly one table
     */
    public Optional<String> resolveAlias(String alias) {
        String sql = "SELECT name, alias_of FROM " + view.qualifiedName() + " WHERE name = ?";
        List<CatalogDependency> rows = read(() -> jdbcTemplate.query(sql, ROW_MAPPER, alias));
        if (rows.size() > 1) {
            log.debug("Alias {} reads from {} relations", alias, rows.size());
            return Optional.empty();
        }
        return rows.stream().map(CatalogDependency::dependentRelation).findFirst();
    }

    private <T> T read(Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new UnexpectedDatabaseException("Failed to read " + view.qualifiedName(), e);
        }
    }
}
