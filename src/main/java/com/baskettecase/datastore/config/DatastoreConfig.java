package com.baskettecase.datastore.config;

import com.baskettecase.datastore.bootstrap.DatastoreBootstrap;
import com.baskettecase.datastore.bootstrap.DatastoreStatus;
import com.baskettecase.datastore.db.EndpointDataSourceFactory;
import com.baskettecase.datastore.db.EndpointResolver;
import com.baskettecase.datastore.db.ResolvedEndpoints;
import com.baskettecase.datastore.metadata.TableMetadataView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Datastore Configuration
 *
 * Resolves the configured endpoints once, builds the write pool, and runs the startup checks while
 * the context is refreshing, so a datastore that fails them never gets to serve a request.
 */
@Slf4j
@Configuration
public class DatastoreConfig {

    @Bean
    public ResolvedEndpoints resolvedEndpoints(EndpointResolver resolver, DatastoreProperties properties) {
        return resolver.resolve(properties);
    }

    @Bean(name = "writeDataSource")
    public DataSource writeDataSource(EndpointDataSourceFactory factory,
                                      ResolvedEndpoints endpoints,
                                      DatastoreProperties properties) {
        return factory.createPool(endpoints.write(), properties.getPool());
    }

    @Bean(name = "writeJdbcTemplate")
    public JdbcTemplate writeJdbcTemplate(@Qualifier("writeDataSource") DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean(name = "writeTransactionManager")
    public DataSourceTransactionManager writeTransactionManager(@Qualifier("writeDataSource") DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean(name = "writeTransactionTemplate")
    public TransactionTemplate writeTransactionTemplate(DataSourceTransactionManager writeTransactionManager) {
        return new TransactionTemplate(writeTransactionManager);
    }

    @Bean
    public TableMetadataView tableMetadataView(DatastoreProperties properties) {
        return new TableMetadataView(properties.getSchema());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs the startup checks. Throws, and so aborts startup, if any of them fails.
     */
    @Bean
    public DatastoreStatus datastoreStatus(DatastoreBootstrap bootstrap) {
        return bootstrap.initialize();
    }
}
