package com.libragraph.stash.core.db;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import javax.sql.DataSource;

@ApplicationScoped
public class JdbiProducer {

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource) {
        return configure(Jdbi.create(dataSource))
                .installPlugin(new PostgresPlugin());
    }

    /**
     * Plugins shared by the production datasource and plain JDBC sources (tests, tooling).
     */
    public static Jdbi create(DataSource dataSource) {
        return configure(Jdbi.create(dataSource));
    }

    private static Jdbi configure(Jdbi jdbi) {
        return jdbi
                .installPlugin(new SqlObjectPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
    }
}
