package com.libragraph.imagio.core.db;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

/**
 * Every handle checks a connection out of the Agroal pool per operation;
 * there is no shared connection and no process-wide lock.
 */
@ApplicationScoped
public class JdbiProducer {

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource) {
        return Jdbi.create(dataSource)
                .installPlugin(new SqlObjectPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
    }
}
