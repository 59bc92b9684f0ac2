package com.smartgallery.app.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Owns the SQLite connection pool, the Jdbi instance and schema migrations for one index file.
 */
public final class IndexDatabase implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IndexDatabase.class);

    private final Path dbFile;
    private final int maxPoolSize;

    private HikariDataSource dataSource;
    private Jdbi jdbi;
    private boolean migrated = false;

    public IndexDatabase(Path dbFile) {
        this(dbFile, 8);
    }

    public IndexDatabase(Path dbFile, int maxPoolSize) {
        this.dbFile = dbFile.toAbsolutePath().normalize();
        this.maxPoolSize = maxPoolSize;
    }

    public Path dbFile() {
        return dbFile;
    }

    public String jdbcUrl() {
        return "jdbc:sqlite:" + dbFile;
    }

    public synchronized void init() {
        if (dataSource == null) {
            createDataSource();
        }
        if (jdbi == null) {
            jdbi = Jdbi.create(dataSource);
            jdbi.installPlugin(new SqlObjectPlugin());
        }
        migrateIfNeeded();
    }

    public synchronized boolean isInitialized() {
        return jdbi != null && migrated;
    }

    /** @throws IndexNotInitializedException before {@link #init()} or after {@link #close()} */
    public synchronized Jdbi jdbi() {
        if (!isInitialized()) throw new IndexNotInitializedException();
        return jdbi;
    }

    private void createDataSource() {
        try {
            Path parent = dbFile.getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Could not create index directory for " + dbFile, e);
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl());
        config.setPoolName("gallery-index");
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(maxPoolSize);
        // applied by the sqlite driver on every new connection
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "10000");
        config.addDataSourceProperty("foreign_keys", "true");

        dataSource = new HikariDataSource(config);
        logger.info("Index database at {}", dbFile);
    }

    private void migrateIfNeeded() {
        if (migrated) return;
        Flyway flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
        try {
            try {
                flyway.migrate();
            } catch (FlywayValidateException e) {
                logger.warn("Flyway validation failed; attempting repair.", e);
                flyway.repair();
                flyway.migrate();
            }
            migrated = true;
        } catch (RuntimeException e) {
            logger.error("Flyway migration failed", e);
            throw new IllegalStateException("Flyway migration failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (dataSource != null) {
            dataSource.close();
            dataSource = null;
        }
        jdbi = null;
        migrated = false;
    }
}
