package com.ordo.app.database;

import java.nio.file.Files;
import java.nio.file.Path;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ordo.app.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Registro durável: pool SQLite, JDBI e migrações Flyway.
 * Uma instância por contexto; não há estado estático.
 */
public final class Database implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    private final Config config;
    private HikariDataSource dataSource;
    private Jdbi jdbi;
    private boolean migrated = false;

    public Database(Config config) {
        this.config = config;
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

    public Jdbi jdbi() {
        init();
        return jdbi;
    }

    public Path getDbFilePath() {
        return config.getDbFilePath();
    }

    private void createDataSource() {
        try {
            Path parent = config.getDbFilePath().toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (java.io.IOException e) {
            throw new IllegalStateException("Não foi possível criar diretório do registro", e);
        }

        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(config.getDbUrl());
        hc.setPoolName("ordo-registry");
        hc.setConnectionTestQuery("SELECT 1");
        hc.setMaximumPoolSize(8);
        // pragmas via propriedades do driver (SQLiteConfig), aplicados em toda conexão
        hc.addDataSourceProperty("journal_mode", "WAL");
        hc.addDataSourceProperty("synchronous", "NORMAL");
        hc.addDataSourceProperty("busy_timeout", "10000");
        hc.addDataSourceProperty("foreign_keys", "true");

        dataSource = new HikariDataSource(hc);
        logger.debug("Pool SQLite aberto em {}", config.getDbFilePath());
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
            try {
                dataSource.close();
            } catch (RuntimeException e) {
                logger.warn("Falha ao fechar pool do registro", e);
            }
            dataSource = null;
        }
        jdbi = null;
        migrated = false;
    }
}
