package com.ordo.app;

import java.time.Clock;

import org.jdbi.v3.core.Jdbi;

import com.ordo.app.config.Config;
import com.ordo.app.database.Database;

/**
 * Contexto explícito passado a todo componente: configuração, registro e relógio.
 * Quem cria o contexto é dono dele e deve fechá-lo.
 */
public final class AppContext implements AutoCloseable {

    private final Config config;
    private final Database database;
    private final Clock clock;

    public AppContext(Config config, Database database, Clock clock) {
        this.config = config;
        this.database = database;
        this.clock = clock;
    }

    public static AppContext open(Config config) {
        Database db = new Database(config);
        db.init();
        return new AppContext(config, db, Clock.system(config.getZone()));
    }

    public static AppContext open(Config config, Clock clock) {
        Database db = new Database(config);
        db.init();
        return new AppContext(config, db, clock);
    }

    public Config config() { return config; }
    public Database database() { return database; }
    public Jdbi jdbi() { return database.jdbi(); }
    public Clock clock() { return clock; }

    public long nowMillis() {
        return clock.millis();
    }

    @Override
    public void close() {
        database.close();
    }
}
