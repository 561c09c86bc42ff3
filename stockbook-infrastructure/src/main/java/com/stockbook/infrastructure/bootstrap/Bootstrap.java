package com.stockbook.infrastructure.bootstrap;

import com.stockbook.application.config.BusinessRules;
import com.stockbook.application.config.ConfigValidator;
import com.stockbook.application.ports.ConfigPort;
import com.stockbook.application.ports.UnitOfWorkFactory;
import com.stockbook.application.service.PortfolioService;
import com.stockbook.application.service.StockService;
import com.stockbook.application.service.TradeService;
import com.stockbook.domain.ValidationException;
import com.stockbook.infrastructure.config.FileConfigService;
import com.stockbook.infrastructure.db.Database;
import com.stockbook.infrastructure.uow.SqliteUnitOfWorkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Wires config, database and services together.
 */
public final class Bootstrap {

    private static final Logger log = LoggerFactory.getLogger(Bootstrap.class);

    private Bootstrap() {
    }

    /** Everything an entry point needs, built from one configuration. */
    public record Stockbook(BusinessRules rules, Database database, UnitOfWorkFactory units,
                            StockService stocks, PortfolioService portfolios, TradeService trades) {
    }

    /**
     * Loads config from the working directory (config/config.properties + config/.env if present).
     */
    public static Stockbook create() {
        try {
            return create(FileConfigService.defaultFromWorkingDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config from working directory", e);
        }
    }

    /**
     * @throws ValidationException when the configuration is incomplete or out of range
     */
    public static Stockbook create(ConfigPort config) {
        new ConfigValidator().validate(config).throwIfInvalid();

        BusinessRules rules = BusinessRules.fromConfig(config);
        Database database = Database.fromConfig(config);
        UnitOfWorkFactory units = new SqliteUnitOfWorkFactory(database, rules);
        log.info("Stockbook ready: db={}, currency={}", database.path(), rules.currency());

        return new Stockbook(rules, database, units,
                new StockService(units),
                new PortfolioService(units, rules),
                new TradeService(units));
    }
}
