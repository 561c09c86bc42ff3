package com.stockbook.infrastructure.uow;

import com.stockbook.application.config.BusinessRules;
import com.stockbook.application.ports.UnitOfWork;
import com.stockbook.application.ports.UnitOfWorkFactory;
import com.stockbook.infrastructure.db.Database;

import java.util.Objects;

public class SqliteUnitOfWorkFactory implements UnitOfWorkFactory {

    private final Database database;
    private final BusinessRules rules;

    public SqliteUnitOfWorkFactory(Database database, BusinessRules rules) {
        this.database = Objects.requireNonNull(database, "database");
        this.rules = Objects.requireNonNull(rules, "rules");
        database.initSchema();
    }

    @Override
    public UnitOfWork create() {
        return new SqliteUnitOfWork(database, rules);
    }
}
