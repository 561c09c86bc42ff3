package com.stockbook.application.service;

import com.stockbook.application.config.BusinessRules;
import com.stockbook.application.ports.UnitOfWorkFactory;
import com.stockbook.domain.ValidationException;
import com.stockbook.domain.money.Money;
import com.stockbook.domain.portfolio.Portfolio;
import com.stockbook.domain.portfolio.PortfolioBalance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class PortfolioService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioService.class);

    private final UnitOfWorkFactory uowFactory;
    private final BusinessRules rules;

    public PortfolioService(UnitOfWorkFactory uowFactory, BusinessRules rules) {
        this.uowFactory = Objects.requireNonNull(uowFactory, "uowFactory");
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    /** New active portfolio with the configured position and risk limits. */
    public Portfolio create(String name, String description) {
        return create(name, description, rules.maxPositions(), rules.maxRiskPerTrade());
    }

    public Portfolio create(String name, String description, int maxPositions, BigDecimal maxRiskPerTrade) {
        Portfolio portfolio = new Portfolio(name, description, maxPositions, maxRiskPerTrade, true);
        return uowFactory.create().execute(uow -> {
            uow.portfolios().create(portfolio);
            log.info("Created portfolio '{}' (id={})", portfolio.name(), portfolio.id());
            return portfolio;
        });
    }

    public Optional<Portfolio> find(long id) {
        return uowFactory.create().portfolios().getById(id);
    }

    public List<Portfolio> listActive() {
        return uowFactory.create().portfolios().listActive();
    }

    public boolean deactivate(long id) {
        boolean done = uowFactory.create().execute(uow -> uow.portfolios().deactivate(id));
        if (done) log.info("Deactivated portfolio id={}", id);
        return done;
    }

    /**
     * Stores the balance snapshot for {@code date}, replacing any earlier snapshot for that day.
     *
     * @throws ValidationException if the portfolio does not exist
     */
    public PortfolioBalance recordBalance(long portfolioId, LocalDate date, Money withdrawals, Money deposits,
                                          Money finalBalance, BigDecimal indexChange) {
        PortfolioBalance balance = new PortfolioBalance(portfolioId, date, withdrawals, deposits, finalBalance, indexChange);
        if (balance.finalBalance().currency() != rules.currency()) {
            throw new ValidationException("finalBalance", "Balances are kept in " + rules.currency()
                    + ", got " + balance.finalBalance().currency());
        }
        return uowFactory.create().execute(uow -> {
            if (uow.portfolios().getById(portfolioId).isEmpty()) {
                throw new ValidationException("portfolioId", "Portfolio not found: " + portfolioId);
            }
            uow.balances().create(balance);
            log.debug("Recorded balance {} for portfolio {} on {}", balance.finalBalance(), portfolioId, date);
            return balance;
        });
    }

    public Optional<PortfolioBalance> latestBalance(long portfolioId) {
        return uowFactory.create().balances().latest(portfolioId);
    }

    public List<PortfolioBalance> balanceHistory(long portfolioId, int limit) {
        return uowFactory.create().balances().history(portfolioId, limit);
    }
}
