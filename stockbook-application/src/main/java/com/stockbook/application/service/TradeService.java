package com.stockbook.application.service;

import com.stockbook.application.ports.TargetFilter;
import com.stockbook.application.ports.TransactionFilter;
import com.stockbook.application.ports.UnitOfWork;
import com.stockbook.application.ports.UnitOfWorkFactory;
import com.stockbook.domain.ValidationException;
import com.stockbook.domain.journal.JournalEntry;
import com.stockbook.domain.money.Money;
import com.stockbook.domain.money.Quantity;
import com.stockbook.domain.portfolio.Portfolio;
import com.stockbook.domain.stock.Stock;
import com.stockbook.domain.stock.Symbol;
import com.stockbook.domain.target.Target;
import com.stockbook.domain.target.TargetStatus;
import com.stockbook.domain.trade.StockTransaction;
import com.stockbook.domain.trade.TransactionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Records trades and keeps their side effects (journal note, position check) in one transaction.
 */
public class TradeService {

    private static final Logger log = LoggerFactory.getLogger(TradeService.class);

    private final UnitOfWorkFactory uowFactory;

    public TradeService(UnitOfWorkFactory uowFactory) {
        this.uowFactory = Objects.requireNonNull(uowFactory, "uowFactory");
    }

    /**
     * Records a buy or sell of {@code symbol} in the portfolio, plus a journal note when
     * {@code note} is not blank.
     *
     * @throws ValidationException if the stock or portfolio is unknown, the portfolio is inactive,
     *                             or a sell exceeds the held position; nothing is stored in that case
     */
    public StockTransaction recordTrade(long portfolioId, String symbol, TransactionType type, Quantity quantity,
                                        Money price, LocalDate date, String note) {
        Symbol sym = Symbol.of(symbol);
        return uowFactory.create().execute(uow -> {
            Stock stock = uow.stocks().getBySymbol(sym.value())
                    .orElseThrow(() -> new ValidationException("symbol", "Unknown stock: " + sym));
            Portfolio portfolio = uow.portfolios().getById(portfolioId)
                    .orElseThrow(() -> new ValidationException("portfolioId", "Portfolio not found: " + portfolioId));
            if (!portfolio.isActive()) {
                throw new ValidationException("portfolioId", "Portfolio '" + portfolio.name() + "' is not active");
            }

            if (type == TransactionType.SELL) {
                Quantity held = position(uow, portfolioId, stock.id());
                if (quantity.isGreaterThan(held)) {
                    throw new ValidationException("quantity",
                            "Cannot sell " + quantity + " " + sym + ", position is " + held);
                }
            }

            StockTransaction tx = new StockTransaction(portfolioId, stock.id(), type, quantity, price, date, null);
            uow.transactions().create(tx);

            if (note != null && !note.isBlank()) {
                JournalEntry entry = new JournalEntry(portfolioId, stock.id(), tx.id(), date,
                        type.name() + " " + sym, note, List.of(type.code(), sym.value()));
                uow.journal().create(entry);
            }

            log.info("Recorded {} {} {} @ {} in portfolio {}", type.code(), quantity, sym, price, portfolioId);
            return tx;
        });
    }

    /** Net shares held: buys minus sells. */
    public Quantity position(long portfolioId, long stockId) {
        return position(uowFactory.create(), portfolioId, stockId);
    }

    /**
     * Replaces the active target of this stock in the portfolio: earlier active targets are cancelled.
     */
    public Target setTarget(long portfolioId, long stockId, Money pivot, Money failure, String notes) {
        Target target = new Target(stockId, portfolioId, pivot, failure, notes, TargetStatus.ACTIVE);
        return uowFactory.create().execute(uow -> {
            List<Target> previous = uow.targets().list(TargetFilter.all()
                    .withPortfolio(portfolioId).withStock(stockId).withStatus(TargetStatus.ACTIVE));
            for (Target t : previous) {
                uow.targets().updateStatus(t.id(), TargetStatus.CANCELLED);
            }
            uow.targets().create(target);
            log.debug("Target set for stock {} in portfolio {} ({} superseded)", stockId, portfolioId, previous.size());
            return target;
        });
    }

    private static Quantity position(UnitOfWork uow, long portfolioId, long stockId) {
        Quantity net = Quantity.signed(0);
        for (StockTransaction t : uow.transactions().list(TransactionFilter.forPosition(portfolioId, stockId))) {
            net = t.isBuy()
                    ? net.add(t.quantity())
                    : net.subtract(t.quantity());
        }
        return net.isNegative() ? Quantity.zero() : Quantity.of(net.value());
    }
}
