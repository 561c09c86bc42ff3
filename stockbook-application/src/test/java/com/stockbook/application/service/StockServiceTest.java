package com.stockbook.application.service;

import com.stockbook.application.persistence.DuplicateKeyException;
import com.stockbook.application.ports.StockRepository;
import com.stockbook.application.ports.UnitOfWork;
import com.stockbook.application.ports.UnitOfWorkFactory;
import com.stockbook.domain.stock.Grade;
import com.stockbook.domain.stock.Stock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StockServiceTest {

    @Mock
    private UnitOfWorkFactory factory;

    @Mock
    private UnitOfWork uow;

    @Mock
    private StockRepository stocks;

    private StockService service;

    @BeforeEach
    void setUp() {
        lenient().when(factory.create()).thenReturn(uow);
        lenient().when(uow.stocks()).thenReturn(stocks);
        lenient().when(uow.execute(any())).thenCallRealMethod();
        service = new StockService(factory);
    }

    @Test
    void registerNormalisesSymbolAndCommits() {
        when(stocks.existsBySymbol("AAPL")).thenReturn(false);

        Stock stock = service.register("aapl ", "Apple Inc.", "Tech", Grade.A, null);

        ArgumentCaptor<Stock> saved = ArgumentCaptor.forClass(Stock.class);
        verify(stocks).create(saved.capture());
        assertThat(saved.getValue().symbol().value()).isEqualTo("AAPL");
        assertThat(stock.grade()).isEqualTo(Grade.A);
        verify(uow).enter();
        verify(uow).exit(isNull());
    }

    @Test
    void registerRejectsDuplicateSymbolAndRollsBack() {
        when(stocks.existsBySymbol("AAPL")).thenReturn(true);

        assertThatThrownBy(() -> service.register("AAPL", "Apple", null, null, null))
                .isInstanceOf(DuplicateKeyException.class)
                .hasMessageContaining("AAPL");

        verify(stocks, never()).create(any());
        verify(uow).exit(any(DuplicateKeyException.class));
    }

    @Test
    void findBySymbolNormalises() {
        Stock apple = Stock.of("AAPL", "Apple");
        when(stocks.getBySymbol("AAPL")).thenReturn(Optional.of(apple));

        assertThat(service.findBySymbol(" aapl")).contains(apple);
    }

    @Test
    void updateDetailsOfMissingStockIsEmpty() {
        when(stocks.getById(99)).thenReturn(Optional.empty());

        assertThat(service.updateDetails(99, "New name", null, null, null)).isEmpty();
        verify(stocks, never()).update(anyLong(), any());
    }

    @Test
    void updateDetailsKeepsUnsetFields() {
        Stock stock = Stock.restore(5, com.stockbook.domain.stock.Symbol.of("MSFT"), "Microsoft", "Software", Grade.B, "core");
        when(stocks.getById(5)).thenReturn(Optional.of(stock));
        when(stocks.update(5, stock)).thenReturn(true);

        Optional<Stock> updated = service.updateDetails(5, null, null, Grade.A, null);

        assertThat(updated).isPresent();
        assertThat(updated.get().grade()).isEqualTo(Grade.A);
        assertThat(updated.get().name()).isEqualTo("Microsoft");
        assertThat(updated.get().notes()).isEqualTo("core");
    }
}
