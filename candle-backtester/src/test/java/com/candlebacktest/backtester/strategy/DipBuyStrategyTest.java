package com.candlebacktest.backtester.strategy;

import com.candlebacktest.backtester.domain.Candle;
import com.candlebacktest.backtester.domain.FeeSchedule;
import com.candlebacktest.backtester.domain.Ledger;
import com.candlebacktest.backtester.domain.Order;
import com.candlebacktest.backtester.domain.OrderStatus;
import com.candlebacktest.backtester.domain.SimulatedExecutionClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.candlebacktest.backtester.strategy.StrategyTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DipBuyStrategy.
 */
class DipBuyStrategyTest {

    private Ledger ledger;
    private SimulatedExecutionClient client;
    private DipBuyStrategy strategy;

    @BeforeEach
    void setUp() {
        ledger = new Ledger("BTC", BigDecimal.ZERO, new BigDecimal("1000"));
        client = new SimulatedExecutionClient(ledger, FeeSchedule.of("0", "0"));
        strategy = new DipBuyStrategy(client, new BigDecimal("0.1"), new BigDecimal("0.2"),
                new BigDecimal("500"), 60);
    }

    @Test
    void testExecute_PlacesBuyBelowClose() {
        // Arrange
        List<Candle> window = hourlyCloses("100");
        client.setCurrentCandle(last(window));

        // Act
        strategy.run(window);

        // Assert
        assertEquals(1, ledger.getBuyOrders().size());
        Order buy = ledger.getBuyOrders().get(0);
        assertEquals(0, new BigDecimal("90").compareTo(buy.getLimitPrice()));
        assertEquals(0, new BigDecimal("500").compareTo(buy.getOnHold()));
        assertEquals(0, new BigDecimal("500").compareTo(ledger.getQuoteAvailable()));
    }

    @Test
    void testExecute_KeepsSingleBuyOrder() {
        List<Candle> window = hourlyCloses("100", "101");
        client.setCurrentCandle(window.get(0));
        strategy.run(window.subList(0, 1));
        client.setCurrentCandle(window.get(1));

        strategy.run(window);

        assertEquals(1, ledger.getBuyOrders().size());
    }

    @Test
    void testExecute_ReplacesBuyThatDriftedAway() {
        // Arrange
        List<Candle> candles = hourlyCloses("100", "130");
        client.setCurrentCandle(candles.get(0));
        strategy.run(candles.subList(0, 1));
        Order stale = ledger.getBuyOrders().get(0);

        // Act
        client.setCurrentCandle(candles.get(1));
        strategy.run(candles);

        // Assert
        assertEquals(OrderStatus.CANCELLED, client.getOrderInfo(stale).getStatus());
        assertEquals(1, ledger.getBuyOrders().size());
        assertEquals(0, new BigDecimal("117").compareTo(ledger.getBuyOrders().get(0).getLimitPrice()));
    }

    @Test
    void testExecute_OffersFilledBaseAtTakeProfit() {
        // Arrange
        List<Candle> candles = hourlyCloses("100", "90");
        client.setCurrentCandle(candles.get(0));
        strategy.run(candles.subList(0, 1));

        // Act
        client.setCurrentCandle(candles.get(1));
        strategy.run(candles);

        // Assert
        assertEquals(1, ledger.getNumberOfTransactions());
        assertEquals(1, ledger.getSellOrders().size());
        Order sell = ledger.getSellOrders().get(0);
        assertEquals(0, new BigDecimal("108").compareTo(sell.getLimitPrice()));
        assertEquals(0, ledger.getTotalBase().compareTo(sell.getOnHold()));
        assertEquals(0, BigDecimal.ZERO.compareTo(ledger.getBaseAvailable()));
    }

    @Test
    void testConstructor_InvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new DipBuyStrategy(client, BigDecimal.ZERO,
                BigDecimal.ONE, BigDecimal.TEN, 60));
        assertThrows(IllegalArgumentException.class, () -> new DipBuyStrategy(client, new BigDecimal("0.1"),
                BigDecimal.ZERO, BigDecimal.TEN, 60));
        assertThrows(IllegalArgumentException.class, () -> new DipBuyStrategy(client, new BigDecimal("0.1"),
                BigDecimal.ONE, BigDecimal.ZERO, 60));
    }
}
