package com.gridbot.service.order;

import com.gridbot.event.EventBus;
import com.gridbot.event.EventType;
import com.gridbot.exception.DataFetchException;
import com.gridbot.exception.InsufficientBalanceException;
import com.gridbot.exception.InsufficientCryptoBalanceException;
import com.gridbot.exchange.ExchangeService;
import com.gridbot.model.Order;
import com.gridbot.model.OrderSide;
import com.gridbot.model.OrderStatus;
import com.gridbot.model.OrderType;
import com.gridbot.model.TradingMode;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class BalanceTrackerTest {

    @Mock
    private ExchangeService exchangeService;

    private EventBus eventBus;
    private BalanceTracker tracker;

    @BeforeEach
    void setUp() {
        try (AutoCloseable mocks = MockitoAnnotations.openMocks(this)) {
            eventBus = new EventBus(Runnable::run);
            tracker = new BalanceTracker(eventBus, new FeeCalculator(new BigDecimal("0.001")),
                    TradingMode.BACKTEST, "SOL", "USDT");
        } catch (Exception e) {
            throw new RuntimeException("Failed to initialize mocks", e);
        }
    }

    @Test
    void testReserveFundsForBuyMovesBalanceToReservation() {
        tracker.setupBalances(bd("10000"), BigDecimal.ZERO, null);

        tracker.reserveFundsForBuy(bd("1000"));

        assertAmount("9000", tracker.getBalance());
        assertAmount("1000", tracker.getReservedFiat());
        assertAmount("10000", tracker.getAdjustedFiatBalance());
    }

    @Test
    void testReservationFollowedByRollbackLeavesFundsUnchanged() {
        tracker.setupBalances(bd("10000"), bd("2"), null);
        BigDecimal fiatBefore = tracker.getBalance().add(tracker.getReservedFiat());
        BigDecimal cryptoBefore = tracker.getCryptoBalance().add(tracker.getReservedCrypto());

        tracker.reserveFundsForBuy(bd("2500"));
        tracker.releaseFundsForBuy(bd("2500"));
        tracker.reserveFundsForSell(bd("1.5"));
        tracker.releaseFundsForSell(bd("1.5"));

        assertAmount(fiatBefore.toPlainString(), tracker.getBalance().add(tracker.getReservedFiat()));
        assertAmount(cryptoBefore.toPlainString(), tracker.getCryptoBalance().add(tracker.getReservedCrypto()));
        assertAmount("0", tracker.getReservedFiat());
        assertAmount("0", tracker.getReservedCrypto());
    }

    @Test
    void testReservationBeyondAvailableFails() {
        tracker.setupBalances(bd("100"), bd("1"), null);

        assertThrows(InsufficientBalanceException.class, () -> tracker.reserveFundsForBuy(bd("100.01")));
        assertThrows(InsufficientCryptoBalanceException.class, () -> tracker.reserveFundsForSell(bd("1.1")));
        assertAmount("100", tracker.getBalance());
        assertAmount("1", tracker.getCryptoBalance());
    }

    @Test
    void testBuyCompletionConsumesReservationAndTakesOvershootFromBalance() {
        // Given: 1000 reserved for 10 @ 100
        tracker.setupBalances(bd("10000"), BigDecimal.ZERO, null);
        tracker.reserveFundsForBuy(bd("1000"));

        // When: the order completes, cost 1000 plus fee 1
        eventBus.publishSync(EventType.ORDER_COMPLETED, order(OrderSide.BUY, "10", "100", OrderStatus.CLOSED));

        // Then: reservation is clamped at zero and the fee comes out of the balance
        assertAmount("0", tracker.getReservedFiat());
        assertAmount("8999", tracker.getBalance());
        assertAmount("10", tracker.getCryptoBalance());
        assertAmount("1", tracker.getTotalFees());
    }

    @Test
    void testBuyCompletionKeepsUnusedReservation() {
        tracker.setupBalances(bd("10000"), BigDecimal.ZERO, null);
        tracker.reserveFundsForBuy(bd("2000"));

        eventBus.publishSync(EventType.ORDER_COMPLETED, order(OrderSide.BUY, "10", "100", OrderStatus.CLOSED));

        // reservedAfter = reservedBefore - (filled x price + fee)
        assertAmount("999", tracker.getReservedFiat());
        assertAmount("8000", tracker.getBalance());
    }

    @Test
    void testSellCompletionCreditsProceedsMinusFee() {
        tracker.setupBalances(bd("1000"), bd("5"), null);
        tracker.reserveFundsForSell(bd("5"));

        eventBus.publishSync(EventType.ORDER_COMPLETED, order(OrderSide.SELL, "5", "200", OrderStatus.CLOSED));

        assertAmount("0", tracker.getReservedCrypto());
        assertAmount("0", tracker.getCryptoBalance());
        assertAmount("1999", tracker.getBalance());
        assertAmount("1", tracker.getTotalFees());
    }

    @Test
    void testSellCompletionUsesAverageFillPrice() {
        tracker.setupBalances(BigDecimal.ZERO, bd("1"), null);
        tracker.reserveFundsForSell(bd("1"));
        Order sell = order(OrderSide.SELL, "1", "200", OrderStatus.CLOSED).toBuilder()
                .average(bd("210"))
                .build();

        eventBus.publishSync(EventType.ORDER_COMPLETED, sell);

        assertAmount("209.79", tracker.getBalance());
    }

    @Test
    void testCancelledBuyReleasesUnfilledReservation() {
        tracker.setupBalances(bd("10000"), BigDecimal.ZERO, null);
        tracker.reserveFundsForBuy(bd("1000"));
        Order cancelled = order(OrderSide.BUY, "10", "100", OrderStatus.CANCELED).toBuilder()
                .filled(BigDecimal.ZERO)
                .remaining(bd("10"))
                .build();

        eventBus.publishSync(EventType.ORDER_CANCELLED, cancelled);

        assertAmount("10000", tracker.getBalance());
        assertAmount("0", tracker.getReservedFiat());
    }

    @Test
    void testBoundBuyCompletionAtSlippedPriceSettlesOnlyItsOwnReservation() {
        // Given: two buys of 10 @ 100 and 20 @ 100, each reserving cost plus fee
        tracker.setupBalances(bd("10000"), BigDecimal.ZERO, null);
        BigDecimal first = tracker.calculateBuyReservation(bd("10"), bd("100"));
        BigDecimal second = tracker.calculateBuyReservation(bd("20"), bd("100"));
        tracker.reserveFundsForBuy(first);
        tracker.bindReservation("a", OrderSide.BUY, first);
        tracker.reserveFundsForBuy(second);
        tracker.bindReservation("b", OrderSide.BUY, second);

        // When: the first fills at 101, cost 1010 plus fee 1.01
        Order filled = order(OrderSide.BUY, "10", "100", OrderStatus.CLOSED).toBuilder()
                .identifier("a")
                .average(bd("101"))
                .build();
        eventBus.publishSync(EventType.ORDER_COMPLETED, filled);

        // Then: the second reservation is intact and the slippage comes out of the balance
        assertAmount("1001", first);
        assertAmount("2002", tracker.getReservedFiat());
        assertAmount("6986.99", tracker.getBalance());
        assertAmount("10", tracker.getCryptoBalance());
        assertEquals(1, tracker.getBoundReservationCount());
    }

    @Test
    void testCancelledBoundBuyCreditsFilledPartAndReturnsTheRest() {
        // Given
        tracker.setupBalances(bd("10000"), BigDecimal.ZERO, null);
        BigDecimal reservation = tracker.calculateBuyReservation(bd("10"), bd("100"));
        tracker.reserveFundsForBuy(reservation);
        tracker.bindReservation("a", OrderSide.BUY, reservation);

        // When: cancelled after 4 of 10 filled
        Order cancelled = order(OrderSide.BUY, "10", "100", OrderStatus.CANCELED).toBuilder()
                .identifier("a")
                .filled(bd("4"))
                .remaining(bd("6"))
                .build();
        eventBus.publishSync(EventType.ORDER_CANCELLED, cancelled);

        // Then: 400 plus fee 0.4 spent, the rest of the 1001 back in the balance
        assertAmount("0", tracker.getReservedFiat());
        assertAmount("9599.6", tracker.getBalance());
        assertAmount("4", tracker.getCryptoBalance());
        assertAmount("0.4", tracker.getTotalFees());
        assertEquals(0, tracker.getBoundReservationCount());
    }

    @Test
    void testCancelledBoundSellReturnsUnsoldQuantity() {
        tracker.setupBalances(BigDecimal.ZERO, bd("5"), null);
        tracker.reserveFundsForSell(bd("5"));
        tracker.bindReservation("s", OrderSide.SELL, bd("5"));
        Order cancelled = order(OrderSide.SELL, "5", "200", OrderStatus.CANCELED).toBuilder()
                .identifier("s")
                .filled(bd("2"))
                .remaining(bd("3"))
                .build();

        eventBus.publishSync(EventType.ORDER_CANCELLED, cancelled);

        assertAmount("0", tracker.getReservedCrypto());
        assertAmount("3", tracker.getCryptoBalance());
        assertAmount("399.6", tracker.getBalance());
    }

    @Test
    void testTotalBalanceValueUsesAdjustedBalances() {
        tracker.setupBalances(bd("1000"), bd("2"), null);
        tracker.reserveFundsForBuy(bd("400"));
        tracker.reserveFundsForSell(bd("1"));

        assertAmount("1300", tracker.getTotalBalanceValue(bd("150")));
        assertAmount("1000", tracker.snapshot().getAdjustedFiatBalance());
        assertAmount("2", tracker.snapshot().getAdjustedCryptoBalance());
    }

    @Test
    void testBalancesAreInitializedOnlyOnce() {
        tracker.setupBalances(bd("10"), BigDecimal.ZERO, null);

        assertThrows(IllegalStateException.class, () -> tracker.setupBalances(bd("20"), BigDecimal.ZERO, null));
        assertAmount("10", tracker.getBalance());
    }

    @Test
    void testLiveModeFetchesFreeBalancesFromExchange() {
        // Given
        BalanceTracker live = new BalanceTracker(eventBus, new FeeCalculator(new BigDecimal("0.001")),
                TradingMode.LIVE, "SOL", "USDT");
        JSONObject free = new JSONObject().put("USDT", new BigDecimal("523.5")).put("SOL", new BigDecimal("2.25"));
        when(exchangeService.getBalance()).thenReturn(new JSONObject().put("free", free));

        // When
        live.setupBalances(null, null, exchangeService);

        // Then
        assertAmount("523.5", live.getBalance());
        assertAmount("2.25", live.getCryptoBalance());
    }

    @Test
    void testMalformedExchangeBalanceIsDataFetchError() {
        BalanceTracker live = new BalanceTracker(eventBus, new FeeCalculator(BigDecimal.ZERO),
                TradingMode.PAPER_TRADING, "SOL", "USDT");
        when(exchangeService.getBalance()).thenReturn(new JSONObject().put("total", new JSONObject()));

        assertThrows(DataFetchException.class, () -> live.setupBalances(null, null, exchangeService));
    }

    private static Order order(OrderSide side, String quantity, String price, OrderStatus status) {
        return Order.builder()
                .identifier("o-" + side)
                .side(side)
                .orderType(OrderType.MARKET)
                .symbol("SOL/USDT")
                .price(bd(price))
                .amount(bd(quantity))
                .filled(bd(quantity))
                .remaining(BigDecimal.ZERO)
                .status(status)
                .build();
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }
}
