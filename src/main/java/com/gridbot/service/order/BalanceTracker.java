package com.gridbot.service.order;

import com.gridbot.event.EventBus;
import com.gridbot.event.EventType;
import com.gridbot.exception.DataFetchException;
import com.gridbot.exception.InsufficientBalanceException;
import com.gridbot.exception.InsufficientCryptoBalanceException;
import com.gridbot.exchange.ExchangeService;
import com.gridbot.model.BalanceSnapshot;
import com.gridbot.model.Order;
import com.gridbot.model.OrderSide;
import com.gridbot.model.TradingMode;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fiat and crypto ledger of the bot.
 * <p>
 * Funds are reserved when an order is placed, bound to the order once the exchange returns it,
 * and settled against the actual fill when the order completes ({@link EventType#ORDER_COMPLETED})
 * or is cancelled ({@link EventType#ORDER_CANCELLED}). Buy reservations include the trading fee. At all times {@code balance + reservedFiat}
 * is the fiat not yet spent, and {@code cryptoBalance + reservedCrypto} the crypto not yet sold.
 * All ledger access is serialized on this instance.
 */
@Slf4j
public class BalanceTracker {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final FeeCalculator feeCalculator;
    private final TradingMode tradingMode;
    private final String baseCurrency;
    private final String quoteCurrency;

    private BigDecimal balance = BigDecimal.ZERO;
    private BigDecimal cryptoBalance = BigDecimal.ZERO;
    private BigDecimal reservedFiat = BigDecimal.ZERO;
    private BigDecimal reservedCrypto = BigDecimal.ZERO;
    private BigDecimal totalFees = BigDecimal.ZERO;
    private boolean initialized;
    private final Map<String, Reservation> reservations = new HashMap<>();

    public BalanceTracker(EventBus eventBus, FeeCalculator feeCalculator, TradingMode tradingMode,
                          String baseCurrency, String quoteCurrency) {
        this.feeCalculator = Objects.requireNonNull(feeCalculator, "feeCalculator");
        this.tradingMode = Objects.requireNonNull(tradingMode, "tradingMode");
        this.baseCurrency = baseCurrency;
        this.quoteCurrency = quoteCurrency;
        eventBus.subscribe(EventType.ORDER_COMPLETED, this::onOrderCompleted);
        eventBus.subscribe(EventType.ORDER_CANCELLED, this::onOrderCancelled);
    }

    /**
     * Load the starting balances once: the configured seed values in backtest mode, the exchange's
     * free balances otherwise.
     *
     * @throws IllegalStateException when called a second time
     * @throws DataFetchException    when the exchange balance cannot be read
     */
    public synchronized void setupBalances(BigDecimal initialBalance, BigDecimal initialCryptoBalance,
                                           ExchangeService exchangeService) {
        if (initialized) {
            throw new IllegalStateException("Balances are already initialized");
        }
        if (tradingMode.isBacktest()) {
            this.balance = nonNull(initialBalance);
            this.cryptoBalance = nonNull(initialCryptoBalance);
        } else {
            if (exchangeService == null) {
                throw new IllegalStateException("An exchange service is required to fetch balances in " + tradingMode + " mode");
            }
            fetchBalances(exchangeService);
        }
        initialized = true;
        log.info("[{}] Balances initialized: fiat {} {}, crypto {} {}",
                tradingMode, balance, quoteCurrency, cryptoBalance, baseCurrency);
    }

    private void fetchBalances(ExchangeService exchangeService) {
        try {
            JSONObject free = exchangeService.getBalance().getJSONObject("free");
            this.balance = free.optBigDecimal(quoteCurrency, BigDecimal.ZERO);
            this.cryptoBalance = free.optBigDecimal(baseCurrency, BigDecimal.ZERO);
            log.debug("Fetched balances - Quote: {}: {}, Base: {}: {}", quoteCurrency, balance, baseCurrency, cryptoBalance);
        } catch (DataFetchException e) {
            throw e;
        } catch (JSONException e) {
            throw new DataFetchException("Malformed balance response from exchange: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new DataFetchException("Failed to fetch balances from exchange: " + e.getMessage(), e);
        }
    }

    public synchronized void reserveFundsForBuy(BigDecimal amount) {
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(
                    "Insufficient fiat balance to reserve " + amount + " (available " + balance + ")");
        }
        balance = balance.subtract(amount);
        reservedFiat = reservedFiat.add(amount);
        log.info("Reserved {} fiat for a buy order. Remaining fiat balance: {}.", amount, balance);
    }

    public synchronized void reserveFundsForSell(BigDecimal quantity) {
        if (cryptoBalance.compareTo(quantity) < 0) {
            throw new InsufficientCryptoBalanceException(
                    "Insufficient crypto balance to reserve " + quantity + " (available " + cryptoBalance + ")");
        }
        cryptoBalance = cryptoBalance.subtract(quantity);
        reservedCrypto = reservedCrypto.add(quantity);
        log.info("Reserved {} crypto for a sell order. Remaining crypto balance: {}.", quantity, cryptoBalance);
    }

    /**
     * Fiat reserved for a buy of {@code quantity} at {@code price}: its cost plus the trading fee.
     */
    public BigDecimal calculateBuyReservation(BigDecimal quantity, BigDecimal price) {
        return feeCalculator.calculateCostWithFee(quantity, price);
    }

    /**
     * Tie a reservation to the order placed with it, so completion or cancellation settles exactly
     * that amount.
     */
    public synchronized void bindReservation(String orderId, OrderSide side, BigDecimal amount) {
        reservations.put(orderId, new Reservation(side, amount));
        log.debug("Bound {} {} reservation of {} to order {}", side, side == OrderSide.BUY ? "fiat" : "crypto", amount, orderId);
    }

    /**
     * Return an unused fiat reservation, e.g. after the order could not be placed.
     */
    public synchronized void releaseFundsForBuy(BigDecimal amount) {
        BigDecimal released = amount.min(reservedFiat);
        reservedFiat = reservedFiat.subtract(released);
        balance = balance.add(released);
        log.info("Released {} reserved fiat back to the available balance.", released);
    }

    public synchronized void releaseFundsForSell(BigDecimal quantity) {
        BigDecimal released = quantity.min(reservedCrypto);
        reservedCrypto = reservedCrypto.subtract(released);
        cryptoBalance = cryptoBalance.add(released);
        log.info("Released {} reserved crypto back to the available balance.", released);
    }

    /**
     * Close a fiat reservation of {@code reserved} against a fill of {@code filledQuantity} at
     * {@code price}: the fill and its fee are paid from the reservation and whatever is left of it
     * returns to the available balance.
     *
     * @param reserved fiat reserved for the order, or {@code null} when unknown
     * @param price    execution price, may be {@code null} when nothing was filled
     */
    public synchronized void settleBuy(BigDecimal reserved, BigDecimal filledQuantity, BigDecimal price) {
        BigDecimal cost = filledQuantity.signum() > 0 ? filledQuantity.multiply(price, MC) : BigDecimal.ZERO;
        BigDecimal fee = feeCalculator.calculateFee(cost);
        BigDecimal totalCost = cost.add(fee);

        BigDecimal consumed = reserved != null
                ? reserved.min(reservedFiat)
                : totalCost.min(unboundReserved(OrderSide.BUY));
        reservedFiat = reservedFiat.subtract(consumed);
        // any overshoot of the reservation comes out of the available balance
        balance = balance.add(consumed.subtract(totalCost));
        if (balance.signum() < 0) {
            log.error("Fiat balance went negative ({}) after buy completion of {} @ {}, clamping to zero",
                    balance, filledQuantity, price);
            balance = BigDecimal.ZERO;
        }
        if (filledQuantity.signum() > 0) {
            cryptoBalance = cryptoBalance.add(filledQuantity);
            totalFees = totalFees.add(fee);
            log.info("Buy order completed: {} crypto purchased at {}.", filledQuantity, price);
        }
    }

    /**
     * Close a crypto reservation of {@code reserved} against a sale of {@code filledQuantity} at
     * {@code price}; the unsold rest returns to the available crypto balance.
     *
     * @param reserved crypto reserved for the order, or {@code null} when unknown
     * @param price    execution price, may be {@code null} when nothing was filled
     */
    public synchronized void settleSell(BigDecimal reserved, BigDecimal filledQuantity, BigDecimal price) {
        BigDecimal saleValue = filledQuantity.signum() > 0 ? filledQuantity.multiply(price, MC) : BigDecimal.ZERO;
        BigDecimal fee = feeCalculator.calculateFee(saleValue);

        BigDecimal consumed = reserved != null
                ? reserved.min(reservedCrypto)
                : filledQuantity.min(unboundReserved(OrderSide.SELL));
        reservedCrypto = reservedCrypto.subtract(consumed);
        cryptoBalance = cryptoBalance.add(consumed.subtract(filledQuantity));
        if (cryptoBalance.signum() < 0) {
            log.error("Crypto balance went negative ({}) after sell completion of {} @ {}, clamping to zero",
                    cryptoBalance, filledQuantity, price);
            cryptoBalance = BigDecimal.ZERO;
        }
        if (filledQuantity.signum() > 0) {
            balance = balance.add(saleValue.subtract(fee));
            totalFees = totalFees.add(fee);
            log.info("Sell order completed: {} crypto sold at {}.", filledQuantity, price);
        }
    }

    void onOrderCompleted(Object data) {
        if (!(data instanceof Order order)) {
            log.warn("Ignoring {} event with unexpected payload: {}", EventType.ORDER_COMPLETED, data);
            return;
        }
        BigDecimal filled = order.getFilled() != null ? order.getFilled() : order.getAmount();
        synchronized (this) {
            Reservation reservation = reservations.remove(order.getIdentifier());
            BigDecimal reserved = reservation != null ? reservation.amount() : null;
            if (order.getSide() == OrderSide.BUY) {
                settleBuy(reserved, filled, order.getExecutionPrice());
            } else {
                settleSell(reserved, filled, order.getExecutionPrice());
            }
        }
    }

    void onOrderCancelled(Object data) {
        if (!(data instanceof Order order)) {
            log.warn("Ignoring {} event with unexpected payload: {}", EventType.ORDER_CANCELLED, data);
            return;
        }
        BigDecimal filled = order.getFilled() != null ? order.getFilled() : BigDecimal.ZERO;
        synchronized (this) {
            Reservation reservation = reservations.remove(order.getIdentifier());
            if (reservation != null) {
                log.info("Order {} cancelled with {} filled, settling its reservation of {}",
                        order.getIdentifier(), filled, reservation.amount());
                if (order.getSide() == OrderSide.BUY) {
                    settleBuy(reservation.amount(), filled, order.getExecutionPrice());
                } else {
                    settleSell(reservation.amount(), filled, order.getExecutionPrice());
                }
                return;
            }

            BigDecimal remaining = order.getRemaining() != null ? order.getRemaining() : order.getAmount().subtract(filled);
            if (remaining.signum() <= 0) {
                return;
            }
            log.warn("Order {} cancelled with {} unfilled but holds no bound reservation, releasing at the order price",
                    order.getIdentifier(), remaining);
            if (order.getSide() == OrderSide.BUY) {
                releaseFundsForBuy(remaining.multiply(order.getPrice(), MC).min(unboundReserved(OrderSide.BUY)));
            } else {
                releaseFundsForSell(remaining.min(unboundReserved(OrderSide.SELL)));
            }
        }
    }

    // Caller holds the monitor. Reserved funds not tied to any placed order.
    private BigDecimal unboundReserved(OrderSide side) {
        BigDecimal bound = reservations.values().stream()
                .filter(r -> r.side() == side)
                .map(Reservation::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal reserved = side == OrderSide.BUY ? reservedFiat : reservedCrypto;
        return reserved.subtract(bound).max(BigDecimal.ZERO);
    }

    public synchronized int getBoundReservationCount() {
        return reservations.size();
    }

    public synchronized BigDecimal getBalance() {
        return balance;
    }

    public synchronized BigDecimal getCryptoBalance() {
        return cryptoBalance;
    }

    public synchronized BigDecimal getReservedFiat() {
        return reservedFiat;
    }

    public synchronized BigDecimal getReservedCrypto() {
        return reservedCrypto;
    }

    public synchronized BigDecimal getTotalFees() {
        return totalFees;
    }

    public synchronized BigDecimal getAdjustedFiatBalance() {
        return balance.add(reservedFiat);
    }

    public synchronized BigDecimal getAdjustedCryptoBalance() {
        return cryptoBalance.add(reservedCrypto);
    }

    /**
     * Account value at {@code currentPrice}: adjusted fiat plus adjusted crypto valued at that price.
     */
    public synchronized BigDecimal getTotalBalanceValue(BigDecimal currentPrice) {
        return getAdjustedFiatBalance().add(getAdjustedCryptoBalance().multiply(currentPrice, MC));
    }

    public synchronized BalanceSnapshot snapshot() {
        return BalanceSnapshot.builder()
                .fiatBalance(balance)
                .cryptoBalance(cryptoBalance)
                .reservedFiat(reservedFiat)
                .reservedCrypto(reservedCrypto)
                .totalFees(totalFees)
                .build();
    }

    private record Reservation(OrderSide side, BigDecimal amount) {
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
