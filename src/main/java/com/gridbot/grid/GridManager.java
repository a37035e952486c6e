package com.gridbot.grid;

import com.gridbot.model.GridCycleState;
import com.gridbot.model.Order;
import com.gridbot.model.OrderSide;
import com.gridbot.model.SpacingType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Owns the price ladder and the table of {@link GridLevel}s keyed by price.
 * <p>
 * The ladder is computed once in {@link #initializeGridLevels()} and is immutable afterwards.
 * Level state changes go through {@link #recordBuyOrder}, {@link #recordSellOrder},
 * {@link #resetGridCycle} and {@link #completeAllLevels}, which the order manager calls from its
 * single finalize section.
 */
@Slf4j
public class GridManager {

    static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final BigDecimal bottomPrice;
    private final BigDecimal topPrice;
    private final int numGrids;
    private final SpacingType spacingType;
    private final BigDecimal percentageSpacing;

    private List<BigDecimal> priceGrids = List.of();
    private List<BigDecimal> sortedBuyGrids = List.of();
    private List<BigDecimal> sortedSellGrids = List.of();
    private BigDecimal centralPrice;
    private final NavigableMap<BigDecimal, GridLevel> gridLevels = new TreeMap<>();

    public GridManager(BigDecimal bottomPrice, BigDecimal topPrice, int numGrids,
                       SpacingType spacingType, BigDecimal percentageSpacing) {
        Objects.requireNonNull(bottomPrice, "bottomPrice");
        Objects.requireNonNull(topPrice, "topPrice");
        Objects.requireNonNull(spacingType, "spacingType");
        if (bottomPrice.signum() <= 0 || topPrice.compareTo(bottomPrice) <= 0) {
            throw new IllegalArgumentException(
                    "Grid range must satisfy 0 < bottom < top, got bottom=" + bottomPrice + ", top=" + topPrice);
        }
        if (numGrids < 2) {
            throw new IllegalArgumentException("Grid count must be at least 2, got " + numGrids);
        }
        if (spacingType == SpacingType.GEOMETRIC && (percentageSpacing == null || percentageSpacing.signum() <= 0)) {
            throw new IllegalArgumentException("Geometric spacing requires a positive percentage spacing");
        }
        this.bottomPrice = bottomPrice;
        this.topPrice = topPrice;
        this.numGrids = numGrids;
        this.spacingType = spacingType;
        this.percentageSpacing = percentageSpacing;
    }

    /**
     * Compute the ladder and create one level per grid price: READY_TO_BUY at or below the
     * central price, READY_TO_SELL above it.
     */
    public synchronized void initializeGridLevels() {
        if (!gridLevels.isEmpty()) {
            log.warn("Grid levels already initialized, ignoring re-initialization request");
            return;
        }
        List<BigDecimal> prices = spacingType == SpacingType.ARITHMETIC
                ? calculateArithmeticGrids()
                : calculateGeometricGrids();
        BigDecimal central = spacingType == SpacingType.ARITHMETIC
                ? calculateArithmeticCentralPrice()
                : calculateGeometricCentralPrice();

        List<BigDecimal> buyGrids = new ArrayList<>();
        List<BigDecimal> sellGrids = new ArrayList<>();
        for (BigDecimal price : prices) {
            boolean buySide = price.compareTo(central) <= 0;
            (buySide ? buyGrids : sellGrids).add(price);
            gridLevels.put(price, new GridLevel(price,
                    buySide ? GridCycleState.READY_TO_BUY : GridCycleState.READY_TO_SELL));
        }

        this.priceGrids = Collections.unmodifiableList(prices);
        this.centralPrice = central;
        this.sortedBuyGrids = Collections.unmodifiableList(buyGrids);
        this.sortedSellGrids = Collections.unmodifiableList(sellGrids);

        log.info("Initialized {} {} grid levels between {} and {}, central price {} ({} buy / {} sell)",
                prices.size(), spacingType, bottomPrice, topPrice, central, buyGrids.size(), sellGrids.size());
    }

    private List<BigDecimal> calculateArithmeticGrids() {
        BigDecimal step = topPrice.subtract(bottomPrice)
                .divide(BigDecimal.valueOf(numGrids - 1L), MC);
        List<BigDecimal> prices = new ArrayList<>(numGrids);
        for (int i = 0; i < numGrids - 1; i++) {
            prices.add(bottomPrice.add(step.multiply(BigDecimal.valueOf(i), MC), MC));
        }
        prices.add(topPrice);
        return prices;
    }

    private BigDecimal calculateArithmeticCentralPrice() {
        return topPrice.add(bottomPrice).divide(TWO, MC);
    }

    private List<BigDecimal> calculateGeometricGrids() {
        BigDecimal ratio = BigDecimal.ONE.add(percentageSpacing);
        List<BigDecimal> prices = new ArrayList<>(numGrids);
        BigDecimal price = bottomPrice;
        for (int i = 0; i < numGrids; i++) {
            prices.add(price);
            price = price.multiply(ratio, MC);
        }
        return prices;
    }

    // Not the geometric mean of the range: existing configurations depend on this exact value.
    // With typical inputs every level lands above it and starts READY_TO_SELL.
    private BigDecimal calculateGeometricCentralPrice() {
        double product = topPrice.multiply(bottomPrice, MC).doubleValue();
        BigDecimal central = BigDecimal.valueOf(Math.pow(product, percentageSpacing.doubleValue()));
        if (central.compareTo(bottomPrice) < 0 || central.compareTo(topPrice) > 0) {
            log.warn("Geometric central price {} lies outside the grid range [{}, {}]", central, bottomPrice, topPrice);
        }
        return central;
    }

    /**
     * Find the grid level crossed between two consecutive prices for the given side.
     */
    public Optional<GridLevel> detectCrossing(BigDecimal currentPrice, BigDecimal previousPrice, OrderSide side) {
        List<BigDecimal> grids = side == OrderSide.BUY ? sortedBuyGrids : sortedSellGrids;
        return detectCrossing(currentPrice, previousPrice, grids, side).map(gridLevels::get);
    }

    /**
     * Scan {@code sortedGrids} ascending and return the first grid price crossed.
     * <ul>
     *   <li>BUY: price fell through or touched the grid, {@code previous >= grid >= current}</li>
     *   <li>SELL: price rose through or touched the grid, {@code previous < grid <= current}</li>
     * </ul>
     */
    public static Optional<BigDecimal> detectCrossing(BigDecimal currentPrice, BigDecimal previousPrice,
                                                      List<BigDecimal> sortedGrids, OrderSide side) {
        if (currentPrice == null || previousPrice == null) {
            return Optional.empty();
        }
        for (BigDecimal grid : sortedGrids) {
            boolean crossed = side == OrderSide.SELL
                    ? previousPrice.compareTo(grid) < 0 && grid.compareTo(currentPrice) <= 0
                    : previousPrice.compareTo(grid) >= 0 && grid.compareTo(currentPrice) >= 0;
            if (crossed) {
                return Optional.of(grid);
            }
        }
        return Optional.empty();
    }

    /**
     * Lowest buy level holding an unmatched buy, i.e. the buy cycle the next sell closes.
     */
    public Optional<GridLevel> findLowestCompletedBuyGrid() {
        for (BigDecimal price : sortedBuyGrids) {
            GridLevel level = gridLevels.get(price);
            if (level != null && level.canPlaceSellOrder()) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Equal share of the account value per grid level, expressed in base currency at {@code currentPrice}.
     */
    public BigDecimal getOrderSizeForGridLevel(BigDecimal totalBalanceValue, BigDecimal currentPrice) {
        int totalGrids = gridLevels.size();
        if (totalGrids == 0 || currentPrice.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return totalBalanceValue
                .divide(BigDecimal.valueOf(totalGrids), MC)
                .divide(currentPrice, MC);
    }

    public Optional<GridLevel> getGridLevel(BigDecimal price) {
        return Optional.ofNullable(gridLevels.get(price));
    }

    public Collection<GridLevel> getGridLevels() {
        return Collections.unmodifiableCollection(gridLevels.values());
    }

    public List<BigDecimal> getPriceGrids() {
        return priceGrids;
    }

    public List<BigDecimal> getSortedBuyGrids() {
        return sortedBuyGrids;
    }

    public List<BigDecimal> getSortedSellGrids() {
        return sortedSellGrids;
    }

    public BigDecimal getCentralPrice() {
        return centralPrice;
    }

    public void recordBuyOrder(GridLevel level, Order order) {
        level.recordBuyOrder(order);
        log.debug("Buy order {} recorded at grid level {}, level now {}", order.getIdentifier(), level.getPrice(), level.getState());
    }

    public void recordSellOrder(GridLevel level, Order order) {
        level.recordSellOrder(order);
        log.debug("Sell order {} recorded at grid level {}", order.getIdentifier(), level.getPrice());
    }

    public void resetGridCycle(GridLevel buyLevel) {
        buyLevel.resetBuyLevelCycle();
        log.debug("Buy grid level at price {} is reset and ready for the next buy/sell cycle.", buyLevel.getPrice());
    }

    public void completeAllLevels() {
        gridLevels.values().forEach(GridLevel::markCompleted);
        log.info("All {} grid levels marked COMPLETED", gridLevels.size());
    }
}
