package com.gridbot.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Point-in-time copy of the balance ledger, for reporting.
 */
@Value
@Builder
public class BalanceSnapshot {
    BigDecimal fiatBalance;
    BigDecimal cryptoBalance;
    BigDecimal reservedFiat;
    BigDecimal reservedCrypto;
    BigDecimal totalFees;

    public BigDecimal getAdjustedFiatBalance() {
        return fiatBalance.add(reservedFiat);
    }

    public BigDecimal getAdjustedCryptoBalance() {
        return cryptoBalance.add(reservedCrypto);
    }
}
