package com.portfoliobacktest.backtest.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A round trip closed by FIFO matching: one opening lot (or part of it) against one closing fill.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompletedTrade {

    private String instrumentId;

    /** Side of the opening lot: BUY for a long round trip, SELL for a short one. */
    private Side side;

    // ==================== ENTRY ====================

    private LocalDateTime entryTime;
    private BigDecimal entryPrice;

    // ==================== EXIT ====================

    private LocalDateTime exitTime;
    private BigDecimal exitPrice;

    // ==================== RESULT ====================

    private long quantity;

    /** Entry and exit commission allocated to this round trip. */
    private BigDecimal commission;

    /** (exit - entry) x quantity x direction - commission. */
    private BigDecimal pnl;

    /** pnl / (entry price x quantity) x 100. */
    private double returnPct;

    /** Whole calendar days between entry date and exit date. */
    private long holdingDays;

    public boolean isWin() {
        return pnl.signum() > 0;
    }
}
