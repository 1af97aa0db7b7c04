package com.portfoliobacktest.backtest.dto;

import com.portfoliobacktest.backtest.ledger.CompletedTrade;
import com.portfoliobacktest.backtest.ledger.Fill;
import com.portfoliobacktest.backtest.metrics.SymbolPerformance;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Drill-down of one instrument in a finished run: its statistics, matched trades and raw fills.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SymbolDetail {
    private String instrumentId;
    private SymbolPerformance performance;
    private List<CompletedTrade> trades;
    private List<Fill> fills;
}
