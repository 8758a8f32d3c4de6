package com.fifogains.jdbc.matching;

import com.fifogains.jdbc.ledger.RemainingLot;
import com.fifogains.jdbc.ledger.ResultRow;
import com.fifogains.jdbc.ledger.SaleResult;
import java.util.List;

/** Output of one engine run: sale results, their flattened rows and the lots left open. */
public final class MatchingResult {
    private final List<SaleResult> sales;
    private final List<ResultRow> rows;
    private final List<RemainingLot> openLots;

    public MatchingResult(List<SaleResult> sales, List<ResultRow> rows, List<RemainingLot> openLots) {
        this.sales = List.copyOf(sales);
        this.rows = List.copyOf(rows);
        this.openLots = List.copyOf(openLots);
    }

    public List<SaleResult> getSales() {
        return sales;
    }

    public List<ResultRow> getRows() {
        return rows;
    }

    public List<RemainingLot> getOpenLots() {
        return openLots;
    }
}
