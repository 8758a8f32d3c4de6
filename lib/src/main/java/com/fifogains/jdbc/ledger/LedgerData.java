package com.fifogains.jdbc.ledger;

import java.util.List;

public final class LedgerData {
    private final List<TransactionRecord> transactions;
    private final List<SaleResult> sales;
    private final List<ResultRow> resultRows;
    private final List<RemainingLot> openLots;

    public LedgerData(
            List<TransactionRecord> transactions,
            List<SaleResult> sales,
            List<ResultRow> resultRows,
            List<RemainingLot> openLots) {
        this.transactions = List.copyOf(transactions);
        this.sales = List.copyOf(sales);
        this.resultRows = List.copyOf(resultRows);
        this.openLots = List.copyOf(openLots);
    }

    /** Normalized transactions in source order. */
    public List<TransactionRecord> getTransactions() {
        return transactions;
    }

    public List<SaleResult> getSales() {
        return sales;
    }

    public List<ResultRow> getResultRows() {
        return resultRows;
    }

    public List<RemainingLot> getOpenLots() {
        return openLots;
    }
}
