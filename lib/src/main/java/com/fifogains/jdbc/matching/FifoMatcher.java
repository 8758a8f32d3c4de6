package com.fifogains.jdbc.matching;

import com.fifogains.jdbc.ledger.GroupKey;
import com.fifogains.jdbc.ledger.MatchedLot;
import com.fifogains.jdbc.ledger.OpenLot;
import com.fifogains.jdbc.ledger.RemainingLot;
import com.fifogains.jdbc.ledger.SaleResult;
import com.fifogains.jdbc.ledger.TransactionKind;
import com.fifogains.jdbc.ledger.TransactionRecord;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * FIFO lot matching. Each call to {@link #matchGroup} runs one group against a fresh queue; sales
 * are numbered across groups in the order they are produced.
 */
public final class FifoMatcher {

    private final boolean roundGains;
    private final List<SaleResult> sales = new ArrayList<>();
    private final List<RemainingLot> openLots = new ArrayList<>();

    public FifoMatcher(boolean roundGains) {
        this.roundGains = roundGains;
    }

    /**
     * Processes one group in the given order: buys open lots at the back of the queue, sells consume
     * them from the front.
     *
     * @return the sales of this group, in processing order
     */
    public List<SaleResult> matchGroup(GroupKey key, List<TransactionRecord> group) {
        LotQueue queue = new LotQueue(roundGains);
        List<SaleResult> groupSales = new ArrayList<>();
        for (TransactionRecord transaction : group) {
            if (transaction.getKind() == TransactionKind.BUY) {
                queue.add(OpenLot.fromBuy(transaction));
                continue;
            }
            List<MatchedLot> matched = queue.consume(transaction.getQuantity(), transaction.getPrice());
            SaleResult sale = new SaleResult(sales.size() + 1, transaction, totalGain(matched), matched);
            sales.add(sale);
            groupSales.add(sale);
        }
        List<OpenLot> remaining = queue.snapshot();
        for (int i = 0; i < remaining.size(); i++) {
            openLots.add(new RemainingLot(key, i, remaining.get(i)));
        }
        return groupSales;
    }

    public List<SaleResult> getSales() {
        return List.copyOf(sales);
    }

    /** Lots still open once their group was processed, group by group in head-first order. */
    public List<RemainingLot> getOpenLots() {
        return List.copyOf(openLots);
    }

    static BigDecimal totalGain(List<MatchedLot> matched) {
        BigDecimal total = BigDecimal.ZERO;
        for (MatchedLot lot : matched) {
            if (lot.isCostBasisKnown()) {
                total = total.add(lot.getGain().orElse(BigDecimal.ZERO));
            }
        }
        return total;
    }
}
