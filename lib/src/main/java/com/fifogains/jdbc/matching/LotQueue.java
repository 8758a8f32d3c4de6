package com.fifogains.jdbc.matching;

import com.fifogains.jdbc.ledger.MatchedLot;
import com.fifogains.jdbc.ledger.OpenLot;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Open lots of one group, earliest acquisition at the head. Only lots with a positive remaining
 * quantity are ever queued.
 */
final class LotQueue {

    static final int GAIN_SCALE = 2;

    private final Deque<OpenLot> lots = new ArrayDeque<>();
    private final boolean roundGains;

    LotQueue(boolean roundGains) {
        this.roundGains = roundGains;
    }

    void add(OpenLot lot) {
        if (lot.getRemainingQuantity().signum() > 0) {
            lots.addLast(lot);
        }
    }

    /**
     * Consumes lots from the head until {@code quantity} is covered. Whatever the queue cannot
     * cover becomes one trailing lot of unknown origin.
     */
    List<MatchedLot> consume(BigDecimal quantity, BigDecimal salePrice) {
        List<MatchedLot> matched = new ArrayList<>();
        BigDecimal remaining = quantity;
        while (remaining.signum() > 0) {
            OpenLot front = lots.peekFirst();
            if (front == null) {
                matched.add(MatchedLot.unknownOrigin(remaining, salePrice));
                break;
            }
            BigDecimal used = remaining.min(front.getRemainingQuantity());
            BigDecimal gain = gain(used, salePrice, front.getUnitPrice());
            matched.add(MatchedLot.fromLot(used, front, salePrice, gain));
            if (front.consume(used)) {
                lots.removeFirst();
            }
            remaining = remaining.subtract(used);
        }
        return matched;
    }

    List<OpenLot> snapshot() {
        List<OpenLot> result = new ArrayList<>(lots.size());
        for (OpenLot lot : lots) {
            result.add(lot.copy());
        }
        return result;
    }

    private BigDecimal gain(BigDecimal used, BigDecimal salePrice, BigDecimal costBasis) {
        BigDecimal gain = used.multiply(salePrice.subtract(costBasis));
        return roundGains ? gain.setScale(GAIN_SCALE, RoundingMode.HALF_EVEN) : gain;
    }
}
