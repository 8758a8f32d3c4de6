package com.fifogains.jdbc.matching;

import com.fifogains.jdbc.ledger.GroupKey;
import com.fifogains.jdbc.ledger.TransactionRecord;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Orders transactions chronologically and splits them into independent matching groups. */
public final class TransactionGrouper {

    static final Comparator<TransactionRecord> BY_DATE =
            Comparator.comparing(
                    TransactionRecord::getDate, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()));

    private TransactionGrouper() {}

    /**
     * Stable ascending sort by date. Transactions on the same date keep their input order and
     * transactions with an invalid date go last.
     */
    public static List<TransactionRecord> sortChronologically(List<TransactionRecord> transactions) {
        List<TransactionRecord> sorted = new ArrayList<>(transactions);
        sorted.sort(BY_DATE);
        return sorted;
    }

    /**
     * Partitions an already sorted sequence by (identifier, currency). Keys iterate in the order they
     * are first met; every group keeps the order of the input.
     */
    public static Map<GroupKey, List<TransactionRecord>> partition(List<TransactionRecord> sorted) {
        Map<GroupKey, List<TransactionRecord>> groups = new LinkedHashMap<>();
        for (TransactionRecord transaction : sorted) {
            groups.computeIfAbsent(GroupKey.of(transaction), key -> new ArrayList<>()).add(transaction);
        }
        return groups;
    }
}
