package com.fifogains.jdbc.matching;

import static com.fifogains.jdbc.testing.TestTransactions.transaction;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fifogains.jdbc.ledger.GroupKey;
import com.fifogains.jdbc.ledger.TransactionKind;
import com.fifogains.jdbc.ledger.TransactionRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class TransactionGrouperTest {

    @Test
    void sortIsStableWithInvalidDatesLast() {
        List<TransactionRecord> input =
                List.of(
                        transaction(1, null, TransactionKind.SELL, "1", "1", "A", null),
                        transaction(2, "2024-02-01", TransactionKind.BUY, "1", "1", "A", null),
                        transaction(3, "2024-01-01", TransactionKind.BUY, "1", "1", "A", null),
                        transaction(4, "2024-02-01", TransactionKind.SELL, "1", "1", "A", null),
                        transaction(5, null, TransactionKind.BUY, "1", "1", "A", null));

        List<TransactionRecord> sorted = TransactionGrouper.sortChronologically(input);

        assertEquals(List.of(3, 2, 4, 1, 5), rowNumbers(sorted));
        assertEquals(List.of(1, 2, 3, 4, 5), rowNumbers(input));
    }

    @Test
    void partitionsByIdentifierAndCurrencyInEncounterOrder() {
        List<TransactionRecord> sorted =
                List.of(
                        transaction(1, "2024-01-01", TransactionKind.BUY, "1", "1", "B", "USD"),
                        transaction(2, "2024-01-02", TransactionKind.BUY, "1", "1", "A", "USD"),
                        transaction(3, "2024-01-03", TransactionKind.SELL, "1", "1", "B", "EUR"),
                        transaction(4, "2024-01-04", TransactionKind.SELL, "1", "1", "B", "USD"));

        Map<GroupKey, List<TransactionRecord>> groups = TransactionGrouper.partition(sorted);

        assertEquals(
                List.of(new GroupKey("B", "USD"), new GroupKey("A", "USD"), new GroupKey("B", "EUR")),
                new ArrayList<>(groups.keySet()));
        assertEquals(List.of(1, 4), rowNumbers(groups.get(new GroupKey("B", "USD"))));
    }

    @Test
    void missingCurrencyFallsIntoOneGroup() {
        List<TransactionRecord> sorted =
                List.of(
                        transaction(1, "2024-01-01", TransactionKind.BUY, "1", "1", "A", null),
                        transaction(2, "2024-01-02", TransactionKind.SELL, "1", "1", "A", null));
        Map<GroupKey, List<TransactionRecord>> groups = TransactionGrouper.partition(sorted);
        assertEquals(List.of(new GroupKey("A", "N/A")), new ArrayList<>(groups.keySet()));
    }

    private static List<Integer> rowNumbers(List<TransactionRecord> transactions) {
        List<Integer> rows = new ArrayList<>();
        for (TransactionRecord transaction : transactions) {
            rows.add(transaction.getRowNumber());
        }
        return rows;
    }
}
