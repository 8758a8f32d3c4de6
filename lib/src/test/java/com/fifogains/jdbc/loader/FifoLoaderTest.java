package com.fifogains.jdbc.loader;

import static com.fifogains.jdbc.testing.TestTransactions.assertDecimal;
import static com.fifogains.jdbc.testing.TestTransactions.options;
import static com.fifogains.jdbc.testing.TestTransactions.row;
import static com.fifogains.jdbc.testing.TestTransactions.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fifogains.jdbc.ledger.LedgerData;
import com.fifogains.jdbc.ledger.ResultRow;
import com.fifogains.jdbc.ledger.SaleResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class FifoLoaderTest {

    @TempDir Path tempDir;

    @Test
    void loadsCsvAndComputesGains() throws Exception {
        Path csv = tempDir.resolve("trades.csv");
        Files.writeString(
                csv,
                String.join(
                        "\n",
                        "Date,Type,Symbol,Quantity,Price,Currency,Name",
                        "2024-01-01,Buy,ACME,10,5,USD,Acme",
                        "2024-01-02,Buy,ACME,5,6,USD,Acme",
                        "2024-01-03,Sell,ACME,12,8,USD,Acme",
                        "2024-01-04,Dividend,ACME,0,1,USD,Acme",
                        ""),
                StandardCharsets.UTF_8);

        LoaderResult result =
                new FifoLoader()
                        .load(csv, options().currencyColumn("Currency").extraColumns(List.of("Name")).build());

        LedgerData data = result.getLedgerData();
        assertEquals(3, data.getTransactions().size());
        assertEquals(1, data.getSales().size());
        SaleResult sale = data.getSales().get(0);
        assertDecimal("34", sale.getTotalGain());
        assertEquals(2, data.getResultRows().size());
        ResultRow first = data.getResultRows().get(0);
        Map<String, Object> rendered = first.toMap(true);
        assertEquals("2024-01-01", rendered.get(ResultRow.BUY_DATE));
        assertEquals("2024-01-03", rendered.get(ResultRow.SELL_DATE));
        assertEquals("USD", rendered.get(ResultRow.CURRENCY));
        assertEquals("Acme", rendered.get("Name"));
        assertEquals(1, data.getOpenLots().size());
        assertEquals(1, result.getSkippedRows().size());
        assertEquals(ErrorKind.UNRECOGNIZED_TYPE, result.getSkippedRows().get(0).getReason());
    }

    @Test
    void rejectsNarrowTables() {
        RawTable narrow =
                RawTable.of(
                        List.of("Date", "Type", "Symbol"),
                        List.of(Map.of("Date", "2024-01-01", "Type", "Buy", "Symbol", "A")));
        assertThrows(SchemaException.class, () -> new FifoLoader().load(narrow, options().build()));
    }

    @Test
    void rejectsTablesWithoutRows() {
        assertThrows(SchemaException.class, () -> new FifoLoader().load(table(List.of()), options().build()));
    }

    @Test
    void rejectsMissingBuyOrSellSelection() {
        RawTable table = table(List.of(row("2024-01-01", "Buy", "ACME", "1", "1")));
        FifoOptions noSell =
                FifoOptions.builder()
                        .dateColumn("Date")
                        .typeColumn("Type")
                        .quantityColumn("Quantity")
                        .priceColumn("Price")
                        .identifierColumn("Symbol")
                        .buyValues(List.of("Buy"))
                        .build();
        ConfigException ex = assertThrows(ConfigException.class, () -> new FifoLoader().load(table, noSell));
        assertTrue(ex.getMessage().contains("Buy and one Sell"));
    }

    @Test
    void rejectsMappedColumnAbsentFromSource() {
        RawTable table = table(List.of(row("2024-01-01", "Buy", "ACME", "1", "1")));
        assertThrows(
                SchemaException.class,
                () -> new FifoLoader().load(table, options().extraColumns(List.of("ISIN")).build()));
    }

    @Test
    void keepsOverlapWarningInMessages() throws Exception {
        RawTable table =
                table(
                        List.of(
                                row("2024-01-01", "Transfer", "ACME", "2", "1"),
                                row("2024-01-02", "Sell", "ACME", "2", "3")));
        LoaderResult result =
                new FifoLoader()
                        .load(table, options().buyValues(List.of("Transfer")).sellValues(List.of("Transfer")).build());
        assertEquals(ErrorKind.CONFIG, result.getMessages().get(0).getKind());
        assertDecimal("4", result.getLedgerData().getSales().get(0).getTotalGain());
    }

    @Test
    void reportsUnreadableSourceAsLoaderException() {
        LoaderException ex =
                assertThrows(
                        LoaderException.class,
                        () -> new FifoLoader().load(tempDir.resolve("missing.csv"), options().build()));
        assertEquals(LoaderException.class, ex.getClass());
    }
}
