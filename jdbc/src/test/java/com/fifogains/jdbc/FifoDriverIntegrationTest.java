package com.fifogains.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fifogains.jdbc.loader.ConfigException;
import com.fifogains.jdbc.testing.TestResources;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

final class FifoDriverIntegrationTest {

    @BeforeAll
    static void registerDriver() throws ClassNotFoundException {
        Class.forName("com.fifogains.jdbc.FifoDriver");
    }

    @Test
    void realizedGainsFollowFifoOrderPerGroup() throws Exception {
        try (Connection connection = DriverManager.getConnection(TestResources.tradesUrl());
                Statement statement = connection.createStatement();
                ResultSet rs =
                        statement.executeQuery(
                                "SELECT \"sale_id\", \"lot_index\", \"identifier\", \"currency\","
                                        + " \"used_quantity\", \"gain\", \"buy_date_text\""
                                        + " FROM \"fifo\".\"realized_gains\""
                                        + " ORDER BY \"sale_id\", \"lot_index\"")) {
            List<String> rows = new ArrayList<>();
            List<BigDecimal> gains = new ArrayList<>();
            while (rs.next()) {
                rows.add(
                        rs.getInt("sale_id")
                                + "/"
                                + rs.getInt("lot_index")
                                + " "
                                + rs.getString("identifier")
                                + " "
                                + rs.getString("currency")
                                + " "
                                + rs.getString("buy_date_text"));
                gains.add(rs.getBigDecimal("gain"));
            }
            assertEquals(
                    List.of(
                            "1/1 ACME USD 2024-01-01",
                            "1/2 ACME USD 2024-01-02",
                            "2/1 ACME USD 2024-01-02",
                            "3/1 GLOBEX EUR 2024-01-02",
                            "3/2 GLOBEX EUR Unknown"),
                    rows);
            assertDecimal("30", gains.get(0));
            assertDecimal("4", gains.get(1));
            assertDecimal("4", gains.get(2));
            assertDecimal("-40", gains.get(3));
            assertNull(gains.get(4));
        }
    }

    @Test
    void salesCarrySaleTotals() throws Exception {
        try (Connection connection = DriverManager.getConnection(TestResources.tradesUrl());
                Statement statement = connection.createStatement();
                ResultSet rs =
                        statement.executeQuery(
                                "SELECT \"sale_id\", \"total_gain\", \"unknown_quantity\", \"Name\""
                                        + " FROM \"sales\" ORDER BY \"sale_id\"")) {
            assertTrue(rs.next());
            assertEquals(1, rs.getInt(1));
            assertDecimal("34", rs.getBigDecimal(2));
            assertDecimal("0", rs.getBigDecimal(3));
            assertEquals("Acme Corp", rs.getString(4));
            assertTrue(rs.next());
            assertEquals(2, rs.getInt(1));
            assertDecimal("4", rs.getBigDecimal(2));
            assertTrue(rs.next());
            assertEquals(3, rs.getInt(1));
            assertDecimal("-40", rs.getBigDecimal(2));
            assertDecimal("2", rs.getBigDecimal(3));
            assertEquals("Globex", rs.getString(4));
            assertFalse(rs.next());
        }
    }

    @Test
    void unknownCostBasisIsQueryableAsBoolean() throws Exception {
        try (Connection connection = DriverManager.getConnection(TestResources.tradesUrl());
                Statement statement = connection.createStatement();
                ResultSet rs =
                        statement.executeQuery(
                                "SELECT \"identifier\", \"used_quantity\" FROM \"realized_gains\""
                                        + " WHERE NOT \"cost_basis_known\"")) {
            assertTrue(rs.next());
            assertEquals("GLOBEX", rs.getString(1));
            assertDecimal("2", rs.getBigDecimal(2));
            assertFalse(rs.next());
        }
    }

    @Test
    void gainSummaryAggregatesSalesPerGroup() throws Exception {
        try (Connection connection = DriverManager.getConnection(TestResources.tradesUrl());
                Statement statement = connection.createStatement();
                ResultSet rs =
                        statement.executeQuery(
                                "SELECT \"identifier\", \"sale_count\", \"sold_quantity\","
                                        + " \"unknown_quantity\", \"realized_gain\""
                                        + " FROM \"gain_summary\" ORDER BY \"identifier\"")) {
            assertTrue(rs.next());
            assertEquals("ACME", rs.getString(1));
            assertEquals(2L, rs.getLong(2));
            assertDecimal("13", rs.getBigDecimal(3));
            assertDecimal("0", rs.getBigDecimal(4));
            assertDecimal("38", rs.getBigDecimal(5));
            assertTrue(rs.next());
            assertEquals("GLOBEX", rs.getString(1));
            assertEquals(1L, rs.getLong(2));
            assertDecimal("6", rs.getBigDecimal(3));
            assertDecimal("2", rs.getBigDecimal(4));
            assertDecimal("-40", rs.getBigDecimal(5));
            assertFalse(rs.next());
        }
    }

    @Test
    void openLotsAndSkippedRowsAreExposed() throws Exception {
        try (Connection connection = DriverManager.getConnection(TestResources.tradesUrl());
                Statement statement = connection.createStatement()) {
            try (ResultSet rs =
                    statement.executeQuery(
                            "SELECT \"identifier\", \"remaining_quantity\", \"unit_price\" FROM \"open_lots\"")) {
                assertTrue(rs.next());
                assertEquals("ACME", rs.getString(1));
                assertDecimal("2", rs.getBigDecimal(2));
                assertDecimal("6", rs.getBigDecimal(3));
                assertFalse(rs.next());
            }
            try (ResultSet rs =
                    statement.executeQuery(
                            "SELECT \"row_number\", \"reason\" FROM \"skipped_rows\" ORDER BY \"row_number\"")) {
                assertTrue(rs.next());
                assertEquals(6, rs.getInt(1));
                assertEquals("UNRECOGNIZED_TYPE", rs.getString(2));
                assertTrue(rs.next());
                assertEquals(7, rs.getInt(1));
                assertEquals("ROW_PARSE", rs.getString(2));
                assertFalse(rs.next());
            }
            try (ResultSet rs =
                    statement.executeQuery(
                            "SELECT COUNT(*) FROM \"transactions\" WHERE \"date\" IS NULL")) {
                assertTrue(rs.next());
                assertEquals(1L, rs.getLong(1));
            }
        }
    }

    @Test
    void loaderWarningsSurfaceAsSqlWarnings() throws Exception {
        try (Connection connection = DriverManager.getConnection(TestResources.tradesUrl())) {
            List<String> messages = new ArrayList<>();
            for (SQLWarning warning = connection.getWarnings();
                    warning != null;
                    warning = warning.getNextWarning()) {
                messages.add(warning.getMessage());
            }
            assertEquals(2, messages.size(), messages.toString());
            assertTrue(messages.get(0).startsWith("[FIFO JDBC] "), messages.get(0));
            assertTrue(messages.get(0).contains("at row 7"), messages.get(0));
            assertTrue(messages.get(1).contains("at row 8"), messages.get(1));
            assertTrue(messages.get(1).endsWith("(trades.csv)"), messages.get(1));

            connection.clearWarnings();
            assertNull(connection.getWarnings());
        }
    }

    @Test
    void connectionPropertiesSupplyOptions() throws Exception {
        Properties info = TestResources.tradesOptions();
        String url = "jdbc:fifo:" + TestResources.fixture(TestResources.TRADES_CSV).toUri();
        try (Connection connection = DriverManager.getConnection(url, info);
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM \"realized_gains\"")) {
            assertTrue(rs.next());
            assertEquals(5L, rs.getLong(1));
        }
    }

    @Test
    void urlParametersOverrideConnectionProperties() throws Exception {
        Properties info = TestResources.tradesOptions();
        info.setProperty("sell", "Nothing");
        try (Connection connection = DriverManager.getConnection(TestResources.tradesUrl(), info);
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM \"sales\"")) {
            assertTrue(rs.next());
            assertEquals(3L, rs.getLong(1));
        }
    }

    @Test
    void metadataReportsFifoProduct() throws Exception {
        try (Connection connection = DriverManager.getConnection(TestResources.tradesUrl())) {
            DatabaseMetaData metaData = connection.getMetaData();
            assertEquals("FIFO Gains", metaData.getDatabaseProductName());
            assertEquals("FIFO Gains JDBC Driver (Calcite)", metaData.getDriverName());
            assertEquals(Version.RUNTIME, metaData.getDriverVersion());
            try (ResultSet tables = metaData.getTables(null, "fifo", "realized_gains", null)) {
                assertTrue(tables.next());
            }
        }
    }

    @Test
    void missingSellTypeFailsTheConnection() throws Exception {
        Properties info = TestResources.tradesOptions();
        info.remove("sell");
        String url = "jdbc:fifo:" + TestResources.fixture(TestResources.TRADES_CSV);
        SQLException ex = assertThrows(SQLException.class, () -> DriverManager.getConnection(url, info));
        assertInstanceOf(ConfigException.class, ex.getCause());
        assertTrue(ex.getMessage().contains("Select at least one Buy and one Sell"), ex.getMessage());
    }

    @Test
    void missingFileIsRejected() {
        SQLException ex =
                assertThrows(
                        SQLException.class,
                        () -> DriverManager.getConnection("jdbc:fifo:/does/not/exist.csv?buy=Buy&sell=Sell"));
        assertTrue(ex.getMessage().contains("Transaction file not found"), ex.getMessage());
    }

    @Test
    void parseUrlDecodesParameters() throws Exception {
        String path = TestResources.fixture(TestResources.TRADES_CSV).toString();
        FifoDriver.ParsedUrl parsed =
                FifoDriver.parseUrl("jdbc:fifo:" + path + "?buy=Buy%20Order,Buy&extraColumns=&roundGains");
        assertEquals("Buy Order,Buy", parsed.properties().getProperty("buy"));
        assertEquals("", parsed.properties().getProperty("extraColumns"));
        assertEquals("", parsed.properties().getProperty("roundGains"));
        assertNotNull(parsed.sourcePath());
        assertTrue(parsed.sourcePath().isAbsolute());
    }

    @Test
    void propertyInfoMarksRequiredOptions() {
        FifoDriver driver = new FifoDriver();
        assertFalse(driver.acceptsURL("jdbc:calcite:"));
        boolean sawSell = false;
        for (var info : driver.getPropertyInfo("jdbc:fifo:x", new Properties())) {
            if ("sell".equals(info.name)) {
                sawSell = true;
                assertTrue(info.required);
            }
            if ("currencyColumn".equals(info.name)) {
                assertFalse(info.required);
            }
        }
        assertTrue(sawSell);
    }

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertNotNull(actual);
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }
}
