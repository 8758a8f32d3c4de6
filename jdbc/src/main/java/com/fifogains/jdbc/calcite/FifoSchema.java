package com.fifogains.jdbc.calcite;

import com.fifogains.jdbc.ledger.LedgerData;
import com.fifogains.jdbc.loader.FifoLoader;
import com.fifogains.jdbc.loader.FifoOptions;
import com.fifogains.jdbc.loader.LoaderException;
import com.fifogains.jdbc.loader.LoaderResult;
import com.fifogains.jdbc.schema.OpenLotsTable;
import com.fifogains.jdbc.schema.RealizedGainsTable;
import com.fifogains.jdbc.schema.SalesTable;
import com.fifogains.jdbc.schema.SkippedRowsTable;
import com.fifogains.jdbc.schema.TransactionsTable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.calcite.schema.SchemaPlus;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;
import org.apache.calcite.schema.impl.ViewTable;

/**
 * Calcite schema exposing one FIFO computation: the normalized transactions, sale results, matched
 * lots, open lots and skipped rows as tables, plus the {@value #GAIN_SUMMARY_VIEW} view.
 */
public final class FifoSchema extends AbstractSchema {

    static final String GAIN_SUMMARY_VIEW = "gain_summary";
    private static final String GAIN_SUMMARY_SQL =
            "SELECT \"identifier\", \"currency\", COUNT(*) AS \"sale_count\","
                    + " SUM(\"sale_quantity\") AS \"sold_quantity\","
                    + " SUM(\"unknown_quantity\") AS \"unknown_quantity\","
                    + " SUM(\"total_gain\") AS \"realized_gain\""
                    + " FROM \"" + SalesTable.NAME + "\""
                    + " GROUP BY \"identifier\", \"currency\"";

    private final SchemaPlus parentSchema;
    private final String schemaName;
    private final Path sourcePath;
    private final FifoOptions options;
    private volatile LoaderResult loaderResult;
    private volatile Map<String, Table> tables;
    private volatile SchemaPlus schemaPlus;
    private final Object viewLock = new Object();
    private volatile boolean viewsRegistered;

    FifoSchema(SchemaPlus parentSchema, String name, Path sourcePath, FifoOptions options) {
        this(parentSchema, name, sourcePath, options, null);
    }

    FifoSchema(
            SchemaPlus parentSchema,
            String name,
            Path sourcePath,
            FifoOptions options,
            LoaderResult preloaded) {
        this.parentSchema = Objects.requireNonNull(parentSchema, "parentSchema");
        this.schemaName = Objects.requireNonNull(name, "name");
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
        this.options = Objects.requireNonNull(options, "options");
        this.loaderResult = preloaded;
    }

    @Override
    protected Map<String, Table> getTableMap() {
        Map<String, Table> local = tables;
        if (local == null) {
            synchronized (this) {
                local = tables;
                if (local == null) {
                    local = buildTables();
                    tables = local;
                }
            }
        }
        return local;
    }

    private Map<String, Table> buildTables() {
        LoaderResult result = loadResult();
        LedgerData data = result.getLedgerData();
        List<String> extras = options.getExtraColumns();
        Map<String, Table> map = new LinkedHashMap<>();
        map.put(
                TransactionsTable.NAME,
                new MaterializedCalciteTable(
                        TransactionsTable.getDefinition(extras),
                        TransactionsTable.materializeRows(data.getTransactions(), extras)));
        map.put(
                SalesTable.NAME,
                new MaterializedCalciteTable(
                        SalesTable.getDefinition(extras), SalesTable.materializeRows(data.getSales(), extras)));
        map.put(
                RealizedGainsTable.NAME,
                new MaterializedCalciteTable(
                        RealizedGainsTable.getDefinition(extras),
                        RealizedGainsTable.materializeRows(data.getResultRows(), extras)));
        map.put(
                OpenLotsTable.NAME,
                new MaterializedCalciteTable(
                        OpenLotsTable.getDefinition(), OpenLotsTable.materializeRows(data.getOpenLots())));
        map.put(
                SkippedRowsTable.NAME,
                new MaterializedCalciteTable(
                        SkippedRowsTable.getDefinition(),
                        SkippedRowsTable.materializeRows(result.getSkippedRows())));
        Map<String, Table> immutable = Map.copyOf(map);
        this.tables = immutable;
        registerViews();
        return immutable;
    }

    LoaderResult loadResult() {
        LoaderResult current = loaderResult;
        if (current == null) {
            synchronized (this) {
                current = loaderResult;
                if (current == null) {
                    try {
                        current = new FifoLoader().load(sourcePath, options);
                    } catch (LoaderException ex) {
                        throw new IllegalStateException("Failed to load transactions: " + sourcePath, ex);
                    }
                    loaderResult = current;
                }
            }
        }
        return current;
    }

    private void registerViews() {
        if (viewsRegistered) {
            return;
        }
        synchronized (viewLock) {
            if (viewsRegistered) {
                return;
            }
            viewsRegistered = true;
            SchemaPlus schema = resolveSchemaPlus();
            List<String> schemaPath = buildSchemaPath(schema);
            List<String> viewPath = new ArrayList<>(schemaPath);
            viewPath.add(GAIN_SUMMARY_VIEW);
            try {
                var macro =
                        ViewTable.viewMacro(
                                schema, GAIN_SUMMARY_SQL, schemaPath, List.copyOf(viewPath), Boolean.FALSE);
                macro.apply(Collections.emptyList());
                schema.add(GAIN_SUMMARY_VIEW, macro);
            } catch (RuntimeException ex) {
                viewsRegistered = false;
                throw new IllegalStateException(
                        "Failed to register Calcite view '" + GAIN_SUMMARY_VIEW + "' with SQL:\n"
                                + GAIN_SUMMARY_SQL,
                        ex);
            }
        }
    }

    private SchemaPlus resolveSchemaPlus() {
        SchemaPlus local = schemaPlus;
        if (local == null) {
            SchemaPlus resolved = parentSchema.getSubSchema(schemaName);
            if (resolved == null) {
                throw new IllegalStateException("Schema not registered yet: " + schemaName);
            }
            schemaPlus = resolved;
            local = resolved;
        }
        return local;
    }

    private static List<String> buildSchemaPath(SchemaPlus schema) {
        List<String> path = new ArrayList<>();
        SchemaPlus current = schema;
        while (current != null) {
            String name = current.getName();
            if (name != null && !name.isEmpty()) {
                path.add(0, name);
            }
            current = current.getParentSchema();
        }
        return List.copyOf(path);
    }
}
