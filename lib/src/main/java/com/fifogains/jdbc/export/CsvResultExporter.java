package com.fifogains.jdbc.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fifogains.jdbc.ledger.ResultRow;
import com.fifogains.jdbc.loader.FifoOptions;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes result rows as CSV with a header line. Numbers are written in plain notation, unknown
 * values as {@value ResultRow#UNKNOWN}. The target writer is flushed but left open.
 */
public final class CsvResultExporter {

    private static final CsvMapper CSV_MAPPER =
            CsvMapper.builder().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET).build();

    public void write(List<ResultRow> rows, FifoOptions options, Writer target) throws IOException {
        boolean includeCurrency = options.hasCurrencyColumn();
        List<String> columns = ResultRow.columnNames(includeCurrency, options.getExtraColumns());
        CsvSchema.Builder schema = CsvSchema.builder();
        for (String column : columns) {
            schema.addColumn(column);
        }
        // Header written as a plain record so that an empty result still carries it.
        try (SequenceWriter writer = CSV_MAPPER.writer(schema.build().withoutHeader()).writeValues(target)) {
            writer.write(columns);
            for (ResultRow row : rows) {
                Map<String, Object> values = row.toMap(includeCurrency);
                List<String> cells = new ArrayList<>(columns.size());
                for (String column : columns) {
                    cells.add(render(values.get(column)));
                }
                writer.write(cells);
            }
        }
        target.flush();
    }

    static String render(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return value.toString();
    }
}
