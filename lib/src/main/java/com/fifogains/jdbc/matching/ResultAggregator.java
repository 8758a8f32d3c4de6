package com.fifogains.jdbc.matching;

import com.fifogains.jdbc.ledger.MatchedLot;
import com.fifogains.jdbc.ledger.ResultRow;
import com.fifogains.jdbc.ledger.SaleResult;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Flattens sale results into one output row per matched lot, rendering dates as text. */
public final class ResultAggregator {

    private final DateTimeFormatter outputFormat;

    public ResultAggregator(DateTimeFormatter outputFormat) {
        this.outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
    }

    public List<ResultRow> aggregate(List<SaleResult> sales) {
        List<ResultRow> rows = new ArrayList<>();
        for (SaleResult sale : sales) {
            String saleDate = format(sale.getDate());
            List<MatchedLot> lots = sale.getMatchedLots();
            for (int i = 0; i < lots.size(); i++) {
                MatchedLot lot = lots.get(i);
                rows.add(new ResultRow(sale.getSaleId(), i + 1, sale, lot, saleDate, acquisitionText(lot)));
            }
        }
        return rows;
    }

    String acquisitionText(MatchedLot lot) {
        if (!lot.isCostBasisKnown()) {
            return ResultRow.UNKNOWN;
        }
        return format(lot.getAcquisitionDate().orElse(null));
    }

    String format(LocalDateTime date) {
        if (date == null) {
            return ResultRow.INVALID_DATE;
        }
        try {
            return outputFormat.format(date);
        } catch (DateTimeException ex) {
            return ResultRow.INVALID_DATE;
        }
    }
}
