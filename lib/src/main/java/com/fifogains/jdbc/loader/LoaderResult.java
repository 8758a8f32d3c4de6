package com.fifogains.jdbc.loader;

import com.fifogains.jdbc.ledger.LedgerData;
import java.util.List;

/** Container for a completed run: the computed ledger plus everything that was skipped or flagged. */
public final class LoaderResult {
    private final LedgerData ledgerData;
    private final List<LoaderMessage> messages;
    private final List<SkippedRow> skippedRows;

    public LoaderResult(LedgerData ledgerData, List<LoaderMessage> messages, List<SkippedRow> skippedRows) {
        this.ledgerData = ledgerData;
        this.messages = List.copyOf(messages);
        this.skippedRows = List.copyOf(skippedRows);
    }

    public LedgerData getLedgerData() {
        return ledgerData;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    public List<SkippedRow> getSkippedRows() {
        return skippedRows;
    }
}
