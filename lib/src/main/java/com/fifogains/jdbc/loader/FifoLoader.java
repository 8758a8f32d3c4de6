package com.fifogains.jdbc.loader;

import com.fifogains.jdbc.ledger.LedgerData;
import com.fifogains.jdbc.loader.validation.ValidationRunner;
import com.fifogains.jdbc.matching.FifoEngine;
import com.fifogains.jdbc.matching.MatchingResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Entry point for loading a transaction table and computing its realized gains. */
public final class FifoLoader {

    private static final Logger LOGGER = Logger.getLogger(FifoLoader.class.getName());

    private final ValidationRunner validationRunner;

    public FifoLoader() {
        this(ValidationRunner.defaultRules());
    }

    public FifoLoader(ValidationRunner validationRunner) {
        this.validationRunner = Objects.requireNonNull(validationRunner, "validationRunner");
    }

    public LoaderResult load(Path sourcePath, FifoOptions options) throws LoaderException {
        RawTable table = new CsvTableReader().read(sourcePath);
        LOGGER.log(
                Level.FINE,
                "Read {0} rows with {1} columns from {2}",
                new Object[] {table.getRows().size(), table.getColumnCount(), sourcePath});
        return load(table, options);
    }

    /**
     * Validates the table against the options, normalizes its rows and runs the matching engine.
     *
     * @throws SchemaException when the table is too narrow, empty, or lacks a mapped column
     * @throws ConfigException when a mapping or the buy/sell selection is missing
     */
    public LoaderResult load(RawTable table, FifoOptions options) throws LoaderException {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(options, "options");

        List<LoaderMessage> messages = new ArrayList<>(validationRunner.run(table, options));
        ValidationRunner.requireNoErrors(messages);

        TransactionNormalizer normalizer = new TransactionNormalizer(options);
        normalizer.normalize(table);
        messages.addAll(normalizer.getMessages());

        MatchingResult matching = FifoEngine.compute(normalizer.getTransactions(), options);
        LedgerData ledgerData =
                new LedgerData(
                        normalizer.getTransactions(),
                        matching.getSales(),
                        matching.getRows(),
                        matching.getOpenLots());

        for (LoaderMessage message : messages) {
            if (message.getLevel() == LoaderMessage.Level.WARNING) {
                LOGGER.log(Level.WARNING, "{0}", message);
            }
        }
        LOGGER.log(
                Level.FINE,
                "Loaded {0} transactions, skipped {1} rows, computed {2} sales",
                new Object[] {
                    normalizer.getTransactions().size(),
                    normalizer.getSkippedRows().size(),
                    matching.getSales().size()
                });
        return new LoaderResult(ledgerData, messages, normalizer.getSkippedRows());
    }
}
