package com.fifogains.jdbc.matching;

import com.fifogains.jdbc.ledger.GroupKey;
import com.fifogains.jdbc.ledger.TransactionRecord;
import com.fifogains.jdbc.loader.ConfigException;
import com.fifogains.jdbc.loader.DateParser;
import com.fifogains.jdbc.loader.FifoOptions;
import com.fifogains.jdbc.loader.LoaderException;
import com.fifogains.jdbc.loader.LoaderMessage;
import com.fifogains.jdbc.loader.validation.TransactionValuesValidationRule;
import com.fifogains.jdbc.loader.validation.ValidationRunner;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pure computation from normalized transactions and options to sale results: sort, group, match
 * each group, flatten. Nothing is kept between calls.
 */
public final class FifoEngine {

    private static final Logger LOGGER = Logger.getLogger(FifoEngine.class.getName());

    private FifoEngine() {}

    /**
     * Runs FIFO matching.
     *
     * @throws ConfigException when no buy or no sell values are configured, or the output date
     *     format is invalid
     */
    public static MatchingResult compute(List<TransactionRecord> transactions, FifoOptions options)
            throws ConfigException {
        requireValidOptions(options);
        DateTimeFormatter outputFormat;
        try {
            outputFormat = DateParser.formatter(options.getOutputDateFormat());
            // Zone or offset fields cannot be rendered from a local date.
            outputFormat.format(LocalDateTime.of(2000, 1, 1, 0, 0));
        } catch (IllegalArgumentException | DateTimeException ex) {
            throw new ConfigException(
                    "Invalid output date format '" + options.getOutputDateFormat() + "'", ex);
        }

        List<TransactionRecord> sorted = TransactionGrouper.sortChronologically(transactions);
        Map<GroupKey, List<TransactionRecord>> groups = TransactionGrouper.partition(sorted);
        FifoMatcher matcher = new FifoMatcher(options.isRoundGains());
        for (Map.Entry<GroupKey, List<TransactionRecord>> group : groups.entrySet()) {
            matcher.matchGroup(group.getKey(), group.getValue());
        }
        ResultAggregator aggregator = new ResultAggregator(outputFormat);
        MatchingResult result =
                new MatchingResult(
                        matcher.getSales(), aggregator.aggregate(matcher.getSales()), matcher.getOpenLots());
        LOGGER.log(
                Level.FINE,
                "Matched {0} transactions in {1} groups: {2} sales, {3} open lots",
                new Object[] {
                    transactions.size(), groups.size(), result.getSales().size(), result.getOpenLots().size()
                });
        return result;
    }

    private static void requireValidOptions(FifoOptions options) throws ConfigException {
        List<LoaderMessage> diagnostics = TransactionValuesValidationRule.check(options);
        try {
            ValidationRunner.requireNoErrors(diagnostics);
        } catch (ConfigException ex) {
            throw ex;
        } catch (LoaderException ex) {
            throw new ConfigException(ex.getMessage(), ex);
        }
    }
}
