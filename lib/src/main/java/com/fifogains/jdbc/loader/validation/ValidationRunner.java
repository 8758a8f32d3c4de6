package com.fifogains.jdbc.loader.validation;

import com.fifogains.jdbc.loader.ConfigException;
import com.fifogains.jdbc.loader.ErrorKind;
import com.fifogains.jdbc.loader.FifoOptions;
import com.fifogains.jdbc.loader.LoaderException;
import com.fifogains.jdbc.loader.LoaderMessage;
import com.fifogains.jdbc.loader.RawTable;
import com.fifogains.jdbc.loader.SchemaException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Executes a list of validation rules and aggregates their diagnostics. This keeps a single place
 * to register rules, and a single place that turns errors into the matching exception type.
 */
public final class ValidationRunner {

    private final List<ValidationRule> rules;

    public ValidationRunner(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /**
     * Convenience factory that wires in the default rule set: table shape first, then column
     * mapping, then buy/sell values.
     */
    public static ValidationRunner defaultRules() {
        return new ValidationRunner(
                List.of(
                        new ColumnCountValidationRule(),
                        new MappedColumnValidationRule(),
                        new TransactionValuesValidationRule()));
    }

    /**
     * Run all configured rules.
     *
     * @return All diagnostics produced by all rules, in rule order.
     */
    public List<LoaderMessage> run(RawTable table, FifoOptions options) {
        List<LoaderMessage> diagnostics = new ArrayList<>();
        for (ValidationRule rule : rules) {
            diagnostics.addAll(rule.validate(table, options));
        }
        return diagnostics;
    }

    /**
     * Throws when any diagnostic is an error. The first error decides the exception type; the
     * message lists every error.
     */
    public static void requireNoErrors(List<LoaderMessage> diagnostics) throws LoaderException {
        ErrorKind firstKind = null;
        StringJoiner joiner = new StringJoiner("; ");
        for (LoaderMessage message : diagnostics) {
            if (message.getLevel() != LoaderMessage.Level.ERROR) {
                continue;
            }
            if (firstKind == null) {
                firstKind = message.getKind();
            }
            joiner.add(message.getMessage());
        }
        if (firstKind == null) {
            return;
        }
        switch (firstKind) {
            case SCHEMA -> throw new SchemaException(joiner.toString());
            case CONFIG -> throw new ConfigException(joiner.toString());
            default -> throw new LoaderException(joiner.toString());
        }
    }
}
