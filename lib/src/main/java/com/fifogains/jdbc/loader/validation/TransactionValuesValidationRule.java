package com.fifogains.jdbc.loader.validation;

import com.fifogains.jdbc.loader.ErrorKind;
import com.fifogains.jdbc.loader.FifoOptions;
import com.fifogains.jdbc.loader.LoaderMessage;
import com.fifogains.jdbc.loader.RawTable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** At least one buy and one sell value must be selected. Values selected for both count as buys. */
public final class TransactionValuesValidationRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(RawTable table, FifoOptions options) {
        return check(options);
    }

    public static List<LoaderMessage> check(FifoOptions options) {
        List<LoaderMessage> messages = new ArrayList<>();
        if (options.getBuyValues().isEmpty() || options.getSellValues().isEmpty()) {
            messages.add(
                    LoaderMessage.error(
                            ErrorKind.CONFIG,
                            "Select at least one Buy and one Sell transaction type"));
            return messages;
        }
        Set<String> overlap = new LinkedHashSet<>(options.getBuyValues());
        overlap.retainAll(options.getSellValues());
        if (!overlap.isEmpty()) {
            messages.add(
                    LoaderMessage.warning(
                            ErrorKind.CONFIG,
                            "Values selected as both Buy and Sell are treated as Buy: " + overlap,
                            0));
        }
        return messages;
    }
}
